package com.receptionkit.backend.workflow.service;

import com.receptionkit.backend.workflow.domain.WorkflowInstanceStep;

public record AdvanceResult(WorkflowInstanceView view, WorkflowInstanceStep step) {}
