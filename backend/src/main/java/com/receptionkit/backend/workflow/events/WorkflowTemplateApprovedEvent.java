package com.receptionkit.backend.workflow.events;

import java.util.UUID;

public record WorkflowTemplateApprovedEvent(UUID templateId, String scopeKey, String approvedBy) {}
