package com.receptionkit.backend.workflow.api;

public record AdvanceResponse(InstanceResponse instance, InstanceStepResponse step) {}
