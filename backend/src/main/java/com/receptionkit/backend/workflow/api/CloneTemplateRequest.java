package com.receptionkit.backend.workflow.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Destination of a template clone. Defaults to the caller's tenant.")
public record CloneTemplateRequest(boolean global, String tenantId) {}
