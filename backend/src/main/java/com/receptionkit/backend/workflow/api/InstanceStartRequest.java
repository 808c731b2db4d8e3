package com.receptionkit.backend.workflow.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

@Schema(description = "Starts a run of an approved workflow for a tenant.")
public record InstanceStartRequest(
    @NotNull UUID templateId,
    @Schema(description = "Defaults to the caller's tenant.") String tenantId,
    @Schema(description = "Free-text reference, e.g. a document or patient identifier.") @Size(max = 256)
        String reference,
    @Size(max = 128) String category) {}
