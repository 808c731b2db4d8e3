package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record EdgeCreateRequest(
    @NotNull Long expectedRevision,
    @NotNull UUID sourceNodeId,
    @Schema(example = "Yes", requiredMode = Schema.RequiredMode.REQUIRED) @NotBlank @Size(max = 500)
        String label,
    @Schema(description = "Target node in the same template; null leaves the edge unwired.")
        UUID targetNodeId,
    String description,
    WorkflowActionKey actionKey,
    @Size(max = 64) String sourceHandle,
    @Size(max = 64) String targetHandle) {}
