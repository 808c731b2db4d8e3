package com.receptionkit.backend.workflow.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record StyleDefaultCopyRequest(
    @NotNull Long expectedRevision,
    @NotNull UUID sourceTemplateId,
    @Schema(description = "Replace existing rows; otherwise only node types without a row are filled.")
        boolean overwrite) {}
