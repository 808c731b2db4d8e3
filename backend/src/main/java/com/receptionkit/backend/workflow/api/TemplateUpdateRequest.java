package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.LandingCategory;
import com.receptionkit.backend.workflow.domain.WorkflowType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(description = "Partial metadata update. Fields left null are unchanged.")
public record TemplateUpdateRequest(
    @Schema(description = "Revision the caller last saw.", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        Long expectedRevision,
    @Size(max = 200) String name,
    String description,
    @Size(max = 64) String iconKey,
    @Size(max = 16) String colourHex,
    Boolean active,
    WorkflowType workflowType,
    LandingCategory landingCategory) {}
