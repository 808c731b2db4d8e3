package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.LandingCategory;
import com.receptionkit.backend.workflow.domain.WorkflowType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "Creates a DRAFT workflow template in the caller's tenant or in the global set.")
public record TemplateCreateRequest(
    @Schema(description = "Create in the global set shared by every tenant. Superuser only.")
        boolean global,
    @Schema(description = "Target tenant; defaults to the caller's tenant.") String tenantId,
    @Schema(example = "Clinic letter received", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        @Size(max = 200)
        String name,
    String description,
    @Size(max = 64) String iconKey,
    @Size(max = 16) String colourHex,
    Boolean active,
    WorkflowType workflowType,
    LandingCategory landingCategory) {}
