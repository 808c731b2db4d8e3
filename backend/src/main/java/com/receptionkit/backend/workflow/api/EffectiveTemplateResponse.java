package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.LandingCategory;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowType;
import com.receptionkit.backend.workflow.service.EffectiveTemplate;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.UUID;

public record EffectiveTemplateResponse(
    UUID id,
    String name,
    String description,
    String iconKey,
    String colourHex,
    boolean active,
    WorkflowType workflowType,
    LandingCategory landingCategory,
    WorkflowApprovalStatus approvalStatus,
    @Schema(description = "GLOBAL, OVERRIDE (tenant clone of a global template) or CUSTOM.") String origin,
    @Schema(description = "Global template this entry replaces, for OVERRIDE entries.") UUID overridesTemplateId) {

  public static EffectiveTemplateResponse from(EffectiveTemplate entry) {
    return new EffectiveTemplateResponse(
        entry.id(),
        entry.name(),
        entry.description(),
        entry.iconKey(),
        entry.colourHex(),
        entry.active(),
        entry.workflowType(),
        entry.landingCategory(),
        entry.approvalStatus(),
        entry.origin().name(),
        entry.overridesTemplateId());
  }
}
