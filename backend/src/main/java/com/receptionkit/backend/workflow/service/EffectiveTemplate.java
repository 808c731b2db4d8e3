package com.receptionkit.backend.workflow.service;

import com.receptionkit.backend.workflow.domain.LandingCategory;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.domain.WorkflowType;
import java.util.UUID;

/** Immutable entry of a tenant's effective workflow list; safe to keep in a cache. */
public record EffectiveTemplate(
    UUID id,
    String name,
    String description,
    String iconKey,
    String colourHex,
    boolean active,
    WorkflowType workflowType,
    LandingCategory landingCategory,
    WorkflowApprovalStatus approvalStatus,
    Origin origin,
    UUID overridesTemplateId) {

  public enum Origin {
    GLOBAL,
    OVERRIDE,
    CUSTOM
  }

  static EffectiveTemplate of(WorkflowTemplate template, Origin origin, UUID overridesTemplateId) {
    return new EffectiveTemplate(
        template.getId(),
        template.getName(),
        template.getDescription(),
        template.getIconKey(),
        template.getColourHex(),
        template.isActive(),
        template.getWorkflowType(),
        template.getLandingCategory(),
        template.getApprovalStatus(),
        origin,
        overridesTemplateId);
  }
}
