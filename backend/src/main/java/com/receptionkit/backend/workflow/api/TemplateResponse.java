package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.LandingCategory;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.domain.WorkflowType;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.UUID;

public record TemplateResponse(
    UUID id,
    @Schema(description = "Either 'global' or 'tenant:<id>'.") String scope,
    String name,
    String description,
    String iconKey,
    String colourHex,
    boolean active,
    WorkflowType workflowType,
    LandingCategory landingCategory,
    WorkflowApprovalStatus approvalStatus,
    String approvedBy,
    Instant approvedAt,
    String reviewNote,
    String lastEditedBy,
    Instant lastEditedAt,
    UUID sourceTemplateId,
    @Schema(description = "Stamp to echo back on the next mutation.") long revision,
    Instant createdAt,
    Instant updatedAt) {

  public static TemplateResponse from(WorkflowTemplate template) {
    return new TemplateResponse(
        template.getId(),
        template.getScopeKey(),
        template.getName(),
        template.getDescription(),
        template.getIconKey(),
        template.getColourHex(),
        template.isActive(),
        template.getWorkflowType(),
        template.getLandingCategory(),
        template.getApprovalStatus(),
        template.getApprovedBy(),
        template.getApprovedAt(),
        template.getReviewNote(),
        template.getLastEditedBy(),
        template.getLastEditedAt(),
        template.getSourceTemplateId(),
        template.getRevision(),
        template.getCreatedAt(),
        template.getUpdatedAt());
  }
}
