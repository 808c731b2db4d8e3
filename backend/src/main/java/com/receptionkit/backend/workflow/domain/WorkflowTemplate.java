package com.receptionkit.backend.workflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(
    name = "workflow_template",
    uniqueConstraints = @UniqueConstraint(name = "uq_workflow_template_scope_name", columnNames = {"scope_key", "name"}))
public class WorkflowTemplate {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "scope_key", nullable = false, length = 160, updatable = false)
  private String scopeKey;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description")
  private String description;

  @Column(name = "icon_key", length = 64)
  private String iconKey;

  @Column(name = "colour_hex", length = 16)
  private String colourHex;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Enumerated(EnumType.STRING)
  @Column(name = "workflow_type", nullable = false, length = 32)
  private WorkflowType workflowType;

  @Enumerated(EnumType.STRING)
  @Column(name = "landing_category", nullable = false, length = 32)
  private LandingCategory landingCategory;

  @Enumerated(EnumType.STRING)
  @Column(name = "approval_status", nullable = false, length = 32)
  private WorkflowApprovalStatus approvalStatus;

  @Column(name = "approved_by", length = 128)
  private String approvedBy;

  @Column(name = "approved_at")
  private Instant approvedAt;

  @Column(name = "review_note")
  private String reviewNote;

  @Column(name = "last_edited_by", length = 128)
  private String lastEditedBy;

  @Column(name = "last_edited_at")
  private Instant lastEditedAt;

  @Column(name = "source_template_id", updatable = false)
  private UUID sourceTemplateId;

  @Column(name = "revision", nullable = false)
  private long revision;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected WorkflowTemplate() {}

  public WorkflowTemplate(TemplateScope scope, String name, WorkflowType workflowType) {
    this.scopeKey = scope.key();
    this.name = name;
    this.workflowType = workflowType != null ? workflowType : WorkflowType.SUPPORTING;
    this.landingCategory = LandingCategory.PRIMARY;
    this.approvalStatus = WorkflowApprovalStatus.DRAFT;
    this.active = true;
    this.revision = 1;
  }

  @PrePersist
  void onPersist() {
    Instant now = Instant.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  void onUpdate() {
    updatedAt = Instant.now();
  }

  /**
   * Records an accepted edit: bumps the revision stamp callers must echo back on their next
   * mutation and stamps the editor.
   */
  public void markEdited(String editor) {
    revision++;
    stampEditor(editor);
  }

  /** Records who last touched the template without moving the revision. */
  public void stampEditor(String editor) {
    lastEditedBy = editor;
    lastEditedAt = Instant.now();
  }

  public void clearApproval() {
    approvedBy = null;
    approvedAt = null;
  }

  public UUID getId() {
    return id;
  }

  public TemplateScope getScope() {
    return TemplateScope.fromKey(scopeKey);
  }

  public String getScopeKey() {
    return scopeKey;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getIconKey() {
    return iconKey;
  }

  public void setIconKey(String iconKey) {
    this.iconKey = iconKey;
  }

  public String getColourHex() {
    return colourHex;
  }

  public void setColourHex(String colourHex) {
    this.colourHex = colourHex;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public WorkflowType getWorkflowType() {
    return workflowType;
  }

  public void setWorkflowType(WorkflowType workflowType) {
    this.workflowType = workflowType;
  }

  public LandingCategory getLandingCategory() {
    return landingCategory;
  }

  public void setLandingCategory(LandingCategory landingCategory) {
    this.landingCategory = landingCategory;
  }

  public WorkflowApprovalStatus getApprovalStatus() {
    return approvalStatus;
  }

  public void setApprovalStatus(WorkflowApprovalStatus approvalStatus) {
    this.approvalStatus = approvalStatus;
  }

  public String getApprovedBy() {
    return approvedBy;
  }

  public void setApprovedBy(String approvedBy) {
    this.approvedBy = approvedBy;
  }

  public Instant getApprovedAt() {
    return approvedAt;
  }

  public void setApprovedAt(Instant approvedAt) {
    this.approvedAt = approvedAt;
  }

  public String getReviewNote() {
    return reviewNote;
  }

  public void setReviewNote(String reviewNote) {
    this.reviewNote = reviewNote;
  }

  public String getLastEditedBy() {
    return lastEditedBy;
  }

  public Instant getLastEditedAt() {
    return lastEditedAt;
  }

  public UUID getSourceTemplateId() {
    return sourceTemplateId;
  }

  public void setSourceTemplateId(UUID sourceTemplateId) {
    this.sourceTemplateId = sourceTemplateId;
  }

  public long getRevision() {
    return revision;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
