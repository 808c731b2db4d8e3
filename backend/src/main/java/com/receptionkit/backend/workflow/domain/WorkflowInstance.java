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
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "workflow_instance")
public class WorkflowInstance {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "tenant_id", nullable = false, length = 128, updatable = false)
  private String tenantId;

  @Column(name = "root_template_id", nullable = false, updatable = false)
  private UUID rootTemplateId;

  @Column(name = "template_id", nullable = false)
  private UUID templateId;

  @Column(name = "current_node_id")
  private UUID currentNodeId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 32)
  private WorkflowInstanceStatus status;

  @Column(name = "reference", length = 256)
  private String reference;

  @Column(name = "category", length = 128)
  private String category;

  @Column(name = "started_by", nullable = false, length = 128, updatable = false)
  private String startedBy;

  @Column(name = "step_count", nullable = false)
  private int stepCount;

  @Column(name = "state_version", nullable = false)
  private long stateVersion;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "closed_at")
  private Instant closedAt;

  protected WorkflowInstance() {}

  public WorkflowInstance(String tenantId, UUID templateId, UUID entryNodeId, String startedBy) {
    this.tenantId = tenantId;
    this.rootTemplateId = templateId;
    this.templateId = templateId;
    this.currentNodeId = entryNodeId;
    this.startedBy = startedBy;
    this.status = WorkflowInstanceStatus.IN_PROGRESS;
    this.stateVersion = 1;
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

  /** Moves the cursor after an accepted transition; history is appended separately. */
  public void moveTo(UUID templateId, UUID nodeId) {
    this.templateId = templateId;
    this.currentNodeId = nodeId;
    this.stepCount++;
    this.stateVersion++;
  }

  public void complete() {
    this.status = WorkflowInstanceStatus.COMPLETED;
    this.closedAt = Instant.now();
  }

  public void abandon() {
    this.status = WorkflowInstanceStatus.ABANDONED;
    this.closedAt = Instant.now();
    this.stateVersion++;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getRootTemplateId() {
    return rootTemplateId;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public UUID getCurrentNodeId() {
    return currentNodeId;
  }

  public WorkflowInstanceStatus getStatus() {
    return status;
  }

  public String getReference() {
    return reference;
  }

  public void setReference(String reference) {
    this.reference = reference;
  }

  public String getCategory() {
    return category;
  }

  public void setCategory(String category) {
    this.category = category;
  }

  public String getStartedBy() {
    return startedBy;
  }

  public int getStepCount() {
    return stepCount;
  }

  public long getStateVersion() {
    return stateVersion;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getClosedAt() {
    return closedAt;
  }
}
