package com.receptionkit.backend.workflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "workflow_node_link")
public class WorkflowNodeLink {

  public static final String DEFAULT_LABEL = "Open linked workflow";

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "node_id", updatable = false)
  private WorkflowNode node;

  @Column(name = "target_template_id", nullable = false)
  private UUID targetTemplateId;

  @Column(name = "label", nullable = false)
  private String label;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected WorkflowNodeLink() {}

  public WorkflowNodeLink(WorkflowNode node, UUID targetTemplateId, String label, int sortOrder) {
    this.node = node;
    this.targetTemplateId = targetTemplateId;
    this.label = label;
    this.sortOrder = sortOrder;
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

  public UUID getId() {
    return id;
  }

  public WorkflowNode getNode() {
    return node;
  }

  public UUID getNodeId() {
    return node != null ? node.getId() : null;
  }

  public UUID getTargetTemplateId() {
    return targetTemplateId;
  }

  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public void setSortOrder(int sortOrder) {
    this.sortOrder = sortOrder;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
