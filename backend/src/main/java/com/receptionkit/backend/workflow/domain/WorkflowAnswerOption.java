package com.receptionkit.backend.workflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

/**
 * Directed edge from its source node. The target is kept as a bare id so that deleting the target
 * only leaves the edge dangling.
 */
@Entity
@Table(name = "workflow_answer_option")
public class WorkflowAnswerOption {

  public static final String DEFAULT_SOURCE_HANDLE = "source-bottom";
  public static final String DEFAULT_TARGET_HANDLE = "target-top";

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "node_id", updatable = false)
  private WorkflowNode node;

  @Column(name = "label", nullable = false)
  private String label;

  @Column(name = "value_key", nullable = false, length = 128)
  private String valueKey;

  @Column(name = "description")
  private String description;

  @Column(name = "next_node_id")
  private UUID nextNodeId;

  @Enumerated(EnumType.STRING)
  @Column(name = "action_key", length = 64)
  private WorkflowActionKey actionKey;

  @Column(name = "source_handle", length = 64)
  private String sourceHandle;

  @Column(name = "target_handle", length = 64)
  private String targetHandle;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected WorkflowAnswerOption() {}

  public WorkflowAnswerOption(WorkflowNode node, String label, String valueKey) {
    this.node = node;
    this.label = label;
    this.valueKey = valueKey;
    this.sourceHandle = DEFAULT_SOURCE_HANDLE;
    this.targetHandle = DEFAULT_TARGET_HANDLE;
  }

  @PrePersist
  void onPersist() {
    createdAt = Instant.now();
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

  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }

  public String getValueKey() {
    return valueKey;
  }

  public void setValueKey(String valueKey) {
    this.valueKey = valueKey;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public UUID getNextNodeId() {
    return nextNodeId;
  }

  public void setNextNodeId(UUID nextNodeId) {
    this.nextNodeId = nextNodeId;
  }

  public boolean isDangling() {
    return nextNodeId == null;
  }

  public WorkflowActionKey getActionKey() {
    return actionKey;
  }

  public void setActionKey(WorkflowActionKey actionKey) {
    this.actionKey = actionKey;
  }

  public String getSourceHandle() {
    return sourceHandle;
  }

  public void setSourceHandle(String sourceHandle) {
    this.sourceHandle = sourceHandle;
  }

  public String getTargetHandle() {
    return targetHandle;
  }

  public void setTargetHandle(String targetHandle) {
    this.targetHandle = targetHandle;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
