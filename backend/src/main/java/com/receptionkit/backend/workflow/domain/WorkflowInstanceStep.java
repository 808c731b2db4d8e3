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
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

/** One append-only history entry of an instance. Rows are never updated after insert. */
@Entity
@Immutable
@Table(name = "workflow_instance_step")
public class WorkflowInstanceStep {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "instance_id", updatable = false)
  private WorkflowInstance instance;

  @Column(name = "sequence_no", nullable = false, updatable = false)
  private int sequenceNo;

  @Column(name = "from_template_id", nullable = false, updatable = false)
  private UUID fromTemplateId;

  @Column(name = "from_node_id", nullable = false, updatable = false)
  private UUID fromNodeId;

  @Enumerated(EnumType.STRING)
  @Column(name = "choice_kind", nullable = false, length = 32, updatable = false)
  private WorkflowChoiceKind choiceKind;

  @Column(name = "choice_id", nullable = false, updatable = false)
  private UUID choiceId;

  @Column(name = "choice_label", updatable = false)
  private String choiceLabel;

  @Column(name = "to_template_id", nullable = false, updatable = false)
  private UUID toTemplateId;

  @Column(name = "to_node_id", updatable = false)
  private UUID toNodeId;

  @Column(name = "template_switched", nullable = false, updatable = false)
  private boolean templateSwitched;

  @Enumerated(EnumType.STRING)
  @Column(name = "action_key", length = 64, updatable = false)
  private WorkflowActionKey actionKey;

  @Column(name = "note", updatable = false)
  private String note;

  @Column(name = "recorded_by", length = 128, updatable = false)
  private String recordedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected WorkflowInstanceStep() {}

  public WorkflowInstanceStep(
      WorkflowInstance instance,
      int sequenceNo,
      UUID fromTemplateId,
      UUID fromNodeId,
      WorkflowChoiceKind choiceKind,
      UUID choiceId,
      String choiceLabel,
      UUID toTemplateId,
      UUID toNodeId,
      WorkflowActionKey actionKey,
      String note,
      String recordedBy) {
    this.instance = instance;
    this.sequenceNo = sequenceNo;
    this.fromTemplateId = fromTemplateId;
    this.fromNodeId = fromNodeId;
    this.choiceKind = choiceKind;
    this.choiceId = choiceId;
    this.choiceLabel = choiceLabel;
    this.toTemplateId = toTemplateId;
    this.toNodeId = toNodeId;
    this.templateSwitched = !toTemplateId.equals(fromTemplateId);
    this.actionKey = actionKey;
    this.note = note;
    this.recordedBy = recordedBy;
  }

  @PrePersist
  void onPersist() {
    createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public WorkflowInstance getInstance() {
    return instance;
  }

  public int getSequenceNo() {
    return sequenceNo;
  }

  public UUID getFromTemplateId() {
    return fromTemplateId;
  }

  public UUID getFromNodeId() {
    return fromNodeId;
  }

  public WorkflowChoiceKind getChoiceKind() {
    return choiceKind;
  }

  public UUID getChoiceId() {
    return choiceId;
  }

  public String getChoiceLabel() {
    return choiceLabel;
  }

  public UUID getToTemplateId() {
    return toTemplateId;
  }

  public UUID getToNodeId() {
    return toNodeId;
  }

  public boolean isTemplateSwitched() {
    return templateSwitched;
  }

  public WorkflowActionKey getActionKey() {
    return actionKey;
  }

  public String getNote() {
    return note;
  }

  public String getRecordedBy() {
    return recordedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
