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
    name = "workflow_node_style_default",
    uniqueConstraints =
        @UniqueConstraint(name = "uq_workflow_style_default_type", columnNames = {"template_id", "node_type"}))
public class WorkflowNodeStyleDefault {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "template_id", nullable = false, updatable = false)
  private UUID templateId;

  @Enumerated(EnumType.STRING)
  @Column(name = "node_type", nullable = false, length = 32, updatable = false)
  private WorkflowNodeType nodeType;

  @Column(name = "bg_color", length = 16)
  private String bgColor;

  @Column(name = "text_color", length = 16)
  private String textColor;

  @Column(name = "border_color", length = 16)
  private String borderColor;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected WorkflowNodeStyleDefault() {}

  public WorkflowNodeStyleDefault(UUID templateId, WorkflowNodeType nodeType) {
    this.templateId = templateId;
    this.nodeType = nodeType;
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

  public void applyColours(String bgColor, String textColor, String borderColor) {
    this.bgColor = bgColor;
    this.textColor = textColor;
    this.borderColor = borderColor;
  }

  public NodeStyle toStyle() {
    return NodeStyle.colours(bgColor, textColor, borderColor);
  }

  public UUID getId() {
    return id;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public WorkflowNodeType getNodeType() {
    return nodeType;
  }

  public String getBgColor() {
    return bgColor;
  }

  public String getTextColor() {
    return textColor;
  }

  public String getBorderColor() {
    return borderColor;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
