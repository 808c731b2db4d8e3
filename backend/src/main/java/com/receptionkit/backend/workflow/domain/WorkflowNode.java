package com.receptionkit.backend.workflow.domain;

import com.receptionkit.backend.shared.json.StringListJsonConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "workflow_node")
public class WorkflowNode {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "template_id", updatable = false)
  private WorkflowTemplate template;

  @Enumerated(EnumType.STRING)
  @Column(name = "node_type", nullable = false, length = 32)
  private WorkflowNodeType nodeType;

  @Column(name = "title", nullable = false)
  private String title;

  @Column(name = "body")
  private String body;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "is_start", nullable = false)
  private boolean start;

  @Enumerated(EnumType.STRING)
  @Column(name = "action_key", length = 64)
  private WorkflowActionKey actionKey;

  @Column(name = "position_x")
  private Integer positionX;

  @Column(name = "position_y")
  private Integer positionY;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "badges", columnDefinition = "jsonb")
  @Convert(converter = StringListJsonConverter.class)
  private List<String> badges = List.of();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "style", columnDefinition = "jsonb")
  @Convert(converter = NodeStyleConverter.class)
  private NodeStyle style;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected WorkflowNode() {}

  public WorkflowNode(WorkflowTemplate template, WorkflowNodeType nodeType, String title, int sortOrder) {
    this.template = template;
    this.nodeType = nodeType;
    this.title = title;
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

  public WorkflowTemplate getTemplate() {
    return template;
  }

  public UUID getTemplateId() {
    return template != null ? template.getId() : null;
  }

  public WorkflowNodeType getNodeType() {
    return nodeType;
  }

  public void setNodeType(WorkflowNodeType nodeType) {
    this.nodeType = nodeType;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getBody() {
    return body;
  }

  public void setBody(String body) {
    this.body = body;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public void setSortOrder(int sortOrder) {
    this.sortOrder = sortOrder;
  }

  public boolean isStart() {
    return start;
  }

  public void setStart(boolean start) {
    this.start = start;
  }

  public WorkflowActionKey getActionKey() {
    return actionKey;
  }

  public void setActionKey(WorkflowActionKey actionKey) {
    this.actionKey = actionKey;
  }

  public Integer getPositionX() {
    return positionX;
  }

  public Integer getPositionY() {
    return positionY;
  }

  public void moveTo(Integer positionX, Integer positionY) {
    this.positionX = positionX;
    this.positionY = positionY;
  }

  public List<String> getBadges() {
    return badges != null ? badges : List.of();
  }

  public void setBadges(List<String> badges) {
    this.badges = StringListJsonConverter.normalize(badges);
  }

  public NodeStyle getStyle() {
    return style;
  }

  public void setStyle(NodeStyle style) {
    this.style = style;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
