package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.NodeStyle;
import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import com.receptionkit.backend.workflow.domain.WorkflowNode;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import java.util.List;
import java.util.UUID;

public record NodeResponse(
    UUID id,
    UUID templateId,
    WorkflowNodeType type,
    String title,
    String body,
    int sortOrder,
    boolean start,
    WorkflowActionKey actionKey,
    Integer positionX,
    Integer positionY,
    List<String> badges,
    NodeStyle style) {

  public static NodeResponse from(WorkflowNode node) {
    return new NodeResponse(
        node.getId(),
        node.getTemplateId(),
        node.getNodeType(),
        node.getTitle(),
        node.getBody(),
        node.getSortOrder(),
        node.isStart(),
        node.getActionKey(),
        node.getPositionX(),
        node.getPositionY(),
        node.getBadges(),
        node.getStyle());
  }
}
