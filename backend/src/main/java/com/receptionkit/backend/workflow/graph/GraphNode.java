package com.receptionkit.backend.workflow.graph;

import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import com.receptionkit.backend.workflow.domain.WorkflowNode;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import java.util.Comparator;
import java.util.UUID;

public record GraphNode(
    UUID id, WorkflowNodeType type, String title, int sortOrder, boolean start, WorkflowActionKey actionKey) {

  /** Sort order first, then the id string so that equal sort orders still resolve the same way. */
  public static final Comparator<GraphNode> BY_SORT_ORDER =
      Comparator.comparingInt(GraphNode::sortOrder).thenComparing(node -> node.id().toString());

  public static GraphNode of(WorkflowNode node) {
    return new GraphNode(
        node.getId(),
        node.getNodeType(),
        node.getTitle(),
        node.getSortOrder(),
        node.isStart(),
        node.getActionKey());
  }
}
