package com.receptionkit.backend.workflow.graph;

import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import com.receptionkit.backend.workflow.domain.WorkflowAnswerOption;
import java.util.UUID;

public record GraphEdge(
    UUID id, UUID sourceNodeId, UUID targetNodeId, String label, WorkflowActionKey actionKey) {

  public static GraphEdge of(WorkflowAnswerOption option) {
    return new GraphEdge(
        option.getId(), option.getNodeId(), option.getNextNodeId(), option.getLabel(), option.getActionKey());
  }

  public boolean isDangling() {
    return targetNodeId == null;
  }
}
