package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import com.receptionkit.backend.workflow.domain.WorkflowAnswerOption;
import java.util.UUID;

public record EdgeResponse(
    UUID id,
    UUID sourceNodeId,
    UUID targetNodeId,
    String label,
    String valueKey,
    String description,
    WorkflowActionKey actionKey,
    String sourceHandle,
    String targetHandle) {

  public static EdgeResponse from(WorkflowAnswerOption option) {
    return new EdgeResponse(
        option.getId(),
        option.getNodeId(),
        option.getNextNodeId(),
        option.getLabel(),
        option.getValueKey(),
        option.getDescription(),
        option.getActionKey(),
        option.getSourceHandle(),
        option.getTargetHandle());
  }
}
