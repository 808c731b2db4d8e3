package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import com.receptionkit.backend.workflow.domain.WorkflowChoiceKind;
import com.receptionkit.backend.workflow.graph.WorkflowChoice;
import java.util.UUID;

public record ChoiceResponse(
    UUID id,
    WorkflowChoiceKind kind,
    String label,
    UUID targetNodeId,
    UUID targetTemplateId,
    WorkflowActionKey actionKey) {

  public static ChoiceResponse from(WorkflowChoice choice) {
    return new ChoiceResponse(
        choice.id(),
        choice.kind(),
        choice.label(),
        choice.targetNodeId(),
        choice.targetTemplateId(),
        choice.actionKey());
  }
}
