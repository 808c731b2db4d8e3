package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import com.receptionkit.backend.workflow.domain.WorkflowChoiceKind;
import com.receptionkit.backend.workflow.domain.WorkflowInstanceStep;
import java.time.Instant;
import java.util.UUID;

public record InstanceStepResponse(
    int sequence,
    UUID fromTemplateId,
    UUID fromNodeId,
    WorkflowChoiceKind choiceKind,
    UUID choiceId,
    String choiceLabel,
    UUID toTemplateId,
    UUID toNodeId,
    boolean templateSwitched,
    WorkflowActionKey actionKey,
    String note,
    String recordedBy,
    Instant recordedAt) {

  public static InstanceStepResponse from(WorkflowInstanceStep step) {
    return new InstanceStepResponse(
        step.getSequenceNo(),
        step.getFromTemplateId(),
        step.getFromNodeId(),
        step.getChoiceKind(),
        step.getChoiceId(),
        step.getChoiceLabel(),
        step.getToTemplateId(),
        step.getToNodeId(),
        step.isTemplateSwitched(),
        step.getActionKey(),
        step.getNote(),
        step.getRecordedBy(),
        step.getCreatedAt());
  }
}
