package com.receptionkit.backend.workflow.graph;

import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import com.receptionkit.backend.workflow.domain.WorkflowChoiceKind;
import java.util.UUID;

/**
 * One option the runtime can offer at a node. For {@link WorkflowChoiceKind#LINK} only {@code
 * targetTemplateId} is set; otherwise {@code targetNodeId} is the destination in the same template
 * and may be {@code null} (dangling edge, or a continue past the last node).
 */
public record WorkflowChoice(
    UUID id,
    WorkflowChoiceKind kind,
    String label,
    UUID targetNodeId,
    UUID targetTemplateId,
    WorkflowActionKey actionKey) {

  public boolean isLink() {
    return kind == WorkflowChoiceKind.LINK;
  }
}
