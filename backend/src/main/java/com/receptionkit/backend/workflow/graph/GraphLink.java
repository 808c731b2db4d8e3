package com.receptionkit.backend.workflow.graph;

import com.receptionkit.backend.workflow.domain.WorkflowNodeLink;
import java.util.UUID;

public record GraphLink(UUID id, UUID sourceNodeId, UUID targetTemplateId, String label, int sortOrder) {

  public static GraphLink of(WorkflowNodeLink link) {
    return new GraphLink(
        link.getId(), link.getNodeId(), link.getTargetTemplateId(), link.getLabel(), link.getSortOrder());
  }
}
