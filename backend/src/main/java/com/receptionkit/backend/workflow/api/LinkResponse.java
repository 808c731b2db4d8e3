package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.WorkflowNodeLink;
import java.util.UUID;

public record LinkResponse(UUID id, UUID sourceNodeId, UUID targetTemplateId, String label, int sortOrder) {

  public static LinkResponse from(WorkflowNodeLink link) {
    return new LinkResponse(
        link.getId(), link.getNodeId(), link.getTargetTemplateId(), link.getLabel(), link.getSortOrder());
  }
}
