package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.WorkflowInstance;
import com.receptionkit.backend.workflow.domain.WorkflowInstanceStatus;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import com.receptionkit.backend.workflow.graph.GraphNode;
import com.receptionkit.backend.workflow.service.WorkflowInstanceView;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record InstanceResponse(
    UUID id,
    String tenantId,
    UUID rootTemplateId,
    @Schema(description = "Template currently executing; differs from the root after a link jump.")
        UUID templateId,
    UUID currentNodeId,
    String currentNodeTitle,
    WorkflowNodeType currentNodeType,
    WorkflowInstanceStatus status,
    String reference,
    String category,
    String startedBy,
    int stepCount,
    @Schema(description = "Stamp to echo back on the next advance.") long stateVersion,
    Instant createdAt,
    Instant updatedAt,
    Instant closedAt,
    List<ChoiceResponse> choices) {

  public static InstanceResponse from(WorkflowInstanceView view) {
    WorkflowInstance instance = view.instance();
    GraphNode node = view.currentNode();
    return new InstanceResponse(
        instance.getId(),
        instance.getTenantId(),
        instance.getRootTemplateId(),
        instance.getTemplateId(),
        instance.getCurrentNodeId(),
        node != null ? node.title() : null,
        node != null ? node.type() : null,
        instance.getStatus(),
        instance.getReference(),
        instance.getCategory(),
        instance.getStartedBy(),
        instance.getStepCount(),
        instance.getStateVersion(),
        instance.getCreatedAt(),
        instance.getUpdatedAt(),
        instance.getClosedAt(),
        view.choices().stream().map(ChoiceResponse::from).toList());
  }
}
