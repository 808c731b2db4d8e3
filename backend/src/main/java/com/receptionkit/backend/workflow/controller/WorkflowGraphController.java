package com.receptionkit.backend.workflow.controller;

import com.receptionkit.backend.workflow.api.BulkRepositionRequest;
import com.receptionkit.backend.workflow.api.EdgeCreateRequest;
import com.receptionkit.backend.workflow.api.EdgeResponse;
import com.receptionkit.backend.workflow.api.EdgeUpdateRequest;
import com.receptionkit.backend.workflow.api.LinkCreateRequest;
import com.receptionkit.backend.workflow.api.LinkResponse;
import com.receptionkit.backend.workflow.api.NodeCreateRequest;
import com.receptionkit.backend.workflow.api.NodePositionRequest;
import com.receptionkit.backend.workflow.api.NodeResponse;
import com.receptionkit.backend.workflow.api.NodeUpdateRequest;
import com.receptionkit.backend.workflow.api.RevisionedResponse;
import com.receptionkit.backend.workflow.domain.WorkflowAnswerOption;
import com.receptionkit.backend.workflow.domain.WorkflowNode;
import com.receptionkit.backend.workflow.domain.WorkflowNodeLink;
import com.receptionkit.backend.workflow.security.HeaderWorkflowCallerResolver;
import com.receptionkit.backend.workflow.service.GraphMutationService;
import com.receptionkit.backend.workflow.service.MutationResult;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workflow/templates/{templateId}")
public class WorkflowGraphController {

  private final GraphMutationService mutationService;
  private final HeaderWorkflowCallerResolver callerResolver;

  public WorkflowGraphController(
      GraphMutationService mutationService, HeaderWorkflowCallerResolver callerResolver) {
    this.mutationService = mutationService;
    this.callerResolver = callerResolver;
  }

  @PostMapping("/nodes")
  @ResponseStatus(HttpStatus.CREATED)
  public RevisionedResponse<NodeResponse> createNode(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @Valid @RequestBody NodeCreateRequest request) {
    return node(mutationService.createNode(callerResolver.resolve(httpRequest), templateId, request));
  }

  @PatchMapping("/nodes/{nodeId}")
  public RevisionedResponse<NodeResponse> updateNode(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @PathVariable UUID nodeId,
      @Valid @RequestBody NodeUpdateRequest request) {
    return node(mutationService.updateNode(callerResolver.resolve(httpRequest), templateId, nodeId, request));
  }

  @DeleteMapping("/nodes/{nodeId}")
  public RevisionedResponse<Void> deleteNode(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @PathVariable UUID nodeId,
      @RequestParam("expectedRevision") long expectedRevision) {
    return empty(
        mutationService.deleteNode(callerResolver.resolve(httpRequest), templateId, nodeId, expectedRevision));
  }

  @PostMapping("/nodes/{nodeId}/position")
  public RevisionedResponse<NodeResponse> repositionNode(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @PathVariable UUID nodeId,
      @Valid @RequestBody NodePositionRequest request) {
    return node(
        mutationService.repositionNode(callerResolver.resolve(httpRequest), templateId, nodeId, request));
  }

  @PutMapping("/nodes/positions")
  public RevisionedResponse<List<NodeResponse>> repositionNodes(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @Valid @RequestBody BulkRepositionRequest request) {
    MutationResult<List<WorkflowNode>> result =
        mutationService.repositionNodes(callerResolver.resolve(httpRequest), templateId, request);
    return new RevisionedResponse<>(
        result.revision(), result.item().stream().map(NodeResponse::from).toList());
  }

  @PostMapping("/edges")
  @ResponseStatus(HttpStatus.CREATED)
  public RevisionedResponse<EdgeResponse> createEdge(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @Valid @RequestBody EdgeCreateRequest request) {
    return edge(mutationService.createEdge(callerResolver.resolve(httpRequest), templateId, request));
  }

  @PatchMapping("/edges/{edgeId}")
  public RevisionedResponse<EdgeResponse> updateEdge(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @PathVariable UUID edgeId,
      @Valid @RequestBody EdgeUpdateRequest request) {
    return edge(mutationService.updateEdge(callerResolver.resolve(httpRequest), templateId, edgeId, request));
  }

  @DeleteMapping("/edges/{edgeId}")
  public RevisionedResponse<Void> deleteEdge(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @PathVariable UUID edgeId,
      @RequestParam("expectedRevision") long expectedRevision) {
    return empty(
        mutationService.deleteEdge(callerResolver.resolve(httpRequest), templateId, edgeId, expectedRevision));
  }

  @PostMapping("/links")
  @ResponseStatus(HttpStatus.CREATED)
  public RevisionedResponse<LinkResponse> createLink(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @Valid @RequestBody LinkCreateRequest request) {
    MutationResult<WorkflowNodeLink> result =
        mutationService.createLink(callerResolver.resolve(httpRequest), templateId, request);
    return new RevisionedResponse<>(result.revision(), LinkResponse.from(result.item()));
  }

  @DeleteMapping("/links/{linkId}")
  public RevisionedResponse<Void> deleteLink(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @PathVariable UUID linkId,
      @RequestParam("expectedRevision") long expectedRevision) {
    return empty(
        mutationService.deleteLink(callerResolver.resolve(httpRequest), templateId, linkId, expectedRevision));
  }

  private static RevisionedResponse<NodeResponse> node(MutationResult<WorkflowNode> result) {
    return new RevisionedResponse<>(result.revision(), NodeResponse.from(result.item()));
  }

  private static RevisionedResponse<EdgeResponse> edge(MutationResult<WorkflowAnswerOption> result) {
    return new RevisionedResponse<>(result.revision(), EdgeResponse.from(result.item()));
  }

  private static RevisionedResponse<Void> empty(MutationResult<Void> result) {
    return new RevisionedResponse<>(result.revision(), null);
  }
}
