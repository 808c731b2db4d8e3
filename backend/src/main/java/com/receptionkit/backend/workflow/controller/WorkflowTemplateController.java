package com.receptionkit.backend.workflow.controller;

import com.receptionkit.backend.workflow.api.CloneTemplateRequest;
import com.receptionkit.backend.workflow.api.EdgeResponse;
import com.receptionkit.backend.workflow.api.EffectiveTemplateResponse;
import com.receptionkit.backend.workflow.api.LinkResponse;
import com.receptionkit.backend.workflow.api.NodeResponse;
import com.receptionkit.backend.workflow.api.ReviewNoteRequest;
import com.receptionkit.backend.workflow.api.RevisionRequest;
import com.receptionkit.backend.workflow.api.StyleDefaultResponse;
import com.receptionkit.backend.workflow.api.TemplateCreateRequest;
import com.receptionkit.backend.workflow.api.TemplateGraphResponse;
import com.receptionkit.backend.workflow.api.TemplateResponse;
import com.receptionkit.backend.workflow.api.TemplateUpdateRequest;
import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.graph.EntryNodeResolver;
import com.receptionkit.backend.workflow.graph.GraphNode;
import com.receptionkit.backend.workflow.security.HeaderWorkflowCallerResolver;
import com.receptionkit.backend.workflow.security.WorkflowAccessPolicy;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.service.ApprovalService;
import com.receptionkit.backend.workflow.service.EffectiveTemplateService;
import com.receptionkit.backend.workflow.service.TemplateCloneService;
import com.receptionkit.backend.workflow.service.TemplateContents;
import com.receptionkit.backend.workflow.service.TemplateService;
import com.receptionkit.backend.workflow.service.WorkflowGraphStore;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workflow/templates")
public class WorkflowTemplateController {

  private final TemplateService templateService;
  private final ApprovalService approvalService;
  private final TemplateCloneService cloneService;
  private final EffectiveTemplateService effectiveTemplateService;
  private final WorkflowGraphStore graphStore;
  private final WorkflowAccessPolicy accessPolicy;
  private final HeaderWorkflowCallerResolver callerResolver;

  public WorkflowTemplateController(
      TemplateService templateService,
      ApprovalService approvalService,
      TemplateCloneService cloneService,
      EffectiveTemplateService effectiveTemplateService,
      WorkflowGraphStore graphStore,
      WorkflowAccessPolicy accessPolicy,
      HeaderWorkflowCallerResolver callerResolver) {
    this.templateService = templateService;
    this.approvalService = approvalService;
    this.cloneService = cloneService;
    this.effectiveTemplateService = effectiveTemplateService;
    this.graphStore = graphStore;
    this.accessPolicy = accessPolicy;
    this.callerResolver = callerResolver;
  }

  @GetMapping
  public List<TemplateResponse> listTemplates(
      HttpServletRequest httpRequest,
      @RequestParam(value = "activeOnly", defaultValue = "false") boolean activeOnly) {
    WorkflowCaller caller = callerResolver.resolve(httpRequest);
    return templateService.listTemplates(caller, activeOnly).stream().map(TemplateResponse::from).toList();
  }

  @GetMapping("/effective")
  public List<EffectiveTemplateResponse> listEffective(
      HttpServletRequest httpRequest,
      @RequestParam(value = "tenantId", required = false) String tenantId,
      @RequestParam(value = "includeDrafts", defaultValue = "false") boolean includeDrafts,
      @RequestParam(value = "includeInactive", defaultValue = "false") boolean includeInactive) {
    WorkflowCaller caller = callerResolver.resolve(httpRequest);
    String tenant = StringUtils.hasText(tenantId) ? tenantId : caller.tenantId();
    return effectiveTemplateService.listEffective(caller, tenant, includeDrafts, includeInactive).stream()
        .map(EffectiveTemplateResponse::from)
        .toList();
  }

  @GetMapping("/{templateId}")
  public TemplateGraphResponse getTemplate(
      HttpServletRequest httpRequest, @PathVariable UUID templateId) {
    WorkflowCaller caller = callerResolver.resolve(httpRequest);
    TemplateContents contents = graphStore.loadContents(templateId, caller);
    UUID entryNodeId = EntryNodeResolver.resolve(contents.graph()).map(GraphNode::id).orElse(null);
    return new TemplateGraphResponse(
        TemplateResponse.from(contents.template()),
        entryNodeId,
        contents.nodes().stream().map(NodeResponse::from).toList(),
        contents.options().stream().map(EdgeResponse::from).toList(),
        contents.links().stream().map(LinkResponse::from).toList(),
        contents.styleDefaults().stream().map(StyleDefaultResponse::from).toList());
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public TemplateResponse createTemplate(
      HttpServletRequest httpRequest, @Valid @RequestBody TemplateCreateRequest request) {
    WorkflowCaller caller = callerResolver.resolve(httpRequest);
    return TemplateResponse.from(templateService.createTemplate(caller, request));
  }

  @PatchMapping("/{templateId}")
  public TemplateResponse updateTemplate(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @Valid @RequestBody TemplateUpdateRequest request) {
    WorkflowCaller caller = callerResolver.resolve(httpRequest);
    return TemplateResponse.from(templateService.updateTemplate(caller, templateId, request));
  }

  @DeleteMapping("/{templateId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void deleteTemplate(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @RequestParam("expectedRevision") long expectedRevision) {
    templateService.deleteTemplate(callerResolver.resolve(httpRequest), templateId, expectedRevision);
  }

  @PostMapping("/{templateId}/submit")
  public TemplateResponse submitForReview(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @Valid @RequestBody RevisionRequest request) {
    WorkflowCaller caller = callerResolver.resolve(httpRequest);
    return TemplateResponse.from(
        approvalService.submitForReview(caller, templateId, request.expectedRevision()));
  }

  @PostMapping("/{templateId}/approve")
  public TemplateResponse approve(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @Valid @RequestBody RevisionRequest request) {
    WorkflowCaller caller = callerResolver.resolve(httpRequest);
    return TemplateResponse.from(approvalService.approve(caller, templateId, request.expectedRevision()));
  }

  @PostMapping("/{templateId}/request-changes")
  public TemplateResponse requestChanges(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @Valid @RequestBody ReviewNoteRequest request) {
    WorkflowCaller caller = callerResolver.resolve(httpRequest);
    return TemplateResponse.from(
        approvalService.requestChanges(caller, templateId, request.expectedRevision(), request.note()));
  }

  @PostMapping("/{templateId}/reopen")
  public TemplateResponse reopenForEditing(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @Valid @RequestBody RevisionRequest request) {
    WorkflowCaller caller = callerResolver.resolve(httpRequest);
    return TemplateResponse.from(
        approvalService.reopenForEditing(caller, templateId, request.expectedRevision()));
  }

  @PostMapping("/{templateId}/clone")
  @ResponseStatus(HttpStatus.CREATED)
  public TemplateResponse cloneTemplate(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @RequestBody(required = false) CloneTemplateRequest request) {
    WorkflowCaller caller = callerResolver.resolve(httpRequest);
    CloneTemplateRequest destination = request != null ? request : new CloneTemplateRequest(false, null);
    TemplateScope scope = accessPolicy.resolveScope(caller, destination.global(), destination.tenantId());
    return TemplateResponse.from(cloneService.cloneTemplate(caller, templateId, scope));
  }
}
