package com.receptionkit.backend.workflow.controller;

import com.receptionkit.backend.workflow.api.RevisionedResponse;
import com.receptionkit.backend.workflow.api.StyleDefaultCopyRequest;
import com.receptionkit.backend.workflow.api.StyleDefaultRequest;
import com.receptionkit.backend.workflow.api.StyleDefaultResponse;
import com.receptionkit.backend.workflow.domain.WorkflowNodeStyleDefault;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import com.receptionkit.backend.workflow.security.HeaderWorkflowCallerResolver;
import com.receptionkit.backend.workflow.service.MutationResult;
import com.receptionkit.backend.workflow.service.StyleDefaultService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workflow/templates/{templateId}/style-defaults")
public class WorkflowStyleDefaultController {

  private final StyleDefaultService styleDefaultService;
  private final HeaderWorkflowCallerResolver callerResolver;

  public WorkflowStyleDefaultController(
      StyleDefaultService styleDefaultService, HeaderWorkflowCallerResolver callerResolver) {
    this.styleDefaultService = styleDefaultService;
    this.callerResolver = callerResolver;
  }

  @GetMapping
  public List<StyleDefaultResponse> list(HttpServletRequest httpRequest, @PathVariable UUID templateId) {
    return styleDefaultService.list(callerResolver.resolve(httpRequest), templateId).stream()
        .map(StyleDefaultResponse::from)
        .toList();
  }

  @PutMapping("/{nodeType}")
  public RevisionedResponse<StyleDefaultResponse> upsert(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @PathVariable WorkflowNodeType nodeType,
      @Valid @RequestBody StyleDefaultRequest request) {
    MutationResult<WorkflowNodeStyleDefault> result =
        styleDefaultService.upsert(callerResolver.resolve(httpRequest), templateId, nodeType, request);
    return new RevisionedResponse<>(result.revision(), StyleDefaultResponse.from(result.item()));
  }

  @DeleteMapping
  public RevisionedResponse<Void> reset(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @RequestParam(value = "nodeType", required = false) WorkflowNodeType nodeType,
      @RequestParam("expectedRevision") long expectedRevision) {
    MutationResult<Void> result =
        styleDefaultService.reset(callerResolver.resolve(httpRequest), templateId, nodeType, expectedRevision);
    return new RevisionedResponse<>(result.revision(), null);
  }

  @PostMapping("/copy")
  public RevisionedResponse<List<StyleDefaultResponse>> copy(
      HttpServletRequest httpRequest,
      @PathVariable UUID templateId,
      @Valid @RequestBody StyleDefaultCopyRequest request) {
    MutationResult<List<WorkflowNodeStyleDefault>> result =
        styleDefaultService.copy(callerResolver.resolve(httpRequest), templateId, request);
    return new RevisionedResponse<>(
        result.revision(), result.item().stream().map(StyleDefaultResponse::from).toList());
  }
}
