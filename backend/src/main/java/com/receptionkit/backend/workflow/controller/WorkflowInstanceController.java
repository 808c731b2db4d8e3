package com.receptionkit.backend.workflow.controller;

import com.receptionkit.backend.workflow.api.AdvanceResponse;
import com.receptionkit.backend.workflow.api.ChoiceResponse;
import com.receptionkit.backend.workflow.api.InstanceAbandonRequest;
import com.receptionkit.backend.workflow.api.InstanceAdvanceRequest;
import com.receptionkit.backend.workflow.api.InstanceResponse;
import com.receptionkit.backend.workflow.api.InstanceStartRequest;
import com.receptionkit.backend.workflow.api.InstanceStepResponse;
import com.receptionkit.backend.workflow.domain.WorkflowInstanceStatus;
import com.receptionkit.backend.workflow.security.HeaderWorkflowCallerResolver;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.service.AdvanceResult;
import com.receptionkit.backend.workflow.service.InstanceExecutionService;
import com.receptionkit.backend.workflow.service.WorkflowInstanceView;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workflow/instances")
public class WorkflowInstanceController {

  private final InstanceExecutionService executionService;
  private final HeaderWorkflowCallerResolver callerResolver;

  public WorkflowInstanceController(
      InstanceExecutionService executionService, HeaderWorkflowCallerResolver callerResolver) {
    this.executionService = executionService;
    this.callerResolver = callerResolver;
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public InstanceResponse start(
      HttpServletRequest httpRequest, @Valid @RequestBody InstanceStartRequest request) {
    return InstanceResponse.from(executionService.start(callerResolver.resolve(httpRequest), request));
  }

  @GetMapping
  public List<InstanceResponse> list(
      HttpServletRequest httpRequest,
      @RequestParam(value = "tenantId", required = false) String tenantId,
      @RequestParam(value = "status", required = false) WorkflowInstanceStatus status) {
    WorkflowCaller caller = callerResolver.resolve(httpRequest);
    return executionService.listInstances(caller, tenantId, status).stream()
        .map(instance -> InstanceResponse.from(new WorkflowInstanceView(instance, null, List.of())))
        .toList();
  }

  @GetMapping("/{instanceId}")
  public InstanceResponse get(HttpServletRequest httpRequest, @PathVariable UUID instanceId) {
    return InstanceResponse.from(executionService.getInstance(callerResolver.resolve(httpRequest), instanceId));
  }

  @GetMapping("/{instanceId}/choices")
  public List<ChoiceResponse> choices(HttpServletRequest httpRequest, @PathVariable UUID instanceId) {
    return executionService.availableChoices(callerResolver.resolve(httpRequest), instanceId).stream()
        .map(ChoiceResponse::from)
        .toList();
  }

  @PostMapping("/{instanceId}/advance")
  public AdvanceResponse advance(
      HttpServletRequest httpRequest,
      @PathVariable UUID instanceId,
      @Valid @RequestBody InstanceAdvanceRequest request) {
    AdvanceResult result = executionService.advance(callerResolver.resolve(httpRequest), instanceId, request);
    return new AdvanceResponse(InstanceResponse.from(result.view()), InstanceStepResponse.from(result.step()));
  }

  @PostMapping("/{instanceId}/abandon")
  public InstanceResponse abandon(
      HttpServletRequest httpRequest,
      @PathVariable UUID instanceId,
      @RequestBody(required = false) InstanceAbandonRequest request) {
    Long expectedStateVersion = request != null ? request.expectedStateVersion() : null;
    return InstanceResponse.from(
        executionService.abandon(callerResolver.resolve(httpRequest), instanceId, expectedStateVersion));
  }

  @GetMapping("/{instanceId}/history")
  public List<InstanceStepResponse> history(HttpServletRequest httpRequest, @PathVariable UUID instanceId) {
    return executionService.history(callerResolver.resolve(httpRequest), instanceId).stream()
        .map(InstanceStepResponse::from)
        .toList();
  }
}
