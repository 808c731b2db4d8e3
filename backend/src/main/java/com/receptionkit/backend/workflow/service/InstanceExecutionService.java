package com.receptionkit.backend.workflow.service;

import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.api.InstanceAdvanceRequest;
import com.receptionkit.backend.workflow.api.InstanceStartRequest;
import com.receptionkit.backend.workflow.config.WorkflowEngineProperties;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowInstance;
import com.receptionkit.backend.workflow.domain.WorkflowInstanceStatus;
import com.receptionkit.backend.workflow.domain.WorkflowInstanceStep;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.graph.ChoicePlanner;
import com.receptionkit.backend.workflow.graph.EntryNodeResolver;
import com.receptionkit.backend.workflow.graph.GraphNode;
import com.receptionkit.backend.workflow.graph.TemplateGraph;
import com.receptionkit.backend.workflow.graph.WorkflowChoice;
import com.receptionkit.backend.workflow.persistence.WorkflowInstanceRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowInstanceStepRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowTemplateRepository;
import com.receptionkit.backend.workflow.security.WorkflowAccessPolicy;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.telemetry.WorkflowTelemetryService;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Runs instances of approved templates node by node. Each call reads the current graph, so authoring
 * edits made after an instance started apply to its remaining steps.
 */
@Service
public class InstanceExecutionService {

  private static final Logger log = LoggerFactory.getLogger(InstanceExecutionService.class);

  private final WorkflowInstanceRepository instanceRepository;
  private final WorkflowInstanceStepRepository stepRepository;
  private final WorkflowTemplateRepository templateRepository;
  private final WorkflowGraphStore graphStore;
  private final WorkflowAccessPolicy accessPolicy;
  private final WorkflowEngineProperties engineProperties;
  private final WorkflowTelemetryService telemetry;

  public InstanceExecutionService(
      WorkflowInstanceRepository instanceRepository,
      WorkflowInstanceStepRepository stepRepository,
      WorkflowTemplateRepository templateRepository,
      WorkflowGraphStore graphStore,
      WorkflowAccessPolicy accessPolicy,
      WorkflowEngineProperties engineProperties,
      WorkflowTelemetryService telemetry) {
    this.instanceRepository = instanceRepository;
    this.stepRepository = stepRepository;
    this.templateRepository = templateRepository;
    this.graphStore = graphStore;
    this.accessPolicy = accessPolicy;
    this.engineProperties = engineProperties;
    this.telemetry = telemetry;
  }

  @Transactional
  public WorkflowInstanceView start(WorkflowCaller caller, InstanceStartRequest request) {
    String tenantId = StringUtils.hasText(request.tenantId()) ? request.tenantId().trim() : caller.tenantId();
    if (tenantId == null) {
      throw WorkflowException.validation("A tenant id is required to start a workflow");
    }
    accessPolicy.checkTenantAccess(caller, tenantId);

    WorkflowTemplate template =
        templateRepository
            .findById(request.templateId())
            .filter(candidate -> candidate.getScope().visibleTo(tenantId))
            .orElseThrow(() -> WorkflowException.notFound("Workflow template not found: " + request.templateId()));
    requireRunnable(template, "start");
    TemplateGraph graph = graphStore.graph(template.getId());
    GraphNode entry =
        EntryNodeResolver.resolve(graph)
            .orElseThrow(() -> WorkflowException.invalidState("Workflow has no nodes to start from"));

    WorkflowInstance instance = new WorkflowInstance(tenantId, template.getId(), entry.id(), caller.callerId());
    instance.setReference(trimToNull(request.reference()));
    instance.setCategory(trimToNull(request.category()));
    if (entry.type().isTerminal()) {
      instance.complete();
    }
    WorkflowInstance saved = instanceRepository.save(instance);
    telemetry.recordInstanceStarted(saved);
    return view(saved, graph);
  }

  /**
   * Applies one choice at the current node. Exactly one history entry is appended per successful
   * call; a stale {@code expectedStateVersion} is rejected as a conflict.
   */
  @Transactional
  public AdvanceResult advance(WorkflowCaller caller, UUID instanceId, InstanceAdvanceRequest request) {
    WorkflowInstance instance = lockInstance(caller, instanceId);
    try {
      requireInProgress(instance);
      if (request.expectedStateVersion() == null
          || request.expectedStateVersion() != instance.getStateVersion()) {
        throw WorkflowException.conflict(
            "Instance is at state version "
                + instance.getStateVersion()
                + " but the request expected "
                + request.expectedStateVersion());
      }
      if (instance.getStepCount() >= engineProperties.getMaxSteps()) {
        throw WorkflowException.invalidState(
            "Instance reached the limit of " + engineProperties.getMaxSteps() + " steps");
      }

      TemplateGraph graph = graphStore.graph(instance.getTemplateId());
      UUID fromTemplateId = instance.getTemplateId();
      UUID fromNodeId = instance.getCurrentNodeId();
      if (fromNodeId == null || !graph.contains(fromNodeId)) {
        throw WorkflowException.invalidState("The current step of this workflow no longer exists");
      }
      WorkflowChoice choice =
          ChoicePlanner.find(graph, fromNodeId, request.choiceId())
              .orElseThrow(
                  () -> WorkflowException.validation("Choice " + request.choiceId() + " is not offered at the current node"));

      TemplateGraph landingGraph = graph;
      UUID toTemplateId = fromTemplateId;
      UUID toNodeId;
      switch (choice.kind()) {
        case LINK -> {
          WorkflowTemplate target = linkTarget(instance, choice.targetTemplateId());
          landingGraph = graphStore.graph(target.getId());
          toTemplateId = target.getId();
          toNodeId =
              EntryNodeResolver.resolve(landingGraph)
                  .map(GraphNode::id)
                  .orElseThrow(() -> WorkflowException.invalidState("Linked workflow has no nodes"));
        }
        case ANSWER -> {
          if (choice.targetNodeId() == null) {
            throw WorkflowException.validation("Answer '" + choice.label() + "' does not lead anywhere yet");
          }
          if (!graph.contains(choice.targetNodeId())) {
            throw WorkflowException.validation("Answer '" + choice.label() + "' points at a missing node");
          }
          toNodeId = choice.targetNodeId();
        }
        default -> toNodeId = choice.targetNodeId();
      }

      instance.moveTo(toTemplateId, toNodeId);
      boolean finished =
          toNodeId == null
              || landingGraph.node(toNodeId).map(node -> node.type().isTerminal()).orElse(false);
      if (finished) {
        instance.complete();
      }
      WorkflowInstanceStep step =
          stepRepository.save(
              new WorkflowInstanceStep(
                  instance,
                  instance.getStepCount(),
                  fromTemplateId,
                  fromNodeId,
                  choice.kind(),
                  choice.id(),
                  choice.label(),
                  toTemplateId,
                  toNodeId,
                  choice.actionKey(),
                  trimToNull(request.note()),
                  caller.callerId()));
      telemetry.recordInstanceAdvanced(instance, step);
      return new AdvanceResult(view(instance, landingGraph), step);
    } catch (WorkflowException ex) {
      telemetry.recordRejected("advance", ex.getKind(), caller.callerId(), ex.getReason());
      throw ex;
    }
  }

  @Transactional
  public WorkflowInstanceView abandon(WorkflowCaller caller, UUID instanceId, Long expectedStateVersion) {
    WorkflowInstance instance = lockInstance(caller, instanceId);
    requireInProgress(instance);
    if (expectedStateVersion != null && expectedStateVersion != instance.getStateVersion()) {
      throw WorkflowException.conflict("Instance was advanced by another request");
    }
    instance.abandon();
    telemetry.recordInstanceAbandoned(instance, caller.callerId());
    return new WorkflowInstanceView(instance, currentNode(instance), List.of());
  }

  @Transactional(readOnly = true)
  public WorkflowInstanceView getInstance(WorkflowCaller caller, UUID instanceId) {
    WorkflowInstance instance = findInstance(caller, instanceId);
    return view(instance, graphStore.graph(instance.getTemplateId()));
  }

  @Transactional(readOnly = true)
  public List<WorkflowChoice> availableChoices(WorkflowCaller caller, UUID instanceId) {
    return getInstance(caller, instanceId).choices();
  }

  @Transactional(readOnly = true)
  public List<WorkflowInstance> listInstances(
      WorkflowCaller caller, String tenantId, WorkflowInstanceStatus status) {
    String tenant = StringUtils.hasText(tenantId) ? tenantId.trim() : caller.tenantId();
    if (tenant == null) {
      throw WorkflowException.validation("A tenant id is required to list workflow runs");
    }
    accessPolicy.checkTenantAccess(caller, tenant);
    return status != null
        ? instanceRepository.findByTenantIdAndStatusOrderByCreatedAtDesc(tenant, status)
        : instanceRepository.findByTenantIdOrderByCreatedAtDesc(tenant);
  }

  @Transactional(readOnly = true)
  public List<WorkflowInstanceStep> history(WorkflowCaller caller, UUID instanceId) {
    findInstance(caller, instanceId);
    return stepRepository.findByInstance_IdOrderBySequenceNoAsc(instanceId);
  }

  private WorkflowTemplate linkTarget(WorkflowInstance instance, UUID targetTemplateId) {
    WorkflowTemplate target =
        templateRepository
            .findById(targetTemplateId)
            .filter(candidate -> candidate.getScope().visibleTo(instance.getTenantId()))
            .orElseThrow(() -> WorkflowException.invalidState("Linked workflow is no longer available"));
    requireRunnable(target, "follow a link to");
    return target;
  }

  private static void requireRunnable(WorkflowTemplate template, String action) {
    if (template.getApprovalStatus() != WorkflowApprovalStatus.APPROVED) {
      throw WorkflowException.invalidState(
          "Cannot " + action + " workflow '" + template.getName() + "' while it is " + template.getApprovalStatus());
    }
    if (!template.isActive()) {
      throw WorkflowException.invalidState(
          "Cannot " + action + " workflow '" + template.getName() + "' while it is inactive");
    }
  }

  private static void requireInProgress(WorkflowInstance instance) {
    if (instance.getStatus() != WorkflowInstanceStatus.IN_PROGRESS) {
      throw WorkflowException.invalidState("This workflow is " + instance.getStatus() + " and can no longer be continued");
    }
  }

  private WorkflowInstance lockInstance(WorkflowCaller caller, UUID instanceId) {
    WorkflowInstance instance =
        instanceRepository.findByIdForUpdate(instanceId).orElseThrow(() -> instanceNotFound(instanceId));
    checkVisible(caller, instance);
    return instance;
  }

  private WorkflowInstance findInstance(WorkflowCaller caller, UUID instanceId) {
    WorkflowInstance instance =
        instanceRepository.findById(instanceId).orElseThrow(() -> instanceNotFound(instanceId));
    checkVisible(caller, instance);
    return instance;
  }

  private void checkVisible(WorkflowCaller caller, WorkflowInstance instance) {
    if (caller == null) {
      throw WorkflowException.forbidden("Caller identity is required");
    }
    if (!caller.superuser() && !caller.belongsTo(instance.getTenantId())) {
      log.debug("Caller {} asked for instance {} of another tenant", caller.callerId(), instance.getId());
      throw instanceNotFound(instance.getId());
    }
  }

  private WorkflowInstanceView view(WorkflowInstance instance, TemplateGraph graph) {
    GraphNode node = instance.getCurrentNodeId() != null ? graph.node(instance.getCurrentNodeId()).orElse(null) : null;
    List<WorkflowChoice> choices =
        instance.getStatus() == WorkflowInstanceStatus.IN_PROGRESS && node != null
            ? ChoicePlanner.choicesAt(graph, node.id())
            : List.of();
    return new WorkflowInstanceView(instance, node, choices);
  }

  private GraphNode currentNode(WorkflowInstance instance) {
    if (instance.getCurrentNodeId() == null) {
      return null;
    }
    return graphStore.graph(instance.getTemplateId()).node(instance.getCurrentNodeId()).orElse(null);
  }

  private static WorkflowException instanceNotFound(UUID instanceId) {
    return WorkflowException.notFound("Workflow instance not found: " + instanceId);
  }

  private static String trimToNull(String raw) {
    return StringUtils.hasText(raw) ? raw.trim() : null;
  }
}
