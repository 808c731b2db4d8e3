package com.receptionkit.backend.workflow.service;

import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.api.BulkRepositionRequest;
import com.receptionkit.backend.workflow.api.EdgeCreateRequest;
import com.receptionkit.backend.workflow.api.EdgeUpdateRequest;
import com.receptionkit.backend.workflow.api.LinkCreateRequest;
import com.receptionkit.backend.workflow.api.NodeCreateRequest;
import com.receptionkit.backend.workflow.api.NodePositionRequest;
import com.receptionkit.backend.workflow.api.NodeUpdateRequest;
import com.receptionkit.backend.workflow.domain.NodeStyle;
import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.domain.WorkflowAnswerOption;
import com.receptionkit.backend.workflow.domain.WorkflowNode;
import com.receptionkit.backend.workflow.domain.WorkflowNodeLink;
import com.receptionkit.backend.workflow.domain.WorkflowNodeStyleDefault;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.events.WorkflowTemplateChangedEvent;
import com.receptionkit.backend.workflow.graph.ValueKeys;
import com.receptionkit.backend.workflow.persistence.WorkflowAnswerOptionRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeLinkRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeStyleDefaultRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowTemplateRepository;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.telemetry.WorkflowTelemetryService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Structural edits to a template's graph. Every call locks the template, checks the caller's
 * revision and bumps it on success.
 */
@Service
public class GraphMutationService {

  private final WorkflowGraphStore graphStore;
  private final WorkflowTemplateRepository templateRepository;
  private final WorkflowNodeRepository nodeRepository;
  private final WorkflowAnswerOptionRepository optionRepository;
  private final WorkflowNodeLinkRepository linkRepository;
  private final WorkflowNodeStyleDefaultRepository styleDefaultRepository;
  private final WorkflowTelemetryService telemetry;
  private final ApplicationEventPublisher eventPublisher;

  public GraphMutationService(
      WorkflowGraphStore graphStore,
      WorkflowTemplateRepository templateRepository,
      WorkflowNodeRepository nodeRepository,
      WorkflowAnswerOptionRepository optionRepository,
      WorkflowNodeLinkRepository linkRepository,
      WorkflowNodeStyleDefaultRepository styleDefaultRepository,
      WorkflowTelemetryService telemetry,
      ApplicationEventPublisher eventPublisher) {
    this.graphStore = graphStore;
    this.templateRepository = templateRepository;
    this.nodeRepository = nodeRepository;
    this.optionRepository = optionRepository;
    this.linkRepository = linkRepository;
    this.styleDefaultRepository = styleDefaultRepository;
    this.telemetry = telemetry;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public MutationResult<WorkflowNode> createNode(WorkflowCaller caller, UUID templateId, NodeCreateRequest request) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, request.expectedRevision(), caller);
    graphStore.requireStructurallyEditable(template);

    WorkflowNodeType type = request.type();
    String title = StringUtils.hasText(request.title()) ? request.title().trim() : type.defaultTitle();
    int sortOrder = nodeRepository.findMaxSortOrder(templateId) + 1;
    WorkflowNode node = new WorkflowNode(template, type, title, sortOrder);
    node.setBody(request.body());
    node.setActionKey(request.actionKey());
    node.setBadges(request.badges());
    if (request.positionX() != null && request.positionY() != null) {
      node.moveTo(round(request.positionX()), round(request.positionY()));
    }
    if (request.style() != null) {
      node.setStyle(request.style().clamp());
    } else {
      styleDefaultRepository
          .findByTemplateIdAndNodeType(templateId, type)
          .map(WorkflowNodeStyleDefault::toStyle)
          .filter(NodeStyle::hasColours)
          .ifPresent(node::setStyle);
    }
    WorkflowNode saved = nodeRepository.save(node);
    if (Boolean.TRUE.equals(request.start())) {
      makeStart(templateId, saved);
    }

    return finish(template, caller, "node_create", saved);
  }

  /**
   * Partial node update. Changing the type keeps existing edges even when the new type would not
   * allow them; the author removes them explicitly.
   */
  @Transactional
  public MutationResult<WorkflowNode> updateNode(
      WorkflowCaller caller, UUID templateId, UUID nodeId, NodeUpdateRequest request) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, request.expectedRevision(), caller);
    if (request.touchesStructure()) {
      graphStore.requireStructurallyEditable(template);
    }
    WorkflowNode node = requireNode(templateId, nodeId);

    if (request.type() != null) {
      node.setNodeType(request.type());
    }
    if (request.title() != null) {
      String title = request.title().trim();
      if (title.isEmpty()) {
        throw WorkflowException.validation("Node title must not be blank");
      }
      node.setTitle(title);
    }
    if (request.body() != null) {
      node.setBody(request.body());
    }
    if (request.actionKey() != null) {
      node.setActionKey(request.actionKey());
    }
    if (request.badges() != null) {
      node.setBadges(request.badges());
    }
    if (request.start() != null) {
      if (request.start()) {
        makeStart(templateId, node);
      } else {
        node.setStart(false);
      }
    }
    if (Boolean.TRUE.equals(request.clearStyle())) {
      node.setStyle(null);
    } else if (request.style() != null) {
      NodeStyle current = node.getStyle();
      node.setStyle(current != null ? current.mergedWith(request.style()) : request.style().clamp());
    }
    if (request.linkedTemplateIds() != null) {
      replaceLinks(template, node, request.linkedTemplateIds());
    }

    return finish(template, caller, request.touchesStructure() ? "node_update" : "node_style", node);
  }

  /**
   * Removes a node with its own edges and links. Edges elsewhere in the template that pointed at
   * it are kept with their target cleared.
   */
  @Transactional
  public MutationResult<Void> deleteNode(WorkflowCaller caller, UUID templateId, UUID nodeId, Long expectedRevision) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, expectedRevision, caller);
    graphStore.requireStructurallyEditable(template);
    WorkflowNode node = requireNode(templateId, nodeId);

    List<WorkflowAnswerOption> owned = new ArrayList<>();
    for (WorkflowAnswerOption option : optionRepository.findByTemplateId(templateId)) {
      if (nodeId.equals(option.getNodeId())) {
        owned.add(option);
      } else if (nodeId.equals(option.getNextNodeId())) {
        option.setNextNodeId(null);
      }
    }
    optionRepository.deleteAll(owned);
    linkRepository.deleteAll(linkRepository.findByNode_IdOrderBySortOrderAsc(nodeId));
    nodeRepository.delete(node);

    return finish(template, caller, "node_delete", null);
  }

  @Transactional
  public MutationResult<WorkflowNode> repositionNode(
      WorkflowCaller caller, UUID templateId, UUID nodeId, NodePositionRequest request) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, request.expectedRevision(), caller);
    WorkflowNode node = requireNode(templateId, nodeId);
    int x = round(request.x());
    int y = round(request.y());
    node.moveTo(x, y);
    return finish(template, caller, "node_move", node);
  }

  /**
   * Applies every position or none: the whole batch is checked against the template before the
   * first node moves.
   */
  @Transactional
  public MutationResult<List<WorkflowNode>> repositionNodes(
      WorkflowCaller caller, UUID templateId, BulkRepositionRequest request) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, request.expectedRevision(), caller);

    Map<UUID, BulkRepositionRequest.NodePosition> positions = new LinkedHashMap<>();
    for (BulkRepositionRequest.NodePosition position : request.positions()) {
      positions.put(position.nodeId(), position);
    }
    Map<UUID, WorkflowNode> nodes =
        nodeRepository.findByTemplate_IdAndIdIn(templateId, positions.keySet()).stream()
            .collect(Collectors.toMap(WorkflowNode::getId, node -> node));
    Set<UUID> unknown = new LinkedHashSet<>(positions.keySet());
    unknown.removeAll(nodes.keySet());
    if (!unknown.isEmpty()) {
      throw WorkflowException.validation(
          "Nodes do not belong to workflow template " + templateId + ": " + unknown);
    }

    Map<UUID, int[]> rounded = new LinkedHashMap<>();
    positions.forEach(
        (nodeId, position) -> rounded.put(nodeId, new int[] {round(position.x()), round(position.y())}));

    List<WorkflowNode> moved = new ArrayList<>(rounded.size());
    rounded.forEach(
        (nodeId, xy) -> {
          WorkflowNode node = nodes.get(nodeId);
          node.moveTo(xy[0], xy[1]);
          moved.add(node);
        });
    return finish(template, caller, "node_move_bulk", List.copyOf(moved));
  }

  @Transactional
  public MutationResult<WorkflowAnswerOption> createEdge(
      WorkflowCaller caller, UUID templateId, EdgeCreateRequest request) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, request.expectedRevision(), caller);
    graphStore.requireStructurallyEditable(template);
    WorkflowNode source = requireNode(templateId, request.sourceNodeId());

    List<WorkflowAnswerOption> siblings = optionRepository.findByNode_IdOrderByCreatedAtAscIdAsc(source.getId());
    int capacity = source.getNodeType().maxAuthoredEdges();
    if (siblings.size() >= capacity) {
      throw WorkflowException.validation(
          capacity == 0
              ? source.getNodeType() + " nodes cannot have answer options"
              : source.getNodeType() + " nodes allow at most " + capacity + " answer option");
    }
    String label = requireLabel(request.label());
    validateTarget(templateId, request.targetNodeId());

    WorkflowAnswerOption option =
        new WorkflowAnswerOption(source, label, ValueKeys.unique(label, valueKeys(siblings)));
    option.setNextNodeId(request.targetNodeId());
    option.setDescription(TemplateService.trimToNull(request.description()));
    option.setActionKey(request.actionKey());
    if (StringUtils.hasText(request.sourceHandle())) {
      option.setSourceHandle(request.sourceHandle().trim());
    }
    if (StringUtils.hasText(request.targetHandle())) {
      option.setTargetHandle(request.targetHandle().trim());
    }
    WorkflowAnswerOption saved = optionRepository.save(option);

    return finish(template, caller, "edge_create", saved);
  }

  @Transactional
  public MutationResult<WorkflowAnswerOption> updateEdge(
      WorkflowCaller caller, UUID templateId, UUID edgeId, EdgeUpdateRequest request) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, request.expectedRevision(), caller);
    graphStore.requireStructurallyEditable(template);
    WorkflowAnswerOption option = requireEdge(templateId, edgeId);

    if (request.label() != null) {
      String label = requireLabel(request.label());
      if (!label.equals(option.getLabel())) {
        List<String> taken =
            optionRepository.findByNode_IdOrderByCreatedAtAscIdAsc(option.getNodeId()).stream()
                .filter(sibling -> !sibling.getId().equals(edgeId))
                .map(WorkflowAnswerOption::getValueKey)
                .toList();
        option.setLabel(label);
        option.setValueKey(ValueKeys.unique(label, taken));
      }
    }
    if (Boolean.TRUE.equals(request.clearTarget())) {
      option.setNextNodeId(null);
    } else if (request.targetNodeId() != null) {
      validateTarget(templateId, request.targetNodeId());
      option.setNextNodeId(request.targetNodeId());
    }
    if (request.description() != null) {
      option.setDescription(TemplateService.trimToNull(request.description()));
    }
    if (request.actionKey() != null) {
      option.setActionKey(request.actionKey());
    }
    if (StringUtils.hasText(request.sourceHandle())) {
      option.setSourceHandle(request.sourceHandle().trim());
    }
    if (StringUtils.hasText(request.targetHandle())) {
      option.setTargetHandle(request.targetHandle().trim());
    }

    return finish(template, caller, "edge_update", option);
  }

  @Transactional
  public MutationResult<Void> deleteEdge(WorkflowCaller caller, UUID templateId, UUID edgeId, Long expectedRevision) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, expectedRevision, caller);
    graphStore.requireStructurallyEditable(template);
    optionRepository.delete(requireEdge(templateId, edgeId));
    return finish(template, caller, "edge_delete", null);
  }

  @Transactional
  public MutationResult<WorkflowNodeLink> createLink(WorkflowCaller caller, UUID templateId, LinkCreateRequest request) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, request.expectedRevision(), caller);
    graphStore.requireStructurallyEditable(template);
    WorkflowNode node = requireNode(templateId, request.nodeId());
    WorkflowNodeLink link = addLink(template, node, request.targetTemplateId(), request.label());
    return finish(template, caller, "link_create", link);
  }

  @Transactional
  public MutationResult<Void> deleteLink(WorkflowCaller caller, UUID templateId, UUID linkId, Long expectedRevision) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, expectedRevision, caller);
    graphStore.requireStructurallyEditable(template);
    WorkflowNodeLink link =
        linkRepository
            .findById(linkId)
            .filter(candidate -> templateId.equals(candidate.getNode().getTemplateId()))
            .orElseThrow(() -> WorkflowException.notFound("Workflow link not found: " + linkId));
    linkRepository.delete(link);
    return finish(template, caller, "link_delete", null);
  }

  private void replaceLinks(WorkflowTemplate template, WorkflowNode node, List<UUID> targetTemplateIds) {
    linkRepository.deleteAll(linkRepository.findByNode_IdOrderBySortOrderAsc(node.getId()));
    for (UUID targetId : new LinkedHashSet<>(targetTemplateIds)) {
      addLink(template, node, targetId, null);
    }
  }

  private WorkflowNodeLink addLink(
      WorkflowTemplate template, WorkflowNode node, UUID targetTemplateId, String label) {
    if (node.getNodeType().isTerminal()) {
      throw WorkflowException.validation("END nodes cannot link to another workflow");
    }
    if (targetTemplateId == null) {
      throw WorkflowException.validation("Linked workflow id is required");
    }
    if (template.getId().equals(targetTemplateId)) {
      throw WorkflowException.validation("A workflow cannot link to itself");
    }
    WorkflowTemplate target =
        templateRepository
            .findById(targetTemplateId)
            .orElseThrow(
                () -> WorkflowException.validation("Linked workflow does not exist: " + targetTemplateId));
    if (!target.isActive()) {
      throw WorkflowException.validation("Linked workflow is inactive: " + target.getName());
    }
    TemplateScope targetScope = target.getScope();
    if (!targetScope.isGlobal() && !target.getScopeKey().equals(template.getScopeKey())) {
      throw WorkflowException.validation("Linked workflow belongs to a different tenant");
    }
    if (linkRepository.existsByNode_IdAndTargetTemplateId(node.getId(), targetTemplateId)) {
      throw WorkflowException.conflict("Node already links to workflow " + target.getName());
    }
    String linkLabel = StringUtils.hasText(label) ? label.trim() : WorkflowNodeLink.DEFAULT_LABEL;
    int sortOrder = linkRepository.findMaxSortOrder(node.getId()) + 1;
    return linkRepository.save(new WorkflowNodeLink(node, targetTemplateId, linkLabel, sortOrder));
  }

  private void makeStart(UUID templateId, WorkflowNode node) {
    for (WorkflowNode sibling : nodeRepository.findByTemplate_IdOrderBySortOrderAsc(templateId)) {
      if (sibling.isStart() && !sibling.getId().equals(node.getId())) {
        sibling.setStart(false);
      }
    }
    node.setStart(true);
  }

  private WorkflowNode requireNode(UUID templateId, UUID nodeId) {
    if (nodeId == null) {
      throw WorkflowException.validation("Node id is required");
    }
    return nodeRepository
        .findById(nodeId)
        .filter(node -> templateId.equals(node.getTemplateId()))
        .orElseThrow(() -> WorkflowException.notFound("Workflow node not found: " + nodeId));
  }

  private WorkflowAnswerOption requireEdge(UUID templateId, UUID edgeId) {
    return optionRepository
        .findById(edgeId)
        .filter(option -> templateId.equals(option.getNode().getTemplateId()))
        .orElseThrow(() -> WorkflowException.notFound("Answer option not found: " + edgeId));
  }

  private void validateTarget(UUID templateId, UUID targetNodeId) {
    if (targetNodeId == null) {
      return;
    }
    boolean sameTemplate =
        nodeRepository
            .findById(targetNodeId)
            .map(target -> templateId.equals(target.getTemplateId()))
            .orElse(false);
    if (!sameTemplate) {
      throw WorkflowException.validation("Target node must belong to the same workflow: " + targetNodeId);
    }
  }

  private static String requireLabel(String raw) {
    String label = raw != null ? raw.trim() : "";
    if (label.isEmpty()) {
      throw WorkflowException.validation("Answer label must not be blank");
    }
    return label;
  }

  private static List<String> valueKeys(List<WorkflowAnswerOption> options) {
    return options.stream().map(WorkflowAnswerOption::getValueKey).toList();
  }

  private <T> MutationResult<T> finish(
      WorkflowTemplate template, WorkflowCaller caller, String action, T item) {
    template.markEdited(caller.callerId());
    telemetry.recordTemplateMutation(action, template, caller.callerId());
    eventPublisher.publishEvent(
        new WorkflowTemplateChangedEvent(template.getId(), template.getScopeKey(), action));
    return new MutationResult<>(item, template.getRevision());
  }

  /** Rounds a diagram coordinate, rejecting values outside the canvas. */
  static int round(double value) {
    if (!Double.isFinite(value) || Math.abs(value) > NodePositionRequest.MAX_COORDINATE) {
      throw WorkflowException.validation(
          "Node position must be within +/-" + NodePositionRequest.MAX_COORDINATE + ": " + value);
    }
    return (int) Math.round(value);
  }
}
