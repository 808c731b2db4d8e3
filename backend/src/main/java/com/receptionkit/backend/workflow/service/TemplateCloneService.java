package com.receptionkit.backend.workflow.service;

import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.domain.WorkflowAnswerOption;
import com.receptionkit.backend.workflow.domain.WorkflowNode;
import com.receptionkit.backend.workflow.domain.WorkflowNodeLink;
import com.receptionkit.backend.workflow.domain.WorkflowNodeStyleDefault;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.events.WorkflowTemplateChangedEvent;
import com.receptionkit.backend.workflow.persistence.WorkflowAnswerOptionRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeLinkRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeStyleDefaultRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowTemplateRepository;
import com.receptionkit.backend.workflow.security.WorkflowAccessPolicy;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.telemetry.WorkflowTelemetryService;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Deep copy of a template into another scope. The copy keeps only provenance ({@code
 * sourceTemplateId}); later edits on either side are independent.
 */
@Service
public class TemplateCloneService {

  private static final Logger log = LoggerFactory.getLogger(TemplateCloneService.class);
  static final String COPY_SUFFIX = " (copy)";

  private final WorkflowGraphStore graphStore;
  private final WorkflowTemplateRepository templateRepository;
  private final WorkflowNodeRepository nodeRepository;
  private final WorkflowAnswerOptionRepository optionRepository;
  private final WorkflowNodeLinkRepository linkRepository;
  private final WorkflowNodeStyleDefaultRepository styleDefaultRepository;
  private final WorkflowAccessPolicy accessPolicy;
  private final WorkflowTelemetryService telemetry;
  private final ApplicationEventPublisher eventPublisher;

  public TemplateCloneService(
      WorkflowGraphStore graphStore,
      WorkflowTemplateRepository templateRepository,
      WorkflowNodeRepository nodeRepository,
      WorkflowAnswerOptionRepository optionRepository,
      WorkflowNodeLinkRepository linkRepository,
      WorkflowNodeStyleDefaultRepository styleDefaultRepository,
      WorkflowAccessPolicy accessPolicy,
      WorkflowTelemetryService telemetry,
      ApplicationEventPublisher eventPublisher) {
    this.graphStore = graphStore;
    this.templateRepository = templateRepository;
    this.nodeRepository = nodeRepository;
    this.optionRepository = optionRepository;
    this.linkRepository = linkRepository;
    this.styleDefaultRepository = styleDefaultRepository;
    this.accessPolicy = accessPolicy;
    this.telemetry = telemetry;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Clones {@code sourceTemplateId} into {@code destination}. A destination that already holds a
   * clone of the same source gets that clone back instead of a duplicate.
   */
  @Transactional
  public WorkflowTemplate cloneTemplate(
      WorkflowCaller caller, UUID sourceTemplateId, TemplateScope destination) {
    TemplateContents source = graphStore.lockContents(sourceTemplateId, caller);
    accessPolicy.checkCanEdit(caller, destination);

    Optional<WorkflowTemplate> existing =
        templateRepository.findFirstByScopeKeyAndSourceTemplateId(destination.key(), sourceTemplateId);
    if (existing.isPresent()) {
      log.debug("Workflow {} already cloned into {} as {}", sourceTemplateId, destination, existing.get().getId());
      return existing.get();
    }

    WorkflowTemplate original = source.template();
    WorkflowTemplate copy =
        new WorkflowTemplate(destination, uniqueName(destination, original.getName()), original.getWorkflowType());
    copy.setDescription(original.getDescription());
    copy.setIconKey(original.getIconKey());
    copy.setColourHex(original.getColourHex());
    copy.setActive(original.isActive());
    copy.setLandingCategory(original.getLandingCategory());
    copy.setSourceTemplateId(original.getId());
    copy.stampEditor(caller.callerId());
    WorkflowTemplate saved = templateRepository.save(copy);

    Map<UUID, WorkflowNode> nodeMap = new HashMap<>();
    for (WorkflowNode node : source.nodes()) {
      WorkflowNode clone = new WorkflowNode(saved, node.getNodeType(), node.getTitle(), node.getSortOrder());
      clone.setBody(node.getBody());
      clone.setStart(node.isStart());
      clone.setActionKey(node.getActionKey());
      clone.moveTo(node.getPositionX(), node.getPositionY());
      clone.setBadges(node.getBadges());
      clone.setStyle(node.getStyle());
      nodeMap.put(node.getId(), nodeRepository.save(clone));
    }
    for (WorkflowAnswerOption option : source.options()) {
      WorkflowNode owner = nodeMap.get(option.getNodeId());
      if (owner == null) {
        continue;
      }
      WorkflowAnswerOption clone = new WorkflowAnswerOption(owner, option.getLabel(), option.getValueKey());
      WorkflowNode target = option.getNextNodeId() != null ? nodeMap.get(option.getNextNodeId()) : null;
      clone.setNextNodeId(target != null ? target.getId() : null);
      clone.setDescription(option.getDescription());
      clone.setActionKey(option.getActionKey());
      clone.setSourceHandle(option.getSourceHandle());
      clone.setTargetHandle(option.getTargetHandle());
      optionRepository.save(clone);
    }
    for (WorkflowNodeLink link : source.links()) {
      WorkflowNode owner = nodeMap.get(link.getNodeId());
      if (owner != null) {
        linkRepository.save(
            new WorkflowNodeLink(owner, link.getTargetTemplateId(), link.getLabel(), link.getSortOrder()));
      }
    }
    for (WorkflowNodeStyleDefault row : source.styleDefaults()) {
      WorkflowNodeStyleDefault clone = new WorkflowNodeStyleDefault(saved.getId(), row.getNodeType());
      clone.applyColours(row.getBgColor(), row.getTextColor(), row.getBorderColor());
      styleDefaultRepository.save(clone);
    }

    telemetry.recordTemplateMutation("clone", saved, caller.callerId());
    eventPublisher.publishEvent(new WorkflowTemplateChangedEvent(saved.getId(), saved.getScopeKey(), "clone"));
    return saved;
  }

  private String uniqueName(TemplateScope destination, String name) {
    String candidate = name;
    while (templateRepository.existsByScopeKeyAndNameIgnoreCase(destination.key(), candidate)) {
      candidate = candidate + COPY_SUFFIX;
    }
    return candidate;
  }
}
