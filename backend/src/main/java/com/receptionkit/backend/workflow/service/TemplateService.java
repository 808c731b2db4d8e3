package com.receptionkit.backend.workflow.service;

import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.api.TemplateCreateRequest;
import com.receptionkit.backend.workflow.api.TemplateUpdateRequest;
import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowInstanceStatus;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.events.WorkflowTemplateChangedEvent;
import com.receptionkit.backend.workflow.persistence.WorkflowAnswerOptionRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowInstanceRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeLinkRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeStyleDefaultRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowTemplateRepository;
import com.receptionkit.backend.workflow.security.WorkflowAccessPolicy;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.telemetry.WorkflowTelemetryService;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class TemplateService {

  private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

  static final String PLACEHOLDER_NAME = "new workflow";
  private static final Pattern HEX_COLOUR = Pattern.compile("^#(?:[0-9a-fA-F]{3}|[0-9a-fA-F]{6})$");

  private final WorkflowTemplateRepository templateRepository;
  private final WorkflowNodeRepository nodeRepository;
  private final WorkflowAnswerOptionRepository optionRepository;
  private final WorkflowNodeLinkRepository linkRepository;
  private final WorkflowNodeStyleDefaultRepository styleDefaultRepository;
  private final WorkflowInstanceRepository instanceRepository;
  private final WorkflowGraphStore graphStore;
  private final WorkflowAccessPolicy accessPolicy;
  private final WorkflowTelemetryService telemetry;
  private final ApplicationEventPublisher eventPublisher;

  public TemplateService(
      WorkflowTemplateRepository templateRepository,
      WorkflowNodeRepository nodeRepository,
      WorkflowAnswerOptionRepository optionRepository,
      WorkflowNodeLinkRepository linkRepository,
      WorkflowNodeStyleDefaultRepository styleDefaultRepository,
      WorkflowInstanceRepository instanceRepository,
      WorkflowGraphStore graphStore,
      WorkflowAccessPolicy accessPolicy,
      WorkflowTelemetryService telemetry,
      ApplicationEventPublisher eventPublisher) {
    this.templateRepository = templateRepository;
    this.nodeRepository = nodeRepository;
    this.optionRepository = optionRepository;
    this.linkRepository = linkRepository;
    this.styleDefaultRepository = styleDefaultRepository;
    this.instanceRepository = instanceRepository;
    this.graphStore = graphStore;
    this.accessPolicy = accessPolicy;
    this.telemetry = telemetry;
    this.eventPublisher = eventPublisher;
  }

  /** Templates the caller can see: the global set followed by the caller's tenant's own. */
  @Transactional(readOnly = true)
  public List<WorkflowTemplate> listTemplates(WorkflowCaller caller, boolean activeOnly) {
    List<WorkflowTemplate> result = new ArrayList<>(graphStore.listTemplates(TemplateScope.global(), activeOnly));
    if (caller.tenantId() != null) {
      result.addAll(graphStore.listTemplates(TemplateScope.tenant(caller.tenantId()), activeOnly));
    }
    return result;
  }

  @Transactional
  public WorkflowTemplate createTemplate(WorkflowCaller caller, TemplateCreateRequest request) {
    TemplateScope scope = accessPolicy.resolveScope(caller, request.global(), request.tenantId());
    accessPolicy.checkCanEdit(caller, scope);
    String name = requireName(request.name());
    if (templateRepository.existsByScopeKeyAndNameIgnoreCase(scope.key(), name)) {
      throw WorkflowException.conflict("A workflow named '" + name + "' already exists in " + scope);
    }

    WorkflowTemplate template = new WorkflowTemplate(scope, name, request.workflowType());
    template.setDescription(trimToNull(request.description()));
    template.setIconKey(trimToNull(request.iconKey()));
    template.setColourHex(requireColour(request.colourHex()));
    if (request.active() != null) {
      template.setActive(request.active());
    }
    if (request.landingCategory() != null) {
      template.setLandingCategory(request.landingCategory());
    }
    template.stampEditor(caller.callerId());
    WorkflowTemplate saved = templateRepository.save(template);

    telemetry.recordTemplateMutation("create", saved, caller.callerId());
    publishChanged(saved, "create");
    return saved;
  }

  /**
   * Metadata edit. Changing anything on an APPROVED template sends it back to DRAFT, since the
   * approval covered the previous content.
   */
  @Transactional
  public WorkflowTemplate updateTemplate(
      WorkflowCaller caller, UUID templateId, TemplateUpdateRequest request) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, request.expectedRevision(), caller);
    boolean changed = false;

    if (request.name() != null) {
      String name = requireName(request.name());
      if (!name.equals(template.getName())) {
        if (templateRepository.existsByScopeKeyAndNameIgnoreCaseAndIdNot(
            template.getScopeKey(), name, template.getId())) {
          throw WorkflowException.conflict("A workflow named '" + name + "' already exists");
        }
        template.setName(name);
        changed = true;
      }
    }
    if (request.description() != null) {
      changed |= setIfDifferent(template.getDescription(), trimToNull(request.description()), template::setDescription);
    }
    if (request.iconKey() != null) {
      changed |= setIfDifferent(template.getIconKey(), trimToNull(request.iconKey()), template::setIconKey);
    }
    if (request.colourHex() != null) {
      changed |= setIfDifferent(template.getColourHex(), requireColour(request.colourHex()), template::setColourHex);
    }
    if (request.active() != null && request.active() != template.isActive()) {
      template.setActive(request.active());
      changed = true;
    }
    if (request.workflowType() != null && request.workflowType() != template.getWorkflowType()) {
      template.setWorkflowType(request.workflowType());
      changed = true;
    }
    if (request.landingCategory() != null
        && request.landingCategory() != template.getLandingCategory()) {
      template.setLandingCategory(request.landingCategory());
      changed = true;
    }
    if (!changed) {
      return template;
    }

    if (template.getApprovalStatus() == WorkflowApprovalStatus.APPROVED) {
      template.setApprovalStatus(WorkflowApprovalStatus.DRAFT);
      template.clearApproval();
      telemetry.recordLifecycleTransition(template, "APPROVED", "DRAFT", caller.callerId());
    }
    template.markEdited(caller.callerId());
    telemetry.recordTemplateMutation("update", template, caller.callerId());
    publishChanged(template, "update");
    return template;
  }

  @Transactional
  public void deleteTemplate(WorkflowCaller caller, UUID templateId, Long expectedRevision) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, expectedRevision, caller);
    if (instanceRepository.existsAnchoredOn(templateId, WorkflowInstanceStatus.IN_PROGRESS)) {
      throw WorkflowException.invalidState(
          "Workflow template has runs in progress; complete or abandon them first");
    }
    int options = optionRepository.deleteByTemplateId(templateId);
    int links = linkRepository.deleteByTemplateId(templateId);
    List<WorkflowTemplate> linkOwners = lockLinkOwners(templateId);
    int inboundLinks = linkRepository.deleteByTargetTemplateId(templateId);
    styleDefaultRepository.deleteByTemplateId(templateId);
    int nodes = nodeRepository.deleteByTemplateId(templateId);
    templateRepository.delete(template);
    log.debug(
        "Deleted workflow template {} with {} nodes, {} edges, {} links and {} inbound links",
        templateId,
        nodes,
        options,
        links,
        inboundLinks);

    telemetry.recordTemplateMutation("delete", template, caller.callerId());
    publishChanged(template, "delete");
    for (WorkflowTemplate owner : linkOwners) {
      owner.markEdited(caller.callerId());
      telemetry.recordTemplateMutation("link_target_deleted", owner, caller.callerId());
      publishChanged(owner, "link_target_deleted");
    }
  }

  /**
   * Locks the other templates holding links into {@code templateId}. Losing those links is an edit
   * to each owner, so their revisions move even when they are approved.
   */
  private List<WorkflowTemplate> lockLinkOwners(UUID templateId) {
    List<WorkflowTemplate> owners = new ArrayList<>();
    for (UUID ownerId : linkRepository.findOwnerTemplateIdsByTargetTemplateId(templateId)) {
      templateRepository.findByIdForUpdate(ownerId).ifPresent(owners::add);
    }
    return owners;
  }

  private void publishChanged(WorkflowTemplate template, String action) {
    eventPublisher.publishEvent(
        new WorkflowTemplateChangedEvent(template.getId(), template.getScopeKey(), action));
  }

  static String requireName(String raw) {
    String name = raw != null ? raw.trim() : "";
    if (name.isEmpty()) {
      throw WorkflowException.validation("Workflow name must not be blank");
    }
    if (PLACEHOLDER_NAME.equals(name.toLowerCase(Locale.ROOT))) {
      throw WorkflowException.validation("Choose a descriptive workflow name");
    }
    return name;
  }

  static String requireColour(String raw) {
    String colour = trimToNull(raw);
    if (colour != null && !HEX_COLOUR.matcher(colour).matches()) {
      throw WorkflowException.validation("Colour must be a hex value like #RGB or #RRGGBB: " + raw);
    }
    return colour;
  }

  static String trimToNull(String raw) {
    return StringUtils.hasText(raw) ? raw.trim() : null;
  }

  private static boolean setIfDifferent(
      String current, String next, Consumer<String> setter) {
    if (Objects.equals(current, next)) {
      return false;
    }
    setter.accept(next);
    return true;
  }
}
