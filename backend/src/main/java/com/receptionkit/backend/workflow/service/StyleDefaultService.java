package com.receptionkit.backend.workflow.service;

import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.api.StyleDefaultCopyRequest;
import com.receptionkit.backend.workflow.api.StyleDefaultRequest;
import com.receptionkit.backend.workflow.domain.WorkflowNodeStyleDefault;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.events.WorkflowTemplateChangedEvent;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeStyleDefaultRepository;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.telemetry.WorkflowTelemetryService;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Per-node-type colour defaults of a template. Accepted in every approval status. */
@Service
public class StyleDefaultService {

  private final WorkflowGraphStore graphStore;
  private final WorkflowNodeStyleDefaultRepository styleDefaultRepository;
  private final WorkflowTelemetryService telemetry;
  private final ApplicationEventPublisher eventPublisher;

  public StyleDefaultService(
      WorkflowGraphStore graphStore,
      WorkflowNodeStyleDefaultRepository styleDefaultRepository,
      WorkflowTelemetryService telemetry,
      ApplicationEventPublisher eventPublisher) {
    this.graphStore = graphStore;
    this.styleDefaultRepository = styleDefaultRepository;
    this.telemetry = telemetry;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public List<WorkflowNodeStyleDefault> list(WorkflowCaller caller, UUID templateId) {
    graphStore.getVisibleTemplate(templateId, caller);
    return styleDefaultRepository.findByTemplateIdOrderByNodeTypeAsc(templateId);
  }

  @Transactional
  public MutationResult<WorkflowNodeStyleDefault> upsert(
      WorkflowCaller caller, UUID templateId, WorkflowNodeType nodeType, StyleDefaultRequest request) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, request.expectedRevision(), caller);
    String bg = TemplateService.requireColour(request.bgColor());
    String text = TemplateService.requireColour(request.textColor());
    String border = TemplateService.requireColour(request.borderColor());
    if (bg == null && text == null && border == null) {
      throw WorkflowException.validation("At least one colour is required; use reset to clear a default");
    }
    WorkflowNodeStyleDefault row =
        styleDefaultRepository
            .findByTemplateIdAndNodeType(templateId, nodeType)
            .orElseGet(() -> new WorkflowNodeStyleDefault(templateId, nodeType));
    row.applyColours(bg, text, border);
    WorkflowNodeStyleDefault saved = styleDefaultRepository.save(row);
    return finish(template, caller, "style_default_upsert", saved);
  }

  /** Clears the default of one node type, or of every type when {@code nodeType} is null. */
  @Transactional
  public MutationResult<Void> reset(WorkflowCaller caller, UUID templateId, WorkflowNodeType nodeType, Long expectedRevision) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, expectedRevision, caller);
    if (nodeType == null) {
      styleDefaultRepository.deleteByTemplateId(templateId);
    } else {
      styleDefaultRepository.deleteByTemplateIdAndNodeType(templateId, nodeType);
    }
    return finish(template, caller, "style_default_reset", null);
  }

  /**
   * Copies the source template's defaults. With {@code overwrite} existing rows are replaced,
   * otherwise only node types without a row are filled in.
   */
  @Transactional
  public MutationResult<List<WorkflowNodeStyleDefault>> copy(
      WorkflowCaller caller, UUID templateId, StyleDefaultCopyRequest request) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, request.expectedRevision(), caller);
    if (templateId.equals(request.sourceTemplateId())) {
      throw WorkflowException.validation("Cannot copy style defaults from the same workflow");
    }
    WorkflowTemplate source = graphStore.getVisibleTemplate(request.sourceTemplateId(), caller);
    if (!source.getScope().isGlobal() && !source.getScopeKey().equals(template.getScopeKey())) {
      throw WorkflowException.validation("Style defaults can only be copied within a tenant or from global");
    }

    Map<WorkflowNodeType, WorkflowNodeStyleDefault> existing = new EnumMap<>(WorkflowNodeType.class);
    styleDefaultRepository
        .findByTemplateIdOrderByNodeTypeAsc(templateId)
        .forEach(row -> existing.put(row.getNodeType(), row));

    for (WorkflowNodeStyleDefault sourceRow :
        styleDefaultRepository.findByTemplateIdOrderByNodeTypeAsc(source.getId())) {
      WorkflowNodeStyleDefault target = existing.get(sourceRow.getNodeType());
      if (target != null && !request.overwrite()) {
        continue;
      }
      if (target == null) {
        target = new WorkflowNodeStyleDefault(templateId, sourceRow.getNodeType());
        existing.put(sourceRow.getNodeType(), target);
      }
      target.applyColours(sourceRow.getBgColor(), sourceRow.getTextColor(), sourceRow.getBorderColor());
      styleDefaultRepository.save(target);
    }
    return finish(template, caller, "style_default_copy", List.copyOf(existing.values()));
  }

  private <T> MutationResult<T> finish(
      WorkflowTemplate template, WorkflowCaller caller, String action, T item) {
    template.markEdited(caller.callerId());
    telemetry.recordTemplateMutation(action, template, caller.callerId());
    eventPublisher.publishEvent(
        new WorkflowTemplateChangedEvent(template.getId(), template.getScopeKey(), action));
    return new MutationResult<>(item, template.getRevision());
  }
}
