package com.receptionkit.backend.workflow.service;

import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.graph.TemplateGraph;
import com.receptionkit.backend.workflow.persistence.WorkflowAnswerOptionRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeLinkRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeStyleDefaultRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowTemplateRepository;
import com.receptionkit.backend.workflow.security.WorkflowAccessPolicy;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Scoped reads of templates and their graphs, plus the locked read every mutation starts from.
 * Writes always go through {@link #lockForEdit}, which ties the template id to the caller's scope.
 */
@Service
public class WorkflowGraphStore {

  private final WorkflowTemplateRepository templateRepository;
  private final WorkflowNodeRepository nodeRepository;
  private final WorkflowAnswerOptionRepository optionRepository;
  private final WorkflowNodeLinkRepository linkRepository;
  private final WorkflowNodeStyleDefaultRepository styleDefaultRepository;
  private final WorkflowAccessPolicy accessPolicy;

  public WorkflowGraphStore(
      WorkflowTemplateRepository templateRepository,
      WorkflowNodeRepository nodeRepository,
      WorkflowAnswerOptionRepository optionRepository,
      WorkflowNodeLinkRepository linkRepository,
      WorkflowNodeStyleDefaultRepository styleDefaultRepository,
      WorkflowAccessPolicy accessPolicy) {
    this.templateRepository = templateRepository;
    this.nodeRepository = nodeRepository;
    this.optionRepository = optionRepository;
    this.linkRepository = linkRepository;
    this.styleDefaultRepository = styleDefaultRepository;
    this.accessPolicy = accessPolicy;
  }

  /** Template by id, only if it belongs to exactly {@code scope}. */
  @Transactional(readOnly = true)
  public WorkflowTemplate getTemplate(UUID templateId, TemplateScope scope) {
    WorkflowTemplate template = findTemplate(templateId);
    if (!template.getScopeKey().equals(scope.key())) {
      throw notFound(templateId);
    }
    return template;
  }

  /** Template by id if the caller may see it: its own tenant's, or global. */
  @Transactional(readOnly = true)
  public WorkflowTemplate getVisibleTemplate(UUID templateId, WorkflowCaller caller) {
    WorkflowTemplate template = findTemplate(templateId);
    accessPolicy.checkCanRead(caller, template.getScope());
    return template;
  }

  @Transactional(readOnly = true)
  public List<WorkflowTemplate> listTemplates(TemplateScope scope, boolean activeOnly) {
    return activeOnly
        ? templateRepository.findByScopeKeyAndActiveTrueOrderByNameAsc(scope.key())
        : templateRepository.findByScopeKeyOrderByNameAsc(scope.key());
  }

  @Transactional(readOnly = true)
  public TemplateContents loadContents(UUID templateId, WorkflowCaller caller) {
    return loadContents(getVisibleTemplate(templateId, caller));
  }

  @Transactional(readOnly = true)
  public TemplateContents loadContents(WorkflowTemplate template) {
    UUID templateId = template.getId();
    return new TemplateContents(
        template,
        nodeRepository.findByTemplate_IdOrderBySortOrderAsc(templateId),
        optionRepository.findByTemplateId(templateId),
        linkRepository.findByTemplateId(templateId),
        styleDefaultRepository.findByTemplateIdOrderByNodeTypeAsc(templateId));
  }

  /**
   * Contents of a visible template read under its row lock, so that no graph edit commits between
   * the node and edge queries.
   */
  @Transactional
  public TemplateContents lockContents(UUID templateId, WorkflowCaller caller) {
    WorkflowTemplate template =
        templateRepository.findByIdForUpdate(templateId).orElseThrow(() -> notFound(templateId));
    accessPolicy.checkCanRead(caller, template.getScope());
    return loadContents(template);
  }

  /** Graph snapshot with no access check; callers have already resolved the template. */
  @Transactional(readOnly = true)
  public TemplateGraph graph(UUID templateId) {
    return TemplateGraph.of(
        templateId,
        nodeRepository.findByTemplate_IdOrderBySortOrderAsc(templateId),
        optionRepository.findByTemplateId(templateId),
        linkRepository.findByTemplateId(templateId));
  }

  /**
   * Locks the template row and checks that the caller may edit it and saw the current revision.
   * Templates outside the caller's visibility report not found.
   */
  @Transactional
  public WorkflowTemplate lockForEdit(UUID templateId, Long expectedRevision, WorkflowCaller caller) {
    WorkflowTemplate template =
        templateRepository.findByIdForUpdate(templateId).orElseThrow(() -> notFound(templateId));
    accessPolicy.checkCanRead(caller, template.getScope());
    accessPolicy.checkCanEdit(caller, template.getScope());
    if (expectedRevision == null) {
      throw WorkflowException.validation("expectedRevision is required");
    }
    if (!Objects.equals(expectedRevision, template.getRevision())) {
      throw WorkflowException.conflict(
          "Workflow template "
              + templateId
              + " is at revision "
              + template.getRevision()
              + " but the request expected "
              + expectedRevision);
    }
    return template;
  }

  public void requireStructurallyEditable(WorkflowTemplate template) {
    if (!template.getApprovalStatus().allowsStructuralEdits()) {
      throw WorkflowException.invalidState(
          "Workflow template is "
              + template.getApprovalStatus()
              + "; reopen it for editing before changing its graph");
    }
  }

  private WorkflowTemplate findTemplate(UUID templateId) {
    return templateRepository.findById(templateId).orElseThrow(() -> notFound(templateId));
  }

  private static WorkflowException notFound(UUID templateId) {
    return WorkflowException.notFound("Workflow template not found: " + templateId);
  }
}
