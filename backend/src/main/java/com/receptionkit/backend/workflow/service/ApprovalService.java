package com.receptionkit.backend.workflow.service;

import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.events.WorkflowTemplateApprovedEvent;
import com.receptionkit.backend.workflow.events.WorkflowTemplateChangedEvent;
import com.receptionkit.backend.workflow.graph.EntryNodeResolver;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.telemetry.WorkflowTelemetryService;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Authoring status machine: DRAFT to PENDING_REVIEW to APPROVED, with CHANGES_REQUIRED and an
 * explicit reopen as the rework path.
 */
@Service
public class ApprovalService {

  private final WorkflowGraphStore graphStore;
  private final WorkflowTelemetryService telemetry;
  private final ApplicationEventPublisher eventPublisher;

  public ApprovalService(
      WorkflowGraphStore graphStore,
      WorkflowTelemetryService telemetry,
      ApplicationEventPublisher eventPublisher) {
    this.graphStore = graphStore;
    this.telemetry = telemetry;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public WorkflowTemplate submitForReview(WorkflowCaller caller, UUID templateId, Long expectedRevision) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, expectedRevision, caller);
    requireStatus(
        template, EnumSet.of(WorkflowApprovalStatus.DRAFT, WorkflowApprovalStatus.CHANGES_REQUIRED), "submit");
    if (EntryNodeResolver.resolve(graphStore.graph(templateId)).isEmpty()) {
      throw WorkflowException.validation("Add at least one node before submitting the workflow for review");
    }
    return transition(template, WorkflowApprovalStatus.PENDING_REVIEW, caller);
  }

  @Transactional
  public WorkflowTemplate approve(WorkflowCaller caller, UUID templateId, Long expectedRevision) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, expectedRevision, caller);
    requireStatus(template, EnumSet.of(WorkflowApprovalStatus.PENDING_REVIEW), "approve");
    template.setApprovedBy(caller.callerId());
    template.setApprovedAt(Instant.now());
    template.setReviewNote(null);
    WorkflowTemplate approved = transition(template, WorkflowApprovalStatus.APPROVED, caller);
    eventPublisher.publishEvent(
        new WorkflowTemplateApprovedEvent(approved.getId(), approved.getScopeKey(), caller.callerId()));
    return approved;
  }

  @Transactional
  public WorkflowTemplate requestChanges(
      WorkflowCaller caller, UUID templateId, Long expectedRevision, String note) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, expectedRevision, caller);
    requireStatus(
        template,
        EnumSet.of(WorkflowApprovalStatus.PENDING_REVIEW, WorkflowApprovalStatus.APPROVED),
        "request changes for");
    template.setReviewNote(StringUtils.hasText(note) ? note.trim() : null);
    template.clearApproval();
    return transition(template, WorkflowApprovalStatus.CHANGES_REQUIRED, caller);
  }

  @Transactional
  public WorkflowTemplate reopenForEditing(WorkflowCaller caller, UUID templateId, Long expectedRevision) {
    WorkflowTemplate template = graphStore.lockForEdit(templateId, expectedRevision, caller);
    requireStatus(
        template,
        EnumSet.of(WorkflowApprovalStatus.APPROVED, WorkflowApprovalStatus.CHANGES_REQUIRED),
        "reopen");
    template.clearApproval();
    return transition(template, WorkflowApprovalStatus.DRAFT, caller);
  }

  private WorkflowTemplate transition(
      WorkflowTemplate template, WorkflowApprovalStatus target, WorkflowCaller caller) {
    WorkflowApprovalStatus from = template.getApprovalStatus();
    template.setApprovalStatus(target);
    template.markEdited(caller.callerId());
    telemetry.recordLifecycleTransition(template, from.name(), target.name(), caller.callerId());
    eventPublisher.publishEvent(
        new WorkflowTemplateChangedEvent(template.getId(), template.getScopeKey(), "status_" + target.name()));
    return template;
  }

  private static void requireStatus(
      WorkflowTemplate template, Set<WorkflowApprovalStatus> allowed, String action) {
    if (!allowed.contains(template.getApprovalStatus())) {
      throw WorkflowException.invalidState(
          "Cannot " + action + " a workflow in status " + template.getApprovalStatus());
    }
  }
}
