package com.receptionkit.backend.workflow.service;

import static com.receptionkit.backend.workflow.TestWorkflowFactory.node;
import static com.receptionkit.backend.workflow.TestWorkflowFactory.template;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.receptionkit.backend.common.exception.WorkflowErrorKind;
import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.events.WorkflowTemplateApprovedEvent;
import com.receptionkit.backend.workflow.persistence.WorkflowAnswerOptionRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeLinkRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeStyleDefaultRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowTemplateRepository;
import com.receptionkit.backend.workflow.security.WorkflowAccessPolicy;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.telemetry.WorkflowTelemetryService;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.context.ApplicationEventPublisher;

class ApprovalServiceTest {

  @Mock private WorkflowTemplateRepository templateRepository;
  @Mock private WorkflowNodeRepository nodeRepository;
  @Mock private WorkflowAnswerOptionRepository optionRepository;
  @Mock private WorkflowNodeLinkRepository linkRepository;
  @Mock private WorkflowNodeStyleDefaultRepository styleDefaultRepository;
  @Mock private WorkflowTelemetryService telemetry;
  @Mock private ApplicationEventPublisher eventPublisher;

  private final WorkflowCaller admin = WorkflowCaller.tenantAdmin("admin-1", "clinic-1");

  private ApprovalService service;
  private WorkflowTemplate template;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    WorkflowGraphStore graphStore =
        new WorkflowGraphStore(
            templateRepository,
            nodeRepository,
            optionRepository,
            linkRepository,
            styleDefaultRepository,
            new WorkflowAccessPolicy());
    service = new ApprovalService(graphStore, telemetry, eventPublisher);

    template = template(TemplateScope.tenant("clinic-1"), "Medication request", WorkflowApprovalStatus.DRAFT);
    when(templateRepository.findByIdForUpdate(template.getId())).thenReturn(Optional.of(template));
    when(nodeRepository.findByTemplate_IdOrderBySortOrderAsc(template.getId()))
        .thenReturn(List.of(node(template, WorkflowNodeType.QUESTION, 0)));
  }

  @Test
  void walksThroughReviewCycle() {
    WorkflowTemplate submitted = service.submitForReview(admin, template.getId(), 1L);
    assertThat(submitted.getApprovalStatus()).isEqualTo(WorkflowApprovalStatus.PENDING_REVIEW);
    assertThat(submitted.getRevision()).isEqualTo(2L);

    WorkflowTemplate approved = service.approve(admin, template.getId(), 2L);
    assertThat(approved.getApprovalStatus()).isEqualTo(WorkflowApprovalStatus.APPROVED);
    assertThat(approved.getApprovedBy()).isEqualTo("admin-1");
    assertThat(approved.getApprovedAt()).isNotNull();
    ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
    verify(eventPublisher, atLeastOnce()).publishEvent(events.capture());
    assertThat(events.getAllValues()).anyMatch(WorkflowTemplateApprovedEvent.class::isInstance);

    WorkflowTemplate sentBack = service.requestChanges(admin, template.getId(), 3L, "  Add a GP step ");
    assertThat(sentBack.getApprovalStatus()).isEqualTo(WorkflowApprovalStatus.CHANGES_REQUIRED);
    assertThat(sentBack.getReviewNote()).isEqualTo("Add a GP step");
    assertThat(sentBack.getApprovedBy()).isNull();

    WorkflowTemplate resubmitted = service.submitForReview(admin, template.getId(), 4L);
    assertThat(resubmitted.getApprovalStatus()).isEqualTo(WorkflowApprovalStatus.PENDING_REVIEW);
    verify(telemetry)
        .recordLifecycleTransition(any(WorkflowTemplate.class), eq("PENDING_REVIEW"), eq("APPROVED"), eq("admin-1"));
  }

  @Test
  void reopenReturnsApprovedTemplateToDraft() {
    template.setApprovalStatus(WorkflowApprovalStatus.APPROVED);
    template.setApprovedBy("reviewer");

    WorkflowTemplate reopened = service.reopenForEditing(admin, template.getId(), 1L);

    assertThat(reopened.getApprovalStatus()).isEqualTo(WorkflowApprovalStatus.DRAFT);
    assertThat(reopened.getApprovedBy()).isNull();
  }

  @Test
  void emptyTemplateCannotBeSubmitted() {
    when(nodeRepository.findByTemplate_IdOrderBySortOrderAsc(template.getId())).thenReturn(List.of());

    assertThatThrownBy(() -> service.submitForReview(admin, template.getId(), 1L))
        .isInstanceOfSatisfying(
            WorkflowException.class, ex -> assertThat(ex.getKind()).isEqualTo(WorkflowErrorKind.VALIDATION));
    assertThat(template.getApprovalStatus()).isEqualTo(WorkflowApprovalStatus.DRAFT);
  }

  @Test
  void illegalTransitionsAreInvalidState() {
    assertThatThrownBy(() -> service.approve(admin, template.getId(), 1L))
        .isInstanceOfSatisfying(
            WorkflowException.class, ex -> assertThat(ex.getKind()).isEqualTo(WorkflowErrorKind.INVALID_STATE));
    assertThatThrownBy(() -> service.reopenForEditing(admin, template.getId(), 1L))
        .isInstanceOfSatisfying(
            WorkflowException.class, ex -> assertThat(ex.getKind()).isEqualTo(WorkflowErrorKind.INVALID_STATE));
    assertThatThrownBy(() -> service.requestChanges(admin, template.getId(), 1L, null))
        .isInstanceOfSatisfying(
            WorkflowException.class, ex -> assertThat(ex.getKind()).isEqualTo(WorkflowErrorKind.INVALID_STATE));
  }

  @Test
  void staffCannotApprove() {
    template.setApprovalStatus(WorkflowApprovalStatus.PENDING_REVIEW);

    assertThatThrownBy(() -> service.approve(WorkflowCaller.staff("staff-1", "clinic-1"), template.getId(), 1L))
        .isInstanceOfSatisfying(
            WorkflowException.class, ex -> assertThat(ex.getKind()).isEqualTo(WorkflowErrorKind.FORBIDDEN));
  }
}
