package com.receptionkit.backend.workflow.service;

import static com.receptionkit.backend.workflow.TestWorkflowFactory.template;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.receptionkit.backend.common.exception.WorkflowErrorKind;
import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.api.StyleDefaultCopyRequest;
import com.receptionkit.backend.workflow.api.StyleDefaultRequest;
import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowNodeStyleDefault;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
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
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.context.ApplicationEventPublisher;

class StyleDefaultServiceTest {

  @Mock private WorkflowTemplateRepository templateRepository;
  @Mock private WorkflowNodeRepository nodeRepository;
  @Mock private WorkflowAnswerOptionRepository optionRepository;
  @Mock private WorkflowNodeLinkRepository linkRepository;
  @Mock private WorkflowNodeStyleDefaultRepository styleDefaultRepository;
  @Mock private WorkflowTelemetryService telemetry;
  @Mock private ApplicationEventPublisher eventPublisher;

  private final WorkflowCaller admin = WorkflowCaller.tenantAdmin("admin-1", "clinic-1");

  private StyleDefaultService service;
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
    service = new StyleDefaultService(graphStore, styleDefaultRepository, telemetry, eventPublisher);

    template = template(TemplateScope.tenant("clinic-1"), "Letters", WorkflowApprovalStatus.APPROVED);
    when(templateRepository.findByIdForUpdate(template.getId())).thenReturn(Optional.of(template));
    when(styleDefaultRepository.save(any(WorkflowNodeStyleDefault.class))).thenAnswer(invocation -> invocation.getArgument(0));
  }

  @Test
  void upsertOnApprovedTemplateKeepsApproval() {
    MutationResult<WorkflowNodeStyleDefault> result =
        service.upsert(admin, template.getId(), WorkflowNodeType.QUESTION, new StyleDefaultRequest(1L, "#fff", null, " #000000 "));

    assertThat(result.item().getBgColor()).isEqualTo("#fff");
    assertThat(result.item().getBorderColor()).isEqualTo("#000000");
    assertThat(result.revision()).isEqualTo(2L);
    assertThat(template.getApprovalStatus()).isEqualTo(WorkflowApprovalStatus.APPROVED);
  }

  @Test
  void upsertRejectsBadOrMissingColours() {
    assertKind(
        () -> service.upsert(admin, template.getId(), WorkflowNodeType.QUESTION, new StyleDefaultRequest(1L, "red", null, null)),
        WorkflowErrorKind.VALIDATION);
    assertKind(
        () -> service.upsert(admin, template.getId(), WorkflowNodeType.QUESTION, new StyleDefaultRequest(1L, null, " ", null)),
        WorkflowErrorKind.VALIDATION);
    verify(styleDefaultRepository, never()).save(any());
  }

  @Test
  void copyFillsOnlyMissingTypesUnlessOverwriting() {
    WorkflowTemplate source = template(TemplateScope.global(), "House style", WorkflowApprovalStatus.APPROVED);
    when(templateRepository.findById(source.getId())).thenReturn(Optional.of(source));
    WorkflowNodeStyleDefault sourceQuestion = styled(source, WorkflowNodeType.QUESTION, "#111111");
    WorkflowNodeStyleDefault sourceEnd = styled(source, WorkflowNodeType.END, "#222222");
    WorkflowNodeStyleDefault ownQuestion = styled(template, WorkflowNodeType.QUESTION, "#abcdef");
    when(styleDefaultRepository.findByTemplateIdOrderByNodeTypeAsc(source.getId()))
        .thenReturn(List.of(sourceQuestion, sourceEnd));
    when(styleDefaultRepository.findByTemplateIdOrderByNodeTypeAsc(template.getId())).thenReturn(List.of(ownQuestion));

    MutationResult<List<WorkflowNodeStyleDefault>> kept =
        service.copy(admin, template.getId(), new StyleDefaultCopyRequest(1L, source.getId(), false));

    assertThat(kept.item()).hasSize(2);
    assertThat(ownQuestion.getBgColor()).isEqualTo("#abcdef");

    service.copy(admin, template.getId(), new StyleDefaultCopyRequest(2L, source.getId(), true));
    assertThat(ownQuestion.getBgColor()).isEqualTo("#111111");
  }

  @Test
  void copyFromAnotherTenantIsNotVisible() {
    WorkflowTemplate foreign = template(TemplateScope.tenant("clinic-2"), "Theirs", WorkflowApprovalStatus.APPROVED);
    when(templateRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

    assertKind(
        () -> service.copy(admin, template.getId(), new StyleDefaultCopyRequest(1L, foreign.getId(), false)),
        WorkflowErrorKind.NOT_FOUND);
  }

  private static WorkflowNodeStyleDefault styled(WorkflowTemplate owner, WorkflowNodeType type, String bg) {
    WorkflowNodeStyleDefault row = new WorkflowNodeStyleDefault(owner.getId(), type);
    row.applyColours(bg, null, null);
    return row;
  }

  private static void assertKind(Runnable action, WorkflowErrorKind kind) {
    assertThatThrownBy(action::run)
        .isInstanceOfSatisfying(WorkflowException.class, ex -> assertThat(ex.getKind()).isEqualTo(kind));
  }
}
