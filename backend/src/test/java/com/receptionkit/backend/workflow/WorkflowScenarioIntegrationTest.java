package com.receptionkit.backend.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.receptionkit.backend.common.exception.WorkflowErrorKind;
import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.support.PostgresTestContainer;
import com.receptionkit.backend.workflow.api.BulkRepositionRequest;
import com.receptionkit.backend.workflow.api.EdgeCreateRequest;
import com.receptionkit.backend.workflow.api.InstanceAdvanceRequest;
import com.receptionkit.backend.workflow.api.InstanceStartRequest;
import com.receptionkit.backend.workflow.api.LinkCreateRequest;
import com.receptionkit.backend.workflow.api.NodeCreateRequest;
import com.receptionkit.backend.workflow.api.TemplateCreateRequest;
import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.domain.WorkflowAnswerOption;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowInstanceStatus;
import com.receptionkit.backend.workflow.domain.WorkflowInstanceStep;
import com.receptionkit.backend.workflow.domain.WorkflowNode;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.graph.WorkflowChoice;
import com.receptionkit.backend.workflow.persistence.WorkflowAnswerOptionRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowNodeRepository;
import com.receptionkit.backend.workflow.persistence.WorkflowTemplateRepository;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.service.ApprovalService;
import com.receptionkit.backend.workflow.service.GraphMutationService;
import com.receptionkit.backend.workflow.service.InstanceExecutionService;
import com.receptionkit.backend.workflow.service.TemplateCloneService;
import com.receptionkit.backend.workflow.service.TemplateService;
import com.receptionkit.backend.workflow.service.WorkflowInstanceView;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class WorkflowScenarioIntegrationTest extends PostgresTestContainer {

  private static final WorkflowCaller ROOT = WorkflowCaller.superuser("root");
  private static final WorkflowCaller ADMIN = WorkflowCaller.tenantAdmin("admin-1", "clinic-1");
  private static final WorkflowCaller STAFF = WorkflowCaller.staff("staff-1", "clinic-1");

  @Autowired private TemplateService templateService;
  @Autowired private GraphMutationService mutationService;
  @Autowired private ApprovalService approvalService;
  @Autowired private TemplateCloneService cloneService;
  @Autowired private InstanceExecutionService executionService;
  @Autowired private WorkflowTemplateRepository templateRepository;
  @Autowired private WorkflowNodeRepository nodeRepository;
  @Autowired private WorkflowAnswerOptionRepository optionRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void clean() {
    jdbcTemplate.execute(
        "TRUNCATE TABLE workflow_instance_step, workflow_instance, workflow_node_link, workflow_answer_option, "
            + "workflow_node_style_default, workflow_node, workflow_template CASCADE");
  }

  @Test
  void cycleIsWalkedAndHistoryGrowsByOnePerAdvance() {
    Triage triage = triage(ADMIN, TemplateScope.tenant("clinic-1"));
    approve(ADMIN, triage.template());

    WorkflowInstanceView started = start(triage.template());
    assertThat(started.instance().getCurrentNodeId()).isEqualTo(triage.a());

    WorkflowInstanceView atC = advance(started, "No");
    assertThat(atC.instance().getCurrentNodeId()).isEqualTo(triage.c());
    assertThat(executionService.history(STAFF, started.instance().getId())).hasSize(1);

    WorkflowInstanceView backAtA = advance(atC, "Back");
    assertThat(backAtA.instance().getCurrentNodeId()).isEqualTo(triage.a());
    List<WorkflowInstanceStep> history = executionService.history(STAFF, started.instance().getId());
    assertThat(history).extracting(WorkflowInstanceStep::getSequenceNo).containsExactly(1, 2);
    assertThat(history.get(0).getToNodeId()).isEqualTo(triage.c());

    WorkflowInstanceView done = advance(backAtA, "Yes");
    assertThat(done.instance().getStatus()).isEqualTo(WorkflowInstanceStatus.COMPLETED);
    assertThat(executionService.history(STAFF, started.instance().getId())).hasSize(3);
  }

  @Test
  void deletingNodeDetachesIncomingEdgeAndAdvanceIsRejected() {
    Triage triage = triage(ADMIN, TemplateScope.tenant("clinic-1"));
    approve(ADMIN, triage.template());
    WorkflowInstanceView started = start(triage.template());

    approvalService.reopenForEditing(ADMIN, triage.template(), revision(triage.template()));
    mutationService.deleteNode(ADMIN, triage.template(), triage.b(), revision(triage.template()));

    List<WorkflowAnswerOption> fromA = optionRepository.findByNode_IdOrderByCreatedAtAscIdAsc(triage.a());
    assertThat(fromA).filteredOn(option -> option.getLabel().equals("Yes")).singleElement()
        .satisfies(option -> assertThat(option.getNextNodeId()).isNull());
    assertThat(fromA).filteredOn(option -> option.getLabel().equals("No")).singleElement()
        .satisfies(option -> assertThat(option.getNextNodeId()).isEqualTo(triage.c()));

    assertThatThrownBy(() -> advance(started, "Yes"))
        .isInstanceOfSatisfying(
            WorkflowException.class, ex -> assertThat(ex.getKind()).isEqualTo(WorkflowErrorKind.VALIDATION));
    assertThat(executionService.history(STAFF, started.instance().getId())).isEmpty();
  }

  @Test
  void cloneIsIndependentOfItsSource() {
    Triage global = triage(ROOT, TemplateScope.global());
    approve(ROOT, global.template());

    WorkflowTemplate clone = cloneService.cloneTemplate(ADMIN, global.template(), TemplateScope.tenant("clinic-1"));

    assertThat(clone.getSourceTemplateId()).isEqualTo(global.template());
    assertThat(clone.getApprovalStatus()).isEqualTo(WorkflowApprovalStatus.DRAFT);
    assertThat(nodeRepository.findByTemplate_IdOrderBySortOrderAsc(clone.getId())).hasSize(3);
    assertThat(optionRepository.findByTemplateId(clone.getId())).hasSize(3);

    approvalService.reopenForEditing(ROOT, global.template(), revision(global.template()));
    mutationService.createNode(ROOT, global.template(), node(global.template(), WorkflowNodeType.INSTRUCTION, "Call back"));
    assertThat(nodeRepository.findByTemplate_IdOrderBySortOrderAsc(clone.getId())).hasSize(3);

    WorkflowNode cloneOfC =
        nodeRepository.findByTemplate_IdOrderBySortOrderAsc(clone.getId()).stream()
            .filter(node -> node.getTitle().equals("Which team?"))
            .findFirst()
            .orElseThrow();
    mutationService.deleteNode(ADMIN, clone.getId(), cloneOfC.getId(), revision(clone.getId()));
    assertThat(nodeRepository.findByTemplate_IdOrderBySortOrderAsc(global.template())).hasSize(4);
  }

  @Test
  void bulkRepositionIsAllOrNothing() {
    Triage triage = triage(ADMIN, TemplateScope.tenant("clinic-1"));
    Triage other = triage(ADMIN, TemplateScope.tenant("clinic-1"), "Other triage");

    mutationService.repositionNodes(
        ADMIN,
        triage.template(),
        new BulkRepositionRequest(
            revision(triage.template()),
            List.of(
                new BulkRepositionRequest.NodePosition(triage.a(), 10, 20),
                new BulkRepositionRequest.NodePosition(triage.b(), 30, 40),
                new BulkRepositionRequest.NodePosition(triage.c(), 50.4, 60.6))));

    assertThatThrownBy(
            () ->
                mutationService.repositionNodes(
                    ADMIN,
                    triage.template(),
                    new BulkRepositionRequest(
                        revision(triage.template()),
                        List.of(
                            new BulkRepositionRequest.NodePosition(triage.a(), 999, 999),
                            new BulkRepositionRequest.NodePosition(other.a(), 999, 999)))))
        .isInstanceOfSatisfying(
            WorkflowException.class, ex -> assertThat(ex.getKind()).isEqualTo(WorkflowErrorKind.VALIDATION));

    List<WorkflowNode> nodes = nodeRepository.findByTemplate_IdOrderBySortOrderAsc(triage.template());
    assertThat(nodes).extracting(WorkflowNode::getPositionX).containsExactly(10, 30, 50);
    assertThat(nodes).extracting(WorkflowNode::getPositionY).containsExactly(20, 40, 61);
  }

  @Test
  void linkMovesRunIntoTargetEntryNode() {
    WorkflowTemplate referral = create(ADMIN, TemplateScope.tenant("clinic-1"), "Referral");
    UUID referralEntry =
        mutationService
            .createNode(ADMIN, referral.getId(), node(referral.getId(), WorkflowNodeType.INSTRUCTION, "Send referral"))
            .item()
            .getId();
    approve(ADMIN, referral.getId());

    WorkflowTemplate letters = create(ADMIN, TemplateScope.tenant("clinic-1"), "Letters");
    UUID d =
        mutationService
            .createNode(ADMIN, letters.getId(), node(letters.getId(), WorkflowNodeType.PANEL, "Needs referral"))
            .item()
            .getId();
    mutationService.createLink(
        ADMIN, letters.getId(), new LinkCreateRequest(revision(letters.getId()), d, referral.getId(), null));
    approve(ADMIN, letters.getId());

    WorkflowInstanceView started = start(letters.getId());
    WorkflowInstanceView jumped = advance(started, "Open linked workflow");

    assertThat(jumped.instance().getTemplateId()).isEqualTo(referral.getId());
    assertThat(jumped.instance().getRootTemplateId()).isEqualTo(letters.getId());
    assertThat(jumped.instance().getCurrentNodeId()).isEqualTo(referralEntry);
    List<WorkflowInstanceStep> history = executionService.history(STAFF, started.instance().getId());
    assertThat(history).singleElement().satisfies(step -> {
      assertThat(step.isTemplateSwitched()).isTrue();
      assertThat(step.getFromTemplateId()).isEqualTo(letters.getId());
      assertThat(step.getToTemplateId()).isEqualTo(referral.getId());
    });
  }

  @Test
  void draftCannotStartUntilApproved() {
    Triage triage = triage(ADMIN, TemplateScope.tenant("clinic-1"));

    assertThatThrownBy(() -> start(triage.template()))
        .isInstanceOfSatisfying(
            WorkflowException.class, ex -> assertThat(ex.getKind()).isEqualTo(WorkflowErrorKind.INVALID_STATE));

    approve(ADMIN, triage.template());
    assertThat(start(triage.template()).instance().getStatus()).isEqualTo(WorkflowInstanceStatus.IN_PROGRESS);
  }

  private record Triage(UUID template, UUID a, UUID b, UUID c) {}

  private Triage triage(WorkflowCaller caller, TemplateScope scope) {
    return triage(caller, scope, "Triage");
  }

  private Triage triage(WorkflowCaller caller, TemplateScope scope, String name) {
    UUID templateId = create(caller, scope, name).getId();
    UUID a = mutationService.createNode(caller, templateId, node(templateId, WorkflowNodeType.QUESTION, "Urgent?")).item().getId();
    UUID b = mutationService.createNode(caller, templateId, node(templateId, WorkflowNodeType.END, "Book today")).item().getId();
    UUID c = mutationService.createNode(caller, templateId, node(templateId, WorkflowNodeType.QUESTION, "Which team?")).item().getId();
    edge(caller, templateId, a, "Yes", b);
    edge(caller, templateId, a, "No", c);
    edge(caller, templateId, c, "Back", a);
    return new Triage(templateId, a, b, c);
  }

  private WorkflowTemplate create(WorkflowCaller caller, TemplateScope scope, String name) {
    String tenantId = scope instanceof TemplateScope.Tenant tenant ? tenant.tenantId() : null;
    return templateService.createTemplate(
        caller, new TemplateCreateRequest(scope.isGlobal(), tenantId, name, null, null, null, null, null, null));
  }

  private NodeCreateRequest node(UUID templateId, WorkflowNodeType type, String title) {
    return new NodeCreateRequest(revision(templateId), type, title, null, null, null, null, null, null, null);
  }

  private void edge(WorkflowCaller caller, UUID templateId, UUID from, String label, UUID to) {
    mutationService.createEdge(
        caller, templateId, new EdgeCreateRequest(revision(templateId), from, label, to, null, null, null, null));
  }

  private void approve(WorkflowCaller caller, UUID templateId) {
    approvalService.submitForReview(caller, templateId, revision(templateId));
    approvalService.approve(caller, templateId, revision(templateId));
  }

  private WorkflowInstanceView start(UUID templateId) {
    return executionService.start(STAFF, new InstanceStartRequest(templateId, null, "DOC-1", null));
  }

  private WorkflowInstanceView advance(WorkflowInstanceView at, String label) {
    UUID instanceId = at.instance().getId();
    WorkflowChoice choice =
        executionService.availableChoices(STAFF, instanceId).stream()
            .filter(candidate -> candidate.label().equals(label))
            .findFirst()
            .orElseThrow();
    long stateVersion = executionService.getInstance(STAFF, instanceId).instance().getStateVersion();
    return executionService
        .advance(STAFF, instanceId, new InstanceAdvanceRequest(choice.id(), stateVersion, null))
        .view();
  }

  private long revision(UUID templateId) {
    return templateRepository.findById(templateId).orElseThrow().getRevision();
  }
}
