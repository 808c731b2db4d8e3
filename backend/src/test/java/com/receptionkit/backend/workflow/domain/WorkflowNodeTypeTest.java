package com.receptionkit.backend.workflow.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class WorkflowNodeTypeTest {

  @Test
  void onlyQuestionsBranch() {
    assertThat(WorkflowNodeType.QUESTION.supportsBranching()).isTrue();
    assertThat(WorkflowNodeType.INSTRUCTION.supportsBranching()).isFalse();
    assertThat(WorkflowNodeType.INSTRUCTION.maxAuthoredEdges()).isEqualTo(1);
    assertThat(WorkflowNodeType.PANEL.maxAuthoredEdges()).isZero();
  }

  @Test
  void endIsTheOnlyTerminalType() {
    for (WorkflowNodeType type : WorkflowNodeType.values()) {
      assertThat(type.isTerminal()).isEqualTo(type == WorkflowNodeType.END);
    }
    assertThat(WorkflowNodeType.END.hasImplicitContinue()).isFalse();
    assertThat(WorkflowNodeType.QUESTION.hasImplicitContinue()).isFalse();
  }

  @Test
  void approvalStatusesGateStructuralEdits() {
    assertThat(WorkflowApprovalStatus.DRAFT.allowsStructuralEdits()).isTrue();
    assertThat(WorkflowApprovalStatus.CHANGES_REQUIRED.allowsStructuralEdits()).isTrue();
    assertThat(WorkflowApprovalStatus.PENDING_REVIEW.allowsStructuralEdits()).isFalse();
    assertThat(WorkflowApprovalStatus.APPROVED.allowsStructuralEdits()).isFalse();
  }
}
