package com.receptionkit.backend.workflow.domain;

public enum WorkflowApprovalStatus {
  DRAFT,
  PENDING_REVIEW,
  APPROVED,
  CHANGES_REQUIRED;

  /** Structural edits (nodes, edges, links) are accepted only in these states. */
  public boolean allowsStructuralEdits() {
    return this == DRAFT || this == CHANGES_REQUIRED;
  }
}
