package com.receptionkit.backend.workflow.domain;

public enum WorkflowChoiceKind {
  /** Authored answer option on the current node. */
  ANSWER,
  /** Cross-template link on the current node. */
  LINK,
  /** Engine-synthesized single continue for nodes without an applicable authored edge. */
  CONTINUE
}
