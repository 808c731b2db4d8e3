package com.receptionkit.backend.workflow.domain;

public enum WorkflowInstanceStatus {
  IN_PROGRESS,
  COMPLETED,
  ABANDONED;

  public boolean isTerminal() {
    return this != IN_PROGRESS;
  }
}
