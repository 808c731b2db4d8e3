package com.receptionkit.backend.workflow.domain;

public enum WorkflowType {
  PRIMARY,
  SUPPORTING,
  MODULE
}
