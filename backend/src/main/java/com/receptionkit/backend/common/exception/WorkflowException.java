package com.receptionkit.backend.common.exception;

import org.springframework.web.server.ResponseStatusException;

/**
 * Single typed failure raised by the workflow core. The HTTP status is derived from the kind so
 * the web layer can render it without a second mapping table.
 */
public class WorkflowException extends ResponseStatusException {

  private final WorkflowErrorKind kind;

  public WorkflowException(WorkflowErrorKind kind, String reason) {
    super(kind.status(), reason);
    this.kind = kind;
    getBody().setProperty("kind", kind.name());
  }

  public WorkflowErrorKind getKind() {
    return kind;
  }

  public static WorkflowException notFound(String reason) {
    return new WorkflowException(WorkflowErrorKind.NOT_FOUND, reason);
  }

  public static WorkflowException forbidden(String reason) {
    return new WorkflowException(WorkflowErrorKind.FORBIDDEN, reason);
  }

  public static WorkflowException validation(String reason) {
    return new WorkflowException(WorkflowErrorKind.VALIDATION, reason);
  }

  public static WorkflowException invalidState(String reason) {
    return new WorkflowException(WorkflowErrorKind.INVALID_STATE, reason);
  }

  public static WorkflowException conflict(String reason) {
    return new WorkflowException(WorkflowErrorKind.CONFLICT, reason);
  }
}
