package com.receptionkit.backend.common.exception;

import org.springframework.http.HttpStatus;

/** Failure categories surfaced by authoring, lifecycle and runtime operations. */
public enum WorkflowErrorKind {
  NOT_FOUND(HttpStatus.NOT_FOUND),
  FORBIDDEN(HttpStatus.FORBIDDEN),
  VALIDATION(HttpStatus.UNPROCESSABLE_ENTITY),
  INVALID_STATE(HttpStatus.CONFLICT),
  CONFLICT(HttpStatus.CONFLICT);

  private final HttpStatus status;

  WorkflowErrorKind(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
