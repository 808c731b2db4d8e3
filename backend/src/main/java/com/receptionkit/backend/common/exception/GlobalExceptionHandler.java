package com.receptionkit.backend.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    ProblemDetail problem = ProblemDetail.forStatus(WorkflowErrorKind.VALIDATION.status());
    problem.setTitle("Validation failed");
    problem.setDetail(resolveValidationMessage(ex));
    problem.setProperty("kind", WorkflowErrorKind.VALIDATION.name());
    return ResponseEntity.status(WorkflowErrorKind.VALIDATION.status()).body(problem);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(WorkflowErrorKind.VALIDATION.status());
    problem.setTitle("Malformed request");
    problem.setDetail("Request body could not be parsed");
    problem.setProperty("kind", WorkflowErrorKind.VALIDATION.name());
    return ResponseEntity.status(WorkflowErrorKind.VALIDATION.status()).body(problem);
  }

  @ExceptionHandler({
    ObjectOptimisticLockingFailureException.class,
    DataIntegrityViolationException.class
  })
  public ResponseEntity<ProblemDetail> handleConcurrentWrite(RuntimeException ex) {
    log.warn("Concurrent write rejected: {}", ex.getMessage());
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Conflict");
    problem.setDetail("The record was changed by another request. Reload and retry.");
    problem.setProperty("kind", WorkflowErrorKind.CONFLICT.name());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    if (ex instanceof WorkflowException workflowException) {
      log.debug("Workflow operation rejected kind={} reason={}", workflowException.getKind(), ex.getReason());
    }
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private String resolveValidationMessage(Exception ex) {
    if (ex instanceof MethodArgumentNotValidException methodArgumentNotValidException) {
      return methodArgumentNotValidException
          .getBindingResult()
          .getFieldErrors()
          .stream()
          .findFirst()
          .map(error -> error.getField() + ": " + (error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid value"))
          .orElse("Invalid request payload");
    }
    if (ex instanceof BindException bindException) {
      return bindException
          .getBindingResult()
          .getAllErrors()
          .stream()
          .findFirst()
          .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid request payload")
          .orElse("Invalid request payload");
    }
    return "Invalid request payload";
  }
}
