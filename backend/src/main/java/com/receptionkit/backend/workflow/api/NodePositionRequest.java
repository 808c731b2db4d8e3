package com.receptionkit.backend.workflow.api;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

public record NodePositionRequest(
    @NotNull Long expectedRevision,
    @DecimalMin("-1000000") @DecimalMax("1000000") double x,
    @DecimalMin("-1000000") @DecimalMax("1000000") double y) {

  /** Largest absolute diagram coordinate a node may be placed at. */
  public static final int MAX_COORDINATE = 1_000_000;
}
