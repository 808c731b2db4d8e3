package com.receptionkit.backend.workflow.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;

@Schema(description = "Moves several nodes of one template at once. Either every position is saved or none.")
public record BulkRepositionRequest(
    @NotNull Long expectedRevision, @NotEmpty List<@Valid @NotNull NodePosition> positions) {

  public record NodePosition(
      @NotNull UUID nodeId,
      @DecimalMin("-1000000") @DecimalMax("1000000") double x,
      @DecimalMin("-1000000") @DecimalMax("1000000") double y) {}
}
