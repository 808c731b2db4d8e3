package com.receptionkit.backend.workflow.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record InstanceAdvanceRequest(
    @Schema(description = "Answer option, link or continue id offered at the current node.") @NotNull
        UUID choiceId,
    @Schema(description = "State version the caller last saw.") @NotNull Long expectedStateVersion,
    @Size(max = 4000) String note) {}
