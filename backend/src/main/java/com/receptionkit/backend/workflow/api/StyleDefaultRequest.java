package com.receptionkit.backend.workflow.api;

import jakarta.validation.constraints.NotNull;

public record StyleDefaultRequest(
    @NotNull Long expectedRevision, String bgColor, String textColor, String borderColor) {}
