package com.receptionkit.backend.workflow.api;

import jakarta.validation.constraints.NotNull;

public record RevisionRequest(@NotNull Long expectedRevision) {}
