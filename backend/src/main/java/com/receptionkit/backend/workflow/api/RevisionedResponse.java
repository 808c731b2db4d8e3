package com.receptionkit.backend.workflow.api;

import io.swagger.v3.oas.annotations.media.Schema;

/** Result of a graph mutation together with the template revision the client must send next. */
public record RevisionedResponse<T>(
    @Schema(description = "Current template revision after the mutation.") long revision, T item) {}
