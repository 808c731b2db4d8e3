package com.receptionkit.backend.workflow.api;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ReviewNoteRequest(@NotNull Long expectedRevision, @Size(max = 4000) String note) {}
