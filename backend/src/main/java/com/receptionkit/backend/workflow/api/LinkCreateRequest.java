package com.receptionkit.backend.workflow.api;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record LinkCreateRequest(
    @NotNull Long expectedRevision,
    @NotNull UUID nodeId,
    @NotNull UUID targetTemplateId,
    @Size(max = 200) String label) {}
