package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record EdgeUpdateRequest(
    @NotNull Long expectedRevision,
    @Size(max = 500) String label,
    UUID targetNodeId,
    Boolean clearTarget,
    String description,
    WorkflowActionKey actionKey,
    @Size(max = 64) String sourceHandle,
    @Size(max = 64) String targetHandle) {}
