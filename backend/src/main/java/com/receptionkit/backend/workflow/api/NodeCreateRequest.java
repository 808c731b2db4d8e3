package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.NodeStyle;
import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record NodeCreateRequest(
    @NotNull Long expectedRevision,
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED) @NotNull WorkflowNodeType type,
    @Schema(description = "Defaults to a per-type placeholder title.") @Size(max = 500) String title,
    @Schema(description = "Opaque rich-text payload.") String body,
    @DecimalMin("-1000000") @DecimalMax("1000000") Double positionX,
    @DecimalMin("-1000000") @DecimalMax("1000000") Double positionY,
    @Schema(description = "Marks this node as the explicit entry node.") Boolean start,
    WorkflowActionKey actionKey,
    List<@Size(max = 64) String> badges,
    @Schema(description = "Style override; when absent the template default for the type is copied.")
        NodeStyle style) {}
