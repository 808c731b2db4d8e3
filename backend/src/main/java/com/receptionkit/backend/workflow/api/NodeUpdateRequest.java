package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.NodeStyle;
import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;

@Schema(
    description =
        "Partial node update. Null fields are unchanged. Style-only updates are accepted in every"
            + " approval status; any other change needs an editable template.")
public record NodeUpdateRequest(
    @NotNull Long expectedRevision,
    WorkflowNodeType type,
    @Size(max = 500) String title,
    String body,
    Boolean start,
    WorkflowActionKey actionKey,
    List<@Size(max = 64) String> badges,
    @Schema(description = "Merged over the stored style override.") NodeStyle style,
    @Schema(description = "Drops the style override so template defaults apply again.")
        Boolean clearStyle,
    @Schema(description = "Replaces every outgoing link of the node, in order.")
        List<@NotNull UUID> linkedTemplateIds) {

  public boolean touchesStructure() {
    return type != null
        || title != null
        || body != null
        || start != null
        || actionKey != null
        || badges != null
        || linkedTemplateIds != null;
  }

  public boolean touchesStyle() {
    return style != null || Boolean.TRUE.equals(clearStyle);
  }
}
