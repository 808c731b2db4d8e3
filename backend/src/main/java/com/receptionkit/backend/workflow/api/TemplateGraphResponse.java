package com.receptionkit.backend.workflow.api;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import java.util.UUID;

@Schema(description = "A template together with its full graph, as the authoring diagram needs it.")
public record TemplateGraphResponse(
    TemplateResponse template,
    @Schema(description = "Node a new run would start at; null for an empty template.") UUID entryNodeId,
    List<NodeResponse> nodes,
    List<EdgeResponse> edges,
    List<LinkResponse> links,
    List<StyleDefaultResponse> styleDefaults) {}
