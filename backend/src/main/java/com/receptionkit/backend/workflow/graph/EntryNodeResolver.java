package com.receptionkit.backend.workflow.graph;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Picks the node at which a run of a template begins. An explicitly flagged start node wins, then
 * the first node in sort order that no edge points at, then the first node in sort order.
 */
public final class EntryNodeResolver {

  private EntryNodeResolver() {}

  public static Optional<GraphNode> resolve(TemplateGraph graph) {
    if (graph.isEmpty()) {
      return Optional.empty();
    }
    Optional<GraphNode> flagged = graph.nodes().stream().filter(GraphNode::start).findFirst();
    if (flagged.isPresent()) {
      return flagged;
    }
    Set<UUID> targeted = graph.nodesWithIncomingEdges();
    return graph.nodes().stream()
        .filter(node -> !targeted.contains(node.id()))
        .findFirst()
        .or(() -> Optional.of(graph.nodes().get(0)));
  }
}
