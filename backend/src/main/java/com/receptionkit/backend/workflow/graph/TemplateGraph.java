package com.receptionkit.backend.workflow.graph;

import com.receptionkit.backend.workflow.domain.WorkflowAnswerOption;
import com.receptionkit.backend.workflow.domain.WorkflowNode;
import com.receptionkit.backend.workflow.domain.WorkflowNodeLink;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-only snapshot of one template's graph. Nodes, edges and links are flat records keyed by id,
 * so cycles in the authored graph are plain data.
 */
public final class TemplateGraph {

  private final UUID templateId;
  private final List<GraphNode> nodes;
  private final Map<UUID, GraphNode> nodesById;
  private final Map<UUID, List<GraphEdge>> edgesBySource;
  private final Map<UUID, List<GraphLink>> linksBySource;
  private final int edgeCount;

  public TemplateGraph(
      UUID templateId, Collection<GraphNode> nodes, Collection<GraphEdge> edges, Collection<GraphLink> links) {
    this.templateId = templateId;
    this.nodes = nodes.stream().sorted(GraphNode.BY_SORT_ORDER).toList();
    this.nodesById = new LinkedHashMap<>();
    this.nodes.forEach(node -> nodesById.put(node.id(), node));
    this.edgesBySource = new LinkedHashMap<>();
    edges.forEach(edge -> edgesBySource.computeIfAbsent(edge.sourceNodeId(), key -> new ArrayList<>()).add(edge));
    this.linksBySource = new LinkedHashMap<>();
    links.stream()
        .sorted((left, right) -> Integer.compare(left.sortOrder(), right.sortOrder()))
        .forEach(link -> linksBySource.computeIfAbsent(link.sourceNodeId(), key -> new ArrayList<>()).add(link));
    this.edgeCount = edges.size();
  }

  public static TemplateGraph of(
      UUID templateId,
      List<WorkflowNode> nodes,
      List<WorkflowAnswerOption> options,
      List<WorkflowNodeLink> links) {
    return new TemplateGraph(
        templateId,
        nodes.stream().map(GraphNode::of).toList(),
        options.stream().map(GraphEdge::of).toList(),
        links.stream().map(GraphLink::of).toList());
  }

  public UUID templateId() {
    return templateId;
  }

  /** Nodes ordered by sort order, then id. */
  public List<GraphNode> nodes() {
    return nodes;
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public int edgeCount() {
    return edgeCount;
  }

  public Optional<GraphNode> node(UUID nodeId) {
    return Optional.ofNullable(nodesById.get(nodeId));
  }

  public boolean contains(UUID nodeId) {
    return nodesById.containsKey(nodeId);
  }

  public List<GraphEdge> edgesFrom(UUID nodeId) {
    return edgesBySource.getOrDefault(nodeId, List.of());
  }

  public List<GraphLink> linksFrom(UUID nodeId) {
    return linksBySource.getOrDefault(nodeId, List.of());
  }

  /** Ids of nodes that are the target of at least one edge, ignoring edges whose source is gone. */
  public Set<UUID> nodesWithIncomingEdges() {
    return edgesBySource.entrySet().stream()
        .filter(entry -> nodesById.containsKey(entry.getKey()))
        .flatMap(entry -> entry.getValue().stream())
        .map(GraphEdge::targetNodeId)
        .filter(nodesById::containsKey)
        .collect(Collectors.toSet());
  }

  /** The node that follows {@code nodeId} in sort order, if any. */
  public Optional<GraphNode> nextInSortOrder(UUID nodeId) {
    GraphNode current = nodesById.get(nodeId);
    if (current == null) {
      return Optional.empty();
    }
    int index = nodes.indexOf(current);
    return index + 1 < nodes.size() ? Optional.of(nodes.get(index + 1)) : Optional.empty();
  }
}
