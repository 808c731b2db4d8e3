package com.receptionkit.backend.workflow.graph;

import com.receptionkit.backend.workflow.domain.WorkflowChoiceKind;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Computes the choices available at a node from its type capabilities and authored edges. */
public final class ChoicePlanner {

  public static final String CONTINUE_LABEL = "Continue";

  private ChoicePlanner() {}

  public static List<WorkflowChoice> choicesAt(TemplateGraph graph, UUID nodeId) {
    GraphNode node = graph.node(nodeId).orElse(null);
    if (node == null || node.type().isTerminal()) {
      return List.of();
    }
    List<WorkflowChoice> choices = new ArrayList<>();
    List<GraphEdge> edges = graph.edgesFrom(nodeId);
    int offered = Math.min(edges.size(), node.type().maxAuthoredEdges());
    for (GraphEdge edge : edges.subList(0, offered)) {
      choices.add(
          new WorkflowChoice(
              edge.id(), WorkflowChoiceKind.ANSWER, edge.label(), edge.targetNodeId(), null, edge.actionKey()));
    }
    for (GraphLink link : graph.linksFrom(nodeId)) {
      choices.add(
          new WorkflowChoice(
              link.id(), WorkflowChoiceKind.LINK, link.label(), null, link.targetTemplateId(), null));
    }
    if (choices.isEmpty() && node.type().hasImplicitContinue()) {
      choices.add(continueChoice(graph, node));
    }
    return List.copyOf(choices);
  }

  public static Optional<WorkflowChoice> find(TemplateGraph graph, UUID nodeId, UUID choiceId) {
    return choicesAt(graph, nodeId).stream().filter(choice -> choice.id().equals(choiceId)).findFirst();
  }

  /** Stable id of the synthesized continue choice of a node. */
  public static UUID continueId(UUID nodeId) {
    return UUID.nameUUIDFromBytes(("continue:" + nodeId).getBytes(StandardCharsets.UTF_8));
  }

  private static WorkflowChoice continueChoice(TemplateGraph graph, GraphNode node) {
    UUID next = graph.nextInSortOrder(node.id()).map(GraphNode::id).orElse(null);
    return new WorkflowChoice(
        continueId(node.id()), WorkflowChoiceKind.CONTINUE, CONTINUE_LABEL, next, null, node.actionKey());
  }
}
