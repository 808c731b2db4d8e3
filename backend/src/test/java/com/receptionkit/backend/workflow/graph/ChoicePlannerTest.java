package com.receptionkit.backend.workflow.graph;

import static org.assertj.core.api.Assertions.assertThat;

import com.receptionkit.backend.workflow.domain.WorkflowActionKey;
import com.receptionkit.backend.workflow.domain.WorkflowChoiceKind;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ChoicePlannerTest {

  private final UUID templateId = UUID.randomUUID();

  @Test
  void questionOffersEveryAuthoredEdgeInOrder() {
    GraphNode question = node(WorkflowNodeType.QUESTION, 0);
    GraphNode yes = node(WorkflowNodeType.END, 1);
    GraphNode no = node(WorkflowNodeType.END, 2);
    GraphEdge yesEdge = edge(question, yes, "Yes");
    GraphEdge noEdge = edge(question, no, "No");
    TemplateGraph graph =
        new TemplateGraph(templateId, List.of(question, yes, no), List.of(yesEdge, noEdge), List.of());

    List<WorkflowChoice> choices = ChoicePlanner.choicesAt(graph, question.id());

    assertThat(choices).extracting(WorkflowChoice::label).containsExactly("Yes", "No");
    assertThat(choices).allMatch(choice -> choice.kind() == WorkflowChoiceKind.ANSWER);
    assertThat(choices.get(1).targetNodeId()).isEqualTo(no.id());
  }

  @Test
  void instructionOffersOnlyItsFirstEdge() {
    GraphNode instruction = node(WorkflowNodeType.INSTRUCTION, 0);
    GraphNode a = node(WorkflowNodeType.END, 1);
    GraphNode b = node(WorkflowNodeType.END, 2);
    TemplateGraph graph =
        new TemplateGraph(
            templateId,
            List.of(instruction, a, b),
            List.of(edge(instruction, a, "First"), edge(instruction, b, "Second")),
            List.of());

    assertThat(ChoicePlanner.choicesAt(graph, instruction.id()))
        .extracting(WorkflowChoice::label)
        .containsExactly("First");
  }

  @Test
  void instructionWithoutEdgesContinuesToNextNodeBySortOrder() {
    GraphNode instruction =
        new GraphNode(UUID.randomUUID(), WorkflowNodeType.INSTRUCTION, "Read", 0, false, WorkflowActionKey.CODE_AND_FILE);
    GraphNode next = node(WorkflowNodeType.END, 1);
    TemplateGraph graph = new TemplateGraph(templateId, List.of(next, instruction), List.of(), List.of());

    List<WorkflowChoice> choices = ChoicePlanner.choicesAt(graph, instruction.id());

    assertThat(choices).hasSize(1);
    WorkflowChoice choice = choices.get(0);
    assertThat(choice.kind()).isEqualTo(WorkflowChoiceKind.CONTINUE);
    assertThat(choice.id()).isEqualTo(ChoicePlanner.continueId(instruction.id()));
    assertThat(choice.label()).isEqualTo(ChoicePlanner.CONTINUE_LABEL);
    assertThat(choice.targetNodeId()).isEqualTo(next.id());
    assertThat(choice.actionKey()).isEqualTo(WorkflowActionKey.CODE_AND_FILE);
  }

  @Test
  void continueOnLastNodeHasNoTarget() {
    GraphNode panel = node(WorkflowNodeType.PANEL, 0);
    TemplateGraph graph = new TemplateGraph(templateId, List.of(panel), List.of(), List.of());

    List<WorkflowChoice> choices = ChoicePlanner.choicesAt(graph, panel.id());

    assertThat(choices).singleElement().satisfies(choice -> assertThat(choice.targetNodeId()).isNull());
  }

  @Test
  void linksAreOfferedAfterEdgesAndSuppressContinue() {
    GraphNode reference = node(WorkflowNodeType.REFERENCE, 0);
    UUID otherTemplate = UUID.randomUUID();
    GraphLink second = new GraphLink(UUID.randomUUID(), reference.id(), UUID.randomUUID(), "Second", 2);
    GraphLink first = new GraphLink(UUID.randomUUID(), reference.id(), otherTemplate, "First", 1);
    TemplateGraph graph = new TemplateGraph(templateId, List.of(reference), List.of(), List.of(second, first));

    List<WorkflowChoice> choices = ChoicePlanner.choicesAt(graph, reference.id());

    assertThat(choices).extracting(WorkflowChoice::label).containsExactly("First", "Second");
    assertThat(choices.get(0).isLink()).isTrue();
    assertThat(choices.get(0).targetTemplateId()).isEqualTo(otherTemplate);
  }

  @Test
  void retypedQuestionKeepsEdgesButOffersOnlyWhatNewTypeAllows() {
    UUID nodeId = UUID.randomUUID();
    GraphNode yes = node(WorkflowNodeType.END, 1);
    GraphNode no = node(WorkflowNodeType.END, 2);
    GraphEdge yesEdge = new GraphEdge(UUID.randomUUID(), nodeId, yes.id(), "Yes", null);
    GraphEdge noEdge = new GraphEdge(UUID.randomUUID(), nodeId, no.id(), "No", null);

    GraphNode asPanel = new GraphNode(nodeId, WorkflowNodeType.PANEL, "Panel", 0, false, null);
    TemplateGraph panelGraph =
        new TemplateGraph(templateId, List.of(asPanel, yes, no), List.of(yesEdge, noEdge), List.of());
    assertThat(panelGraph.edgesFrom(nodeId)).hasSize(2);
    assertThat(ChoicePlanner.choicesAt(panelGraph, nodeId))
        .singleElement()
        .satisfies(
            choice -> {
              assertThat(choice.kind()).isEqualTo(WorkflowChoiceKind.CONTINUE);
              assertThat(choice.targetNodeId()).isEqualTo(yes.id());
            });

    GraphNode asInstruction = new GraphNode(nodeId, WorkflowNodeType.INSTRUCTION, "Step", 0, false, null);
    TemplateGraph instructionGraph =
        new TemplateGraph(templateId, List.of(asInstruction, yes, no), List.of(yesEdge, noEdge), List.of());
    assertThat(ChoicePlanner.choicesAt(instructionGraph, nodeId))
        .singleElement()
        .satisfies(
            choice -> {
              assertThat(choice.kind()).isEqualTo(WorkflowChoiceKind.ANSWER);
              assertThat(choice.id()).isEqualTo(yesEdge.id());
            });
    assertThat(ChoicePlanner.find(instructionGraph, nodeId, noEdge.id())).isEmpty();
  }

  @Test
  void endNodeOffersNothing() {
    GraphNode end = node(WorkflowNodeType.END, 0);
    GraphNode after = node(WorkflowNodeType.QUESTION, 1);
    TemplateGraph graph = new TemplateGraph(templateId, List.of(end, after), List.of(), List.of());

    assertThat(ChoicePlanner.choicesAt(graph, end.id())).isEmpty();
  }

  @Test
  void questionWithoutEdgesIsStuck() {
    GraphNode question = node(WorkflowNodeType.QUESTION, 0);
    TemplateGraph graph =
        new TemplateGraph(templateId, List.of(question, node(WorkflowNodeType.END, 1)), List.of(), List.of());

    assertThat(ChoicePlanner.choicesAt(graph, question.id())).isEmpty();
  }

  @Test
  void danglingEdgeIsStillOffered() {
    GraphNode question = node(WorkflowNodeType.QUESTION, 0);
    GraphEdge dangling = new GraphEdge(UUID.randomUUID(), question.id(), null, "Yes", null);
    TemplateGraph graph = new TemplateGraph(templateId, List.of(question), List.of(dangling), List.of());

    assertThat(ChoicePlanner.find(graph, question.id(), dangling.id()))
        .hasValueSatisfying(choice -> assertThat(choice.targetNodeId()).isNull());
  }

  @Test
  void findRejectsChoiceFromAnotherNode() {
    GraphNode a = node(WorkflowNodeType.QUESTION, 0);
    GraphNode b = node(WorkflowNodeType.QUESTION, 1);
    GraphEdge fromB = edge(b, a, "Back");
    TemplateGraph graph = new TemplateGraph(templateId, List.of(a, b), List.of(fromB), List.of());

    assertThat(ChoicePlanner.find(graph, a.id(), fromB.id())).isEmpty();
    assertThat(ChoicePlanner.find(graph, b.id(), fromB.id())).isPresent();
  }

  @Test
  void continueIdIsStablePerNode() {
    UUID nodeId = UUID.randomUUID();

    assertThat(ChoicePlanner.continueId(nodeId)).isEqualTo(ChoicePlanner.continueId(nodeId));
    assertThat(ChoicePlanner.continueId(nodeId)).isNotEqualTo(ChoicePlanner.continueId(UUID.randomUUID()));
  }

  private static GraphNode node(WorkflowNodeType type, int sortOrder) {
    return new GraphNode(UUID.randomUUID(), type, type.defaultTitle(), sortOrder, false, null);
  }

  private static GraphEdge edge(GraphNode from, GraphNode to, String label) {
    return new GraphEdge(UUID.randomUUID(), from.id(), to.id(), label, null);
  }
}
