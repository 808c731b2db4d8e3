package com.receptionkit.backend.workflow.service;

import com.receptionkit.backend.workflow.domain.WorkflowAnswerOption;
import com.receptionkit.backend.workflow.domain.WorkflowNode;
import com.receptionkit.backend.workflow.domain.WorkflowNodeLink;
import com.receptionkit.backend.workflow.domain.WorkflowNodeStyleDefault;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.graph.TemplateGraph;
import java.util.List;

/** A template with every row of its graph, loaded in one read. */
public record TemplateContents(
    WorkflowTemplate template,
    List<WorkflowNode> nodes,
    List<WorkflowAnswerOption> options,
    List<WorkflowNodeLink> links,
    List<WorkflowNodeStyleDefault> styleDefaults) {

  public TemplateGraph graph() {
    return TemplateGraph.of(template.getId(), nodes, options, links);
  }
}
