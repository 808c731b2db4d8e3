package com.receptionkit.backend.workflow.service;

import com.receptionkit.backend.workflow.domain.WorkflowInstance;
import com.receptionkit.backend.workflow.graph.GraphNode;
import com.receptionkit.backend.workflow.graph.WorkflowChoice;
import java.util.List;

/** An instance with the node it currently sits on and the choices offered there. */
public record WorkflowInstanceView(
    WorkflowInstance instance, GraphNode currentNode, List<WorkflowChoice> choices) {}
