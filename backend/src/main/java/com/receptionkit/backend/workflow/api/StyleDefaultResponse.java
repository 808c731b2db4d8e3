package com.receptionkit.backend.workflow.api;

import com.receptionkit.backend.workflow.domain.WorkflowNodeStyleDefault;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;

public record StyleDefaultResponse(
    WorkflowNodeType nodeType, String bgColor, String textColor, String borderColor) {

  public static StyleDefaultResponse from(WorkflowNodeStyleDefault row) {
    return new StyleDefaultResponse(
        row.getNodeType(), row.getBgColor(), row.getTextColor(), row.getBorderColor());
  }
}
