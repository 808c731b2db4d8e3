package com.receptionkit.backend.workflow.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.workflow.engine")
public class WorkflowEngineProperties {

  /** Upper bound on recorded transitions per instance; guards against authored loops. */
  @Min(1)
  private int maxSteps = 500;

  public int getMaxSteps() {
    return Math.max(1, maxSteps);
  }

  public void setMaxSteps(int maxSteps) {
    this.maxSteps = Math.max(1, maxSteps);
  }
}
