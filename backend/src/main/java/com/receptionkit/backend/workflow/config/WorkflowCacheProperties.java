package com.receptionkit.backend.workflow.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.workflow.cache")
public class WorkflowCacheProperties {

  private boolean enabled = true;

  @Min(1)
  private long maximumSize = 1_000;

  private Duration ttl = Duration.ofMinutes(10);

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public long getMaximumSize() {
    return Math.max(1, maximumSize);
  }

  public void setMaximumSize(long maximumSize) {
    this.maximumSize = Math.max(1, maximumSize);
  }

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    if (ttl != null && !ttl.isNegative() && !ttl.isZero()) {
      this.ttl = ttl;
    }
  }
}
