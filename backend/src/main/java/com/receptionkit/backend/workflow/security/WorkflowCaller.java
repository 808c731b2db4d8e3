package com.receptionkit.backend.workflow.security;

import org.springframework.util.StringUtils;

/**
 * Identity decision for one request: who is calling, which tenant they act for (may be {@code
 * null} for platform staff) and their permission level.
 */
public record WorkflowCaller(String callerId, String tenantId, boolean superuser, boolean tenantAdmin) {

  public WorkflowCaller {
    if (!StringUtils.hasText(callerId)) {
      throw new IllegalArgumentException("callerId must not be blank");
    }
    callerId = callerId.trim();
    tenantId = StringUtils.hasText(tenantId) ? tenantId.trim() : null;
  }

  public static WorkflowCaller superuser(String callerId) {
    return new WorkflowCaller(callerId, null, true, false);
  }

  public static WorkflowCaller tenantAdmin(String callerId, String tenantId) {
    return new WorkflowCaller(callerId, tenantId, false, true);
  }

  public static WorkflowCaller staff(String callerId, String tenantId) {
    return new WorkflowCaller(callerId, tenantId, false, false);
  }

  public boolean belongsTo(String tenant) {
    return tenantId != null && tenantId.equals(tenant);
  }

  public boolean isTenantAdmin(String tenant) {
    return tenantAdmin && belongsTo(tenant);
  }
}
