package com.receptionkit.backend.workflow.security;

import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.domain.TemplateScope;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class WorkflowAccessPolicy {

  /** Global templates are edited by superusers only; tenant templates by that tenant's admins too. */
  public void checkCanEdit(WorkflowCaller caller, TemplateScope scope) {
    if (caller == null) {
      throw WorkflowException.forbidden("Caller identity is required");
    }
    if (caller.superuser()) {
      return;
    }
    if (scope instanceof TemplateScope.Tenant tenant && caller.isTenantAdmin(tenant.tenantId())) {
      return;
    }
    throw WorkflowException.forbidden(
        scope.isGlobal()
            ? "Superuser role is required to edit global workflows"
            : "Tenant admin role is required to edit this workflow");
  }

  /**
   * Out-of-scope reads surface as not found so that template ids from other tenants cannot be
   * probed.
   */
  public void checkCanRead(WorkflowCaller caller, TemplateScope scope) {
    if (caller == null) {
      throw WorkflowException.forbidden("Caller identity is required");
    }
    if (caller.superuser() || scope.visibleTo(caller.tenantId())) {
      return;
    }
    throw WorkflowException.notFound("Workflow template not found");
  }

  public void checkTenantAccess(WorkflowCaller caller, String tenantId) {
    if (caller == null) {
      throw WorkflowException.forbidden("Caller identity is required");
    }
    if (caller.superuser() || caller.belongsTo(tenantId)) {
      return;
    }
    throw WorkflowException.forbidden("Caller does not belong to tenant " + tenantId);
  }

  /** Destination scope of a create or clone. Falls back to the caller's own tenant. */
  public TemplateScope resolveScope(WorkflowCaller caller, boolean global, String tenantId) {
    if (caller == null) {
      throw WorkflowException.forbidden("Caller identity is required");
    }
    if (global) {
      return TemplateScope.global();
    }
    if (StringUtils.hasText(tenantId)) {
      return TemplateScope.tenant(tenantId);
    }
    if (caller.tenantId() != null) {
      return TemplateScope.tenant(caller.tenantId());
    }
    throw WorkflowException.validation("A tenant id is required for callers without a tenant");
  }
}
