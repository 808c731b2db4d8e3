package com.receptionkit.backend.workflow.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.workflow.security")
public class WorkflowSecurityProperties {

  @NotBlank private String callerHeader = "X-Caller-Id";
  @NotBlank private String tenantHeader = "X-Tenant-Id";
  @NotBlank private String rolesHeader = "X-Caller-Roles";
  @NotBlank private String superuserRole = "superuser";
  @NotBlank private String tenantAdminRole = "tenant-admin";

  public String getCallerHeader() {
    return callerHeader;
  }

  public void setCallerHeader(String callerHeader) {
    this.callerHeader = callerHeader;
  }

  public String getTenantHeader() {
    return tenantHeader;
  }

  public void setTenantHeader(String tenantHeader) {
    this.tenantHeader = tenantHeader;
  }

  public String getRolesHeader() {
    return rolesHeader;
  }

  public void setRolesHeader(String rolesHeader) {
    this.rolesHeader = rolesHeader;
  }

  public String getSuperuserRole() {
    return superuserRole;
  }

  public void setSuperuserRole(String superuserRole) {
    this.superuserRole = superuserRole;
  }

  public String getTenantAdminRole() {
    return tenantAdminRole;
  }

  public void setTenantAdminRole(String tenantAdminRole) {
    this.tenantAdminRole = tenantAdminRole;
  }
}
