package com.receptionkit.backend.workflow.security;

import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.config.WorkflowSecurityProperties;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Reads the caller identity forwarded by the gateway. Fails closed when it is absent. */
@Component
public class HeaderWorkflowCallerResolver {

  private final WorkflowSecurityProperties properties;

  public HeaderWorkflowCallerResolver(WorkflowSecurityProperties properties) {
    this.properties = properties;
  }

  public WorkflowCaller resolve(HttpServletRequest request) {
    String callerId = request.getHeader(properties.getCallerHeader());
    if (!StringUtils.hasText(callerId)) {
      throw WorkflowException.forbidden(properties.getCallerHeader() + " header is required");
    }
    Set<String> roles = parseRoles(request.getHeader(properties.getRolesHeader()));
    boolean superuser = roles.contains(properties.getSuperuserRole().toLowerCase(Locale.ROOT));
    boolean tenantAdmin = roles.contains(properties.getTenantAdminRole().toLowerCase(Locale.ROOT));
    return new WorkflowCaller(
        callerId, request.getHeader(properties.getTenantHeader()), superuser, tenantAdmin);
  }

  private Set<String> parseRoles(String header) {
    if (!StringUtils.hasText(header)) {
      return Set.of();
    }
    return Arrays.stream(header.split(","))
        .map(String::trim)
        .filter(StringUtils::hasText)
        .map(role -> role.toLowerCase(Locale.ROOT))
        .collect(Collectors.toSet());
  }
}
