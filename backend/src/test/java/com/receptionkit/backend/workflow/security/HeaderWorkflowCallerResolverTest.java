package com.receptionkit.backend.workflow.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.config.WorkflowSecurityProperties;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class HeaderWorkflowCallerResolverTest {

  private final HeaderWorkflowCallerResolver resolver =
      new HeaderWorkflowCallerResolver(new WorkflowSecurityProperties());

  @Test
  void readsCallerTenantAndRoles() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    request.addHeader("X-Caller-Id", "alice");
    request.addHeader("X-Tenant-Id", "clinic-1");
    request.addHeader("X-Caller-Roles", "staff, Tenant-Admin");

    WorkflowCaller caller = resolver.resolve(request);

    assertThat(caller.callerId()).isEqualTo("alice");
    assertThat(caller.tenantId()).isEqualTo("clinic-1");
    assertThat(caller.isTenantAdmin("clinic-1")).isTrue();
    assertThat(caller.superuser()).isFalse();
  }

  @Test
  void missingCallerIsForbidden() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    request.addHeader("X-Caller-Roles", "superuser");

    assertThatThrownBy(() -> resolver.resolve(request)).isInstanceOf(WorkflowException.class);
  }
}
