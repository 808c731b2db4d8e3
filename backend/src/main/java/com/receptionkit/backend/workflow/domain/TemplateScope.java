package com.receptionkit.backend.workflow.domain;

import org.springframework.util.StringUtils;

/**
 * Ownership scope of a workflow template: either the shared default set visible to every tenant or
 * a single tenant. Persisted as a scope key ({@code global} or {@code tenant:<id>}).
 */
public sealed interface TemplateScope permits TemplateScope.Global, TemplateScope.Tenant {

  String GLOBAL_KEY = "global";
  String TENANT_PREFIX = "tenant:";

  String key();

  static TemplateScope global() {
    return Global.INSTANCE;
  }

  static TemplateScope tenant(String tenantId) {
    return new Tenant(tenantId);
  }

  static TemplateScope fromKey(String key) {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Template scope key must not be blank");
    }
    if (GLOBAL_KEY.equals(key)) {
      return Global.INSTANCE;
    }
    if (key.startsWith(TENANT_PREFIX)) {
      return new Tenant(key.substring(TENANT_PREFIX.length()));
    }
    throw new IllegalArgumentException("Unknown template scope key: " + key);
  }

  default boolean isGlobal() {
    return this instanceof Global;
  }

  /** Whether a template in this scope is visible to the given tenant. */
  default boolean visibleTo(String tenantId) {
    if (this instanceof Tenant tenant) {
      return tenant.tenantId().equals(tenantId);
    }
    return true;
  }

  final class Global implements TemplateScope {

    private static final Global INSTANCE = new Global();

    private Global() {}

    @Override
    public String key() {
      return GLOBAL_KEY;
    }

    @Override
    public String toString() {
      return GLOBAL_KEY;
    }
  }

  record Tenant(String tenantId) implements TemplateScope {

    public Tenant {
      if (!StringUtils.hasText(tenantId)) {
        throw new IllegalArgumentException("Tenant id must not be blank");
      }
      tenantId = tenantId.trim();
    }

    @Override
    public String key() {
      return TENANT_PREFIX + tenantId;
    }

    @Override
    public String toString() {
      return key();
    }
  }
}
