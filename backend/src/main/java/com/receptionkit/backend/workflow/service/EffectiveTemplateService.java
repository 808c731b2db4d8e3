package com.receptionkit.backend.workflow.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.receptionkit.backend.workflow.config.WorkflowCacheProperties;
import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.persistence.WorkflowTemplateRepository;
import com.receptionkit.backend.workflow.security.WorkflowAccessPolicy;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The workflows a tenant actually uses: the global set with each global template replaced by the
 * tenant's clone of it, plus the tenant's own templates.
 */
@Service
public class EffectiveTemplateService {

  private final WorkflowTemplateRepository templateRepository;
  private final WorkflowAccessPolicy accessPolicy;
  private final WorkflowCacheProperties cacheProperties;
  private final Cache<String, List<EffectiveTemplate>> cache;
  private final Counter cacheHitCounter;
  private final Counter cacheMissCounter;

  public EffectiveTemplateService(
      WorkflowTemplateRepository templateRepository,
      WorkflowAccessPolicy accessPolicy,
      WorkflowCacheProperties cacheProperties,
      MeterRegistry meterRegistry) {
    this.templateRepository = templateRepository;
    this.accessPolicy = accessPolicy;
    this.cacheProperties = cacheProperties;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(cacheProperties.getMaximumSize())
            .expireAfterWrite(cacheProperties.getTtl().toMillis(), TimeUnit.MILLISECONDS)
            .build();
    this.cacheHitCounter = meterRegistry.counter("workflow_effective_cache_hit_total");
    this.cacheMissCounter = meterRegistry.counter("workflow_effective_cache_miss_total");
  }

  /**
   * Effective list for {@code tenantId}, sorted by name. Staff without authoring rights only see
   * approved, active entries whatever flags they pass.
   */
  @Transactional(readOnly = true)
  public List<EffectiveTemplate> listEffective(
      WorkflowCaller caller, String tenantId, boolean includeDrafts, boolean includeInactive) {
    accessPolicy.checkTenantAccess(caller, tenantId);
    boolean author = caller.superuser() || caller.isTenantAdmin(tenantId);
    boolean drafts = includeDrafts && author;
    boolean inactive = includeInactive && author;
    return resolve(tenantId).stream()
        .filter(entry -> drafts || entry.approvalStatus() == WorkflowApprovalStatus.APPROVED)
        .filter(entry -> inactive || entry.active())
        .toList();
  }

  public void evictTenant(String tenantId) {
    cache.invalidate(tenantId);
  }

  public void evictAll() {
    cache.invalidateAll();
  }

  private List<EffectiveTemplate> resolve(String tenantId) {
    if (!cacheProperties.isEnabled()) {
      return compute(tenantId);
    }
    List<EffectiveTemplate> cached = cache.getIfPresent(tenantId);
    if (cached != null) {
      cacheHitCounter.increment();
      return cached;
    }
    cacheMissCounter.increment();
    List<EffectiveTemplate> computed = compute(tenantId);
    cache.put(tenantId, computed);
    return computed;
  }

  private List<EffectiveTemplate> compute(String tenantId) {
    List<WorkflowTemplate> globals =
        templateRepository.findByScopeKeyOrderByNameAsc(TemplateScope.global().key());
    List<WorkflowTemplate> own =
        templateRepository.findByScopeKeyOrderByNameAsc(TemplateScope.tenant(tenantId).key());

    Set<UUID> globalIds = new HashSet<>();
    globals.forEach(template -> globalIds.add(template.getId()));
    Map<UUID, WorkflowTemplate> overrides = new HashMap<>();
    List<EffectiveTemplate> result = new ArrayList<>();
    for (WorkflowTemplate template : own) {
      UUID source = template.getSourceTemplateId();
      if (source != null && globalIds.contains(source) && !overrides.containsKey(source)) {
        overrides.put(source, template);
      } else {
        result.add(EffectiveTemplate.of(template, EffectiveTemplate.Origin.CUSTOM, null));
      }
    }
    for (WorkflowTemplate global : globals) {
      WorkflowTemplate override = overrides.get(global.getId());
      result.add(
          override != null
              ? EffectiveTemplate.of(override, EffectiveTemplate.Origin.OVERRIDE, global.getId())
              : EffectiveTemplate.of(global, EffectiveTemplate.Origin.GLOBAL, null));
    }
    result.sort(
        Comparator.comparing((EffectiveTemplate entry) -> entry.name().toLowerCase(Locale.ROOT))
            .thenComparing(entry -> entry.id().toString()));
    return List.copyOf(result);
  }
}
