package com.receptionkit.backend.workflow.events;

import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.service.EffectiveTemplateService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/** Drops cached effective listings once a template change has committed. */
@Component
public class EffectiveTemplateCacheInvalidator {

  private static final Logger log = LoggerFactory.getLogger(EffectiveTemplateCacheInvalidator.class);

  private final EffectiveTemplateService effectiveTemplateService;
  @Nullable private final Counter invalidationCounter;

  public EffectiveTemplateCacheInvalidator(
      EffectiveTemplateService effectiveTemplateService, @Nullable MeterRegistry meterRegistry) {
    this.effectiveTemplateService = effectiveTemplateService;
    this.invalidationCounter =
        meterRegistry != null ? meterRegistry.counter("workflow_effective_cache_invalidation_total") : null;
  }

  @TransactionalEventListener(fallbackExecution = true)
  public void onTemplateChanged(WorkflowTemplateChangedEvent event) {
    invalidate(event.scopeKey());
  }

  @TransactionalEventListener(fallbackExecution = true)
  public void onTemplateApproved(WorkflowTemplateApprovedEvent event) {
    invalidate(event.scopeKey());
  }

  private void invalidate(String scopeKey) {
    if (scopeKey == null) {
      return;
    }
    try {
      TemplateScope scope = TemplateScope.fromKey(scopeKey);
      if (scope instanceof TemplateScope.Tenant tenant) {
        effectiveTemplateService.evictTenant(tenant.tenantId());
      } else {
        effectiveTemplateService.evictAll();
      }
      if (invalidationCounter != null) {
        invalidationCounter.increment();
      }
      log.debug("Invalidated effective workflow cache for {}", scopeKey);
    } catch (IllegalArgumentException ex) {
      log.warn("Failed to invalidate effective workflow cache for {} - {}", scopeKey, ex.getMessage());
    }
  }
}
