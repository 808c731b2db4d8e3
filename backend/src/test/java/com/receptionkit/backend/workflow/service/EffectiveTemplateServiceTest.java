package com.receptionkit.backend.workflow.service;

import static com.receptionkit.backend.workflow.TestWorkflowFactory.template;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.receptionkit.backend.common.exception.WorkflowErrorKind;
import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.config.WorkflowCacheProperties;
import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.persistence.WorkflowTemplateRepository;
import com.receptionkit.backend.workflow.security.WorkflowAccessPolicy;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.service.EffectiveTemplate.Origin;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class EffectiveTemplateServiceTest {

  private static final String GLOBAL_KEY = TemplateScope.global().key();
  private static final String CLINIC_KEY = TemplateScope.tenant("clinic-1").key();

  @Mock private WorkflowTemplateRepository templateRepository;

  private final WorkflowCaller admin = WorkflowCaller.tenantAdmin("admin-1", "clinic-1");
  private final WorkflowCaller staff = WorkflowCaller.staff("staff-1", "clinic-1");

  private SimpleMeterRegistry meterRegistry;
  private EffectiveTemplateService service;
  private WorkflowTemplate alpha;
  private WorkflowTemplate beta;
  private WorkflowTemplate betaOverride;
  private WorkflowTemplate zeta;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    meterRegistry = new SimpleMeterRegistry();
    service =
        new EffectiveTemplateService(
            templateRepository, new WorkflowAccessPolicy(), new WorkflowCacheProperties(), meterRegistry);

    alpha = template(TemplateScope.global(), "Alpha", WorkflowApprovalStatus.APPROVED);
    beta = template(TemplateScope.global(), "Beta", WorkflowApprovalStatus.APPROVED);
    betaOverride = template(TemplateScope.tenant("clinic-1"), "Beta (clinic)", WorkflowApprovalStatus.DRAFT);
    betaOverride.setSourceTemplateId(beta.getId());
    zeta = template(TemplateScope.tenant("clinic-1"), "Zeta", WorkflowApprovalStatus.APPROVED);

    when(templateRepository.findByScopeKeyOrderByNameAsc(GLOBAL_KEY)).thenReturn(List.of(alpha, beta));
    when(templateRepository.findByScopeKeyOrderByNameAsc(CLINIC_KEY)).thenReturn(List.of(betaOverride, zeta));
  }

  @Test
  void authorSeesOverrideInPlaceOfGlobal() {
    List<EffectiveTemplate> entries = service.listEffective(admin, "clinic-1", true, true);

    assertThat(entries)
        .extracting(EffectiveTemplate::name, EffectiveTemplate::origin, EffectiveTemplate::overridesTemplateId)
        .containsExactly(
            tuple("Alpha", Origin.GLOBAL, null),
            tuple("Beta (clinic)", Origin.OVERRIDE, beta.getId()),
            tuple("Zeta", Origin.CUSTOM, null));
  }

  @Test
  void staffOnlySeeApprovedActiveEntries() {
    zeta.setActive(false);

    List<EffectiveTemplate> entries = service.listEffective(staff, "clinic-1", true, true);

    assertThat(entries).extracting(EffectiveTemplate::name).containsExactly("Alpha");
  }

  @Test
  void authorWithoutFlagsGetsApprovedView() {
    assertThat(service.listEffective(admin, "clinic-1", false, false))
        .extracting(EffectiveTemplate::name)
        .containsExactly("Alpha", "Zeta");
  }

  @Test
  void cachesPerTenantUntilEvicted() {
    service.listEffective(admin, "clinic-1", true, true);
    service.listEffective(staff, "clinic-1", false, false);
    verify(templateRepository, times(1)).findByScopeKeyOrderByNameAsc(CLINIC_KEY);
    assertThat(meterRegistry.counter("workflow_effective_cache_hit_total").count()).isEqualTo(1.0);

    service.evictTenant("clinic-1");
    service.listEffective(admin, "clinic-1", true, true);
    verify(templateRepository, times(2)).findByScopeKeyOrderByNameAsc(CLINIC_KEY);
  }

  @Test
  void otherTenantsListIsForbidden() {
    assertThatThrownBy(() -> service.listEffective(staff, "clinic-2", false, false))
        .isInstanceOfSatisfying(
            WorkflowException.class, ex -> assertThat(ex.getKind()).isEqualTo(WorkflowErrorKind.FORBIDDEN));
  }
}
