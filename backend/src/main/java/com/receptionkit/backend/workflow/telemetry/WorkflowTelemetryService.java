package com.receptionkit.backend.workflow.telemetry;

import com.receptionkit.backend.common.exception.WorkflowErrorKind;
import com.receptionkit.backend.workflow.domain.WorkflowInstance;
import com.receptionkit.backend.workflow.domain.WorkflowInstanceStep;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Counters and audit log lines for authoring, lifecycle and runtime actions. */
@Component
public class WorkflowTelemetryService {

  private static final Logger auditLogger = LoggerFactory.getLogger("WorkflowAudit");

  private final MeterRegistry meterRegistry;

  public WorkflowTelemetryService(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordTemplateMutation(String action, WorkflowTemplate template, String actor) {
    incrementCounter("workflow_template_mutations_total", Tags.of("action", safeTagValue(action)));
    auditLogger.info(
        "template_mutation action={} templateId={} scope={} revision={} actor={}",
        safeLogValue(action),
        template != null ? template.getId() : null,
        template != null ? template.getScopeKey() : null,
        template != null ? template.getRevision() : null,
        safeLogValue(actor));
  }

  public void recordLifecycleTransition(
      WorkflowTemplate template, String from, String to, String actor) {
    incrementCounter(
        "workflow_lifecycle_transitions_total",
        Tags.of("from", safeTagValue(from), "to", safeTagValue(to)));
    auditLogger.info(
        "template_lifecycle templateId={} from={} to={} actor={}",
        template != null ? template.getId() : null,
        safeLogValue(from),
        safeLogValue(to),
        safeLogValue(actor));
  }

  public void recordInstanceStarted(WorkflowInstance instance) {
    incrementCounter("workflow_instance_starts_total", Tags.empty());
    auditLogger.info(
        "instance_start instanceId={} templateId={} tenant={} actor={}",
        instance.getId(),
        instance.getTemplateId(),
        safeLogValue(instance.getTenantId()),
        safeLogValue(instance.getStartedBy()));
  }

  public void recordInstanceAdvanced(WorkflowInstance instance, WorkflowInstanceStep step) {
    incrementCounter(
        "workflow_instance_advances_total",
        Tags.of(
            "kind", safeTagValue(step.getChoiceKind().name()),
            "template_switched", Boolean.toString(step.isTemplateSwitched())));
    if (instance.getStatus().isTerminal()) {
      incrementCounter(
          "workflow_instance_closed_total", Tags.of("status", safeTagValue(instance.getStatus().name())));
    }
    auditLogger.info(
        "instance_advance instanceId={} seq={} fromNode={} choice={} toTemplate={} toNode={} status={}",
        instance.getId(),
        step.getSequenceNo(),
        step.getFromNodeId(),
        step.getChoiceId(),
        step.getToTemplateId(),
        step.getToNodeId(),
        instance.getStatus());
  }

  public void recordInstanceAbandoned(WorkflowInstance instance, String actor) {
    incrementCounter("workflow_instance_closed_total", Tags.of("status", "abandoned"));
    auditLogger.info(
        "instance_abandon instanceId={} steps={} actor={}",
        instance.getId(),
        instance.getStepCount(),
        safeLogValue(actor));
  }

  public void recordRejected(String operation, WorkflowErrorKind kind, String actor, String reason) {
    incrementCounter(
        "workflow_rejected_operations_total",
        Tags.of("operation", safeTagValue(operation), "kind", safeTagValue(kind != null ? kind.name() : null)));
    auditLogger.warn(
        "workflow_rejected operation={} kind={} actor={} reason={}",
        safeLogValue(operation),
        kind,
        safeLogValue(actor),
        safeLogValue(reason));
  }

  private void incrementCounter(String name, Tags tags) {
    Counter.builder(name).tags(tags).register(meterRegistry).increment();
  }

  private String safeTagValue(String raw) {
    if (!StringUtils.hasText(raw)) {
      return "unknown";
    }
    String normalized =
        raw.trim().replaceAll("[^A-Za-z0-9_\\-]+", "_").replaceAll("_+", "_").replaceAll("^_|_$", "");
    if (!StringUtils.hasText(normalized)) {
      return "unknown";
    }
    return normalized.toLowerCase(Locale.ROOT);
  }

  private String safeLogValue(String raw) {
    return StringUtils.hasText(raw) ? raw.trim() : "unknown";
  }
}
