package com.receptionkit.backend.workflow.events;

import java.util.UUID;

/**
 * Published after a template or its graph was changed. {@code scopeKey} identifies whose effective
 * listings are stale; a global key affects every tenant.
 */
public record WorkflowTemplateChangedEvent(UUID templateId, String scopeKey, String action) {}
