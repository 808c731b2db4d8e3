package com.receptionkit.backend.workflow.api;

public record InstanceAbandonRequest(Long expectedStateVersion) {}
