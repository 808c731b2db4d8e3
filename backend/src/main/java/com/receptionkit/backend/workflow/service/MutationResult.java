package com.receptionkit.backend.workflow.service;

/** Outcome of a graph mutation with the template revision it produced. */
public record MutationResult<T>(T item, long revision) {}
