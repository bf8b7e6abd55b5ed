package com.polyglot.pipeline.service;

import com.polyglot.pipeline.execute.ExecutionResult;

/**
 * Outcome of executing a stored document.
 *
 * @param stored false when the result sink rejected the result
 */
public record DocumentExecution(String documentId, ExecutionResult result, boolean stored) {}
