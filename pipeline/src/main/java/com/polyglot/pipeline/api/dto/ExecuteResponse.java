package com.polyglot.pipeline.api.dto;

import com.polyglot.pipeline.service.DocumentExecution;

import java.util.Map;

/** Response body for POST /documents/{id}/execute. */
public record ExecuteResponse(
        String              documentId,
        boolean             stored,
        boolean             ok,
        String              language,
        Map<String, Object> details
) {
    public static ExecuteResponse from(DocumentExecution execution) {
        return new ExecuteResponse(
                execution.documentId(),
                execution.stored(),
                execution.result().ok(),
                execution.result().language().wireName(),
                execution.result().details()
        );
    }
}
