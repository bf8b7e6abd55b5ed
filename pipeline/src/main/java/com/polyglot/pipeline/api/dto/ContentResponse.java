package com.polyglot.pipeline.api.dto;

/** Response body for POST /polyglot/sanitize. */
public record ContentResponse(String content) {}
