package com.polyglot.pipeline.api.dto;

/** Response body for POST /polyglot/check. */
public record CheckResponse(boolean polyglot) {}
