package com.polyglot.pipeline.api.dto;

import com.polyglot.pipeline.transpile.Transpilation;

/** 422 body when the document lacks the artifact a target needs. */
public record TranspileFailureResponse(String target, String missing, String message) {

    public static TranspileFailureResponse from(Transpilation.Failure failure) {
        return new TranspileFailureResponse(
                failure.target().wireName(),
                failure.missing().wireName(),
                failure.message());
    }
}
