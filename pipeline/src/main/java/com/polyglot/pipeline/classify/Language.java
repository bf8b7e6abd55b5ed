package com.polyglot.pipeline.classify;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Dominant classification of a document. Exactly one language drives
 * execution routing even when several artifact types coexist.
 */
public enum Language {
    DOCKERFILE,
    TERRAFORM,
    KUBERNETES,
    EXECUTABLE,
    GIT,
    SQL,
    NONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
