package com.polyglot.pipeline.classify;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ArtifactType {
    DOCKERFILE,
    TERRAFORM,
    KUBERNETES,
    SQL,
    FILE,
    BASH,
    EXECUTABLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
