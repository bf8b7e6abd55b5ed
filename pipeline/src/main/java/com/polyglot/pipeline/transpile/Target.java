package com.polyglot.pipeline.transpile;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Transpilation targets. Adding one is a compile-checked change: every
 * {@code switch} over this enum in {@link Transpilers} must handle it.
 */
public enum Target {
    DOCKER,
    TERRAFORM,
    KUBERNETES,
    GIT,
    BASH,
    SQL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup by wire name; empty for unknown names. */
    public static Optional<Target> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (Target t : values()) {
            if (t.wireName().equalsIgnoreCase(name.strip())) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
