package com.polyglot.pipeline.transpile;

import com.polyglot.pipeline.classify.ArtifactType;

/**
 * Result of a transpile call. A missing artifact is an expected outcome, so
 * it is returned as {@link Failure} rather than thrown.
 */
public sealed interface Transpilation {

    record Success(TranspiledConfig config) implements Transpilation {}

    /**
     * @param target  the requested target
     * @param missing the artifact type the target needs
     */
    record Failure(Target target, ArtifactType missing, String message) implements Transpilation {

        static Failure missing(Target target, ArtifactType type) {
            return new Failure(target, type,
                    "No " + type.wireName() + " artifact found for target " + target.wireName());
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
