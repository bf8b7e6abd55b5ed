package com.polyglot.pipeline.transpile;

import com.polyglot.pipeline.classify.MetadataExtractor;
import com.polyglot.pipeline.classify.Polyglot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point of the transpile stage. Every transpiler is a pure function of
 * the parsed document; nothing here touches the filesystem or a process.
 */
public final class Transpilers {

    private Transpilers() {}

    public static Transpilation transpile(Polyglot polyglot, Target target) {
        return switch (target) {
            case DOCKER     -> DockerTranspiler.transpile(polyglot);
            case TERRAFORM  -> TerraformTranspiler.transpile(polyglot);
            case KUBERNETES -> KubernetesTranspiler.transpile(polyglot);
            case GIT        -> GitTranspiler.transpile(polyglot);
            case BASH       -> BashTranspiler.transpile(polyglot);
            case SQL        -> SqlTranspiler.transpile(polyglot);
        };
    }

    // ------------------------------------------------------------------
    // Shared metadata lookups
    // ------------------------------------------------------------------

    /** String value of a {@code polyglot:<key>} directive, or {@code fallback}. */
    static String directive(Polyglot polyglot, String key, String fallback) {
        Object value = polyglot.metadataMap(MetadataExtractor.POLYGLOT).get(key);
        if (value instanceof String s && !s.isBlank()) {
            return s;
        }
        return fallback;
    }

    static Map<String, String> environment(Polyglot polyglot) {
        Map<String, String> env = new LinkedHashMap<>();
        polyglot.metadataMap(MetadataExtractor.ENVIRONMENT)
                .forEach((k, v) -> env.put(k, String.valueOf(v)));
        return env;
    }
}
