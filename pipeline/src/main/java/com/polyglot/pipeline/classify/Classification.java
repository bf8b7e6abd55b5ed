package com.polyglot.pipeline.classify;

import java.util.List;
import java.util.Map;

/**
 * Output of {@link MetadataExtractor}: the dominant language, every extracted
 * artifact in document order, the metadata map, and the raw directives (kept
 * with their line numbers for the AST enhancer).
 */
public record Classification(
        Language            language,
        List<Artifact>      artifacts,
        Map<String, Object> metadata,
        List<Directive>     directives) {

    public Classification {
        artifacts  = List.copyOf(artifacts);
        directives = List.copyOf(directives);
    }
}
