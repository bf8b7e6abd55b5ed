package com.polyglot.pipeline.classify;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.polyglot.pipeline.markdown.AstNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level parse result: what a Markdown document really is.
 *
 * @param source    original text
 * @param language  dominant classification, drives executor routing
 * @param artifacts every extracted payload, in document order
 * @param ast       enhanced mdast tree
 * @param metadata  directives, hidden payloads and content links
 */
public record Polyglot(
        @JsonIgnore String  source,
        Language            language,
        List<Artifact>      artifacts,
        AstNode.Root        ast,
        Map<String, Object> metadata) {

    public Polyglot {
        artifacts = List.copyOf(artifacts);
        metadata  = metadata == null ? Map.of() : metadata;
    }

    public List<Artifact> artifactsOf(ArtifactType... types) {
        return artifacts.stream()
                .filter(a -> List.of(types).contains(a.type()))
                .toList();
    }

    /** Sub-map of the metadata, e.g. {@code polyglot} or {@code environment}; empty when absent. */
    public Map<String, Object> metadataMap(String key) {
        if (!(metadata.get(key) instanceof Map<?, ?> m)) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        m.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
