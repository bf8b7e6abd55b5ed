package com.polyglot.pipeline.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * YAML inspection for Kubernetes manifests. A block is a manifest when any
 * document of its (possibly multi-document) YAML stream is a mapping with
 * both {@code apiVersion} and {@code kind}.
 */
public final class KubernetesManifests {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private KubernetesManifests() {}

    public static boolean isManifest(String content) {
        return documents(content).stream()
                .anyMatch(doc -> doc.has("apiVersion") && doc.has("kind"));
    }

    /** {@code metadata.namespace} of the first document that declares one. */
    public static Optional<String> namespace(String content) {
        return documents(content).stream()
                .map(doc -> doc.path("metadata").path("namespace"))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .findFirst();
    }

    /** {@code kind} of the first document, lower-cased, e.g. "deployment". */
    public static Optional<String> kind(String content) {
        return documents(content).stream()
                .map(doc -> doc.path("kind"))
                .filter(JsonNode::isTextual)
                .map(node -> node.asText().toLowerCase(Locale.ROOT))
                .findFirst();
    }

    /** Mapping documents of the stream; empty when the text is not YAML. */
    static List<JsonNode> documents(String content) {
        List<JsonNode> docs = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return docs;
        }
        try (MappingIterator<JsonNode> it = YAML.readerFor(JsonNode.class).readValues(content)) {
            while (it.hasNext()) {
                JsonNode doc = it.next();
                if (doc != null && doc.isObject()) {
                    docs.add(doc);
                }
            }
        } catch (IOException | RuntimeException e) {
            // Not YAML (or not YAML all the way through): keep what parsed.
            return docs;
        }
        return docs;
    }
}
