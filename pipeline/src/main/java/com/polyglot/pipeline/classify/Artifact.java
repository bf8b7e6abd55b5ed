package com.polyglot.pipeline.classify;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One typed payload extracted from a document.
 *
 * @param type       what the payload is
 * @param content    payload text, fence markers excluded
 * @param location   target path for {@link ArtifactType#FILE} artifacts, null otherwise
 * @param executable true for scripts the shell executor may run
 * @param line       1-based line of the opening fence
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Artifact(
        ArtifactType type,
        String       content,
        String       location,
        boolean      executable,
        int          line) {

    public Artifact {
        Objects.requireNonNull(type, "type");
        content = content == null ? "" : content;
    }
}
