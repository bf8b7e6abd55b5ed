package com.polyglot.pipeline.api.dto;

import com.polyglot.pipeline.classify.Artifact;
import com.polyglot.pipeline.classify.Polyglot;
import com.polyglot.pipeline.markdown.AstNode;

import java.util.List;
import java.util.Map;

/**
 * Response body for POST /polyglot/parse and GET /documents/{id}/polyglot.
 * {@code ast} is the enhanced mdast tree.
 */
public record ParseResponse(
        String              language,
        List<Artifact>      artifacts,
        Map<String, Object> metadata,
        AstNode.Root        ast
) {
    public static ParseResponse from(Polyglot polyglot) {
        return new ParseResponse(
                polyglot.language().wireName(),
                polyglot.artifacts(),
                polyglot.metadata(),
                polyglot.ast()
        );
    }
}
