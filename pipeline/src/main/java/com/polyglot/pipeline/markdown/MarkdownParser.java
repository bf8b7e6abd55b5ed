package com.polyglot.pipeline.markdown;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Entry point for the Markdown layer: raw text to mdast-compatible tree.
 */
public final class MarkdownParser {

    private static final ObjectMapper JSON = new ObjectMapper();

    private MarkdownParser() {}

    /** Tokenize and build. Never fails on well-formed text. */
    public static AstNode.Root parse(String content) {
        return AstBuilder.build(Tokenizer.tokenize(content));
    }

    /**
     * Serialise a tree as mdast JSON.
     *
     * @throws IllegalStateException if Jackson cannot serialise a data value
     */
    public static String toMdastJson(AstNode node) {
        try {
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise mdast tree", e);
        }
    }
}
