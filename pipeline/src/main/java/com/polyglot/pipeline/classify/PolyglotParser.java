package com.polyglot.pipeline.classify;

import com.polyglot.pipeline.markdown.AstNode;
import com.polyglot.pipeline.markdown.MarkdownParser;

/**
 * Full parse: tree, classification, and the tree enhanced with the
 * classification's metadata.
 *
 * <pre>
 *   raw text ─┬─ Tokenizer → AstBuilder ───────────┐
 *             └─ MetadataExtractor (raw text) ──── KyozoEnhancer → Polyglot
 * </pre>
 */
public final class PolyglotParser {

    private PolyglotParser() {}

    public static Polyglot parse(String markdown) {
        String source = markdown == null ? "" : markdown;
        AstNode.Root tree = MarkdownParser.parse(source);
        Classification classification = MetadataExtractor.classify(source);
        return new Polyglot(
                source,
                classification.language(),
                classification.artifacts(),
                KyozoEnhancer.enhance(tree, classification),
                classification.metadata());
    }
}
