package com.polyglot.pipeline.sanitize;

import com.polyglot.pipeline.classify.ContentLinkScanner;
import com.polyglot.pipeline.classify.ZeroWidthCodec;

import java.util.regex.Pattern;

/**
 * Produces a plain copy of a document with every polyglot feature neutralised:
 * zero-width characters, {@code polyglot:} / {@code kyozo:} comments and
 * content-addressed links.
 *
 * Idempotent: sanitising sanitised text returns it unchanged.
 */
public final class Sanitizer {

    private static final String DIRECTIVE_COMMENT = "<!--\\s*(?:polyglot|kyozo):(?:(?!-->).)*-->";

    // A line holding nothing but directive comments goes away with its line break.
    private static final Pattern DIRECTIVE_LINE = Pattern.compile(
            "(?m)^[ \\t]*(?:" + DIRECTIVE_COMMENT + "[ \\t]*)+(?:\\r?\\n|$)", Pattern.DOTALL);

    private static final Pattern DIRECTIVE_SPAN = Pattern.compile(DIRECTIVE_COMMENT, Pattern.DOTALL);

    private Sanitizer() {}

    public static String sanitize(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return "";
        }
        String text = ZeroWidthCodec.strip(markdown);

        // Cutting one comment can splice the pieces of another together, so
        // repeat until nothing matches.
        String previous;
        do {
            previous = text;
            text = DIRECTIVE_LINE.matcher(text).replaceAll("");
            text = DIRECTIVE_SPAN.matcher(text).replaceAll("");
        } while (!text.equals(previous));

        return ContentLinkScanner.CONTENT_LINK.matcher(text).replaceAll("[$1](#)");
    }
}
