package com.polyglot.pipeline.markdown;

/**
 * One line-level token produced by {@link Tokenizer}.
 *
 * Tokens are created once per tokenization pass and consumed linearly by
 * {@link AstBuilder}; they are never mutated. Every token knows the 1-based
 * source line it came from.
 */
public sealed interface Token {

    int line();

    record Heading(int depth, String text, int line) implements Token {}

    /** Opening fence; lang is the first word of the info string, meta the rest. */
    record CodeFenceStart(String lang, String meta, int line) implements Token {}

    record CodeFenceEnd(int line) implements Token {}

    record CodeContent(int line, String text) implements Token {}

    /** A comment that opens and closes on the same line. */
    record HtmlComment(int line, String text) implements Token {}

    record HtmlCommentStart(int line, String text) implements Token {}

    record HtmlCommentContent(int line, String text) implements Token {}

    record HtmlCommentEnd(int line, String text) implements Token {}

    record TextLine(int line, String value) implements Token {}

    record Blank(int line) implements Token {}
}
