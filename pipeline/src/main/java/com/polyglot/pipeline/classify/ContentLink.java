package com.polyglot.pipeline.classify;

/**
 * A Markdown link whose target is a content hash rather than a URL.
 */
public record ContentLink(String text, String hash, int line) {}
