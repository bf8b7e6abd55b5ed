package com.polyglot.pipeline.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds content-addressed links: {@code [text](<40 or more hex chars>)}.
 * 40 covers SHA-1, 64 covers SHA-256.
 */
public final class ContentLinkScanner {

    public static final Pattern CONTENT_LINK = Pattern.compile("\\[([^\\]]*)\\]\\(([0-9a-fA-F]{40,})\\)");

    private ContentLinkScanner() {}

    public static List<ContentLink> scan(String text) {
        List<ContentLink> links = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return links;
        }
        LineIndex lines = LineIndex.of(text);
        Matcher m = CONTENT_LINK.matcher(text);
        while (m.find()) {
            links.add(new ContentLink(m.group(1), m.group(2), lines.lineOf(m.start())));
        }
        return links;
    }
}
