package com.polyglot.pipeline.classify;

import java.util.Locale;

/**
 * A fenced code block found by {@link FenceScanner}.
 *
 * @param lang      first word of the info string, e.g. {@code dockerfile} or {@code file:src/app.py}
 * @param meta      rest of the info string
 * @param content   lines between the fences joined with '\n'
 * @param startLine line of the opening fence
 * @param endLine   line of the closing fence, or the last line for an unterminated fence
 */
public record FencedBlock(String lang, String meta, String content, int startLine, int endLine) {

    private static final String FILE_PREFIX = "file:";

    public boolean hasLang(String... candidates) {
        for (String c : candidates) {
            if (c.equalsIgnoreCase(lang)) {
                return true;
            }
        }
        return false;
    }

    /** Target path of a {@code file:<path>} block, or null. */
    public String filePath() {
        if (lang.toLowerCase(Locale.ROOT).startsWith(FILE_PREFIX) && lang.length() > FILE_PREFIX.length()) {
            return lang.substring(FILE_PREFIX.length());
        }
        return null;
    }
}
