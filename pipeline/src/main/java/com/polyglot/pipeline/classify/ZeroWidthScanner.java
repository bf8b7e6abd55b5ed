package com.polyglot.pipeline.classify;

import java.util.ArrayList;
import java.util.List;

/**
 * Zero-width code point pass: finds every maximal run of invisible
 * characters and tries to decode it with {@link ZeroWidthCodec}.
 */
public final class ZeroWidthScanner {

    private ZeroWidthScanner() {}

    public static List<HiddenPayload> scan(String text) {
        List<HiddenPayload> runs = new ArrayList<>();
        if (text == null) {
            return runs;
        }
        int i = 0;
        while (i < text.length()) {
            if (!ZeroWidthCodec.isZeroWidth(text.charAt(i))) {
                i++;
                continue;
            }
            int start = i;
            while (i < text.length() && ZeroWidthCodec.isZeroWidth(text.charAt(i))) {
                i++;
            }
            String run = text.substring(start, i);
            runs.add(new HiddenPayload(start, run.length(), ZeroWidthCodec.decode(run).orElse(null)));
        }
        return runs;
    }
}
