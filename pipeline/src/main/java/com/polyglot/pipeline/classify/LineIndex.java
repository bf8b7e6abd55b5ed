package com.polyglot.pipeline.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps character offsets in a document to 1-based line numbers.
 */
final class LineIndex {

    private final List<Integer> lineStarts;

    private LineIndex(List<Integer> lineStarts) {
        this.lineStarts = lineStarts;
    }

    static LineIndex of(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return new LineIndex(starts);
    }

    int lineOf(int offset) {
        int idx = Collections.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }
}
