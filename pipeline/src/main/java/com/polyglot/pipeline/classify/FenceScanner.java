package com.polyglot.pipeline.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fence-language pass over raw text.
 *
 * Runs on the text itself, not the AST, so it also sees fences the tree
 * hides (for example a fence written inside a multi-line HTML comment).
 */
public final class FenceScanner {

    private static final Pattern OPEN = Pattern.compile("^```\\s*(\\S*)\\s*(.*)$");
    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private FenceScanner() {}

    public static List<FencedBlock> scan(String text) {
        List<FencedBlock> blocks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return blocks;
        }

        String[] lines = LINE_BREAK.split(text, -1);
        int i = 0;
        while (i < lines.length) {
            Matcher open = OPEN.matcher(lines[i]);
            if (!open.matches()) {
                i++;
                continue;
            }
            int startLine = i + 1;
            List<String> body = new ArrayList<>();
            int j = i + 1;
            while (j < lines.length && !lines[j].startsWith("```")) {
                body.add(lines[j]);
                j++;
            }
            int endLine = j < lines.length ? j + 1 : lines.length;
            blocks.add(new FencedBlock(open.group(1), open.group(2).strip(),
                    String.join("\n", body), startLine, endLine));
            i = j + 1;
        }
        return blocks;
    }
}
