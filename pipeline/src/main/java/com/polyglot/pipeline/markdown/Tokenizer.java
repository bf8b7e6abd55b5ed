package com.polyglot.pipeline.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw Markdown into a line-oriented token stream.
 *
 * Single pass over the lines carrying a small state flag. While inside a
 * code block or a multi-line HTML comment the state wins over any line-level
 * match, so a {@code # heading} inside a fence is code content.
 *
 * Never fails: lines that match nothing become {@link Token.TextLine}.
 */
public final class Tokenizer {

    private enum State { NONE, CODE_BLOCK, HTML_COMMENT }

    static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private static final Pattern FENCE = Pattern.compile("^```\\s*(\\S*)\\s*(.*)$");
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*)$");

    private Tokenizer() {}

    public static List<Token> tokenize(String content) {
        List<Token> tokens = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return tokens;
        }

        State state = State.NONE;
        String[] lines = LINE_BREAK.split(content, -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int num = i + 1;

            switch (state) {
                case CODE_BLOCK -> {
                    if (line.startsWith("```")) {
                        tokens.add(new Token.CodeFenceEnd(num));
                        state = State.NONE;
                    } else {
                        tokens.add(new Token.CodeContent(num, line));
                    }
                }
                case HTML_COMMENT -> {
                    if (line.contains("-->")) {
                        tokens.add(new Token.HtmlCommentEnd(num, line));
                        state = State.NONE;
                    } else {
                        tokens.add(new Token.HtmlCommentContent(num, line));
                    }
                }
                case NONE -> state = tokenizeFreeLine(line, num, tokens);
            }
        }
        return tokens;
    }

    private static State tokenizeFreeLine(String line, int num, List<Token> tokens) {
        Matcher fence = FENCE.matcher(line);
        if (fence.matches()) {
            tokens.add(new Token.CodeFenceStart(fence.group(1), fence.group(2).strip(), num));
            return State.CODE_BLOCK;
        }

        if (line.startsWith("<!--")) {
            if (line.indexOf("-->", 4) >= 0) {
                tokens.add(new Token.HtmlComment(num, line));
                return State.NONE;
            }
            tokens.add(new Token.HtmlCommentStart(num, line));
            return State.HTML_COMMENT;
        }

        Matcher heading = HEADING.matcher(line);
        if (heading.matches()) {
            tokens.add(new Token.Heading(heading.group(1).length(), heading.group(2).strip(), num));
        } else if (line.isBlank()) {
            tokens.add(new Token.Blank(num));
        } else {
            tokens.add(new Token.TextLine(num, line));
        }
        return State.NONE;
    }
}
