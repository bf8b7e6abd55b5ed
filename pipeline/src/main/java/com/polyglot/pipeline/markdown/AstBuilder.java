package com.polyglot.pipeline.markdown;

import com.polyglot.pipeline.markdown.AstNode.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds an mdast-compatible tree from the {@link Tokenizer} stream.
 *
 * Block structure only. Inline parsing is shallow: every block gets one
 * {@link AstNode.Text} child holding its raw text, which is all the
 * classifier needs.
 */
public final class AstBuilder {

    private static final Pattern BULLET  = Pattern.compile("^\\s*[-*+]\\s+(.*)$");
    private static final Pattern ORDERED = Pattern.compile("^\\s*(\\d{1,9})[.)]\\s+(.*)$");

    private AstBuilder() {}

    public static AstNode.Root build(List<Token> tokens) {
        List<AstNode> children = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);

            if (token instanceof Token.Heading h) {
                children.add(new AstNode.Heading(h.depth(), List.of(new AstNode.Text(h.text())),
                        lineSpan(h.line(), h.line(), h.text()), null));
                i++;
            } else if (token instanceof Token.CodeFenceStart start) {
                i = buildCode(tokens, i, start, children);
            } else if (token instanceof Token.HtmlComment c) {
                children.add(new AstNode.Html(c.text(), lineSpan(c.line(), c.line(), c.text()), null));
                i++;
            } else if (token instanceof Token.HtmlCommentStart) {
                i = buildHtmlRun(tokens, i, children);
            } else if (token instanceof Token.TextLine t) {
                i = isListLine(t.value()) ? buildList(tokens, i, children) : buildParagraph(tokens, i, children);
            } else {
                // Blank lines and stray closing tokens carry no content.
                i++;
            }
        }

        Position position = tokens.isEmpty() ? null : Position.of(1, tokens.get(tokens.size() - 1).line(), 1);
        return new AstNode.Root(children, position, null);
    }

    private static int buildCode(List<Token> tokens, int i, Token.CodeFenceStart start, List<AstNode> out) {
        List<String> lines = new ArrayList<>();
        int endLine = start.line();
        int j = i + 1;
        while (j < tokens.size()) {
            Token next = tokens.get(j);
            if (next instanceof Token.CodeFenceEnd end) {
                endLine = end.line();
                j++;
                break;
            }
            if (next instanceof Token.CodeContent content) {
                lines.add(content.text());
                endLine = content.line();
            }
            j++;
        }

        String lang = start.lang().isEmpty() ? null : start.lang();
        String meta = start.meta().isEmpty() ? null : start.meta();
        out.add(new AstNode.Code(lang, meta, String.join("\n", lines),
                Position.of(start.line(), endLine, 4), null));
        return j;
    }

    private static int buildHtmlRun(List<Token> tokens, int i, List<AstNode> out) {
        List<String> lines = new ArrayList<>();
        int startLine = tokens.get(i).line();
        int j = i;
        while (j < tokens.size()) {
            Token next = tokens.get(j);
            if (next instanceof Token.HtmlCommentStart s) {
                lines.add(s.text());
            } else if (next instanceof Token.HtmlCommentContent c) {
                lines.add(c.text());
            } else if (next instanceof Token.HtmlCommentEnd e) {
                lines.add(e.text());
                j++;
                break;
            } else {
                break;
            }
            j++;
        }
        String last = lines.get(lines.size() - 1);
        out.add(new AstNode.Html(String.join("\n", lines),
                lineSpan(startLine, tokens.get(j - 1).line(), last), null));
        return j;
    }

    private static int buildParagraph(List<Token> tokens, int i, List<AstNode> out) {
        List<String> lines = new ArrayList<>();
        int startLine = tokens.get(i).line();
        int endLine = startLine;
        int j = i;
        while (j < tokens.size()
                && tokens.get(j) instanceof Token.TextLine t
                && (j == i || !isListLine(t.value()))) {
            lines.add(t.value());
            endLine = t.line();
            j++;
        }
        String text = String.join("\n", lines);
        out.add(new AstNode.Paragraph(List.of(new AstNode.Text(text)),
                lineSpan(startLine, endLine, lines.get(lines.size() - 1)), null));
        return j;
    }

    private static int buildList(List<Token> tokens, int i, List<AstNode> out) {
        boolean ordered = ORDERED.matcher(((Token.TextLine) tokens.get(i)).value()).matches();
        Integer start = null;
        List<AstNode> items = new ArrayList<>();
        int startLine = tokens.get(i).line();
        int endLine = startLine;
        String lastText = "";
        int j = i;

        while (j < tokens.size() && tokens.get(j) instanceof Token.TextLine t) {
            Matcher m = ordered ? ORDERED.matcher(t.value()) : BULLET.matcher(t.value());
            if (!m.matches()) {
                break;
            }
            String itemText = ordered ? m.group(2) : m.group(1);
            if (ordered && start == null) {
                start = Integer.valueOf(m.group(1));
            }
            Position itemPos = lineSpan(t.line(), t.line(), t.value());
            AstNode.Paragraph para = new AstNode.Paragraph(List.of(new AstNode.Text(itemText)), itemPos, null);
            items.add(new AstNode.ListItem(List.of(para), itemPos, null));
            endLine = t.line();
            lastText = t.value();
            j++;
        }

        out.add(new AstNode.ListBlock(ordered, start, items, lineSpan(startLine, endLine, lastText), null));
        return j;
    }

    static boolean isListLine(String line) {
        return BULLET.matcher(line).matches() || ORDERED.matcher(line).matches();
    }

    private static Position lineSpan(int startLine, int endLine, String lastLine) {
        return Position.of(startLine, endLine, lastLine.length() + 1);
    }
}
