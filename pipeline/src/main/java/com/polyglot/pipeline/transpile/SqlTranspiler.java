package com.polyglot.pipeline.transpile;

import com.polyglot.pipeline.classify.Artifact;
import com.polyglot.pipeline.classify.ArtifactType;
import com.polyglot.pipeline.classify.Polyglot;

import java.util.ArrayList;
import java.util.List;

final class SqlTranspiler {

    private SqlTranspiler() {}

    static Transpilation transpile(Polyglot polyglot) {
        List<Artifact> blocks = polyglot.artifactsOf(ArtifactType.SQL);
        if (blocks.isEmpty()) {
            return Transpilation.Failure.missing(Target.SQL, ArtifactType.SQL);
        }
        List<String> statements = new ArrayList<>();
        for (Artifact block : blocks) {
            statements.addAll(split(block.content()));
        }
        return new Transpilation.Success(new TranspiledConfig.SqlConfig(
                statements, Transpilers.directive(polyglot, "database", null)));
    }

    /**
     * Splits on {@code ;} outside string literals, quoted identifiers and
     * comments. Comments are kept with the statement they precede; segments
     * holding only whitespace or comments are dropped.
     */
    static List<String> split(String sql) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean hasCode = false;
        int i = 0;
        int n = sql.length();

        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = closingQuote(sql, i, c);
                current.append(sql, i, end);
                hasCode = true;
                i = end;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? n : end;
                current.append(sql, i, end);
                i = end;
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                current.append(sql, i, end);
                i = end;
            } else if (c == ';') {
                flush(out, current, hasCode);
                current.setLength(0);
                hasCode = false;
                i++;
            } else {
                current.append(c);
                hasCode |= !Character.isWhitespace(c);
                i++;
            }
        }
        flush(out, current, hasCode);
        return out;
    }

    /** Index just past the quote closing the one at {@code start}; doubled quotes are escapes. */
    private static int closingQuote(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private static void flush(List<String> out, StringBuilder current, boolean hasCode) {
        if (hasCode) {
            out.add(current.toString().strip());
        }
    }
}
