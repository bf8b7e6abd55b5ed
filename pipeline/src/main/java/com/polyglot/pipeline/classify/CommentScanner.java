package com.polyglot.pipeline.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTML-comment pass over raw text. Turns {@code polyglot:} and {@code kyozo:}
 * comment bodies into {@link Directive}s; ordinary comments are ignored.
 */
public final class CommentScanner {

    private static final Logger log = LoggerFactory.getLogger(CommentScanner.class);

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    // Body may not contain another opener, so "<!-- a <!-- b -->" yields the inner comment.
    private static final Pattern COMMENT   = Pattern.compile("<!--((?:(?!<!--|-->).)*)-->", Pattern.DOTALL);
    private static final Pattern DIRECTIVE = Pattern.compile("^(polyglot|kyozo):(.*)$", Pattern.DOTALL);

    // key, key=value, key="quoted value", key='quoted value'
    private static final Pattern PARAM = Pattern.compile(
            "([^\\s=]+)(?:=(?:\"([^\"]*)\"|'([^']*)'|(\\S*)))?");

    private CommentScanner() {}

    public static List<Directive> scan(String text) {
        List<Directive> directives = new ArrayList<>();
        if (text == null || !text.contains("<!--")) {
            return directives;
        }

        LineIndex lines = LineIndex.of(text);
        Matcher m = COMMENT.matcher(text);
        while (m.find()) {
            Matcher d = DIRECTIVE.matcher(m.group(1).strip());
            if (d.matches()) {
                directives.add(parse(d.group(1), d.group(2).strip(),
                        lines.lineOf(m.start()), lines.lineOf(m.end() - 1)));
            }
        }
        return directives;
    }

    static Directive parse(String namespace, String body, int line, int endLine) {
        if (body.startsWith("{")) {
            try {
                Map<String, Object> json = JSON.readValue(body, MAP_TYPE);
                return new Directive(namespace, "json", null, json, line, endLine);
            } catch (JsonProcessingException e) {
                log.debug("{}: directive on line {} is not valid JSON, reading it as text", namespace, line);
            }
        }

        Matcher p = PARAM.matcher(body);
        if (!p.find()) {
            return new Directive(namespace, "", null, Map.of(), line, endLine);
        }

        String name = p.group(1);
        String value = paramValue(p);
        if (value == null) {
            int colon = name.indexOf(':');
            if (colon > 0) {
                value = name.substring(colon + 1);
                name = name.substring(0, colon);
            }
        }

        Map<String, Object> params = new LinkedHashMap<>();
        while (p.find()) {
            String v = paramValue(p);
            params.put(p.group(1), v == null ? Boolean.TRUE : v);
        }
        return new Directive(namespace, name, value, params, line, endLine);
    }

    private static String paramValue(Matcher p) {
        for (int g = 2; g <= 4; g++) {
            if (p.group(g) != null) {
                return p.group(g);
            }
        }
        return null;
    }
}
