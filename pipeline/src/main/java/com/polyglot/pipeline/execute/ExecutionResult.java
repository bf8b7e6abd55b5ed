package com.polyglot.pipeline.execute;

import com.polyglot.pipeline.classify.Language;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal value of an executor call. {@code details} varies per target;
 * failures always carry {@code code} and {@code output}.
 */
public record ExecutionResult(
        boolean             ok,
        Language            language,
        Map<String, Object> details) {

    public static final String CODE   = "code";
    public static final String OUTPUT = "output";
    public static final String REASON = "reason";
    public static final String MOCK   = "mock";

    public ExecutionResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ExecutionResult ok(Language language, Map<String, Object> details) {
        return new ExecutionResult(true, language, details);
    }

    /** Success returned when the target tool is not installed. */
    public static ExecutionResult mock(Language language, Map<String, Object> details) {
        Map<String, Object> d = new LinkedHashMap<>(details);
        d.put(MOCK, true);
        return new ExecutionResult(true, language, d);
    }

    public static ExecutionResult error(Language language, int code, String output) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(CODE, code);
        d.put(OUTPUT, output == null ? "" : output);
        return new ExecutionResult(false, language, d);
    }

    public static ExecutionResult error(Language language, String reason, int code, String output) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(REASON, reason);
        d.put(CODE, code);
        d.put(OUTPUT, output == null ? "" : output);
        return new ExecutionResult(false, language, d);
    }

    public boolean isMock() {
        return Boolean.TRUE.equals(details.get(MOCK));
    }
}
