package com.polyglot.pipeline.execute;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one manifest, command or statement inside a batch execution.
 *
 * @param unit short label: manifest index, command text or statement preview
 */
record UnitResult(String unit, boolean ok, int code, String output) {

    static UnitResult of(String unit, ProcessOutcome outcome) {
        if (outcome instanceof ProcessOutcome.Completed c) {
            return new UnitResult(unit, c.succeeded(), c.exitCode(), c.output());
        }
        if (outcome instanceof ProcessOutcome.TimedOut t) {
            return new UnitResult(unit, false, -1, "timed out after " + t.timeout().toSeconds() + "s\n" + t.output());
        }
        return new UnitResult(unit, false, -1, ((ProcessOutcome.InvocationFailed) outcome).message());
    }

    static UnitResult failed(String unit, String message) {
        return new UnitResult(unit, false, -1, message);
    }

    Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("unit", unit);
        m.put("ok", ok);
        m.put(ExecutionResult.CODE, code);
        m.put(ExecutionResult.OUTPUT, output);
        return m;
    }
}
