package com.polyglot.pipeline.execute;

import com.polyglot.pipeline.classify.Polyglot;
import com.polyglot.pipeline.transpile.Target;
import com.polyglot.pipeline.transpile.Transpilation;
import com.polyglot.pipeline.transpile.TranspiledConfig;
import com.polyglot.pipeline.transpile.Transpilers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Shared plumbing for executors backed by an external binary: transpile,
 * then hand the typed configuration to the subclass.
 *
 * @param <C> configuration type produced by {@link #target()}
 */
abstract class ToolExecutor<C extends TranspiledConfig> implements Executor {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    static final String MISSING_ARTIFACT = "missing_artifact";
    static final String TIMEOUT          = "timeout";

    protected final ProcessRunner runner;
    protected final Workspaces    workspaces;

    private final Class<C> configType;

    protected ToolExecutor(ProcessRunner runner, Workspaces workspaces, Class<C> configType) {
        this.runner     = runner;
        this.workspaces = workspaces;
        this.configType = configType;
    }

    protected abstract Target target();

    protected abstract ExecutionResult run(C config, Polyglot polyglot);

    @Override
    public final ExecutionResult execute(Polyglot polyglot) {
        Transpilation transpilation = Transpilers.transpile(polyglot, target());
        if (transpilation instanceof Transpilation.Failure f) {
            log.info("Nothing to execute for {}: {}", target().wireName(), f.message());
            return ExecutionResult.error(language(), MISSING_ARTIFACT, -1, f.message());
        }
        TranspiledConfig config = ((Transpilation.Success) transpilation).config();
        return run(configType.cast(config), polyglot);
    }

    // ------------------------------------------------------------------
    // Result helpers
    // ------------------------------------------------------------------

    protected ExecutionResult toolMissing(String tool, Map<String, Object> details) {
        log.warn("{} not found on search path, returning mock result", tool);
        return ExecutionResult.mock(language(), details);
    }

    /**
     * Map a single-unit outcome. Exit 0 goes through {@code onSuccess}, which
     * receives the combined output.
     */
    protected ExecutionResult fromOutcome(ProcessOutcome outcome,
                                          Function<String, Map<String, Object>> onSuccess) {
        if (outcome instanceof ProcessOutcome.Completed c) {
            return c.succeeded()
                    ? ExecutionResult.ok(language(), onSuccess.apply(c.output()))
                    : ExecutionResult.error(language(), c.exitCode(), c.output());
        }
        if (outcome instanceof ProcessOutcome.TimedOut t) {
            return ExecutionResult.error(language(), TIMEOUT, -1, t.output());
        }
        return ExecutionResult.error(language(), -1, ((ProcessOutcome.InvocationFailed) outcome).message());
    }

    /** Batch summary: every unit ran, failures are counted rather than fatal. */
    protected ExecutionResult batch(List<UnitResult> units, Map<String, Object> extra) {
        int failed = (int) units.stream().filter(u -> !u.ok()).count();
        Map<String, Object> details = new LinkedHashMap<>(extra);
        details.put("applied", units.size() - failed);
        details.put("failed", failed);
        details.put("results", units.stream().map(UnitResult::toMap).toList());
        if (failed > 0) {
            log.warn("{}: {} of {} units failed", target().wireName(), failed, units.size());
        }
        return ExecutionResult.ok(language(), details);
    }
}
