package com.polyglot.pipeline.execute;

import com.polyglot.pipeline.classify.Language;
import com.polyglot.pipeline.classify.Polyglot;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes a parsed document to the executor for its language and records
 * every call:
 * <pre>
 *   polyglot.executor.calls{language, status="ok|mock|error"}
 *   polyglot.executor.duration{language}
 * </pre>
 *
 * Routing is a switch over {@link Language}, so a new language does not
 * compile until it has an executor.
 */
@Component
public class ExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRegistry.class);

    private final DockerExecutor     docker;
    private final TerraformExecutor  terraform;
    private final KubernetesExecutor kubernetes;
    private final ShellExecutor      shell;
    private final GitExecutor        git;
    private final SqlExecutor        sql;
    private final NoopExecutor       noop;
    private final MeterRegistry      meterRegistry;

    public ExecutorRegistry(DockerExecutor docker,
                            TerraformExecutor terraform,
                            KubernetesExecutor kubernetes,
                            ShellExecutor shell,
                            GitExecutor git,
                            SqlExecutor sql,
                            NoopExecutor noop,
                            MeterRegistry meterRegistry) {
        this.docker        = docker;
        this.terraform     = terraform;
        this.kubernetes    = kubernetes;
        this.shell         = shell;
        this.git           = git;
        this.sql           = sql;
        this.noop          = noop;
        this.meterRegistry = meterRegistry;
        for (Executor e : List.of(docker, terraform, kubernetes, shell, git, sql, noop)) {
            log.info("Registered executor {} for language '{}'",
                    e.getClass().getSimpleName(), e.language().wireName());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Executor executorFor(Language language) {
        return switch (language) {
            case DOCKERFILE -> docker;
            case TERRAFORM  -> terraform;
            case KUBERNETES -> kubernetes;
            case EXECUTABLE -> shell;
            case GIT        -> git;
            case SQL        -> sql;
            case NONE       -> noop;
        };
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute the document with the executor for its language. Never throws:
     * an exception escaping the executor becomes an error result with code -1.
     */
    public ExecutionResult execute(Polyglot polyglot) {
        Language language = polyglot.language();
        String tag = language.wireName();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            ExecutionResult result = executorFor(language).execute(polyglot);
            status = !result.ok() ? "error" : result.isMock() ? "mock" : "ok";
            return result;
        } catch (RuntimeException e) {
            log.error("Executor for '{}' failed: {}", tag, e.getMessage(), e);
            return ExecutionResult.error(language, -1, "Unexpected error: " + e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("polyglot.executor.duration", "language", tag));
            meterRegistry.counter("polyglot.executor.calls", "language", tag, "status", status).increment();
        }
    }
}
