package com.polyglot.pipeline.execute;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyglot.pipeline.classify.Language;
import com.polyglot.pipeline.classify.Polyglot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static com.polyglot.pipeline.execute.ExecutorTestSupport.parse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Registry routing and metrics. No Spring context; all wiring is manual.
 */
class ExecutorRegistryTest {

    SimpleMeterRegistry meters;
    ProcessRunner       runner;
    ExecutorRegistry    registry;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        runner = mock(ProcessRunner.class);
        // No tools installed anywhere.
        when(runner.locate(any())).thenReturn(Optional.empty());

        Workspaces workspaces = new Workspaces(System.getProperty("java.io.tmpdir"));
        registry = new ExecutorRegistry(
                new DockerExecutor(runner, workspaces),
                new TerraformExecutor(runner, workspaces, new ObjectMapper()),
                new KubernetesExecutor(runner, workspaces),
                new ShellExecutor(runner, workspaces),
                new GitExecutor(runner, workspaces),
                new SqlExecutor(runner, workspaces, "postgres://localhost/polyglot_db"),
                new NoopExecutor(),
                meters);
    }

    @ParameterizedTest
    @EnumSource(Language.class)
    void executorFor_isTotalAndLanguageConsistent(Language language) {
        Executor executor = registry.executorFor(language);

        assertThat(executor).isNotNull();
        assertThat(executor.language()).isEqualTo(language);
    }

    @Test
    void execute_missingTool_neverThrowsAndCountsMock() {
        ExecutionResult result = registry.execute(parse("```dockerfile\nFROM alpine\n```"));

        assertThat(result.ok()).isTrue();
        assertThat(result.isMock()).isTrue();
        assertThat(meters.counter("polyglot.executor.calls", "language", "dockerfile", "status", "mock").count())
                .isEqualTo(1.0);
        assertThat(meters.timer("polyglot.executor.duration", "language", "dockerfile").count()).isEqualTo(1L);
    }

    @Test
    void execute_plainDocument_usesNoop() {
        ExecutionResult result = registry.execute(parse("# Readme\n\nNothing runnable."));

        assertThat(result.details()).containsEntry("message", "documentation only");
        assertThat(meters.counter("polyglot.executor.calls", "language", "none", "status", "ok").count())
                .isEqualTo(1.0);
    }

    @Test
    void execute_unexpectedException_becomesErrorResult() {
        reset(runner);
        when(runner.locate(any())).thenThrow(new IllegalStateException("search path exploded"));

        Polyglot polyglot = parse("```dockerfile\nFROM alpine\n```");
        ExecutionResult result = registry.execute(polyglot);

        assertThat(result.ok()).isFalse();
        assertThat(result.details()).containsEntry("code", -1);
        assertThat((String) result.details().get("output")).contains("search path exploded");
        assertThat(meters.counter("polyglot.executor.calls", "language", "dockerfile", "status", "error").count())
                .isEqualTo(1.0);
    }
}
