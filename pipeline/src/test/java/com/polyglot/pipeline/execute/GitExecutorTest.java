package com.polyglot.pipeline.execute;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.polyglot.pipeline.execute.ExecutorTestSupport.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GitExecutorTest {

    private static final String TWO_FILES = """
            ```file:README.md
            # Demo
            ```
            ```file:src/run.sh
            echo run
            ```
            """;

    @Mock ProcessRunner runner;
    @TempDir Path root;

    GitExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new GitExecutor(runner, new Workspaces(root.toString()));
    }

    @Test
    void execute_writesFilesThenRunsEachCommandWithSh() {
        when(runner.locate("sh")).thenReturn(tool("sh"));
        when(runner.locate("git")).thenReturn(tool("git"));
        List<String> seenFiles = new ArrayList<>();
        when(runner.run(any())).thenAnswer(inv -> {
            Command cmd = inv.getArgument(0);
            if (seenFiles.isEmpty()) {
                try (var files = Files.walk(cmd.workDir())) {
                    files.filter(Files::isRegularFile)
                            .map(p -> cmd.workDir().relativize(p).toString())
                            .forEach(seenFiles::add);
                }
            }
            return exit(0, "");
        });

        ExecutionResult result = executor.execute(parse(TWO_FILES));

        assertThat(result.ok()).isTrue();
        assertThat(result.details())
                .containsEntry("files_created", 2)
                .containsEntry("applied", 3)
                .containsEntry("failed", 0);
        assertThat(seenFiles).containsExactlyInAnyOrder("README.md", "src/run.sh");
        verify(runner, times(3)).run(argThat(c -> c.argv().get(1).equals("-c")));
    }

    @Test
    void execute_failingCommand_doesNotStopTheRest() {
        when(runner.locate("sh")).thenReturn(tool("sh"));
        when(runner.locate("git")).thenReturn(tool("git"));
        when(runner.run(any()))
                .thenReturn(exit(0, ""))
                .thenReturn(exit(128, "fatal: pathspec"))
                .thenReturn(exit(0, ""));

        ExecutionResult result = executor.execute(parse(TWO_FILES));

        assertThat(result.details()).containsEntry("applied", 2).containsEntry("failed", 1);
        assertThat(results(result).get(1))
                .containsEntry("unit", "git add .")
                .containsEntry("code", 128);
    }

    @Test
    void execute_collectsCommandOutputInOrder() {
        when(runner.locate("sh")).thenReturn(tool("sh"));
        when(runner.locate("git")).thenReturn(tool("git"));
        when(runner.run(any()))
                .thenReturn(exit(0, "Initialized empty Git repository\n"))
                .thenReturn(exit(0, ""))
                .thenReturn(exit(0, "[master (root-commit) abc123] Initial commit\n"));

        ExecutionResult result = executor.execute(parse(TWO_FILES));

        assertThat(result.details()).containsEntry("git_output",
                "Initialized empty Git repository\n[master (root-commit) abc123] Initial commit\n");
    }

    @Test
    void execute_pathEscapingWorkspace_isAFailedUnit() {
        when(runner.locate("sh")).thenReturn(tool("sh"));
        when(runner.locate("git")).thenReturn(tool("git"));
        when(runner.run(any())).thenReturn(exit(0, ""));

        ExecutionResult result = executor.execute(parse("```file:../outside.txt\nx\n```\n```file:ok.txt\ny\n```"));

        assertThat(result.details())
                .containsEntry("files_created", 1)
                .containsEntry("failed", 1)
                .containsEntry("applied", 3);
        assertThat(results(result).get(0)).containsEntry("unit", "write ../outside.txt");
        assertThat(root.resolveSibling("outside.txt")).doesNotExist();
    }

    @Test
    void execute_gitMissing_returnsMockSuccess() {
        when(runner.locate("sh")).thenReturn(tool("sh"));
        when(runner.locate("git")).thenReturn(Optional.empty());

        ExecutionResult result = executor.execute(parse(TWO_FILES));

        assertThat(result.ok()).isTrue();
        assertThat(result.isMock()).isTrue();
        assertThat(result.details().get("files")).isEqualTo(List.of("README.md", "src/run.sh"));
        verify(runner, never()).run(any());
    }
}
