package com.polyglot.pipeline.execute;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs real child processes; skipped where no POSIX shell is available.
 */
class ProcessRunnerTest {

    @TempDir Path dir;

    ProcessRunner runner;
    Path          sh;

    @BeforeEach
    void setUp() {
        runner = new ProcessRunner("", 2);
        sh = runner.locate("sh").orElse(null);
        assumeTrue(sh != null, "sh not on PATH");
    }

    @Test
    void run_capturesCombinedOutputAndExitCode() {
        ProcessOutcome outcome = runner.run(Command.of(dir, sh.toString(), "-c", "echo out; echo err >&2; exit 3"));

        assertThat(outcome).isInstanceOf(ProcessOutcome.Completed.class);
        ProcessOutcome.Completed done = (ProcessOutcome.Completed) outcome;
        assertThat(done.exitCode()).isEqualTo(3);
        assertThat(done.output()).contains("out").contains("err");
    }

    @Test
    void run_feedsStdinAndEnvironment() {
        Command cmd = Command.of(dir, sh.toString(), "-c", "read line; echo \"$line-$SUFFIX\"")
                .withStdin("hello\n")
                .withEnvironment(Map.of("SUFFIX", "env"));

        ProcessOutcome.Completed done = (ProcessOutcome.Completed) runner.run(cmd);

        assertThat(done.succeeded()).isTrue();
        assertThat(done.output().strip()).isEqualTo("hello-env");
    }

    @Test
    void run_usesWorkingDirectory() throws Exception {
        Files.writeString(dir.resolve("marker.txt"), "here");

        ProcessOutcome.Completed done = (ProcessOutcome.Completed) runner.run(
                Command.of(dir, sh.toString(), "-c", "cat marker.txt"));

        assertThat(done.output()).isEqualTo("here");
    }

    @Test
    void run_killsProcessOnTimeout() {
        long start = System.nanoTime();

        ProcessOutcome outcome = runner.run(Command.of(dir, sh.toString(), "-c", "echo started; exec sleep 30"));

        assertThat(outcome).isInstanceOf(ProcessOutcome.TimedOut.class);
        assertThat(System.nanoTime() - start).isLessThan(20_000_000_000L);
    }

    @Test
    void run_missingBinary_isInvocationFailure() {
        ProcessOutcome outcome = runner.run(Command.of(dir, dir.resolve("no-such-tool").toString()));

        assertThat(outcome).isInstanceOf(ProcessOutcome.InvocationFailed.class);
        assertThat(((ProcessOutcome.InvocationFailed) outcome).message()).contains("no-such-tool");
    }

    @Test
    void locate_honoursConfiguredSearchPath() throws Exception {
        Path bin = Files.createDirectory(dir.resolve("bin"));
        Path tool = Files.writeString(bin.resolve("mytool"), "#!/bin/sh\necho mine\n");
        Files.setPosixFilePermissions(tool, PosixFilePermissions.fromString("rwxr-xr-x"));
        Files.writeString(bin.resolve("notexec"), "data");

        ProcessRunner scoped = new ProcessRunner(bin.toString(), 2);

        assertThat(scoped.locate("mytool")).contains(tool);
        assertThat(scoped.locate("notexec")).isEmpty();
        assertThat(scoped.locate("sh")).isEmpty();
    }

    @Test
    void parseSearchPath_skipsBlankEntries() {
        assertThat(ProcessRunner.parseSearchPath("/a::/b:")).isEqualTo(List.of(Path.of("/a"), Path.of("/b")));
        assertThat(ProcessRunner.parseSearchPath(null)).isEmpty();
    }
}
