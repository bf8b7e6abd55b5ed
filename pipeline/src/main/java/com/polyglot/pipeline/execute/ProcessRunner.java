package com.polyglot.pipeline.execute;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs external tools with a hard timeout.
 *
 * Every call is bounded by {@code polyglot.executor.timeout-sec}; a child
 * that outlives it is killed and reported as {@link ProcessOutcome.TimedOut}.
 * Output is drained on a separate thread so a chatty child cannot block on a
 * full pipe while we wait for it.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    // Grace period for the output pump after the child exits or is killed.
    private static final long DRAIN_SECONDS = 5;

    private final List<Path> searchPath;
    private final Duration   timeout;

    private final AtomicInteger   pumpCount = new AtomicInteger();
    private final ExecutorService pumps     = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "process-output-" + pumpCount.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public ProcessRunner(
            @Value("${polyglot.executor.search-path:}") String searchPath,
            @Value("${polyglot.executor.timeout-sec:300}") long timeoutSec) {
        String raw = searchPath == null || searchPath.isBlank() ? System.getenv("PATH") : searchPath;
        this.searchPath = parseSearchPath(raw);
        this.timeout    = Duration.ofSeconds(timeoutSec);
    }

    // ------------------------------------------------------------------
    // Binary lookup
    // ------------------------------------------------------------------

    /** First executable regular file named {@code binary} on the search path. */
    public Optional<Path> locate(String binary) {
        for (Path dir : searchPath) {
            Path candidate = dir.resolve(binary);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    public ProcessOutcome run(Command command) {
        log.debug("Running '{}' in {}", command.display(), command.workDir());

        ProcessBuilder builder = new ProcessBuilder(command.argv())
                .directory(command.workDir().toFile())
                .redirectErrorStream(true);
        builder.environment().putAll(command.environment());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Could not start '{}': {}", command.program(), e.getMessage());
            return new ProcessOutcome.InvocationFailed(
                    "Failed to start " + command.program() + ": " + e.getMessage());
        }

        Future<String> output = pumps.submit(() -> readAll(process.getInputStream()));
        try {
            writeStdin(process, command.stdin() == null ? "" : command.stdin());
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                process.waitFor(DRAIN_SECONDS, TimeUnit.SECONDS);
                log.warn("'{}' exceeded {}s and was killed", command.display(), timeout.toSeconds());
                return new ProcessOutcome.TimedOut(timeout, collect(output));
            }
            return new ProcessOutcome.Completed(process.exitValue(), collect(output));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            output.cancel(true);
            return new ProcessOutcome.InvocationFailed("Interrupted while waiting for " + command.program());
        }
    }

    private static void writeStdin(Process process, String input) {
        try (OutputStream in = process.getOutputStream()) {
            in.write(input.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            // The child may exit without reading its input; its exit code tells the story.
            log.debug("stdin closed early by child: {}", e.getMessage());
        }
    }

    private static String collect(Future<String> output) throws InterruptedException {
        try {
            return output.get(DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            log.warn("Failed to read process output: {}", e.getCause().getMessage());
            return "";
        } catch (TimeoutException e) {
            // A grandchild can keep the pipe open after the child is gone.
            output.cancel(true);
            return "";
        }
    }

    private static String readAll(InputStream stream) {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static List<Path> parseSearchPath(String raw) {
        List<Path> dirs = new ArrayList<>();
        if (raw == null) {
            return dirs;
        }
        for (String entry : raw.split(File.pathSeparator)) {
            if (entry.isBlank()) {
                continue;
            }
            try {
                dirs.add(Path.of(entry));
            } catch (InvalidPathException e) {
                log.debug("Skipping invalid search path entry '{}'", entry);
            }
        }
        return List.copyOf(dirs);
    }
}
