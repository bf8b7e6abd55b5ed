package com.polyglot.pipeline.execute;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One external process invocation.
 *
 * @param argv        program and arguments, never passed through a shell
 * @param workDir     working directory
 * @param stdin       written to the child then closed; null for none
 * @param environment added to the inherited environment
 */
public record Command(
        List<String>        argv,
        Path                workDir,
        String              stdin,
        Map<String, String> environment) {

    public Command {
        argv = List.copyOf(argv);
        Objects.requireNonNull(workDir, "workDir");
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        if (argv.isEmpty()) {
            throw new IllegalArgumentException("argv must not be empty");
        }
    }

    public static Command of(Path workDir, String... argv) {
        return new Command(List.of(argv), workDir, null, Map.of());
    }

    public Command withStdin(String input) {
        return new Command(argv, workDir, input, environment);
    }

    public Command withEnvironment(Map<String, String> env) {
        return new Command(argv, workDir, stdin, env);
    }

    public String program() {
        return argv.get(0);
    }

    public String display() {
        return String.join(" ", argv);
    }
}
