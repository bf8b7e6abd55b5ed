package com.polyglot.pipeline.execute;

import java.time.Duration;

/** How a child process ended. Output is stdout and stderr interleaved. */
public sealed interface ProcessOutcome {

    record Completed(int exitCode, String output) implements ProcessOutcome {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    /** The process outlived its timeout and was killed. */
    record TimedOut(Duration timeout, String output) implements ProcessOutcome {}

    /** The process could not be started or waited for. */
    record InvocationFailed(String message) implements ProcessOutcome {}
}
