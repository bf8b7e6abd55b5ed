package com.polyglot.pipeline.document;

/**
 * Thrown when an execution result cannot be persisted. The execution itself
 * already happened; callers report the failure instead of retrying it.
 */
public class ResultSinkException extends RuntimeException {

    public ResultSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
