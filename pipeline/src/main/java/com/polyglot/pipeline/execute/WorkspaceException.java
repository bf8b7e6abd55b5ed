package com.polyglot.pipeline.execute;

/**
 * Thrown when a scratch workspace cannot be created or written.
 */
public class WorkspaceException extends RuntimeException {

    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
