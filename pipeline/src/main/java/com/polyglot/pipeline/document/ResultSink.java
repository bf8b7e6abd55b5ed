package com.polyglot.pipeline.document;

import com.polyglot.pipeline.execute.ExecutionResult;

/** Destination for execution results. */
public interface ResultSink {

    /**
     * @throws ResultSinkException if the result could not be stored
     */
    void store(String documentId, ExecutionResult result);
}
