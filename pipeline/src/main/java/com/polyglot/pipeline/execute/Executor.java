package com.polyglot.pipeline.execute;

import com.polyglot.pipeline.classify.Language;
import com.polyglot.pipeline.classify.Polyglot;

/**
 * Runs a parsed document against one external tool.
 *
 * Implementations never throw for expected failures: a missing artifact, a
 * missing tool, a non-zero exit and a timeout all come back as an
 * {@link ExecutionResult}.
 */
public interface Executor {

    /** The classification this executor handles. */
    Language language();

    ExecutionResult execute(Polyglot polyglot);
}
