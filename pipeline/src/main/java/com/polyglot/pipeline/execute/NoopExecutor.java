package com.polyglot.pipeline.execute;

import com.polyglot.pipeline.classify.Language;
import com.polyglot.pipeline.classify.Polyglot;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Plain documentation: nothing to run. */
@Component
public class NoopExecutor implements Executor {

    static final String MESSAGE = "documentation only";

    @Override
    public Language language() {
        return Language.NONE;
    }

    @Override
    public ExecutionResult execute(Polyglot polyglot) {
        return ExecutionResult.ok(Language.NONE, Map.of("message", MESSAGE));
    }
}
