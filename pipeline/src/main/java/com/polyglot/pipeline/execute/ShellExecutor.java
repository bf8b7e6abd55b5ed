package com.polyglot.pipeline.execute;

import com.polyglot.pipeline.classify.Language;
import com.polyglot.pipeline.classify.Polyglot;
import com.polyglot.pipeline.transpile.Target;
import com.polyglot.pipeline.transpile.TranspiledConfig.BashConfig;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Runs executable blocks with bash, falling back to sh. */
@Component
public class ShellExecutor extends ToolExecutor<BashConfig> {

    public ShellExecutor(ProcessRunner runner, Workspaces workspaces) {
        super(runner, workspaces, BashConfig.class);
    }

    @Override public Language language() { return Language.EXECUTABLE; }
    @Override protected Target target()  { return Target.BASH; }

    @Override
    protected ExecutionResult run(BashConfig config, Polyglot polyglot) {
        Optional<Path> shell = runner.locate("bash").or(() -> runner.locate("sh"));
        if (shell.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put(ExecutionResult.OUTPUT, "No shell found (bash/sh) - would execute script");
            details.put("exit_code", 0);
            return toolMissing("bash", details);
        }

        try (Workspace ws = workspaces.acquire("sh")) {
            Command cmd = Command.of(ws.dir(), shell.get().toString(), "-c", config.script())
                    .withEnvironment(config.environment());
            log.info("Running script with {}", shell.get().getFileName());
            return fromOutcome(runner.run(cmd), output -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put(ExecutionResult.OUTPUT, output);
                details.put("exit_code", 0);
                return details;
            });
        }
    }
}
