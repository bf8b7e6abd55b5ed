package com.polyglot.pipeline.execute;

import com.polyglot.pipeline.classify.Language;
import com.polyglot.pipeline.classify.Polyglot;
import com.polyglot.pipeline.transpile.Target;
import com.polyglot.pipeline.transpile.TranspiledConfig.GitConfig;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Materialises the document's {@code file:} blocks and commits them to a
 * fresh repository. Every file write and every git command is its own unit.
 */
@Component
public class GitExecutor extends ToolExecutor<GitConfig> {

    public GitExecutor(ProcessRunner runner, Workspaces workspaces) {
        super(runner, workspaces, GitConfig.class);
    }

    @Override public Language language() { return Language.GIT; }
    @Override protected Target target()  { return Target.GIT; }

    @Override
    protected ExecutionResult run(GitConfig config, Polyglot polyglot) {
        Optional<Path> sh = runner.locate("sh");
        if (sh.isEmpty() || runner.locate("git").isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("files", List.copyOf(config.files().keySet()));
            details.put("commands", config.initCommands());
            details.put(ExecutionResult.OUTPUT, "git not installed - would create "
                    + config.files().size() + " files and run " + config.initCommands().size() + " commands");
            return toolMissing("git", details);
        }

        try (Workspace ws = workspaces.acquire("repo")) {
            List<UnitResult> units = new ArrayList<>();
            int written = 0;
            for (Map.Entry<String, String> file : config.files().entrySet()) {
                String path = file.getKey();
                if (ws.resolve(path).isEmpty()) {
                    log.warn("Refusing to write '{}' outside the workspace", path);
                    units.add(UnitResult.failed("write " + path, "path escapes workspace"));
                    continue;
                }
                try {
                    ws.write(path, file.getValue());
                    written++;
                } catch (WorkspaceException e) {
                    units.add(UnitResult.failed("write " + path, e.getMessage()));
                }
            }

            StringBuilder gitOutput = new StringBuilder();
            for (String command : config.initCommands()) {
                UnitResult unit = UnitResult.of(command,
                        runner.run(Command.of(ws.dir(), sh.get().toString(), "-c", command)));
                gitOutput.append(unit.output());
                units.add(unit);
            }

            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("files_created", written);
            extra.put("git_output", gitOutput.toString());
            return batch(units, extra);
        }
    }
}
