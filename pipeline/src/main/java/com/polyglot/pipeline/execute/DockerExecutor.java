package com.polyglot.pipeline.execute;

import com.polyglot.pipeline.classify.Language;
import com.polyglot.pipeline.classify.Polyglot;
import com.polyglot.pipeline.transpile.Target;
import com.polyglot.pipeline.transpile.TranspiledConfig.DockerConfig;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Builds the document's Dockerfile with the workspace as build context. */
@Component
public class DockerExecutor extends ToolExecutor<DockerConfig> {

    public DockerExecutor(ProcessRunner runner, Workspaces workspaces) {
        super(runner, workspaces, DockerConfig.class);
    }

    @Override public Language language() { return Language.DOCKERFILE; }
    @Override protected Target target()  { return Target.DOCKER; }

    @Override
    protected ExecutionResult run(DockerConfig config, Polyglot polyglot) {
        Optional<Path> docker = runner.locate("docker");
        if (docker.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("image", config.image());
            details.put(ExecutionResult.OUTPUT, "docker not installed - would execute: " + config.buildCommand());
            return toolMissing("docker", details);
        }

        try (Workspace ws = workspaces.acquire("docker")) {
            Path dockerfile = ws.write("Dockerfile", config.dockerfile());
            Command build = Command.of(ws.dir(), docker.get().toString(),
                    "build", "-f", dockerfile.toString(), "-t", config.image(), ws.dir().toString());
            log.info("Building image {}", config.image());
            return fromOutcome(runner.run(build), output -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("image", config.image());
                details.put(ExecutionResult.OUTPUT, output);
                details.put("built_at", Instant.now().toString());
                return details;
            });
        }
    }
}
