package com.polyglot.pipeline.execute;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyglot.pipeline.classify.Language;
import com.polyglot.pipeline.classify.Polyglot;
import com.polyglot.pipeline.transpile.Target;
import com.polyglot.pipeline.transpile.TranspiledConfig.TerraformConfig;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs {@code terraform init} then {@code terraform plan}. Nothing is
 * applied; the result names the apply command as the next step.
 */
@Component
public class TerraformExecutor extends ToolExecutor<TerraformConfig> {

    static final String VAR_FILE = "terraform.tfvars.json";

    private final ObjectMapper json;

    public TerraformExecutor(ProcessRunner runner, Workspaces workspaces, ObjectMapper objectMapper) {
        super(runner, workspaces, TerraformConfig.class);
        this.json = objectMapper;
    }

    @Override public Language language() { return Language.TERRAFORM; }
    @Override protected Target target()  { return Target.TERRAFORM; }

    @Override
    protected ExecutionResult run(TerraformConfig config, Polyglot polyglot) {
        Optional<Path> terraform = runner.locate("terraform");
        if (terraform.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("plan", "Terraform not installed - would execute: " + config.planCommand());
            details.put("next_step", "Install terraform to execute");
            return toolMissing("terraform", details);
        }

        try (Workspace ws = workspaces.acquire("tf")) {
            ws.write("main.tf", config.configuration());
            boolean hasVars = !config.variables().isEmpty();
            if (hasVars) {
                ws.write(VAR_FILE, toJson(config.variables()));
            }

            String bin = terraform.get().toString();
            ProcessOutcome init = runner.run(Command.of(ws.dir(), bin, "init", "-input=false", "-no-color"));
            if (!(init instanceof ProcessOutcome.Completed c && c.succeeded())) {
                log.warn("terraform init failed in {}", ws.dir());
                return fromOutcome(init, output -> Map.of());
            }

            List<String> plan = new ArrayList<>(List.of(bin, "plan", "-input=false", "-no-color"));
            if (hasVars) {
                plan.add("-var-file=" + VAR_FILE);
            }
            return fromOutcome(runner.run(new Command(plan, ws.dir(), null, Map.of())), output -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("plan", output);
                details.put("next_step", config.applyCommand());
                return details;
            });
        }
    }

    private String toJson(Map<String, Object> variables) {
        try {
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(variables);
        } catch (JsonProcessingException e) {
            throw new WorkspaceException("Failed to serialise terraform variables", e);
        }
    }
}
