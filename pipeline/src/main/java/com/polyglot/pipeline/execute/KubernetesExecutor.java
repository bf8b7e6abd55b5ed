package com.polyglot.pipeline.execute;

import com.polyglot.pipeline.classify.KubernetesManifests;
import com.polyglot.pipeline.classify.Language;
import com.polyglot.pipeline.classify.Polyglot;
import com.polyglot.pipeline.transpile.Target;
import com.polyglot.pipeline.transpile.TranspiledConfig.KubernetesConfig;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies each manifest with its own {@code kubectl apply}; one bad manifest
 * does not stop the rest.
 */
@Component
public class KubernetesExecutor extends ToolExecutor<KubernetesConfig> {

    static final String MOCK_OUTPUT = "kubectl not installed - mock execution";

    public KubernetesExecutor(ProcessRunner runner, Workspaces workspaces) {
        super(runner, workspaces, KubernetesConfig.class);
    }

    @Override public Language language() { return Language.KUBERNETES; }
    @Override protected Target target()  { return Target.KUBERNETES; }

    @Override
    protected ExecutionResult run(KubernetesConfig config, Polyglot polyglot) {
        List<String> manifests = config.manifests();
        Optional<Path> kubectl = runner.locate("kubectl");
        if (kubectl.isEmpty()) {
            List<UnitResult> units = new ArrayList<>();
            for (int i = 0; i < manifests.size(); i++) {
                units.add(new UnitResult(label(i, manifests.get(i)), true, 0, MOCK_OUTPUT));
            }
            log.warn("kubectl not found on search path, returning mock result");
            return ExecutionResult.mock(language(),
                    batch(units, Map.of("namespace", config.namespace())).details());
        }

        try (Workspace ws = workspaces.acquire("k8s")) {
            List<UnitResult> units = new ArrayList<>();
            for (int i = 0; i < manifests.size(); i++) {
                Command apply = Command.of(ws.dir(), kubectl.get().toString(), "apply", "-f", "-")
                        .withStdin(manifests.get(i));
                UnitResult unit = UnitResult.of(label(i, manifests.get(i)), runner.run(apply));
                log.debug("{}: ok={} code={}", unit.unit(), unit.ok(), unit.code());
                units.add(unit);
            }
            return batch(units, Map.of("namespace", config.namespace()));
        }
    }

    /** {@code configmap[0]}, or {@code manifest[0]} when the kind is unreadable. */
    static String label(int index, String manifest) {
        return KubernetesManifests.kind(manifest).orElse("manifest") + "[" + index + "]";
    }
}
