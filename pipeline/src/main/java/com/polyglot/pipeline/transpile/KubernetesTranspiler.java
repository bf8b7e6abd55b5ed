package com.polyglot.pipeline.transpile;

import com.polyglot.pipeline.classify.Artifact;
import com.polyglot.pipeline.classify.ArtifactType;
import com.polyglot.pipeline.classify.KubernetesManifests;
import com.polyglot.pipeline.classify.Polyglot;

import java.util.List;

final class KubernetesTranspiler {

    static final String DEFAULT_NAMESPACE = "default";

    private KubernetesTranspiler() {}

    static Transpilation transpile(Polyglot polyglot) {
        List<String> manifests = polyglot.artifactsOf(ArtifactType.KUBERNETES).stream()
                .map(Artifact::content)
                .toList();
        if (manifests.isEmpty()) {
            return Transpilation.Failure.missing(Target.KUBERNETES, ArtifactType.KUBERNETES);
        }
        String namespace = KubernetesManifests.namespace(manifests.get(0)).orElse(DEFAULT_NAMESPACE);
        return new Transpilation.Success(new TranspiledConfig.KubernetesConfig(
                manifests,
                namespace,
                "kubectl apply -n " + namespace + " -f -"));
    }
}
