package com.polyglot.pipeline.transpile;

import com.polyglot.pipeline.classify.Artifact;
import com.polyglot.pipeline.classify.ArtifactType;
import com.polyglot.pipeline.classify.Polyglot;

import java.util.List;

final class DockerTranspiler {

    static final String DEFAULT_IMAGE = "polyglot:latest";

    private DockerTranspiler() {}

    static Transpilation transpile(Polyglot polyglot) {
        List<Artifact> dockerfiles = polyglot.artifactsOf(ArtifactType.DOCKERFILE);
        if (dockerfiles.isEmpty()) {
            return Transpilation.Failure.missing(Target.DOCKER, ArtifactType.DOCKERFILE);
        }
        String image = Transpilers.directive(polyglot, "image", DEFAULT_IMAGE);
        return new Transpilation.Success(new TranspiledConfig.DockerConfig(
                dockerfiles.get(0).content(),
                image,
                "docker build -t " + image + " -f Dockerfile ."));
    }
}
