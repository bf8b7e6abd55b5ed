package com.polyglot.pipeline.transpile;

import com.polyglot.pipeline.classify.Artifact;
import com.polyglot.pipeline.classify.ArtifactType;
import com.polyglot.pipeline.classify.Polyglot;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Script contents are passed through untouched, joined by a blank line. The
 * interpreter line is reported separately: the first block's own shebang, or
 * {@link #DEFAULT_SHEBANG}.
 */
final class BashTranspiler {

    static final String DEFAULT_SHEBANG = "#!/usr/bin/env bash";

    private BashTranspiler() {}

    static Transpilation transpile(Polyglot polyglot) {
        List<Artifact> scripts = polyglot.artifactsOf(ArtifactType.BASH, ArtifactType.EXECUTABLE);
        if (scripts.isEmpty()) {
            return Transpilation.Failure.missing(Target.BASH, ArtifactType.BASH);
        }
        String script = scripts.stream()
                .map(Artifact::content)
                .collect(Collectors.joining("\n\n"));
        return new Transpilation.Success(new TranspiledConfig.BashConfig(
                script, shebang(scripts.get(0).content()), Transpilers.environment(polyglot)));
    }

    private static String shebang(String content) {
        if (!content.startsWith("#!")) {
            return DEFAULT_SHEBANG;
        }
        int nl = content.indexOf('\n');
        return (nl < 0 ? content : content.substring(0, nl)).strip();
    }
}
