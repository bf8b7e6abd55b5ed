package com.polyglot.pipeline.transpile;

import com.polyglot.pipeline.classify.Artifact;
import com.polyglot.pipeline.classify.ArtifactType;
import com.polyglot.pipeline.classify.Polyglot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class GitTranspiler {

    static final String DEFAULT_MESSAGE = "Initial commit";
    static final String COMMITTER_NAME  = "Polyglot";
    static final String COMMITTER_EMAIL = "polyglot@localhost";

    private GitTranspiler() {}

    static Transpilation transpile(Polyglot polyglot) {
        List<Artifact> files = polyglot.artifactsOf(ArtifactType.FILE);
        if (files.isEmpty()) {
            return Transpilation.Failure.missing(Target.GIT, ArtifactType.FILE);
        }

        // Later blocks for the same path replace earlier ones but keep the first position.
        Map<String, String> tree = new LinkedHashMap<>();
        for (Artifact file : files) {
            tree.put(file.location(), file.content());
        }

        String message = Transpilers.directive(polyglot, "commit_message", DEFAULT_MESSAGE);
        List<String> commands = List.of(
                "git init -q",
                "git add .",
                "git -c user.name=" + shellQuote(COMMITTER_NAME)
                        + " -c user.email=" + shellQuote(COMMITTER_EMAIL)
                        + " commit -q -m " + shellQuote(message));
        return new Transpilation.Success(new TranspiledConfig.GitConfig(tree, commands));
    }

    /** POSIX single-quoting: the result is always one literal word. */
    static String shellQuote(String s) {
        return "'" + s.replace("'", "'\\''") + "'";
    }
}
