package com.polyglot.pipeline.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides what a document is and pulls out its typed artifacts.
 *
 * Works on raw text, not the AST. Detection rules in priority order; the
 * first rule that matches picks the language, every rule that matches
 * contributes artifacts:
 * <ol>
 *   <li>{@code dockerfile} fence</li>
 *   <li>{@code terraform} / {@code hcl} fence</li>
 *   <li>fence whose YAML has both {@code apiVersion} and {@code kind}</li>
 *   <li>{@code polyglot:executable} directive plus a {@code bash} / {@code sh} fence</li>
 *   <li>{@code file:<path>} fences</li>
 *   <li>{@code sql} fences</li>
 * </ol>
 * Zero-width runs mark the metadata as a hidden payload when nothing above
 * matched. Otherwise the document is plain Markdown ({@link Language#NONE}).
 */
public final class MetadataExtractor {

    public static final String TYPE           = "type";
    public static final String SUBTYPE        = "subtype";
    public static final String POLYGLOT       = "polyglot";
    public static final String KYOZO          = "kyozo";
    public static final String ENVIRONMENT    = "environment";
    public static final String TERRAFORM_VARS = "terraform_vars";
    public static final String DIRECTIVES     = "directives";
    public static final String HIDDEN         = "hidden";
    public static final String CONTENT_LINKS  = "content_links";

    public static final String HIDDEN_PAYLOAD = "hidden_payload";
    public static final String ZERO_WIDTH     = "zero_width";

    private MetadataExtractor() {}

    public static Classification classify(String text) {
        String source = text == null ? "" : text;

        List<FencedBlock>   fences     = FenceScanner.scan(source);
        List<Directive>     directives = CommentScanner.scan(source);
        List<HiddenPayload> hidden     = ZeroWidthScanner.scan(source);
        List<ContentLink>   links      = ContentLinkScanner.scan(source);

        Detection detection = detect(fences, directives);
        Map<String, Object> metadata = buildMetadata(detection.language(), directives, hidden, links);
        return new Classification(detection.language(), detection.artifacts(), metadata, directives);
    }

    /**
     * Cheap pre-check used to skip full parsing of plain documents: no AST,
     * no metadata assembly.
     */
    public static boolean isPolyglot(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        if (ZeroWidthCodec.containsZeroWidth(text)) {
            return true;
        }
        List<Directive> directives = CommentScanner.scan(text);
        if (!directives.isEmpty() || ContentLinkScanner.CONTENT_LINK.matcher(text).find()) {
            return true;
        }
        return text.contains("```") && detect(FenceScanner.scan(text), directives).language() != Language.NONE;
    }

    // ------------------------------------------------------------------
    // Detection
    // ------------------------------------------------------------------

    private record Detection(Language language, List<Artifact> artifacts) {}

    private static Detection detect(List<FencedBlock> fences, List<Directive> directives) {
        List<Artifact> dockerfiles = dockerfileArtifacts(fences);
        List<Artifact> terraform   = terraformArtifacts(fences);
        List<Artifact> manifests   = kubernetesArtifacts(fences);
        List<Artifact> scripts     = executableArtifacts(fences, directives);
        List<Artifact> files       = fileArtifacts(fences);
        List<Artifact> sql         = sqlArtifacts(fences);

        Language language;
        if (!dockerfiles.isEmpty()) {
            language = Language.DOCKERFILE;
        } else if (!terraform.isEmpty()) {
            language = Language.TERRAFORM;
        } else if (!manifests.isEmpty()) {
            language = Language.KUBERNETES;
        } else if (!scripts.isEmpty()) {
            language = Language.EXECUTABLE;
        } else if (!files.isEmpty()) {
            language = Language.GIT;
        } else if (!sql.isEmpty()) {
            language = Language.SQL;
        } else {
            language = Language.NONE;
        }

        List<Artifact> all = new ArrayList<>();
        all.addAll(dockerfiles);
        all.addAll(terraform);
        all.addAll(manifests);
        all.addAll(scripts);
        all.addAll(files);
        all.addAll(sql);
        all.sort(Comparator.comparingInt(Artifact::line));
        return new Detection(language, all);
    }

    static List<Artifact> dockerfileArtifacts(List<FencedBlock> fences) {
        return fences.stream()
                .filter(f -> f.hasLang("dockerfile"))
                .map(f -> new Artifact(ArtifactType.DOCKERFILE, f.content(), null, false, f.startLine()))
                .toList();
    }

    static List<Artifact> terraformArtifacts(List<FencedBlock> fences) {
        return fences.stream()
                .filter(f -> f.hasLang("terraform", "hcl"))
                .map(f -> new Artifact(ArtifactType.TERRAFORM, f.content().strip(), null, false, f.startLine()))
                .toList();
    }

    static List<Artifact> kubernetesArtifacts(List<FencedBlock> fences) {
        return fences.stream()
                .filter(f -> !isClaimedByOtherRule(f))
                .filter(f -> KubernetesManifests.isManifest(f.content()))
                .map(f -> new Artifact(ArtifactType.KUBERNETES, f.content().strip(), null, false, f.startLine()))
                .toList();
    }

    static List<Artifact> executableArtifacts(List<FencedBlock> fences, List<Directive> directives) {
        boolean declared = directives.stream().anyMatch(MetadataExtractor::declaresExecutable);
        if (!declared) {
            return List.of();
        }
        return fences.stream()
                .filter(f -> f.hasLang("bash", "sh", "shell"))
                .map(f -> new Artifact(f.hasLang("bash") ? ArtifactType.BASH : ArtifactType.EXECUTABLE,
                        f.content().strip(), null, true, f.startLine()))
                .toList();
    }

    static List<Artifact> fileArtifacts(List<FencedBlock> fences) {
        return fences.stream()
                .filter(f -> f.filePath() != null)
                .map(f -> new Artifact(ArtifactType.FILE, withTrailingNewline(f.content()),
                        f.filePath(), false, f.startLine()))
                .toList();
    }

    static List<Artifact> sqlArtifacts(List<FencedBlock> fences) {
        return fences.stream()
                .filter(f -> f.hasLang("sql"))
                .map(f -> new Artifact(ArtifactType.SQL, f.content().strip(), null, false, f.startLine()))
                .toList();
    }

    private static boolean isClaimedByOtherRule(FencedBlock f) {
        return f.filePath() != null
                || f.hasLang("dockerfile", "terraform", "hcl", "bash", "sh", "shell", "sql");
    }

    static boolean declaresExecutable(Directive d) {
        return d.namespace().equals(Directive.POLYGLOT)
                && (d.name().equals("executable") || (d.name().equals("type") && "executable".equals(d.value())));
    }

    private static String withTrailingNewline(String content) {
        return content.isEmpty() || content.endsWith("\n") ? content : content + "\n";
    }

    // ------------------------------------------------------------------
    // Metadata
    // ------------------------------------------------------------------

    private static Map<String, Object> buildMetadata(Language language,
                                                     List<Directive> directives,
                                                     List<HiddenPayload> hidden,
                                                     List<ContentLink> links) {
        Map<String, Object> metadata = new LinkedHashMap<>();

        if (!directives.isEmpty()) {
            Directive first = directives.get(0);
            metadata.put(TYPE, first.namespace());
            metadata.put(SUBTYPE, first.name());
        }
        if (!hidden.isEmpty() && language == Language.NONE) {
            metadata.put(TYPE, HIDDEN_PAYLOAD);
            metadata.put(SUBTYPE, ZERO_WIDTH);
        }

        Map<String, Object> polyglot      = new LinkedHashMap<>();
        Map<String, Object> kyozo         = new LinkedHashMap<>();
        Map<String, Object> environment   = new LinkedHashMap<>();
        Map<String, Object> terraformVars = new LinkedHashMap<>();

        for (Directive d : directives) {
            if (d.namespace().equals(Directive.POLYGLOT)) {
                switch (d.name()) {
                    case "env"    -> environment.putAll(d.params());
                    case "tfvars" -> terraformVars.putAll(d.params());
                    default -> {
                        polyglot.put(d.name(), d.valueOrTrue());
                        polyglot.putAll(d.params());
                    }
                }
            } else {
                kyozo.put(d.name(), d.params().isEmpty() ? d.valueOrTrue() : d.params());
            }
        }

        putIfNotEmpty(metadata, POLYGLOT, polyglot);
        putIfNotEmpty(metadata, KYOZO, kyozo);
        putIfNotEmpty(metadata, ENVIRONMENT, environment);
        putIfNotEmpty(metadata, TERRAFORM_VARS, terraformVars);
        if (!directives.isEmpty()) {
            metadata.put(DIRECTIVES, directives.stream().map(Directive::toMap).toList());
        }
        if (!hidden.isEmpty()) {
            metadata.put(HIDDEN, hidden.stream().map(HiddenPayload::toMap).toList());
        }
        if (!links.isEmpty()) {
            metadata.put(CONTENT_LINKS, links.stream()
                    .map(l -> Map.<String, Object>of("text", l.text(), "hash", l.hash(), "line", l.line()))
                    .toList());
        }
        return Collections.unmodifiableMap(metadata);
    }

    private static void putIfNotEmpty(Map<String, Object> target, String key, Map<String, Object> value) {
        if (!value.isEmpty()) {
            target.put(key, Collections.unmodifiableMap(value));
        }
    }
}
