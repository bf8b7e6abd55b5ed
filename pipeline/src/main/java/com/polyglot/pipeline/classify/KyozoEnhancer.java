package com.polyglot.pipeline.classify;

import com.polyglot.pipeline.markdown.AstNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges extracted metadata back onto the tree under {@code data.kyozo}.
 *
 * <ul>
 *   <li>code node opened on an artifact's line: artifact type, location, executable flag</li>
 *   <li>directive comments directly above a code node (blank lines allowed): attached to it</li>
 *   <li>html node holding directives: the directives it holds</li>
 * </ul>
 * The tree shape never changes; nodes are rebuilt with merged data and any
 * existing {@code data} entries are kept.
 */
public final class KyozoEnhancer {

    public static final String DATA_KEY = "kyozo";

    private KyozoEnhancer() {}

    public static AstNode.Root enhance(AstNode.Root root, Classification classification) {
        return (AstNode.Root) enhanceNode(root, classification);
    }

    private static AstNode enhanceNode(AstNode node, Classification c) {
        if (node instanceof AstNode.Parent parent) {
            return parent.withChildren(enhanceChildren(parent.children(), c));
        }
        return node;
    }

    private static List<AstNode> enhanceChildren(List<AstNode> children, Classification c) {
        List<AstNode> out = new ArrayList<>(children.size());
        List<Directive> pending = new ArrayList<>();

        for (AstNode child : children) {
            if (child instanceof AstNode.Html html) {
                List<Directive> held = directivesIn(html, c.directives());
                if (held.isEmpty()) {
                    pending.clear();
                    out.add(html);
                } else {
                    pending.addAll(held);
                    out.add(merge(html, Map.of("directives", held.stream().map(Directive::toMap).toList())));
                }
            } else if (child instanceof AstNode.Code code) {
                out.add(enhanceCode(code, List.copyOf(pending), c));
                pending.clear();
            } else {
                pending.clear();
                out.add(enhanceNode(child, c));
            }
        }
        return out;
    }

    private static AstNode enhanceCode(AstNode.Code code, List<Directive> attached, Classification c) {
        Optional<Artifact> artifact = code.position() == null ? Optional.empty()
                : c.artifacts().stream()
                        .filter(a -> a.line() == code.position().start().line())
                        .findFirst();
        if (artifact.isEmpty() && attached.isEmpty()) {
            return code;
        }

        Map<String, Object> kyozo = new LinkedHashMap<>();
        boolean executable = false;
        if (artifact.isPresent()) {
            Artifact a = artifact.get();
            kyozo.put("artifact", a.type().wireName());
            if (a.location() != null) {
                kyozo.put("location", a.location());
            }
            executable = a.executable();
        }

        for (Directive d : attached) {
            if (MetadataExtractor.declaresExecutable(d)) {
                executable = true;
            }
            if (d.name().equals("json")) {
                executable = executable || Boolean.TRUE.equals(d.params().get("executable"));
                kyozo.put("enlightened", Boolean.TRUE.equals(d.params().get("enlighten")));
                kyozo.put("metadata", d.params());
            }
        }
        kyozo.put("executable", executable);
        if (!attached.isEmpty()) {
            kyozo.put("directives", attached.stream().map(Directive::toMap).toList());
        }
        return merge(code, kyozo);
    }

    private static List<Directive> directivesIn(AstNode.Html html, List<Directive> directives) {
        if (html.position() == null) {
            return List.of();
        }
        int start = html.position().start().line();
        int end = html.position().end().line();
        return directives.stream()
                .filter(d -> d.line() >= start && d.line() <= end)
                .toList();
    }

    private static AstNode merge(AstNode node, Map<String, Object> kyozo) {
        Map<String, Object> data = node.data() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(node.data());
        Map<String, Object> merged = new LinkedHashMap<>(kyozo);
        if (data.get(DATA_KEY) instanceof Map<?, ?> existing) {
            existing.forEach((k, v) -> merged.put(String.valueOf(k), v));
        }
        data.put(DATA_KEY, merged);
        return node.withData(data);
    }
}
