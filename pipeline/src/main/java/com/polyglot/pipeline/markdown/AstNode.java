package com.polyglot.pipeline.markdown;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * mdast-compatible syntax tree.
 *
 * Nodes serialise with a {@code type} discriminator exactly like mdast, so a
 * standard mdast consumer can read the JSON. Non-standard metadata rides in
 * the open {@code data} map (under the {@code kyozo} key) instead of new node
 * types.
 *
 * Children lists and data maps are copied into unmodifiable collections on
 * construction; a tree is changed only by rebuilding it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AstNode.Root.class,      name = "root"),
        @JsonSubTypes.Type(value = AstNode.Heading.class,   name = "heading"),
        @JsonSubTypes.Type(value = AstNode.Paragraph.class, name = "paragraph"),
        @JsonSubTypes.Type(value = AstNode.Code.class,      name = "code"),
        @JsonSubTypes.Type(value = AstNode.Html.class,      name = "html"),
        @JsonSubTypes.Type(value = AstNode.ListBlock.class, name = "list"),
        @JsonSubTypes.Type(value = AstNode.ListItem.class,  name = "listItem"),
        @JsonSubTypes.Type(value = AstNode.Text.class,      name = "text"),
        @JsonSubTypes.Type(value = AstNode.Emphasis.class,  name = "emphasis"),
        @JsonSubTypes.Type(value = AstNode.Strong.class,    name = "strong"),
        @JsonSubTypes.Type(value = AstNode.Link.class,      name = "link"),
        @JsonSubTypes.Type(value = AstNode.Image.class,     name = "image")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface AstNode {

    /** mdast node type name, e.g. "heading" or "listItem". */
    @JsonIgnore
    String type();

    Position position();

    Map<String, Object> data();

    /** Returns a copy of this node carrying the given data map. */
    AstNode withData(Map<String, Object> data);

    /** Ordered children; empty for leaf nodes. */
    @JsonIgnore
    default List<AstNode> childNodes() {
        return List.of();
    }

    /** Nodes that own children. */
    sealed interface Parent extends AstNode
            permits Root, Heading, Paragraph, ListBlock, ListItem, Emphasis, Strong, Link {

        List<AstNode> children();

        /** Returns a copy of this node with its children replaced. */
        Parent withChildren(List<AstNode> children);

        @Override
        default List<AstNode> childNodes() {
            return children();
        }
    }

    record Point(int line, int column) {}

    record Position(Point start, Point end) {

        public static Position of(int startLine, int endLine, int endColumn) {
            return new Position(new Point(startLine, 1), new Point(endLine, endColumn));
        }
    }

    // ------------------------------------------------------------------
    // Block nodes
    // ------------------------------------------------------------------

    record Root(List<AstNode> children, Position position, Map<String, Object> data) implements Parent {
        public Root {
            children = List.copyOf(children);
            data = copyData(data);
        }
        public Root(List<AstNode> children) { this(children, null, null); }
        @Override public String type() { return "root"; }
        @Override public Root withData(Map<String, Object> d) { return new Root(children, position, d); }
        @Override public Root withChildren(List<AstNode> c) { return new Root(c, position, data); }
    }

    record Heading(int depth, List<AstNode> children, Position position, Map<String, Object> data)
            implements Parent {
        public Heading {
            children = List.copyOf(children);
            data = copyData(data);
        }
        @Override public String type() { return "heading"; }
        @Override public Heading withData(Map<String, Object> d) { return new Heading(depth, children, position, d); }
        @Override public Heading withChildren(List<AstNode> c) { return new Heading(depth, c, position, data); }
    }

    record Paragraph(List<AstNode> children, Position position, Map<String, Object> data) implements Parent {
        public Paragraph {
            children = List.copyOf(children);
            data = copyData(data);
        }
        @Override public String type() { return "paragraph"; }
        @Override public Paragraph withData(Map<String, Object> d) { return new Paragraph(children, position, d); }
        @Override public Paragraph withChildren(List<AstNode> c) { return new Paragraph(c, position, data); }
    }

    record Code(String lang, String meta, String value, Position position, Map<String, Object> data)
            implements AstNode {
        public Code {
            value = value == null ? "" : value;
            data = copyData(data);
        }
        @Override public String type() { return "code"; }
        @Override public Code withData(Map<String, Object> d) { return new Code(lang, meta, value, position, d); }
    }

    record Html(String value, Position position, Map<String, Object> data) implements AstNode {
        public Html {
            data = copyData(data);
        }
        @Override public String type() { return "html"; }
        @Override public Html withData(Map<String, Object> d) { return new Html(value, position, d); }
    }

    record ListBlock(boolean ordered, Integer start, List<AstNode> children, Position position,
                     Map<String, Object> data) implements Parent {
        public ListBlock {
            children = List.copyOf(children);
            data = copyData(data);
        }
        @Override public String type() { return "list"; }
        @Override public ListBlock withData(Map<String, Object> d) {
            return new ListBlock(ordered, start, children, position, d);
        }
        @Override public ListBlock withChildren(List<AstNode> c) {
            return new ListBlock(ordered, start, c, position, data);
        }
    }

    record ListItem(List<AstNode> children, Position position, Map<String, Object> data) implements Parent {
        public ListItem {
            children = List.copyOf(children);
            data = copyData(data);
        }
        @Override public String type() { return "listItem"; }
        @Override public ListItem withData(Map<String, Object> d) { return new ListItem(children, position, d); }
        @Override public ListItem withChildren(List<AstNode> c) { return new ListItem(c, position, data); }
    }

    // ------------------------------------------------------------------
    // Inline nodes
    // ------------------------------------------------------------------

    record Text(String value, Position position, Map<String, Object> data) implements AstNode {
        public Text {
            data = copyData(data);
        }
        public Text(String value) { this(value, null, null); }
        @Override public String type() { return "text"; }
        @Override public Text withData(Map<String, Object> d) { return new Text(value, position, d); }
    }

    record Emphasis(List<AstNode> children, Position position, Map<String, Object> data) implements Parent {
        public Emphasis {
            children = List.copyOf(children);
            data = copyData(data);
        }
        @Override public String type() { return "emphasis"; }
        @Override public Emphasis withData(Map<String, Object> d) { return new Emphasis(children, position, d); }
        @Override public Emphasis withChildren(List<AstNode> c) { return new Emphasis(c, position, data); }
    }

    record Strong(List<AstNode> children, Position position, Map<String, Object> data) implements Parent {
        public Strong {
            children = List.copyOf(children);
            data = copyData(data);
        }
        @Override public String type() { return "strong"; }
        @Override public Strong withData(Map<String, Object> d) { return new Strong(children, position, d); }
        @Override public Strong withChildren(List<AstNode> c) { return new Strong(c, position, data); }
    }

    record Link(String url, String title, List<AstNode> children, Position position, Map<String, Object> data)
            implements Parent {
        public Link {
            children = List.copyOf(children);
            data = copyData(data);
        }
        @Override public String type() { return "link"; }
        @Override public Link withData(Map<String, Object> d) { return new Link(url, title, children, position, d); }
        @Override public Link withChildren(List<AstNode> c) { return new Link(url, title, c, position, data); }
    }

    record Image(String url, String alt, Position position, Map<String, Object> data) implements AstNode {
        public Image {
            data = copyData(data);
        }
        @Override public String type() { return "image"; }
        @Override public Image withData(Map<String, Object> d) { return new Image(url, alt, position, d); }
    }

    private static Map<String, Object> copyData(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return null;
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
