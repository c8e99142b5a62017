package com.specmend.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One key/value line of an indented contract document.
 *
 * A node with no value is a block: deeper lines that follow it become its
 * children. Children are owned exclusively by their parent; the tree has no
 * back-references and no cross-links.
 *
 * INVARIANT: path equals the key sequence of the enclosing block nodes,
 * outermost first. Top-level nodes have an empty path.
 */
public final class DocumentNode {

    private static final Set<String> HTTP_METHODS =
            Set.of("get", "post", "put", "patch", "delete", "head", "options");

    private final DocumentNodeKind   kind;
    private final String             key;
    private final String             value;
    private final List<String>       path;
    private final int                line;
    private final List<DocumentNode> children = new ArrayList<>();

    public DocumentNode(DocumentNodeKind kind, String key, String value, List<String> path, int line) {
        this.kind  = kind;
        this.key   = key;
        this.value = value;
        this.path  = path != null ? List.copyOf(path) : List.of();
        this.line  = line;
    }

    void addChild(DocumentNode child) {
        children.add(child);
    }

    public DocumentNodeKind getKind() { return kind; }

    public String getKey() { return key; }

    /** Null for block nodes. */
    public String getValue() { return value; }

    public List<String> getPath() { return path; }

    public int getLine() { return line; }

    public List<DocumentNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isBlock() {
        return value == null;
    }

    public boolean isHttpMethod() {
        return kind == DocumentNodeKind.OPERATION && HTTP_METHODS.contains(key.toLowerCase());
    }

    /** Dotted form of path + key, e.g. {@code paths./widgets.get}. */
    public String getQualifiedName() {
        if (path.isEmpty()) return key;
        return String.join(".", path) + "." + key;
    }

    public Optional<DocumentNode> child(String childKey) {
        for (DocumentNode child : children) {
            if (child.key.equals(childKey)) return Optional.of(child);
        }
        return Optional.empty();
    }

    public boolean hasChild(String childKey) {
        return child(childKey).isPresent();
    }

    @Override
    public String toString() {
        return "DocumentNode{" + kind + " " + getQualifiedName()
                + (value != null ? "=" + value : "") + " @" + line + "}";
    }
}
