package com.specmend.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Result of {@link DocumentParser#parse(String)}: top-level nodes plus a flat
 * view of every node in document order.
 */
public final class DocumentTree {

    private final List<DocumentNode> roots    = new ArrayList<>();
    private final List<DocumentNode> allNodes = new ArrayList<>();

    void addRoot(DocumentNode node) {
        roots.add(node);
    }

    void register(DocumentNode node) {
        allNodes.add(node);
    }

    public List<DocumentNode> getRoots() {
        return Collections.unmodifiableList(roots);
    }

    public List<DocumentNode> getAllNodes() {
        return Collections.unmodifiableList(allNodes);
    }

    public int size() {
        return allNodes.size();
    }

    public boolean isEmpty() {
        return allNodes.isEmpty();
    }

    /** First node in document order whose key matches, at any depth. */
    public Optional<DocumentNode> findFirst(String key) {
        return allNodes.stream().filter(n -> n.getKey().equals(key)).findFirst();
    }

    public Optional<DocumentNode> root(String key) {
        return roots.stream().filter(n -> n.getKey().equals(key)).findFirst();
    }
}
