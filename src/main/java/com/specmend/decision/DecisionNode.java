package com.specmend.decision;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One entry of the fix catalogue.
 *
 * Fully immutable: children are fixed at construction, so a built tree can be
 * read from any number of threads without synchronization.
 */
public final class DecisionNode {

    private final IssueCategory      category;
    private final String             issuePattern;
    private final String             solution;
    private final double             confidence;
    private final List<DecisionNode> children;

    public DecisionNode(IssueCategory category, String issuePattern, String solution, double confidence) {
        this(category, issuePattern, solution, confidence, List.of());
    }

    public DecisionNode(
            IssueCategory category,
            String issuePattern,
            String solution,
            double confidence,
            List<DecisionNode> children
    ) {
        this.category     = category;
        this.issuePattern = issuePattern != null ? issuePattern : "";
        this.solution     = solution != null ? solution : "";
        this.confidence   = confidence;
        this.children     = List.copyOf(children);
    }

    public IssueCategory getCategory() { return category; }

    public String getIssuePattern() { return issuePattern; }

    public String getSolution() { return solution; }

    public double getConfidence() { return confidence; }

    public List<DecisionNode> getChildren() { return children; }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** Every node below this one, depth-first, parents before children. */
    public List<DecisionNode> allDescendants() {
        List<DecisionNode> out = new ArrayList<>();
        for (DecisionNode child : children) {
            out.add(child);
            out.addAll(child.allDescendants());
        }
        return out;
    }

    /** Node whose issue pattern equals {@code pattern} exactly, searching depth-first. */
    public Optional<DecisionNode> findNode(String pattern) {
        if (issuePattern.equals(pattern)) return Optional.of(this);
        for (DecisionNode child : children) {
            Optional<DecisionNode> found = child.findNode(pattern);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    /** 0 for a leaf, otherwise 1 + the deepest child. */
    public int depth() {
        int deepest = 0;
        for (DecisionNode child : children) {
            deepest = Math.max(deepest, child.depth());
        }
        return isLeaf() ? 0 : 1 + deepest;
    }

    @Override
    public String toString() {
        return "DecisionNode{" + category.getLabel() + " '" + issuePattern + "' -> " + solution + "}";
    }
}
