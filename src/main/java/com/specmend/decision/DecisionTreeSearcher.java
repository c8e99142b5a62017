package com.specmend.decision;

import java.util.Locale;
import java.util.Optional;

/**
 * Recursive lookup over a {@link DecisionNode} tree.
 *
 * At each node:
 *   1. the node's own pattern is a substring of the issue   -> node's solution
 *   2. branch whose category keywords hit the issue         -> matching child, else branch's solution
 *   3. otherwise                                            -> first matching child, in order
 *
 * Stateless and side-effect free.
 */
final class DecisionTreeSearcher {

    private DecisionTreeSearcher() {}

    static String normalize(String issue) {
        return issue == null ? "" : issue.toLowerCase(Locale.ROOT).trim();
    }

    static Optional<Solution> search(DecisionNode root, String issue) {
        String normalized = normalize(issue);
        if (normalized.isEmpty()) return Optional.empty();
        return searchNode(root, normalized);
    }

    private static Optional<Solution> searchNode(DecisionNode node, String issue) {

        if (!node.getIssuePattern().isEmpty() && issue.contains(node.getIssuePattern())) {
            return Optional.of(Solution.from(node));
        }

        if (!node.isLeaf() && node.getCategory().matches(issue)) {
            Optional<Solution> specific = searchChildren(node, issue);
            if (specific.isPresent()) return specific;
            if (!node.getSolution().isEmpty()) {
                return Optional.of(Solution.from(node));
            }
        }

        return searchChildren(node, issue);
    }

    private static Optional<Solution> searchChildren(DecisionNode node, String issue) {
        for (DecisionNode child : node.getChildren()) {
            Optional<Solution> found = searchNode(child, issue);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }
}
