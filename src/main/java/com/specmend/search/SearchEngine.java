package com.specmend.search;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.specmend.config.SearchSettings;
import com.specmend.oracle.OracleException;

/**
 * Monte Carlo Tree Search over repair states.
 *
 * One iteration:
 *   1. SELECT     descend by UCB1 while the node is expanded and has children
 *   2. EXPAND     add one child for the next untried action, if any
 *   3. SIMULATE   ask the oracle for a reward (the only external call)
 *   4. BACKPROP   add the reward to every node up to the root
 *   5. STOP       early when the reward beats the high-quality threshold
 *
 * Iterations run strictly one after another. The tree is built fresh for each
 * call and dropped when it returns; an oracle failure aborts the call.
 */
@Component
public class SearchEngine {

    private static final Logger log = LoggerFactory.getLogger(SearchEngine.class);

    private final SearchSettings settings;

    public SearchEngine(SearchSettings settings) {
        this.settings = settings;
    }

    public SearchTreeNode search(SearchState initialState, SimulationOracle oracle)
            throws SearchException, OracleException {
        return search(initialState, settings.getMaxIterations(), oracle);
    }

    /**
     * @return the node reached by following the highest average reward from the root
     * @throws SearchException  NO_VALID_PATH_FOUND when the root never got a child
     * @throws OracleException  propagated unchanged from the oracle
     */
    public SearchTreeNode search(SearchState initialState, int maxIterations, SimulationOracle oracle)
            throws SearchException, OracleException {

        if (initialState == null) {
            throw SearchException.initializationFailed();
        }
        SearchTreeNode root = SearchTreeNode.root(initialState);

        log.info("[MCTS] Search started: {} outstanding issues, up to {} iterations",
                initialState.getOutstandingIssues().size(), maxIterations);

        for (int iteration = 1; iteration <= maxIterations; iteration++) {

            SearchTreeNode selected = select(root);
            SearchTreeNode expanded = expand(selected);
            double         reward   = oracle.simulate(expanded);
            backpropagate(expanded, reward);

            if (reward > settings.getHighQualityThreshold()) {
                log.info("[MCTS] High-quality result at iteration {} (reward {})", iteration, reward);
                break;
            }

            if (iteration % settings.getProgressInterval() == 0) {
                double best = root.bestChild().map(SearchTreeNode::averageReward).orElse(0.0);
                log.info("[MCTS] Iteration {}: best average reward {}", iteration, String.format("%.3f", best));
            }
        }

        return bestPath(root);
    }

    // =========================================================================
    // Phases
    // =========================================================================

    SearchTreeNode select(SearchTreeNode root) {
        SearchTreeNode current = root;
        while (!current.isLeaf() && current.isFullyExpanded()) {
            current = highestUcb1Child(current);
        }
        return current;
    }

    SearchTreeNode expand(SearchTreeNode node) {
        if (!node.canExpand()) {
            return node;
        }
        Optional<RepairAction> untried = node.untriedAction();
        return untried.isPresent() ? node.expand(untried.get()) : node;
    }

    void backpropagate(SearchTreeNode node, double reward) {
        SearchTreeNode current = node;
        while (current != null) {
            current.update(reward);
            current = current.getParent();
        }
    }

    SearchTreeNode bestPath(SearchTreeNode root) throws SearchException {
        if (root.isLeaf()) {
            throw SearchException.noValidPathFound();
        }
        SearchTreeNode current = root;
        while (!current.isLeaf()) {
            current = current.bestChild().orElseThrow();
        }
        log.info("[MCTS] Best path ends at depth {} ({} outstanding, avg reward {})",
                current.getDepth(),
                current.getState().getOutstandingIssues().size(),
                String.format("%.3f", current.averageReward()));
        return current;
    }

    // =========================================================================
    // UCB1
    // =========================================================================

    private SearchTreeNode highestUcb1Child(SearchTreeNode node) {
        SearchTreeNode best      = null;
        double         bestScore = Double.NEGATIVE_INFINITY;
        for (SearchTreeNode child : node.getChildren()) {
            double score = ucb1(child);
            if (best == null || score > bestScore) {
                best      = child;
                bestScore = score;
            }
        }
        return best;
    }

    /** Unvisited children score +infinity so every action is tried once first. */
    double ucb1(SearchTreeNode node) {
        SearchTreeNode parent = node.getParent();
        if (node.getVisitCount() == 0 || parent == null) {
            return Double.POSITIVE_INFINITY;
        }
        double exploitation = node.averageReward();
        double exploration  = settings.getExplorationConstant()
                * Math.sqrt(Math.log(parent.getVisitCount()) / node.getVisitCount());
        return exploitation + exploration;
    }

    // =========================================================================
    // Errors
    // =========================================================================

    public static class SearchException extends Exception {

        public enum Reason {
            INITIALIZATION_FAILED,
            NO_VALID_PATH_FOUND
        }

        private final Reason reason;

        public SearchException(Reason reason, String message) {
            super(message);
            this.reason = reason;
        }

        public static SearchException initializationFailed() {
            return new SearchException(Reason.INITIALIZATION_FAILED, "Search tree could not be initialized");
        }

        public static SearchException noValidPathFound() {
            return new SearchException(Reason.NO_VALID_PATH_FOUND, "Search finished without expanding the root");
        }

        public Reason getReason() {
            return reason;
        }
    }
}
