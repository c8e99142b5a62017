package com.specmend.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One node of a single search() call's tree.
 *
 * The tree is owned by the engine for the duration of the call. The parent
 * reference is only walked upward during backpropagation.
 *
 * State is replaceable: the simulation oracle may swap in a state carrying the
 * document it actually produced. SearchState itself stays immutable.
 */
public final class SearchTreeNode {

    private final SearchTreeNode       parent;
    private final RepairAction         action;
    private final List<SearchTreeNode> children = new ArrayList<>();

    private SearchState state;
    private int         visitCount;
    private double      cumulativeReward;

    SearchTreeNode(SearchState state, SearchTreeNode parent, RepairAction action) {
        this.state  = state;
        this.parent = parent;
        this.action = action;
    }

    static SearchTreeNode root(SearchState state) {
        return new SearchTreeNode(state, null, null);
    }

    // =========================================================================
    // Tree structure
    // =========================================================================

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isFullyExpanded() {
        return children.size() >= state.availableActions().size();
    }

    public boolean canExpand() {
        return !isFullyExpanded() && !state.isTerminal();
    }

    /** Next action in {@link SearchState#availableActions()} order without a child yet. */
    Optional<RepairAction> untriedAction() {
        List<RepairAction> actions = state.availableActions();
        return children.size() < actions.size()
                ? Optional.of(actions.get(children.size()))
                : Optional.empty();
    }

    SearchTreeNode expand(RepairAction untried) {
        SearchTreeNode child = new SearchTreeNode(state.apply(untried), this, untried);
        children.add(child);
        return child;
    }

    /** Child with the highest average reward; the first one wins ties. */
    public Optional<SearchTreeNode> bestChild() {
        SearchTreeNode best = null;
        for (SearchTreeNode child : children) {
            if (best == null || child.averageReward() > best.averageReward()) {
                best = child;
            }
        }
        return Optional.ofNullable(best);
    }

    // =========================================================================
    // Statistics
    // =========================================================================

    void update(double reward) {
        visitCount++;
        cumulativeReward += reward;
    }

    public double averageReward() {
        return visitCount == 0 ? 0.0 : cumulativeReward / visitCount;
    }

    // =========================================================================
    // State
    // =========================================================================

    public SearchState getState() {
        return state;
    }

    public void setState(SearchState state) {
        this.state = state;
    }

    public void updateSpecification(String specification) {
        this.state = state.withSpecification(specification);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public SearchTreeNode getParent() { return parent; }

    /** Action that produced this node; null for the root. */
    public RepairAction getAction() { return action; }

    public List<SearchTreeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getVisitCount() { return visitCount; }

    public int getDepth() { return state.getDepth(); }

    @Override
    public String toString() {
        return String.format("SearchTreeNode{action=%s, visits=%d, avg=%.3f, %s}",
                action, visitCount, averageReward(), state);
    }
}
