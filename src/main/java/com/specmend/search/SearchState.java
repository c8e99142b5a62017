package com.specmend.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.specmend.config.SearchSettings;

/**
 * Immutable snapshot of a candidate document during search.
 *
 * Every transition ({@link #apply}, {@link #withSpecification},
 * {@link #withIssues}) returns a new instance.
 *
 *   progress   = fixed / (fixed + outstanding + 1)
 *   confidence = min(1, progress - parentDepth * 0.01)      after apply
 *   reward     = max(0, progress - depth * 0.02 + 0.5 if valid)
 *
 * Neither confidence nor reward is clamped to [0, 1] on every path:
 * confidence can go negative and reward can exceed 1.
 */
public final class SearchState {

    static final double CONFIDENCE_DEPTH_PENALTY = 0.01;
    static final double REWARD_DEPTH_PENALTY     = 0.02;
    static final double VALIDITY_BONUS           = 0.5;
    static final int    ENHANCE_ISSUE_LIMIT      = 2;

    private final String         specification;
    private final List<String>   outstandingIssues;
    private final List<String>   fixedIssues;
    private final int            depth;
    private final double         confidence;
    private final SearchSettings settings;

    public SearchState(
            String specification,
            List<String> outstandingIssues,
            List<String> fixedIssues,
            int depth,
            double confidence,
            SearchSettings settings
    ) {
        this.specification     = specification != null ? specification : "";
        this.outstandingIssues = List.copyOf(outstandingIssues);
        this.fixedIssues       = List.copyOf(fixedIssues);
        this.depth             = depth;
        this.confidence        = confidence;
        this.settings          = Objects.requireNonNull(settings, "settings");
    }

    public static SearchState initial(String specification, List<String> issues, SearchSettings settings) {
        return new SearchState(specification, issues, List.of(), 0, 0.0, settings);
    }

    public static SearchState initial(String specification, List<String> issues) {
        return initial(specification, issues, SearchSettings.defaults());
    }

    // =========================================================================
    // Derived properties
    // =========================================================================

    public boolean isTerminal() {
        return outstandingIssues.isEmpty() || depth >= settings.getMaxDepth();
    }

    public boolean isValid() {
        return outstandingIssues.isEmpty() && confidence > settings.getValidConfidenceThreshold();
    }

    public double progress() {
        return (double) fixedIssues.size() / (fixedIssues.size() + outstandingIssues.size() + 1);
    }

    public double reward() {
        double bonus = isValid() ? VALIDITY_BONUS : 0.0;
        return Math.max(0.0, progress() - depth * REWARD_DEPTH_PENALTY + bonus);
    }

    /**
     * Fix actions for the first few outstanding issues, two enhance actions once
     * little is left, then a single validate action. Empty when terminal.
     */
    public List<RepairAction> availableActions() {
        if (isTerminal()) return List.of();

        List<RepairAction> actions = new ArrayList<>();
        int fixes = Math.min(outstandingIssues.size(), settings.getMaxActionsPerNode());
        for (int i = 0; i < fixes; i++) {
            actions.add(RepairAction.fix(outstandingIssues.get(i)));
        }
        if (outstandingIssues.size() <= ENHANCE_ISSUE_LIMIT) {
            actions.add(RepairAction.enhance("schemas"));
            actions.add(RepairAction.enhance("examples"));
        }
        actions.add(RepairAction.validate("full"));
        return actions;
    }

    // =========================================================================
    // Transitions
    // =========================================================================

    public SearchState apply(RepairAction action) {

        List<String> issues = new ArrayList<>(outstandingIssues);
        List<String> fixed  = new ArrayList<>(fixedIssues);

        if (action.getType() == ActionType.FIX && issues.remove(action.getTarget())) {
            fixed.add(action.getTarget());
        }

        double base          = (double) fixed.size() / (fixed.size() + issues.size() + 1);
        double newConfidence = Math.min(1.0, base - depth * CONFIDENCE_DEPTH_PENALTY);

        return new SearchState(specification, issues, fixed, depth + 1, newConfidence, settings);
    }

    public SearchState withSpecification(String newSpecification) {
        return new SearchState(newSpecification, outstandingIssues, fixedIssues, depth, confidence, settings);
    }

    /**
     * Replaces the outstanding issues. Issues that disappeared are recorded as
     * fixed; issues reported again are no longer counted as fixed.
     */
    public SearchState withIssues(List<String> newOutstanding) {
        List<String> fixed = new ArrayList<>(fixedIssues);
        for (String issue : outstandingIssues) {
            if (!newOutstanding.contains(issue) && !fixed.contains(issue)) {
                fixed.add(issue);
            }
        }
        fixed.removeAll(newOutstanding);
        return new SearchState(specification, newOutstanding, fixed, depth, confidence, settings);
    }

    public SearchState withConfidence(double newConfidence) {
        return new SearchState(specification, outstandingIssues, fixedIssues, depth, newConfidence, settings);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String getSpecification() { return specification; }

    public List<String> getOutstandingIssues() { return outstandingIssues; }

    public List<String> getFixedIssues() { return fixedIssues; }

    public int getDepth() { return depth; }

    public double getConfidence() { return confidence; }

    @Override
    public String toString() {
        return String.format("SearchState{depth=%d, outstanding=%d, fixed=%d, confidence=%.3f}",
                depth, outstandingIssues.size(), fixedIssues.size(), confidence);
    }
}
