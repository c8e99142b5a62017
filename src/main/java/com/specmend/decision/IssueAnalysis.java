package com.specmend.decision;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view of a batch of issues run through the decision tree.
 */
public final class IssueAnalysis {

    private final int                         totalIssues;
    private final List<ResolvedIssue>         solutions;
    private final Map<IssueCategory, Integer> categories;
    private final double                      confidence;
    private final List<String>                recommendations;

    public IssueAnalysis(
            int totalIssues,
            List<ResolvedIssue> solutions,
            Map<IssueCategory, Integer> categories,
            double confidence,
            List<String> recommendations
    ) {
        this.totalIssues     = totalIssues;
        this.solutions       = List.copyOf(solutions);
        this.categories      = categories.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(categories));
        this.confidence      = confidence;
        this.recommendations = List.copyOf(recommendations);
    }

    public int getTotalIssues() { return totalIssues; }

    public int getResolvedIssues() { return solutions.size(); }

    /** resolved / total, 0 when there were no issues. */
    public double getResolutionRate() {
        return totalIssues == 0 ? 0.0 : (double) solutions.size() / totalIssues;
    }

    /** Issue counts per category; categories with no issues are absent. */
    public Map<IssueCategory, Integer> getCategories() { return categories; }

    /** Mean confidence of resolved issues, 0 when nothing resolved. */
    public double getConfidence() { return confidence; }

    public List<String> getRecommendations() { return recommendations; }

    public List<ResolvedIssue> getSolutions() { return solutions; }

    /** Category with the most issues; earliest category wins ties. Null when empty. */
    public IssueCategory getTopCategory() {
        IssueCategory top = null;
        int best = 0;
        for (Map.Entry<IssueCategory, Integer> e : categories.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                top  = e.getKey();
            }
        }
        return top;
    }

    /** True when every issue resolved and each resolution is at least {@code threshold}. */
    public boolean isFullyResolved(double threshold) {
        if (totalIssues == 0 || solutions.size() != totalIssues) return false;
        return solutions.stream().allMatch(s -> s.getConfidence() >= threshold);
    }

    @Override
    public String toString() {
        return String.format("IssueAnalysis{total=%d, resolved=%d, confidence=%.2f, top=%s}",
                totalIssues, solutions.size(), confidence, getTopCategory());
    }
}
