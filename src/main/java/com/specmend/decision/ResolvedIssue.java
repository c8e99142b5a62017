package com.specmend.decision;

/** An issue paired with the solution the decision tree found for it. */
public final class ResolvedIssue {

    private final String   issue;
    private final Solution solution;

    public ResolvedIssue(String issue, Solution solution) {
        this.issue    = issue;
        this.solution = solution;
    }

    public String getIssue() { return issue; }

    public Solution getSolution() { return solution; }

    public String getSolutionText() { return solution.getText(); }

    public double getConfidence() { return solution.getConfidence(); }

    @Override
    public String toString() {
        return issue + " -> " + solution;
    }
}
