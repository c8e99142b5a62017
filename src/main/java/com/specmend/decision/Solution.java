package com.specmend.decision;

/**
 * A canned fix returned by the decision tree.
 *
 * Equality is by value so repeated lookups of the same issue compare equal.
 */
public final class Solution {

    private final String        text;
    private final double        confidence;
    private final IssueCategory category;

    public Solution(String text, double confidence, IssueCategory category) {
        this.text       = text;
        this.confidence = confidence;
        this.category   = category;
    }

    static Solution from(DecisionNode node) {
        return new Solution(node.getSolution(), node.getConfidence(), node.getCategory());
    }

    public String getText() { return text; }

    public double getConfidence() { return confidence; }

    public IssueCategory getCategory() { return category; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Solution)) return false;
        Solution other = (Solution) o;
        return Double.compare(confidence, other.confidence) == 0
                && text.equals(other.text)
                && category == other.category;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * text.hashCode() + Double.hashCode(confidence)) + category.hashCode();
    }

    @Override
    public String toString() {
        return String.format("%s (%.2f)", text, confidence);
    }
}
