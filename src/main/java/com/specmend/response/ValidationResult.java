package com.specmend.response;

import java.util.List;

/**
 * Validity verdict with its issue list and a heuristic confidence.
 *
 * Confidence is not a calibrated probability and is not clamped here.
 */
public final class ValidationResult {

    private final boolean      valid;
    private final List<String> issues;
    private final double       confidence;

    public ValidationResult(boolean valid, List<String> issues, double confidence) {
        this.valid      = valid;
        this.issues     = issues != null ? List.copyOf(issues) : List.of();
        this.confidence = confidence;
    }

    public static ValidationResult invalid(List<String> issues, double confidence) {
        return new ValidationResult(false, issues, confidence);
    }

    public boolean isValid() { return valid; }

    public List<String> getIssues() { return issues; }

    public double getConfidence() { return confidence; }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("ValidationResult{valid=%s, issues=%d, confidence=%.2f}",
                valid, issues.size(), confidence);
    }
}
