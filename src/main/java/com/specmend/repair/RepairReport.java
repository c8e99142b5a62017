package com.specmend.repair;

import java.util.List;

/**
 * Outcome of one repair loop run.
 *
 * When {@code valid} is false the loop ran out of iterations and
 * {@code remainingIssues} holds what the last validation still reported.
 */
public final class RepairReport {

    private final boolean      valid;
    private final String       specification;
    private final int          iterations;
    private final List<String> remainingIssues;
    private final List<String> fixedIssues;
    private final List<String> persistentIssues;
    private final boolean      escalated;
    private final double       finalConfidence;

    public RepairReport(
            boolean      valid,
            String       specification,
            int          iterations,
            List<String> remainingIssues,
            List<String> fixedIssues,
            List<String> persistentIssues,
            boolean      escalated,
            double       finalConfidence
    ) {
        this.valid            = valid;
        this.specification    = specification;
        this.iterations       = iterations;
        this.remainingIssues  = List.copyOf(remainingIssues);
        this.fixedIssues      = List.copyOf(fixedIssues);
        this.persistentIssues = List.copyOf(persistentIssues);
        this.escalated        = escalated;
        this.finalConfidence  = finalConfidence;
    }

    public boolean isValid() { return valid; }

    public String getSpecification() { return specification; }

    public int getIterations() { return iterations; }

    public List<String> getRemainingIssues() { return remainingIssues; }

    public List<String> getFixedIssues() { return fixedIssues; }

    public List<String> getPersistentIssues() { return persistentIssues; }

    public boolean isEscalated() { return escalated; }

    public double getFinalConfidence() { return finalConfidence; }

    @Override
    public String toString() {
        return String.format("RepairReport{valid=%s, iterations=%d, remaining=%d, fixed=%d, escalated=%s, confidence=%.2f}",
                valid, iterations, remainingIssues.size(), fixedIssues.size(), escalated, finalConfidence);
    }
}
