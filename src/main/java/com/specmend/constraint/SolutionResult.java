package com.specmend.constraint;

import java.util.List;

/**
 * Outcome of {@link ConstraintSolver#solve(List)}.
 *
 * satisfactionRate = satisfied / total, 1.0 for an empty constraint set.
 */
public final class SolutionResult {

    private final List<Constraint>          satisfied;
    private final List<ConstraintViolation> violations;
    private final double                    satisfactionRate;

    public SolutionResult(List<Constraint> satisfied, List<ConstraintViolation> violations) {
        this.satisfied  = List.copyOf(satisfied);
        this.violations = List.copyOf(violations);

        int total = this.satisfied.size() + this.violations.size();
        this.satisfactionRate = total == 0 ? 1.0 : (double) this.satisfied.size() / total;
    }

    public boolean isSatisfied() {
        return violations.isEmpty();
    }

    public List<Constraint> getSatisfied() { return satisfied; }

    public List<ConstraintViolation> getViolations() { return violations; }

    public double getSatisfactionRate() { return satisfactionRate; }

    public boolean hasCriticalViolation() {
        return violations.stream().anyMatch(ConstraintViolation::isCritical);
    }

    public List<String> violationMessages() {
        return violations.stream().map(ConstraintViolation::getMessage).toList();
    }

    @Override
    public String toString() {
        return String.format("SolutionResult{satisfied=%d, violations=%d, rate=%.2f}",
                satisfied.size(), violations.size(), satisfactionRate);
    }
}
