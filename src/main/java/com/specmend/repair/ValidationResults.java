package com.specmend.repair;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.specmend.constraint.SolutionResult;
import com.specmend.response.ValidationResult;

/**
 * Merging, scoring and comparing validation outcomes.
 *
 * Pure static helpers; no state, no logging.
 */
public final class ValidationResults {

    static final double STRUCTURAL_PENALTY_SIMPLE        = 0.5;
    static final double STRUCTURAL_PENALTY_COMPREHENSIVE = 0.7;
    static final double CLEAN_CONFIDENCE_FLOOR           = 0.7;
    static final double VALID_WITHOUT_CRITICAL           = 0.8;

    private ValidationResults() {}

    // =========================================================================
    // Combination
    // =========================================================================

    /**
     * Structural issues plus the oracle's review.
     * Confidence is halved when structural issues exist and raised to 0.7 when
     * nothing is left; valid iff no issues remain.
     */
    public static ValidationResult combine(List<String> structural, ValidationResult review) {
        List<String> issues = dedupe(structural, review.getIssues());

        double confidence = review.getConfidence();
        if (!structural.isEmpty()) {
            confidence *= STRUCTURAL_PENALTY_SIMPLE;
        }
        if (issues.isEmpty()) {
            confidence = Math.max(confidence, CLEAN_CONFIDENCE_FLOOR);
        }
        return new ValidationResult(issues.isEmpty(), issues, Math.min(confidence, 1.0));
    }

    /**
     * Constraint violations, structural issues and the oracle's review.
     *
     *   confidence = (satisfactionRate + review confidence) / 2, x0.7 with structural issues
     *   valid      = no issues, or no critical violation and confidence > 0.8
     */
    public static ValidationResult combineComprehensive(
            SolutionResult constraints,
            List<String> structural,
            ValidationResult review
    ) {
        List<String> issues = dedupe(structural, review.getIssues(), constraints.violationMessages());

        double penalty    = structural.isEmpty() ? 1.0 : STRUCTURAL_PENALTY_COMPREHENSIVE;
        double confidence = (constraints.getSatisfactionRate() + review.getConfidence()) / 2.0 * penalty;

        boolean valid = issues.isEmpty()
                || (!constraints.hasCriticalViolation() && confidence > VALID_WITHOUT_CRITICAL);

        return new ValidationResult(valid, issues, confidence);
    }

    @SafeVarargs
    private static List<String> dedupe(List<String>... sources) {
        Set<String> seen = new LinkedHashSet<>();
        for (List<String> source : sources) {
            seen.addAll(source);
        }
        return new ArrayList<>(seen);
    }

    // =========================================================================
    // Scoring
    // =========================================================================

    /** confidence, +0.5 when valid, -0.1 per issue; never below -1. */
    public static double score(ValidationResult result) {
        double score = result.getConfidence();
        if (result.isValid()) {
            score += 0.5;
        }
        score -= result.getIssues().size() * 0.1;
        return Math.max(score, -1.0);
    }

    /** Index of the highest-scoring result; the earliest wins ties. */
    public static int selectBest(List<ValidationResult> results) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("No validation results to choose from");
        }
        int    bestIndex = 0;
        double bestScore = score(results.get(0));
        for (int i = 1; i < results.size(); i++) {
            double s = score(results.get(i));
            if (s > bestScore) {
                bestScore = s;
                bestIndex = i;
            }
        }
        return bestIndex;
    }

    // =========================================================================
    // Issue tracking across iterations
    // =========================================================================

    /** Issues in both current and previous that were never recorded as fixed, in current order. */
    public static List<String> persistentIssues(List<String> current, List<String> previous, Iterable<String> fixed) {
        Set<String> fixedSet = new LinkedHashSet<>();
        fixed.forEach(fixedSet::add);

        List<String> persistent = new ArrayList<>();
        for (String issue : current) {
            if (previous.contains(issue) && !fixedSet.contains(issue) && !persistent.contains(issue)) {
                persistent.add(issue);
            }
        }
        return persistent;
    }

    /** Issues present previously that are gone now, in previous order. */
    public static List<String> newlyFixed(List<String> previous, List<String> current) {
        List<String> fixed = new ArrayList<>();
        for (String issue : previous) {
            if (!current.contains(issue) && !fixed.contains(issue)) {
                fixed.add(issue);
            }
        }
        return fixed;
    }
}
