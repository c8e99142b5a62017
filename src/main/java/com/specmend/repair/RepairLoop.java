package com.specmend.repair;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specmend.config.RepairSettings;
import com.specmend.config.SearchSettings;
import com.specmend.decision.DecisionTree;
import com.specmend.decision.IssueAnalysis;
import com.specmend.decision.ResolvedIssue;
import com.specmend.decision.Solution;
import com.specmend.oracle.OracleException;
import com.specmend.oracle.SpecificationOracle;
import com.specmend.response.ValidationResult;
import com.specmend.search.SearchEngine;
import com.specmend.search.SearchEngine.SearchException;
import com.specmend.search.SearchState;
import com.specmend.search.SearchTreeNode;

/**
 * Generate, validate, diagnose and fix until the document is valid.
 *
 * Phase flow:  GENERATE → VALIDATE → (done) | DIAGNOSE → FIX → VALIDATE ...
 *
 * FIX picks one strategy per iteration:
 *   - FORCE          some issue has been persistent for more than persistence-threshold iterations
 *   - DETERMINISTIC  every issue has a decision-tree fix at or above deterministic-fix-confidence
 *   - SEARCH         MCTS over fix actions; any search failure falls back to the
 *                    decision-tree fix for the first issue
 *   - CORRECT        plain oracle correction when search is disabled
 *
 * Runs at most max-iterations validations and then reports what is left
 * instead of looping forever.
 */
@Component
public class RepairLoop {

    private static final Logger log = LoggerFactory.getLogger(RepairLoop.class);

    private final SpecificationOracle    oracle;
    private final SpecificationValidator validator;
    private final DecisionTree           decisionTree;
    private final SearchEngine           searchEngine;
    private final OperationIdFixer       operationIdFixer;
    private final RepairSettings         settings;
    private final SearchSettings         searchSettings;
    private final ObjectMapper           jsonMapper;

    public RepairLoop(
            SpecificationOracle    oracle,
            SpecificationValidator validator,
            DecisionTree           decisionTree,
            SearchEngine           searchEngine,
            OperationIdFixer       operationIdFixer,
            RepairSettings         settings,
            SearchSettings         searchSettings
    ) {
        this.oracle           = oracle;
        this.validator        = validator;
        this.decisionTree     = decisionTree;
        this.searchEngine     = searchEngine;
        this.operationIdFixer = operationIdFixer;
        this.settings         = settings;
        this.searchSettings   = searchSettings;
        this.jsonMapper       = new ObjectMapper();
    }

    // =========================================================================
    // MAIN ENTRY POINTS
    // =========================================================================

    public RepairReport run(String context) throws OracleException {
        return repair(context, oracle.generate(context));
    }

    /**
     * Repair an existing draft.
     *
     * @param context        description the draft was generated from; reused if search regenerates
     * @param specification  starting document
     */
    public RepairReport repair(String context, String specification) throws OracleException {

        log.info("========== REPAIR LOOP START ==========");
        long startTime = System.currentTimeMillis();

        String               spec             = specification;
        List<String>         previousIssues   = List.of();
        List<String>         persistentIssues = List.of();
        Set<String>          fixedIssues      = new LinkedHashSet<>();
        Map<String, Integer> persistentCount  = new LinkedHashMap<>();
        boolean              escalated        = false;
        ValidationResult     result           = null;
        int                  iteration        = 0;

        while (iteration < settings.getMaxIterations()) {
            iteration++;

            result = validator.validate(spec);
            log.info("[RepairLoop] Iteration {}/{}: {}", iteration, settings.getMaxIterations(), result);

            // -----------------------------------------------------------------
            // DIAGNOSE: what got fixed, what keeps coming back
            // -----------------------------------------------------------------
            List<String> currentIssues = result.getIssues();
            List<String> newlyFixed    = ValidationResults.newlyFixed(previousIssues, currentIssues);
            fixedIssues.addAll(newlyFixed);
            fixedIssues.removeAll(currentIssues);

            persistentIssues = ValidationResults.persistentIssues(currentIssues, previousIssues, fixedIssues);
            updatePersistentCounts(persistentCount, persistentIssues);

            if (!newlyFixed.isEmpty()) {
                log.info("[RepairLoop] Fixed since last iteration: {}", newlyFixed.size());
            }
            if (!persistentIssues.isEmpty()) {
                log.warn("[RepairLoop] Persistent issues: {}", persistentIssues);
            }

            if (result.isValid() && result.getConfidence() >= settings.getMinConfidence()) {
                RepairReport report = new RepairReport(true, spec, iteration, result.getIssues(),
                        new ArrayList<>(fixedIssues), persistentIssues, escalated, result.getConfidence());
                logBenchmark(report, startTime);
                return report;
            }

            if (iteration == settings.getMaxIterations()) {
                break;
            }

            // -----------------------------------------------------------------
            // FIX
            // -----------------------------------------------------------------
            if (exceedsPersistenceThreshold(persistentCount)) {
                log.warn("[RepairLoop] Issues persisted beyond {} iterations. Forcing full correction.",
                        settings.getPersistenceThreshold());
                spec      = oracle.forceCorrect(spec, currentIssues);
                escalated = true;
            } else {
                spec = fix(context, spec, currentIssues, persistentIssues, new ArrayList<>(fixedIssues));
            }

            previousIssues = currentIssues;
        }

        List<String> remaining = result != null ? result.getIssues() : List.of();
        log.warn("[RepairLoop] Gave up after {} iterations with {} issues remaining", iteration, remaining.size());

        RepairReport report = new RepairReport(false, spec, iteration, remaining,
                new ArrayList<>(fixedIssues), persistentIssues, escalated,
                result != null ? result.getConfidence() : 0.0);
        logBenchmark(report, startTime);
        return report;
    }

    // =========================================================================
    // Fix strategies
    // =========================================================================

    String fix(String context, String spec, List<String> issues, List<String> persistent, List<String> fixed)
            throws OracleException {

        if (issues.isEmpty()) {
            // Valid but under-confident: nothing specific to target
            return oracle.correct(spec, issues, fixed);
        }

        IssueAnalysis analysis = decisionTree.analyzeIssues(issues);
        log.info("[RepairLoop] Decision tree: resolution {}%, top category {}",
                Math.round(analysis.getResolutionRate() * 100), analysis.getTopCategory());

        if (analysis.isFullyResolved(settings.getDeterministicFixConfidence())) {
            return applyDeterministicFixes(spec, analysis);
        }

        if (settings.isSearchEnabled()) {
            try {
                return searchForFix(context, spec, issues);
            } catch (SearchException | OracleException e) {
                log.warn("[RepairLoop] Search failed ({}). Falling back to decision-tree fix.", e.getMessage());
                return applyFirstDecision(spec, issues.get(0));
            }
        }

        return persistent.isEmpty()
                ? oracle.correct(spec, issues, fixed)
                : oracle.correctPersistent(spec, persistent, fixed);
    }

    private String applyDeterministicFixes(String spec, IssueAnalysis analysis) throws OracleException {

        List<ResolvedIssue> ordered = new ArrayList<>(analysis.getSolutions());
        ordered.sort(Comparator.comparingDouble(ResolvedIssue::getConfidence).reversed());

        String  updated      = spec;
        boolean idsGenerated = false;

        for (ResolvedIssue resolved : ordered) {
            if (resolved.getIssue().toLowerCase(Locale.ROOT).contains("operationid")) {
                if (!idsGenerated) {
                    updated      = operationIdFixer.apply(updated);
                    idsGenerated = true;
                }
                continue;
            }
            updated = oracle.applyFix(updated, resolved.getIssue(), resolved.getSolutionText());
        }

        log.info("[RepairLoop] Applied {} deterministic fix(es)", ordered.size());
        return updated;
    }

    private String searchForFix(String context, String spec, List<String> issues)
            throws SearchException, OracleException {

        SearchState    start = SearchState.initial(spec, issues, searchSettings);
        SearchTreeNode best  = searchEngine.search(start,
                new MctsSimulation(oracle, validator, decisionTree, context));

        String found = best.getState().getSpecification();
        return found.isBlank() ? spec : found;
    }

    private String applyFirstDecision(String spec, String issue) throws OracleException {
        String solution = decisionTree.findSolution(issue)
                .map(Solution::getText)
                .orElse(MctsSimulation.FALLBACK_SOLUTION);
        return oracle.applyFix(spec, issue, solution);
    }

    // =========================================================================
    // Persistence tracking
    // =========================================================================

    /**
     * Consecutive persistent iterations per issue. The first sighting does not
     * count; an issue that stops being persistent is dropped.
     */
    private static void updatePersistentCounts(Map<String, Integer> persistentCount, List<String> persistentIssues) {
        persistentCount.keySet().retainAll(persistentIssues);
        for (String issue : persistentIssues) {
            persistentCount.merge(issue, 1, Integer::sum);
        }
    }

    private boolean exceedsPersistenceThreshold(Map<String, Integer> persistentCount) {
        return persistentCount.values().stream().anyMatch(c -> c > settings.getPersistenceThreshold());
    }

    // =========================================================================
    // Benchmark
    // =========================================================================

    private void logBenchmark(RepairReport report, long startTime) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("valid",             report.isValid());
        entry.put("iterations",        report.getIterations());
        entry.put("remaining_issues",  report.getRemainingIssues().size());
        entry.put("fixed_issues",      report.getFixedIssues().size());
        entry.put("persistent_issues", report.getPersistentIssues().size());
        entry.put("escalated",         report.isEscalated());
        entry.put("final_confidence",  report.getFinalConfidence());
        entry.put("wall_time_ms",      System.currentTimeMillis() - startTime);

        try {
            log.info("[Benchmark] {}", jsonMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            log.warn("[Benchmark] Could not serialize benchmark entry: {}", e.getMessage());
        }
    }
}
