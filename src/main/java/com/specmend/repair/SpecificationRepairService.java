package com.specmend.repair;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.specmend.config.RepairSettings;
import com.specmend.config.SearchSettings;
import com.specmend.decision.DecisionTree;
import com.specmend.oracle.OracleException;
import com.specmend.oracle.SpecificationOracle;
import com.specmend.response.ValidationResult;
import com.specmend.search.SearchEngine;
import com.specmend.search.SearchEngine.SearchException;
import com.specmend.search.SearchState;
import com.specmend.search.SearchTreeNode;

/**
 * Entry points for producing a valid document from a description.
 *
 *   repair                       iterative loop (see {@link RepairLoop})
 *   generateWithSearch           one draft, then MCTS over fixes
 *   generateWithSelfConsistency  several drafts, keep the best, repair it if needed
 */
@Service
public class SpecificationRepairService {

    private static final Logger log = LoggerFactory.getLogger(SpecificationRepairService.class);

    private final RepairLoop             repairLoop;
    private final SpecificationOracle    oracle;
    private final SpecificationValidator validator;
    private final DecisionTree           decisionTree;
    private final SearchEngine           searchEngine;
    private final RepairSettings         repairSettings;
    private final SearchSettings         searchSettings;

    public SpecificationRepairService(
            RepairLoop             repairLoop,
            SpecificationOracle    oracle,
            SpecificationValidator validator,
            DecisionTree           decisionTree,
            SearchEngine           searchEngine,
            RepairSettings         repairSettings,
            SearchSettings         searchSettings
    ) {
        this.repairLoop     = repairLoop;
        this.oracle         = oracle;
        this.validator      = validator;
        this.decisionTree   = decisionTree;
        this.searchEngine   = searchEngine;
        this.repairSettings = repairSettings;
        this.searchSettings = searchSettings;
    }

    public RepairReport repair(String context) throws OracleException {
        return repairLoop.run(context);
    }

    public String generateWithSearch(String context) throws OracleException, SearchException {
        return generateWithSearch(context, searchSettings.getMaxIterations());
    }

    /**
     * @throws IllegalStateException when the best node carries no document
     */
    public String generateWithSearch(String context, int maxIterations) throws OracleException, SearchException {

        String           draft   = oracle.generate(context);
        ValidationResult initial = validator.validate(draft);

        if (initial.isValid() && initial.getConfidence() >= repairSettings.getMinConfidence()) {
            log.info("[Service] First draft already valid ({})", initial);
            return draft;
        }

        SearchState    start = SearchState.initial(draft, initial.getIssues(), searchSettings);
        SearchTreeNode best  = searchEngine.search(start, maxIterations,
                new MctsSimulation(oracle, validator, decisionTree, context));

        String specification = best.getState().getSpecification();
        if (specification.isBlank()) {
            throw new IllegalStateException("Search finished without producing a specification");
        }
        return specification;
    }

    public String generateWithSelfConsistency(String context) throws OracleException {
        return generateWithSelfConsistency(context, repairSettings.getSelfConsistencyPaths());
    }

    public String generateWithSelfConsistency(String context, int paths) throws OracleException {
        if (paths < 1) {
            throw new IllegalArgumentException("paths must be at least 1, got " + paths);
        }

        List<String>           drafts  = new ArrayList<>();
        List<ValidationResult> results = new ArrayList<>();

        for (int i = 1; i <= paths; i++) {
            String draft = oracle.generate(context);
            ValidationResult result = validator.validateQuick(draft);
            drafts.add(draft);
            results.add(result);
            log.info("[Service] Path {}/{}: {}", i, paths, result);
        }

        int              bestIndex  = ValidationResults.selectBest(results);
        ValidationResult bestResult = results.get(bestIndex);
        log.info("[Service] Selected path {} ({})", bestIndex + 1, bestResult);

        if (!bestResult.hasIssues()) {
            return drafts.get(bestIndex);
        }
        return repairLoop.repair(context, drafts.get(bestIndex)).getSpecification();
    }
}
