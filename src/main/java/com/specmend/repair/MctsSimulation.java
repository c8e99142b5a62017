package com.specmend.repair;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.specmend.decision.DecisionTree;
import com.specmend.decision.Solution;
import com.specmend.oracle.OracleException;
import com.specmend.oracle.SpecificationOracle;
import com.specmend.response.ValidationResult;
import com.specmend.search.ActionType;
import com.specmend.search.RepairAction;
import com.specmend.search.SearchState;
import com.specmend.search.SearchTreeNode;
import com.specmend.search.SimulationOracle;

/**
 * Simulation step backed by the real oracle.
 *
 * A node with no document gets one generated from the context. A node created
 * by a FIX action asks the oracle to apply the decision-tree solution for that
 * issue. Either way the result is validated and the node's state is replaced
 * with the document and the issues actually found; the reward is that state's
 * reward.
 */
public class MctsSimulation implements SimulationOracle {

    private static final Logger log = LoggerFactory.getLogger(MctsSimulation.class);

    static final String FALLBACK_SOLUTION = "Resolve the issue without changing unrelated parts";

    private final SpecificationOracle    oracle;
    private final SpecificationValidator validator;
    private final DecisionTree           decisionTree;
    private final String                 context;

    public MctsSimulation(
            SpecificationOracle    oracle,
            SpecificationValidator validator,
            DecisionTree           decisionTree,
            String                 context
    ) {
        this.oracle       = oracle;
        this.validator    = validator;
        this.decisionTree = decisionTree;
        this.context      = context;
    }

    @Override
    public double simulate(SearchTreeNode node) throws OracleException {

        SearchState  state         = node.getState();
        String       specification = state.getSpecification();
        RepairAction action        = node.getAction();

        if (specification.isBlank()) {
            specification = oracle.generate(context);
        } else if (action != null && action.getType() == ActionType.FIX) {
            String solution = decisionTree.findSolution(action.getTarget())
                    .map(Solution::getText)
                    .orElse(FALLBACK_SOLUTION);
            specification = oracle.applyFix(specification, action.getTarget(), solution);
        }

        ValidationResult result = validator.validate(specification);

        SearchState updated = state
                .withSpecification(specification)
                .withIssues(result.getIssues())
                .withConfidence(result.getConfidence());
        node.setState(updated);

        double reward = updated.reward();
        log.debug("[MCTS] Simulated {} -> {} issues, reward {}", action, result.getIssues().size(), reward);
        return reward;
    }
}
