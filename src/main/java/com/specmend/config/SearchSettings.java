package com.specmend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tuning knobs for the MCTS engine and its state model.
 *
 * Bound from {@code specmend.search.*}; every key has a default so the engine
 * runs with an empty configuration.
 */
@Component
public class SearchSettings {

    private final int    maxIterations;
    private final double explorationConstant;
    private final int    maxActionsPerNode;
    private final int    maxDepth;
    private final double highQualityThreshold;
    private final int    progressInterval;
    private final double validConfidenceThreshold;

    public SearchSettings(
            @Value("${specmend.search.max-iterations:50}")                int    maxIterations,
            @Value("${specmend.search.exploration-constant:1.414}")       double explorationConstant,
            @Value("${specmend.search.max-actions-per-node:3}")           int    maxActionsPerNode,
            @Value("${specmend.search.max-depth:10}")                     int    maxDepth,
            @Value("${specmend.search.high-quality-threshold:0.95}")      double highQualityThreshold,
            @Value("${specmend.search.progress-interval:10}")             int    progressInterval,
            @Value("${specmend.search.valid-confidence-threshold:0.85}")  double validConfidenceThreshold
    ) {
        if (maxIterations < 0 || maxActionsPerNode < 1 || maxDepth < 1 || progressInterval < 1) {
            throw new IllegalArgumentException(
                    "Invalid search settings: iterations=" + maxIterations
                    + ", actionsPerNode=" + maxActionsPerNode
                    + ", depth=" + maxDepth
                    + ", progressInterval=" + progressInterval);
        }
        this.maxIterations            = maxIterations;
        this.explorationConstant      = explorationConstant;
        this.maxActionsPerNode        = maxActionsPerNode;
        this.maxDepth                 = maxDepth;
        this.highQualityThreshold     = highQualityThreshold;
        this.progressInterval         = progressInterval;
        this.validConfidenceThreshold = validConfidenceThreshold;
    }

    /** Settings with every default applied; for code running outside Spring. */
    public static SearchSettings defaults() {
        return new SearchSettings(50, 1.414, 3, 10, 0.95, 10, 0.85);
    }

    public int getMaxIterations() { return maxIterations; }

    public double getExplorationConstant() { return explorationConstant; }

    public int getMaxActionsPerNode() { return maxActionsPerNode; }

    public int getMaxDepth() { return maxDepth; }

    public double getHighQualityThreshold() { return highQualityThreshold; }

    public int getProgressInterval() { return progressInterval; }

    public double getValidConfidenceThreshold() { return validConfidenceThreshold; }
}
