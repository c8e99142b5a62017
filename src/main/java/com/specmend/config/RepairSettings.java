package com.specmend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Limits and thresholds for the generate/validate/fix loop.
 *
 * persistenceThreshold: an issue persistent (reported in this iteration and
 * the previous one) in more than this many consecutive iterations triggers the
 * forced all-issues correction.
 */
@Component
public class RepairSettings {

    private final int     maxIterations;
    private final int     persistenceThreshold;
    private final double  minConfidence;
    private final double  deterministicFixConfidence;
    private final boolean searchEnabled;
    private final int     selfConsistencyPaths;

    public RepairSettings(
            @Value("${specmend.repair.max-iterations:5}")                  int     maxIterations,
            @Value("${specmend.repair.persistence-threshold:2}")           int     persistenceThreshold,
            @Value("${specmend.repair.min-confidence:0.85}")               double  minConfidence,
            @Value("${specmend.repair.deterministic-fix-confidence:0.9}")  double  deterministicFixConfidence,
            @Value("${specmend.repair.search-enabled:true}")               boolean searchEnabled,
            @Value("${specmend.repair.self-consistency-paths:3}")          int     selfConsistencyPaths
    ) {
        if (maxIterations < 1 || persistenceThreshold < 1 || selfConsistencyPaths < 1) {
            throw new IllegalArgumentException(
                    "Invalid repair settings: iterations=" + maxIterations
                    + ", persistenceThreshold=" + persistenceThreshold
                    + ", selfConsistencyPaths=" + selfConsistencyPaths);
        }
        this.maxIterations              = maxIterations;
        this.persistenceThreshold       = persistenceThreshold;
        this.minConfidence              = minConfidence;
        this.deterministicFixConfidence = deterministicFixConfidence;
        this.searchEnabled              = searchEnabled;
        this.selfConsistencyPaths       = selfConsistencyPaths;
    }

    public static RepairSettings defaults() {
        return new RepairSettings(5, 2, 0.85, 0.9, true, 3);
    }

    public int getMaxIterations() { return maxIterations; }

    public int getPersistenceThreshold() { return persistenceThreshold; }

    public double getMinConfidence() { return minConfidence; }

    public double getDeterministicFixConfidence() { return deterministicFixConfidence; }

    public boolean isSearchEnabled() { return searchEnabled; }

    public int getSelfConsistencyPaths() { return selfConsistencyPaths; }
}
