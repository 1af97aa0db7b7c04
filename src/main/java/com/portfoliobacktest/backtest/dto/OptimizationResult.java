package com.portfoliobacktest.backtest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a parameter grid search, best run first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptimizationResult {

    private OptimizationMetric metric;

    private int totalCombinations;

    /** Combinations whose backtest completed. Failed runs are not ranked. */
    private int completedRuns;

    @Builder.Default
    private List<RankedRun> rankings = new ArrayList<>();

    /**
     * One completed combination and its result.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class RankedRun {
        private int rank;
        private Map<String, Object> parameters;
        private BacktestResult result;
    }
}
