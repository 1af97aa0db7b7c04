package com.portfoliobacktest.backtest.dto;

import java.util.Comparator;

/**
 * Ranking criterion for a parameter grid search. Higher return and Sharpe ratio rank first;
 * lower drawdown ranks first.
 */
public enum OptimizationMetric {
    TOTAL_RETURN(Comparator.comparingDouble(BacktestResult::getTotalReturn).reversed()),
    SHARPE_RATIO(Comparator.comparingDouble(BacktestResult::getSharpeRatio).reversed()),
    MDD(Comparator.comparingDouble(BacktestResult::getMdd));

    private final Comparator<BacktestResult> ranking;

    OptimizationMetric(Comparator<BacktestResult> ranking) {
        this.ranking = ranking;
    }

    /**
     * Best result first.
     */
    public Comparator<BacktestResult> ranking() {
        return ranking;
    }
}
