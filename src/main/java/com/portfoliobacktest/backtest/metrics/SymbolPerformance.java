package com.portfoliobacktest.backtest.metrics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Trade statistics for one instrument over a backtest run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SymbolPerformance {

    private String instrumentId;

    /**
     * Sum of realized pnl over the run's initial capital, in percent.
     */
    private double totalReturn;

    private int tradeCount;

    /**
     * Winning trades as a percentage (0-100) of all trades.
     */
    private double winRate;

    /**
     * Gross profit / |gross loss|. Infinity when there is profit but no loss.
     */
    private double profitFactor;

    /**
     * Mean holding period in days.
     */
    private double avgHoldingPeriod;

    private BigDecimal totalPnl;
}
