package com.portfoliobacktest.backtest.dto;

import com.portfoliobacktest.backtest.metrics.SymbolPerformance;
import com.portfoliobacktest.backtest.portfolio.RejectedOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result DTO containing backtest performance metrics, the equity curve and
 * per-instrument statistics. Treated as immutable once produced.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class BacktestResult {

    /**
     * Unique identifier for this backtest execution.
     */
    private String backtestId;

    private String strategyName;

    private Mode mode;

    /**
     * Bar interval the run was simulated on (e.g. "1d").
     */
    private String interval;

    private LocalDate startDate;

    private LocalDate endDate;

    // ==================== PORTFOLIO METRICS ====================

    private BigDecimal initialCapital;

    private BigDecimal finalEquity;

    /**
     * (final equity - initial capital) / initial capital, as a fraction.
     */
    private double totalReturn;

    /**
     * Maximum drawdown as a positive fraction (0.25 = 25% peak-to-trough).
     */
    private double mdd;

    /**
     * Annualised Sharpe ratio of per-session equity returns.
     */
    private double sharpeRatio;

    /**
     * Winning trades as a percentage (0-100) of all completed trades.
     */
    private double winRate;

    /**
     * Gross profit / |gross loss| over all completed trades.
     */
    private double profitFactor;

    /**
     * Number of completed (matched) round trips.
     */
    private int totalTrades;

    /**
     * Number of raw fills settled.
     */
    private int totalFills;

    /**
     * Average pnl of winning trades.
     */
    private BigDecimal avgWin;

    /**
     * Average pnl of losing trades (negative or zero).
     */
    private BigDecimal avgLoss;

    private int maxConsecutiveWins;

    private int maxConsecutiveLosses;

    // ==================== SERIES ====================

    @Builder.Default
    private List<BigDecimal> equityCurve = new ArrayList<>();

    @Builder.Default
    private List<LocalDateTime> equityTimestamps = new ArrayList<>();

    /**
     * One entry per instrument with at least one completed trade, ordered by instrument id.
     */
    @Builder.Default
    private List<SymbolPerformance> symbolPerformances = new ArrayList<>();

    // ==================== RUN DIAGNOSTICS ====================

    /**
     * Sessions skipped because market data could not be fetched.
     */
    private int skippedSessions;

    @Builder.Default
    private List<RejectedOrder> rejectedOrders = new ArrayList<>();

    private int rejectedOrderCount;

    /**
     * Sells that opened a short lot while running long-only.
     */
    private int matchingViolations;

    /**
     * Times the whole book was liquidated because cash fell below the configured minimum.
     */
    private int forcedLiquidations;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    /**
     * Total wall-clock time taken to run the backtest (milliseconds).
     */
    private long executionDurationMs;

    public enum Mode {
        SINGLE_INSTRUMENT,
        PORTFOLIO
    }
}
