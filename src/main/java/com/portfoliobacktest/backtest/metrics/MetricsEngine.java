package com.portfoliobacktest.backtest.metrics;

import com.portfoliobacktest.backtest.dto.BacktestResult;
import com.portfoliobacktest.backtest.ledger.CompletedTrade;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces a frozen trade log and equity series into a {@link BacktestResult}.
 * <p>
 * Pure function of its inputs: the same trades, samples and capital always give an equal result.
 * Instruments are grouped in id order and trades are walked in exit order, so input ordering of
 * instruments never changes the output.
 */
@Slf4j
public class MetricsEngine {

    public static final int DEFAULT_PERIODS_PER_YEAR = 252;

    private static final MathContext MC = new MathContext(16, RoundingMode.HALF_UP);
    private static final int MONEY_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final int periodsPerYear;
    private final double riskFreeRate;

    public MetricsEngine() {
        this(DEFAULT_PERIODS_PER_YEAR, 0.0);
    }

    public MetricsEngine(int periodsPerYear, double riskFreeRate) {
        if (periodsPerYear <= 0) {
            throw new IllegalArgumentException("periodsPerYear must be positive: " + periodsPerYear);
        }
        this.periodsPerYear = periodsPerYear;
        this.riskFreeRate = riskFreeRate;
    }

    /**
     * @param completedTrades every round trip closed during the run
     * @param equitySamples   one sample per session, strictly increasing in time
     * @param initialCapital  starting cash, must be positive
     * @throws IllegalArgumentException if capital is not positive or sample timestamps are not strictly increasing
     */
    public BacktestResult reduce(List<CompletedTrade> completedTrades,
                                 List<EquitySample> equitySamples,
                                 BigDecimal initialCapital) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new IllegalArgumentException("Initial capital must be positive: " + initialCapital);
        }
        validateTimestamps(equitySamples);

        List<CompletedTrade> trades = new ArrayList<>(completedTrades);
        trades.sort(Comparator.comparing(CompletedTrade::getExitTime));

        List<BigDecimal> equityCurve = new ArrayList<>(equitySamples.size());
        List<LocalDateTime> timestamps = new ArrayList<>(equitySamples.size());
        for (EquitySample sample : equitySamples) {
            equityCurve.add(sample.equity());
            timestamps.add(sample.timestamp());
        }

        BigDecimal finalEquity = equityCurve.isEmpty() ? initialCapital : equityCurve.get(equityCurve.size() - 1);
        double totalReturn = finalEquity.subtract(initialCapital).divide(initialCapital, MC).doubleValue();

        int[] streaks = maxStreaks(trades);

        BacktestResult result = BacktestResult.builder()
                .initialCapital(initialCapital)
                .finalEquity(finalEquity)
                .totalReturn(totalReturn)
                .mdd(maxDrawdown(equityCurve))
                .sharpeRatio(sharpeRatio(equityCurve))
                .winRate(winRate(trades))
                .profitFactor(profitFactor(trades))
                .totalTrades(trades.size())
                .avgWin(averagePnl(trades, true))
                .avgLoss(averagePnl(trades, false))
                .maxConsecutiveWins(streaks[0])
                .maxConsecutiveLosses(streaks[1])
                .equityCurve(equityCurve)
                .equityTimestamps(timestamps)
                .symbolPerformances(symbolPerformances(trades, initialCapital))
                .build();

        log.debug("Reduced {} trades over {} samples: return={}, mdd={}, sharpe={}",
                trades.size(), equitySamples.size(), totalReturn, result.getMdd(), result.getSharpeRatio());
        return result;
    }

    // ==================== PER INSTRUMENT ====================

    /**
     * Sum of trade pnl over initial capital, in percent.
     */
    public static double totalReturnPct(List<CompletedTrade> trades, BigDecimal initialCapital) {
        BigDecimal totalPnl = sumPnl(trades);
        return totalPnl.multiply(HUNDRED).divide(initialCapital, MC).doubleValue();
    }

    private List<SymbolPerformance> symbolPerformances(List<CompletedTrade> trades, BigDecimal initialCapital) {
        Map<String, List<CompletedTrade>> byInstrument = new TreeMap<>();
        for (CompletedTrade trade : trades) {
            byInstrument.computeIfAbsent(trade.getInstrumentId(), id -> new ArrayList<>()).add(trade);
        }

        List<SymbolPerformance> performances = new ArrayList<>(byInstrument.size());
        byInstrument.forEach((instrumentId, instrumentTrades) -> {
            double avgHolding = instrumentTrades.stream()
                    .mapToLong(CompletedTrade::getHoldingDays)
                    .average()
                    .orElse(0.0);
            performances.add(SymbolPerformance.builder()
                    .instrumentId(instrumentId)
                    .totalReturn(totalReturnPct(instrumentTrades, initialCapital))
                    .tradeCount(instrumentTrades.size())
                    .winRate(winRate(instrumentTrades))
                    .profitFactor(profitFactor(instrumentTrades))
                    .avgHoldingPeriod(avgHolding)
                    .totalPnl(sumPnl(instrumentTrades))
                    .build());
        });
        return performances;
    }

    // ==================== TRADE STATISTICS ====================

    static double winRate(List<CompletedTrade> trades) {
        if (trades.isEmpty()) {
            return 0.0;
        }
        long wins = trades.stream().filter(CompletedTrade::isWin).count();
        return wins * 100.0 / trades.size();
    }

    static double profitFactor(List<CompletedTrade> trades) {
        BigDecimal grossProfit = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        for (CompletedTrade trade : trades) {
            if (trade.getPnl().signum() > 0) {
                grossProfit = grossProfit.add(trade.getPnl());
            } else {
                grossLoss = grossLoss.add(trade.getPnl().abs());
            }
        }
        if (grossLoss.signum() == 0) {
            return grossProfit.signum() > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return grossProfit.divide(grossLoss, MC).doubleValue();
    }

    private static BigDecimal averagePnl(List<CompletedTrade> trades, boolean winners) {
        BigDecimal total = BigDecimal.ZERO;
        int count = 0;
        for (CompletedTrade trade : trades) {
            int sign = trade.getPnl().signum();
            if (winners ? sign > 0 : sign < 0) {
                total = total.add(trade.getPnl());
                count++;
            }
        }
        if (count == 0) {
            return BigDecimal.ZERO;
        }
        return total.divide(BigDecimal.valueOf(count), MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Longest runs of winning and losing trades in exit order. A break-even trade ends both runs.
     */
    private static int[] maxStreaks(List<CompletedTrade> trades) {
        int maxWins = 0;
        int maxLosses = 0;
        int wins = 0;
        int losses = 0;
        for (CompletedTrade trade : trades) {
            int sign = trade.getPnl().signum();
            wins = sign > 0 ? wins + 1 : 0;
            losses = sign < 0 ? losses + 1 : 0;
            maxWins = Math.max(maxWins, wins);
            maxLosses = Math.max(maxLosses, losses);
        }
        return new int[]{maxWins, maxLosses};
    }

    private static BigDecimal sumPnl(List<CompletedTrade> trades) {
        return trades.stream()
                .map(CompletedTrade::getPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    // ==================== EQUITY SERIES ====================

    static double maxDrawdown(List<BigDecimal> equityCurve) {
        BigDecimal runningMax = null;
        double worst = 0.0;
        for (BigDecimal equity : equityCurve) {
            if (runningMax == null || equity.compareTo(runningMax) > 0) {
                runningMax = equity;
            }
            if (runningMax.signum() <= 0) {
                continue;
            }
            double drawdown = equity.divide(runningMax, MC).doubleValue() - 1.0;
            worst = Math.min(worst, drawdown);
        }
        return worst < 0 ? -worst : 0.0;
    }

    double sharpeRatio(List<BigDecimal> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            BigDecimal previous = equityCurve.get(i - 1);
            if (previous.signum() <= 0) {
                continue;
            }
            returns.add(equityCurve.get(i).divide(previous, MC).doubleValue() - 1.0);
        }
        if (returns.size() < 2) {
            return 0.0;
        }

        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream()
                .mapToDouble(r -> (r - mean) * (r - mean))
                .sum() / returns.size();
        double stdev = Math.sqrt(variance);
        if (stdev == 0.0) {
            return 0.0;
        }
        double excess = mean - riskFreeRate / periodsPerYear;
        return excess / stdev * Math.sqrt(periodsPerYear);
    }

    private static void validateTimestamps(List<EquitySample> samples) {
        LocalDateTime previous = null;
        for (EquitySample sample : samples) {
            if (previous != null && !sample.timestamp().isAfter(previous)) {
                throw new IllegalArgumentException(String.format(
                        "Equity sample timestamps must be strictly increasing: %s follows %s",
                        sample.timestamp(), previous));
            }
            previous = sample.timestamp();
        }
    }
}
