package com.portfoliobacktest.backtest.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliobacktest.backtest.dto.BacktestResult;
import com.portfoliobacktest.backtest.ledger.CompletedTrade;
import com.portfoliobacktest.backtest.ledger.FifoLedger;
import com.portfoliobacktest.backtest.ledger.Fill;
import com.portfoliobacktest.backtest.ledger.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link MetricsEngine}.
 */
class MetricsEngineTest {

    private static final BigDecimal CAPITAL = new BigDecimal("100000");
    private static final LocalDate START = LocalDate.of(2024, 1, 2);

    private MetricsEngine metricsEngine;

    @BeforeEach
    void setUp() {
        metricsEngine = new MetricsEngine();
    }

    private static Fill fill(String instrument, Side side, long qty, String price, int day) {
        return Fill.builder()
                .instrumentId(instrument)
                .side(side)
                .quantity(qty)
                .price(new BigDecimal(price))
                .timestamp(START.plusDays(day).atTime(15, 30))
                .orderId(instrument + "-" + day)
                .build();
    }

    private static CompletedTrade trade(String instrument, String pnl, int exitDay) {
        LocalDateTime exit = START.plusDays(exitDay).atTime(15, 30);
        return CompletedTrade.builder()
                .instrumentId(instrument)
                .side(Side.BUY)
                .entryTime(exit.minusDays(1))
                .exitTime(exit)
                .entryPrice(BigDecimal.TEN)
                .exitPrice(BigDecimal.TEN)
                .quantity(1)
                .commission(BigDecimal.ZERO)
                .pnl(new BigDecimal(pnl))
                .holdingDays(1)
                .build();
    }

    private static List<EquitySample> curve(String... equities) {
        List<EquitySample> samples = new ArrayList<>();
        for (int i = 0; i < equities.length; i++) {
            samples.add(new EquitySample(START.plusDays(i).atTime(15, 30), new BigDecimal(equities[i])));
        }
        return samples;
    }

    /** A: +1000 (10%), B: -500 (-5%). */
    private static List<CompletedTrade> twoInstrumentTrades() {
        FifoLedger ledger = new FifoLedger();
        ledger.applyFill(fill("A", Side.BUY, 100, "100", 0));
        ledger.applyFill(fill("B", Side.BUY, 50, "200", 0));
        ledger.applyFill(fill("A", Side.SELL, 100, "110", 3));
        ledger.applyFill(fill("B", Side.SELL, 50, "190", 5));
        return ledger.getCompletedTrades();
    }

    @Nested
    @DisplayName("Two-instrument scenario")
    class TwoInstrumentScenario {

        @Test
        @DisplayName("Per-trade pnl and return")
        void tradeResults() {
            List<CompletedTrade> trades = twoInstrumentTrades();

            CompletedTrade a = trades.stream().filter(t -> t.getInstrumentId().equals("A")).findFirst().orElseThrow();
            CompletedTrade b = trades.stream().filter(t -> t.getInstrumentId().equals("B")).findFirst().orElseThrow();
            assertEquals(0, new BigDecimal("1000").compareTo(a.getPnl()));
            assertEquals(10.0, a.getReturnPct(), 1e-9);
            assertEquals(0, new BigDecimal("-500").compareTo(b.getPnl()));
            assertEquals(-5.0, b.getReturnPct(), 1e-9);
        }

        @Test
        @DisplayName("Portfolio win rate 50% and profit factor 2.0")
        void portfolioStatistics() {
            BacktestResult result = metricsEngine.reduce(twoInstrumentTrades(),
                    curve("100000", "100500"), CAPITAL);

            assertEquals(2, result.getTotalTrades());
            assertEquals(50.0, result.getWinRate(), 1e-9);
            assertEquals(2.0, result.getProfitFactor(), 1e-9);
            assertEquals(0.005, result.getTotalReturn(), 1e-12);
            assertEquals(0, new BigDecimal("1000").compareTo(result.getAvgWin()));
            assertEquals(0, new BigDecimal("-500").compareTo(result.getAvgLoss()));
        }

        @Test
        @DisplayName("Per-instrument statistics")
        void symbolStatistics() {
            BacktestResult result = metricsEngine.reduce(twoInstrumentTrades(), curve("100000"), CAPITAL);

            SymbolPerformance a = result.getSymbolPerformances().get(0);
            SymbolPerformance b = result.getSymbolPerformances().get(1);
            assertEquals("A", a.getInstrumentId());
            assertEquals(1.0, a.getTotalReturn(), 1e-12);
            assertEquals(100.0, a.getWinRate(), 1e-12);
            assertEquals(Double.POSITIVE_INFINITY, a.getProfitFactor());
            assertEquals(3.0, a.getAvgHoldingPeriod(), 1e-12);
            assertEquals("B", b.getInstrumentId());
            assertEquals(-0.5, b.getTotalReturn(), 1e-12);
            assertEquals(0.0, b.getWinRate(), 1e-12);
            assertEquals(0.0, b.getProfitFactor(), 1e-12);
        }
    }

    @Nested
    @DisplayName("Trade statistics")
    class TradeStatistics {

        @Test
        @DisplayName("Win rate equals wins / trades x 100")
        void winRateFormula() {
            List<CompletedTrade> trades = List.of(
                    trade("A", "10", 1), trade("A", "-5", 2), trade("B", "3", 3),
                    trade("B", "0", 4), trade("C", "-1", 5), trade("C", "7", 6), trade("C", "2", 7));

            BacktestResult result = metricsEngine.reduce(trades, curve("100000"), CAPITAL);

            long wins = trades.stream().filter(t -> t.getPnl().signum() > 0).count();
            assertEquals(wins * 100.0 / trades.size(), result.getWinRate(), 1e-12);
        }

        @Test
        @DisplayName("No trades gives zero win rate and profit factor")
        void noTrades() {
            BacktestResult result = metricsEngine.reduce(List.of(), curve("100000", "100000"), CAPITAL);

            assertEquals(0, result.getTotalTrades());
            assertEquals(0.0, result.getWinRate());
            assertEquals(0.0, result.getProfitFactor());
            assertTrue(result.getSymbolPerformances().isEmpty());
        }

        @Test
        @DisplayName("Streaks are counted in exit order")
        void consecutiveStreaks() {
            List<CompletedTrade> trades = List.of(
                    trade("B", "-1", 4), trade("A", "5", 1), trade("A", "6", 2),
                    trade("C", "-2", 3), trade("C", "-3", 5), trade("A", "1", 6));

            BacktestResult result = metricsEngine.reduce(trades, curve("100000"), CAPITAL);

            // exit order: +5 +6 -2 -1 -3 +1
            assertEquals(2, result.getMaxConsecutiveWins());
            assertEquals(3, result.getMaxConsecutiveLosses());
        }

        @Test
        @DisplayName("Symbol performances cover exactly the traded instruments, in id order")
        void universeCompleteness() {
            List<CompletedTrade> trades = List.of(
                    trade("ZZ", "1", 1), trade("AA", "-1", 2), trade("MM", "2", 3), trade("AA", "4", 4));

            BacktestResult result = metricsEngine.reduce(trades, curve("100000"), CAPITAL);

            List<String> ids = result.getSymbolPerformances().stream()
                    .map(SymbolPerformance::getInstrumentId)
                    .collect(Collectors.toList());
            assertEquals(List.of("AA", "MM", "ZZ"), ids);
            assertEquals(2, result.getSymbolPerformances().get(0).getTradeCount());
        }

        @Test
        @DisplayName("Total return is reproducible from the trade list")
        void returnReproducibility() {
            List<CompletedTrade> trades = twoInstrumentTrades();
            BacktestResult result = metricsEngine.reduce(trades, curve("100000"), CAPITAL);

            double fromSymbols = result.getSymbolPerformances().stream()
                    .mapToDouble(SymbolPerformance::getTotalReturn)
                    .sum();
            assertEquals(MetricsEngine.totalReturnPct(trades, CAPITAL), fromSymbols, 1e-9);
            assertEquals(0.5, fromSymbols, 1e-9);
        }
    }

    @Nested
    @DisplayName("Equity series")
    class EquitySeries {

        @Test
        @DisplayName("Max drawdown is the deepest fall from a running peak")
        void maxDrawdown() {
            BacktestResult result = metricsEngine.reduce(List.of(),
                    curve("100", "120", "90", "130", "117"), new BigDecimal("100"));

            assertEquals(0.25, result.getMdd(), 1e-12);
            assertEquals(0.17, result.getTotalReturn(), 1e-12);
        }

        @Test
        @DisplayName("Monotonic curve has zero drawdown")
        void noDrawdown() {
            BacktestResult result = metricsEngine.reduce(List.of(), curve("100", "101", "102"), new BigDecimal("100"));

            assertEquals(0.0, result.getMdd());
        }

        @Test
        @DisplayName("Flat curve has zero Sharpe ratio")
        void flatSharpe() {
            BacktestResult result = metricsEngine.reduce(List.of(),
                    curve("100", "100", "100", "100"), new BigDecimal("100"));

            assertEquals(0.0, result.getSharpeRatio());
        }

        @Test
        @DisplayName("Sharpe uses population deviation annualised over 252 periods")
        void sharpe() {
            // returns 0.10 and 0.00: mean 0.05, population stdev 0.05
            BacktestResult result = metricsEngine.reduce(List.of(),
                    curve("100", "110", "110"), new BigDecimal("100"));

            assertEquals(Math.sqrt(252), result.getSharpeRatio(), 1e-9);
        }

        @Test
        @DisplayName("Risk-free rate is deducted per period")
        void sharpeWithRiskFree() {
            MetricsEngine withRiskFree = new MetricsEngine(252, 0.0252);
            BacktestResult result = withRiskFree.reduce(List.of(),
                    curve("100", "110", "110"), new BigDecimal("100"));

            // (0.05 - 0.0001) / 0.05 x sqrt(252)
            assertEquals(0.998 * Math.sqrt(252), result.getSharpeRatio(), 1e-9);
        }

        @Test
        @DisplayName("Non-increasing sample timestamps are rejected")
        void rejectsNonIncreasingTimestamps() {
            LocalDateTime ts = START.atTime(15, 30);
            List<EquitySample> samples = List.of(
                    new EquitySample(ts, new BigDecimal("100")),
                    new EquitySample(ts, new BigDecimal("101")));

            assertThrows(IllegalArgumentException.class,
                    () -> metricsEngine.reduce(List.of(), samples, new BigDecimal("100")));
        }

        @Test
        @DisplayName("No samples leaves final equity at initial capital")
        void noSamples() {
            BacktestResult result = metricsEngine.reduce(List.of(), List.of(), CAPITAL);

            assertEquals(0, CAPITAL.compareTo(result.getFinalEquity()));
            assertEquals(0.0, result.getTotalReturn());
            assertEquals(0.0, result.getSharpeRatio());
        }
    }

    @Test
    @DisplayName("Reduction is deterministic down to the serialized bytes")
    void idempotentReduction() throws Exception {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        List<CompletedTrade> trades = twoInstrumentTrades();
        List<EquitySample> samples = curve("100000", "99000", "100500", "100250");

        String first = mapper.writeValueAsString(metricsEngine.reduce(trades, samples, CAPITAL));
        String second = mapper.writeValueAsString(new MetricsEngine().reduce(trades, samples, CAPITAL));

        assertEquals(first, second);
    }
}
