package com.portfoliobacktest.backtest.strategy;

import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.ledger.Side;
import com.portfoliobacktest.backtest.portfolio.AccountView;
import com.portfoliobacktest.backtest.portfolio.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MACrossStrategyTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private static List<Bar> history(double... closes) {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            BigDecimal close = BigDecimal.valueOf(closes[i]);
            bars.add(Bar.builder()
                    .instrumentId("A")
                    .timestamp(START.plusDays(i).atStartOfDay())
                    .open(close).high(close).low(close).close(close)
                    .volume(100)
                    .build());
        }
        return bars;
    }

    private static AccountView flat(String equity) {
        return new AccountView(new BigDecimal(equity), new BigDecimal(equity), List.of());
    }

    private static AccountView holding(long quantity) {
        Position position = Position.builder().instrumentId("A").quantity(quantity).build();
        return new AccountView(BigDecimal.ZERO, BigDecimal.valueOf(100000), List.of(position));
    }

    private static MACrossStrategy strategy() {
        return new MACrossStrategy(Map.of("short_period", 2, "long_period", 3, "position_size", 0.5));
    }

    @Test
    @DisplayName("Needs long_period + 1 bars before signalling")
    void warmUp() {
        assertTrue(strategy().onBar(history(10, 10, 20), List.of(), flat("1000")).isEmpty());
    }

    @Test
    @DisplayName("Golden cross while flat buys position_size of equity")
    void goldenCross() {
        // previous: short 10 / long 10, now: short 15 / long 13.33
        List<OrderSignal> signals = strategy().onBar(history(10, 10, 10, 20), List.of(), flat("1000"));

        assertEquals(1, signals.size());
        assertEquals(Side.BUY, signals.get(0).side());
        assertEquals("A", signals.get(0).instrumentId());
        // floor(1000 x 0.5 / 20)
        assertEquals(25, signals.get(0).quantity());
    }

    @Test
    @DisplayName("Golden cross while already holding does nothing")
    void goldenCrossWhenHeld() {
        assertTrue(strategy().onBar(history(10, 10, 10, 20), List.of(), holding(5)).isEmpty());
    }

    @Test
    @DisplayName("Dead cross sells the whole position")
    void deadCross() {
        List<OrderSignal> signals = strategy().onBar(history(20, 20, 20, 10), List.of(), holding(7));

        assertEquals(1, signals.size());
        assertEquals(Side.SELL, signals.get(0).side());
        assertEquals(7, signals.get(0).quantity());
    }

    @Test
    void deadCrossWhenFlatDoesNothing() {
        assertTrue(strategy().onBar(history(20, 20, 20, 10), List.of(), flat("1000")).isEmpty());
    }

    @Test
    void rejectsInvalidPeriods() {
        assertThrows(IllegalArgumentException.class,
                () -> new MACrossStrategy(Map.of("short_period", 5, "long_period", 5)));
        assertThrows(IllegalArgumentException.class,
                () -> new MACrossStrategy(Map.of("short_period", "five")));
    }

    @Test
    void numericStringParametersAreAccepted() {
        MACrossStrategy fromStrings = new MACrossStrategy(Map.of("short_period", "2", "long_period", "3",
                "position_size", "0.5"));

        assertEquals(25, fromStrings.onBar(history(10, 10, 10, 20), List.of(), flat("1000")).get(0).quantity());
    }
}
