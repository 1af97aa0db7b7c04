package com.portfoliobacktest.backtest.ledger;

import com.portfoliobacktest.backtest.engine.BacktestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FIFO lot matching in {@link FifoLedger}.
 */
class FifoLedgerTest {

    private static final LocalDateTime DAY_1 = LocalDateTime.of(2024, 1, 2, 15, 30);
    private static final LocalDateTime DAY_2 = DAY_1.plusDays(1);
    private static final LocalDateTime DAY_5 = DAY_1.plusDays(4);

    private FifoLedger ledger;
    private int orderSeq;

    @BeforeEach
    void setUp() {
        ledger = new FifoLedger();
        orderSeq = 0;
    }

    private Fill fill(String instrument, Side side, long qty, String price, String commission, LocalDateTime ts) {
        return Fill.builder()
                .instrumentId(instrument)
                .side(side)
                .quantity(qty)
                .price(new BigDecimal(price))
                .commission(new BigDecimal(commission))
                .timestamp(ts)
                .orderId("ORD-" + (++orderSeq))
                .build();
    }

    @Nested
    @DisplayName("Round trips")
    class RoundTrips {

        @Test
        @DisplayName("Buy then sell closes one trade with pnl, return and holding period")
        void buyThenSell() {
            assertTrue(ledger.applyFill(fill("A", Side.BUY, 100, "100", "0", DAY_1)).isEmpty());
            List<CompletedTrade> closed = ledger.applyFill(fill("A", Side.SELL, 100, "110", "0", DAY_5));

            assertEquals(1, closed.size());
            CompletedTrade trade = closed.get(0);
            assertEquals(Side.BUY, trade.getSide());
            assertEquals(100, trade.getQuantity());
            assertEquals(0, new BigDecimal("1000").compareTo(trade.getPnl()));
            assertEquals(10.0, trade.getReturnPct(), 1e-9);
            assertEquals(4, trade.getHoldingDays());
            assertEquals(DAY_1, trade.getEntryTime());
            assertEquals(DAY_5, trade.getExitTime());
            assertTrue(ledger.getOpenLots("A").isEmpty());
        }

        @Test
        @DisplayName("Short round trip gains when price falls")
        void shortRoundTrip() {
            FifoLedger shortable = new FifoLedger(false);
            shortable.applyFill(fill("A", Side.SELL, 10, "50", "0", DAY_1));
            List<CompletedTrade> closed = shortable.applyFill(fill("A", Side.BUY, 10, "45", "0", DAY_2));

            assertEquals(1, closed.size());
            assertEquals(Side.SELL, closed.get(0).getSide());
            assertEquals(0, new BigDecimal("50").compareTo(closed.get(0).getPnl()));
            assertEquals(0, shortable.getMatchingViolations());
        }

        @Test
        @DisplayName("Partial close leaves the remainder of the oldest lot open")
        void partialClose() {
            ledger.applyFill(fill("A", Side.BUY, 100, "10", "0", DAY_1));
            List<CompletedTrade> closed = ledger.applyFill(fill("A", Side.SELL, 40, "12", "0", DAY_2));

            assertEquals(1, closed.size());
            assertEquals(40, closed.get(0).getQuantity());
            assertEquals(60, ledger.getNetOpenQuantity("A"));
        }
    }

    @Nested
    @DisplayName("FIFO ordering")
    class FifoOrdering {

        @Test
        @DisplayName("One sell across three lots produces one trade per lot closure")
        void oneSellClosesSeveralLots() {
            ledger.applyFill(fill("A", Side.BUY, 10, "100", "0", DAY_1));
            ledger.applyFill(fill("A", Side.BUY, 10, "101", "0", DAY_1));
            ledger.applyFill(fill("A", Side.BUY, 10, "102", "0", DAY_2));

            List<CompletedTrade> closed = ledger.applyFill(fill("A", Side.SELL, 25, "105", "0", DAY_5));

            // 1 sell fill but 3 closures, not min(buys, sells) = 1
            assertEquals(3, closed.size());
            assertEquals(0, new BigDecimal("100").compareTo(closed.get(0).getEntryPrice()));
            assertEquals(0, new BigDecimal("101").compareTo(closed.get(1).getEntryPrice()));
            assertEquals(0, new BigDecimal("102").compareTo(closed.get(2).getEntryPrice()));
            assertEquals(5, closed.get(2).getQuantity());
            assertEquals(5, ledger.getNetOpenQuantity("A"));
        }

        @Test
        @DisplayName("Trades per instrument are kept separately")
        void instrumentsAreIndependent() {
            ledger.applyFill(fill("A", Side.BUY, 10, "100", "0", DAY_1));
            ledger.applyFill(fill("B", Side.BUY, 10, "200", "0", DAY_1));
            ledger.applyFill(fill("B", Side.SELL, 10, "210", "0", DAY_2));

            assertTrue(ledger.getCompletedTrades("A").isEmpty());
            assertEquals(1, ledger.getCompletedTrades("B").size());
            assertEquals(1, ledger.getCompletedTrades().size());
            assertEquals(3, ledger.getFillCount());
            assertEquals(2, ledger.getFills("B").size());
        }
    }

    @Nested
    @DisplayName("Commission allocation")
    class CommissionAllocation {

        @Test
        @DisplayName("Entry and exit commissions are pro-rated across partial closes")
        void proRatesCommission() {
            ledger.applyFill(fill("A", Side.BUY, 100, "10", "10", DAY_1));
            CompletedTrade first = ledger.applyFill(fill("A", Side.SELL, 25, "10", "2", DAY_2)).get(0);
            CompletedTrade second = ledger.applyFill(fill("A", Side.SELL, 75, "10", "6", DAY_5)).get(0);

            // 25% of entry commission + all of the first exit commission
            assertEquals(0, new BigDecimal("4.5").compareTo(first.getCommission()));
            assertEquals(0, new BigDecimal("-4.5").compareTo(first.getPnl()));
            // remaining 75% of entry commission + all of the second exit commission
            assertEquals(0, new BigDecimal("13.5").compareTo(second.getCommission()));
        }

        @Test
        @DisplayName("Total allocated commission equals total charged")
        void allocatesEveryUnitOfCommission() {
            ledger.applyFill(fill("A", Side.BUY, 3, "10", "1", DAY_1));
            ledger.applyFill(fill("A", Side.BUY, 7, "11", "1", DAY_1));
            ledger.applyFill(fill("A", Side.SELL, 10, "12", "1", DAY_2));

            BigDecimal allocated = ledger.getCompletedTrades().stream()
                    .map(CompletedTrade::getCommission)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            assertEquals(0, new BigDecimal("3").compareTo(allocated));
        }
    }

    @Nested
    @DisplayName("Invariant violations")
    class Violations {

        @Test
        @DisplayName("Sell with no long exposure opens a short lot and is counted in long-only mode")
        void shortLotInLongOnlyMode() {
            List<CompletedTrade> closed = ledger.applyFill(fill("A", Side.SELL, 10, "100", "0", DAY_1));

            assertTrue(closed.isEmpty());
            assertEquals(1, ledger.getMatchingViolations());
            assertEquals(-10, ledger.getNetOpenQuantity("A"));
        }

        @Test
        @DisplayName("Oversized sell closes the long lot and shorts the remainder")
        void oversizedSell() {
            ledger.applyFill(fill("A", Side.BUY, 10, "100", "0", DAY_1));
            List<CompletedTrade> closed = ledger.applyFill(fill("A", Side.SELL, 15, "100", "0", DAY_2));

            assertEquals(1, closed.size());
            assertEquals(1, ledger.getMatchingViolations());
            assertEquals(-5, ledger.getNetOpenQuantity("A"));
        }

        @Test
        @DisplayName("Fill older than the previous fill is rejected")
        void rejectsOutOfOrderFill() {
            ledger.applyFill(fill("A", Side.BUY, 10, "100", "0", DAY_2));

            BacktestException e = assertThrows(BacktestException.class,
                    () -> ledger.applyFill(fill("A", Side.SELL, 10, "100", "0", DAY_1)));
            assertEquals(BacktestException.ErrorCode.LEDGER_ORDER_VIOLATION, e.getErrorCode());
            assertEquals(1, ledger.getFills("A").size());
        }

        @Test
        @DisplayName("Non-positive quantity is rejected")
        void rejectsZeroQuantity() {
            assertThrows(IllegalArgumentException.class,
                    () -> ledger.applyFill(fill("A", Side.BUY, 0, "100", "0", DAY_1)));
        }
    }
}
