package com.portfoliobacktest.backtest.execution;

import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.ledger.Fill;
import com.portfoliobacktest.backtest.ledger.Side;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedExecutionModelTest {

    private static final LocalDateTime TS = LocalDateTime.of(2024, 5, 6, 15, 30);

    private static Bar bar(String open, String high, String low, String close) {
        return Bar.builder()
                .instrumentId("A")
                .timestamp(TS.toLocalDate().atStartOfDay())
                .open(new BigDecimal(open))
                .high(new BigDecimal(high))
                .low(new BigDecimal(low))
                .close(new BigDecimal(close))
                .volume(1000)
                .build();
    }

    @Nested
    @DisplayName("Price policy")
    class Policy {

        @Test
        void openAndClose() {
            Bar bar = bar("100", "110", "95", "105");
            assertEquals(0, new BigDecimal("100").compareTo(PricePolicy.OPEN.priceOf(bar)));
            assertEquals(0, new BigDecimal("105").compareTo(PricePolicy.CLOSE.priceOf(bar)));
        }

        @Test
        @DisplayName("VWAP proxy is the typical price")
        void vwapProxy() {
            Bar bar = bar("100", "110", "95", "105");
            // (110 + 95 + 105) / 3 = 103.3333
            assertEquals(0, new BigDecimal("103.3333").compareTo(PricePolicy.VWAP.priceOf(bar)));
        }
    }

    @Nested
    @DisplayName("Fills")
    class Fills {

        @Test
        @DisplayName("Buy pays slippage and commission on turnover")
        void buyWithSlippageAndCommission() {
            SimulatedExecutionModel model = new SimulatedExecutionModel(PricePolicy.CLOSE,
                    new BigDecimal("0.01"), new PercentageCommissionModel(new BigDecimal("0.0015")));

            List<Fill> fills = model.execute(new Order("ORD-1", "A", Side.BUY, 10), bar("100", "110", "90", "100"), TS);

            assertEquals(1, fills.size());
            Fill fill = fills.get(0);
            assertEquals(0, new BigDecimal("101").compareTo(fill.getPrice()));
            // 1010 x 0.0015
            assertEquals(0, new BigDecimal("1.515").compareTo(fill.getCommission()));
            assertEquals(10, fill.getQuantity());
            assertEquals("ORD-1", fill.getOrderId());
            assertEquals(TS, fill.getTimestamp());
        }

        @Test
        @DisplayName("Sell receives price reduced by slippage")
        void sellWithSlippage() {
            SimulatedExecutionModel model = new SimulatedExecutionModel(PricePolicy.OPEN,
                    new BigDecimal("0.01"), CommissionModel.ZERO);

            Fill fill = model.execute(new Order("ORD-2", "A", Side.SELL, 5), bar("200", "210", "190", "205"), TS).get(0);

            assertEquals(0, new BigDecimal("198").compareTo(fill.getPrice()));
            assertEquals(0, BigDecimal.ZERO.compareTo(fill.getCommission()));
        }

        @Test
        @DisplayName("No bar or a non-positive price yields no fill")
        void noUsablePrice() {
            SimulatedExecutionModel model = new SimulatedExecutionModel(PricePolicy.CLOSE, null, null);

            assertTrue(model.execute(new Order("ORD-3", "A", Side.BUY, 1), null, TS).isEmpty());
            assertTrue(model.execute(new Order("ORD-4", "A", Side.BUY, 1), bar("1", "1", "0", "0"), TS).isEmpty());
        }
    }

    @Test
    @DisplayName("Minimum commission per order applies to small orders")
    void minimumCommission() {
        PercentageCommissionModel model = new PercentageCommissionModel(new BigDecimal("0.001"), new BigDecimal("20"));

        assertEquals(0, new BigDecimal("20").compareTo(model.commissionFor(Side.BUY, 10, new BigDecimal("100"))));
        assertEquals(0, new BigDecimal("100").compareTo(model.commissionFor(Side.BUY, 1000, new BigDecimal("100"))));
    }

    @Test
    void orderRejectsNonPositiveQuantity() {
        assertThrows(IllegalArgumentException.class, () -> new Order("ORD-5", "A", Side.BUY, 0));
    }

    @Test
    @DisplayName("Slippage must lie in [0, 1)")
    void slippageBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new SimulatedExecutionModel(PricePolicy.CLOSE, BigDecimal.ONE, CommissionModel.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new SimulatedExecutionModel(PricePolicy.CLOSE, new BigDecimal("1.5"), CommissionModel.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new SimulatedExecutionModel(PricePolicy.CLOSE, new BigDecimal("-0.01"), CommissionModel.ZERO));

        SimulatedExecutionModel steep = new SimulatedExecutionModel(PricePolicy.CLOSE, new BigDecimal("0.99"),
                CommissionModel.ZERO);
        Fill fill = steep.execute(new Order("ORD-6", "A", Side.SELL, 1), bar("100", "100", "100", "100"), TS).get(0);
        assertEquals(0, BigDecimal.ONE.compareTo(fill.getPrice()));
    }
}
