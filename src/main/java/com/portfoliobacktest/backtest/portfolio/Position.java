package com.portfoliobacktest.backtest.portfolio;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Current holding in one instrument during a backtest.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Position {

    private String instrumentId;

    /** Signed: positive long, negative short, zero flat. */
    @Builder.Default
    private long quantity = 0;

    @Builder.Default
    private BigDecimal averageCost = BigDecimal.ZERO;

    /** Sum of pnl of every round trip closed on this instrument. */
    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    /** Last known price used for mark-to-market. */
    @Builder.Default
    private BigDecimal lastPrice = BigDecimal.ZERO;

    public BigDecimal getMarketValue() {
        return lastPrice.multiply(BigDecimal.valueOf(quantity));
    }

    public BigDecimal getUnrealizedPnl() {
        return lastPrice.subtract(averageCost).multiply(BigDecimal.valueOf(quantity));
    }

    public boolean isOpen() {
        return quantity != 0;
    }
}
