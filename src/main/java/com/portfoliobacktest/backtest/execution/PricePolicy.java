package com.portfoliobacktest.backtest.execution;

import com.portfoliobacktest.backtest.dto.Bar;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Which price of the session bar an order trades at.
 */
public enum PricePolicy {
    OPEN,
    CLOSE,
    /** Typical-price proxy for VWAP: (high + low + close) / 3. */
    VWAP;

    private static final BigDecimal THREE = BigDecimal.valueOf(3);

    public BigDecimal priceOf(Bar bar) {
        return switch (this) {
            case OPEN -> bar.getOpen();
            case CLOSE -> bar.getClose();
            case VWAP -> bar.getHigh().add(bar.getLow()).add(bar.getClose())
                    .divide(THREE, 4, RoundingMode.HALF_UP);
        };
    }
}
