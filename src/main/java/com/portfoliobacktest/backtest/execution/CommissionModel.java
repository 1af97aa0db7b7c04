package com.portfoliobacktest.backtest.execution;

import com.portfoliobacktest.backtest.ledger.Side;

import java.math.BigDecimal;

/**
 * Computes the commission charged on one fill.
 */
@FunctionalInterface
public interface CommissionModel {

    CommissionModel ZERO = (side, quantity, price) -> BigDecimal.ZERO;

    /**
     * @return commission for the fill, never negative
     */
    BigDecimal commissionFor(Side side, long quantity, BigDecimal price);
}
