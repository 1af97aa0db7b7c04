package com.portfoliobacktest.backtest.execution;

import com.portfoliobacktest.backtest.ledger.Side;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Commission as a flat rate of turnover (price x quantity), optionally with a per-order minimum.
 */
public class PercentageCommissionModel implements CommissionModel {

    private static final MathContext MC = new MathContext(10, RoundingMode.HALF_UP);

    private final BigDecimal rate;
    private final BigDecimal minimumPerOrder;

    public PercentageCommissionModel(BigDecimal rate) {
        this(rate, BigDecimal.ZERO);
    }

    public PercentageCommissionModel(BigDecimal rate, BigDecimal minimumPerOrder) {
        if (rate == null || rate.signum() < 0) {
            throw new IllegalArgumentException("Commission rate must be non-negative: " + rate);
        }
        this.rate = rate;
        this.minimumPerOrder = minimumPerOrder != null ? minimumPerOrder : BigDecimal.ZERO;
    }

    @Override
    public BigDecimal commissionFor(Side side, long quantity, BigDecimal price) {
        if (rate.signum() == 0 && minimumPerOrder.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal turnover = price.multiply(BigDecimal.valueOf(quantity));
        BigDecimal commission = turnover.multiply(rate, MC).setScale(4, RoundingMode.HALF_UP);
        return commission.max(minimumPerOrder);
    }

    public BigDecimal getRate() {
        return rate;
    }
}
