package com.portfoliobacktest.backtest.execution;

import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.ledger.Fill;
import com.portfoliobacktest.backtest.ledger.Side;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Fills every order in full at the policy price of the session bar, adjusted for slippage:
 * buys pay price x (1 + slippage), sells receive price x (1 - slippage). Slippage must lie in
 * [0, 1) so a sell price stays positive.
 */
@Slf4j
@Getter
public class SimulatedExecutionModel implements ExecutionModel {

    private final PricePolicy pricePolicy;
    private final BigDecimal slippageRate;
    private final CommissionModel commissionModel;

    public SimulatedExecutionModel(PricePolicy pricePolicy, BigDecimal slippageRate, CommissionModel commissionModel) {
        BigDecimal slippage = slippageRate != null ? slippageRate : BigDecimal.ZERO;
        if (slippage.signum() < 0 || slippage.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("Slippage rate must be in [0, 1): " + slippage);
        }
        this.pricePolicy = pricePolicy != null ? pricePolicy : PricePolicy.CLOSE;
        this.slippageRate = slippage;
        this.commissionModel = commissionModel != null ? commissionModel : CommissionModel.ZERO;
    }

    @Override
    public List<Fill> execute(Order order, Bar bar, LocalDateTime timestamp) {
        if (bar == null) {
            return List.of();
        }
        BigDecimal basePrice = pricePolicy.priceOf(bar);
        if (basePrice == null || basePrice.signum() <= 0) {
            log.warn("No usable {} price for {} at {}", pricePolicy, order.instrumentId(), timestamp);
            return List.of();
        }

        BigDecimal price = applySlippage(basePrice, order.side());
        BigDecimal commission = commissionModel.commissionFor(order.side(), order.quantity(), price);

        return List.of(Fill.builder()
                .instrumentId(order.instrumentId())
                .side(order.side())
                .quantity(order.quantity())
                .price(price)
                .commission(commission)
                .timestamp(timestamp)
                .orderId(order.orderId())
                .build());
    }

    private BigDecimal applySlippage(BigDecimal price, Side side) {
        if (slippageRate.signum() == 0) {
            return price;
        }
        BigDecimal factor = side == Side.BUY
                ? BigDecimal.ONE.add(slippageRate)
                : BigDecimal.ONE.subtract(slippageRate);
        return price.multiply(factor).setScale(4, RoundingMode.HALF_UP);
    }
}
