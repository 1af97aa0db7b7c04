package com.portfoliobacktest.backtest.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One executed order leg produced by the execution model.
 * Fills are consumed by the ledger immediately and never persisted on their own.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Fill {

    private String instrumentId;

    private Side side;

    /** Always positive; direction is carried by {@link #side}. */
    private long quantity;

    private BigDecimal price;

    @Builder.Default
    private BigDecimal commission = BigDecimal.ZERO;

    private LocalDateTime timestamp;

    /** Id of the order this fill executed. */
    private String orderId;

    public BigDecimal notional() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
