package com.portfoliobacktest.backtest.execution;

import com.portfoliobacktest.backtest.ledger.Side;

/**
 * Market order handed to the {@link ExecutionModel}.
 *
 * @param quantity always positive; direction is carried by {@code side}
 */
public record Order(String orderId, String instrumentId, Side side, long quantity) {

    public Order {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + quantity);
        }
    }

    /** Signed quantity: positive for buys, negative for sells. */
    public long signedQuantity() {
        return side.sign() * quantity;
    }
}
