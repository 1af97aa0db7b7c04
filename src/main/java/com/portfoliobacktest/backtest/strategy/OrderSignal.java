package com.portfoliobacktest.backtest.strategy;

import com.portfoliobacktest.backtest.ledger.Side;

/**
 * An order a single-instrument strategy wants executed at the current bar.
 *
 * @param instrumentId instrument to trade; null means the instrument being replayed
 */
public record OrderSignal(String instrumentId, Side side, long quantity) {

    public static OrderSignal buy(String instrumentId, long quantity) {
        return new OrderSignal(instrumentId, Side.BUY, quantity);
    }

    public static OrderSignal sell(String instrumentId, long quantity) {
        return new OrderSignal(instrumentId, Side.SELL, quantity);
    }
}
