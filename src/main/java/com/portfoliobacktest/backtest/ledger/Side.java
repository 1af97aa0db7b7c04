package com.portfoliobacktest.backtest.ledger;

/**
 * Direction of a fill or of an open lot.
 */
public enum Side {
    BUY,
    SELL;

    /**
     * +1 for BUY (long exposure), -1 for SELL (short exposure).
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }
}
