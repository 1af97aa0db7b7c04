package com.portfoliobacktest.backtest.portfolio;

import java.time.LocalDate;

/**
 * An order the engine refused for one session. Rejections are recorded, never retried.
 *
 * @param quantity signed order quantity (positive buy, negative sell)
 */
public record RejectedOrder(LocalDate sessionDate, String instrumentId, long quantity, Reason reason) {

    public enum Reason {
        /** Buying a new instrument would exceed the configured position cap. */
        POSITION_LIMIT,
        /** The buy would push cash below zero after earlier orders in the session. */
        INSUFFICIENT_CASH,
        /** No usable price for the instrument on that session. */
        NO_PRICE
    }
}
