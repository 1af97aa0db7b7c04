package com.portfoliobacktest.backtest.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one run. The engine checks it after every session.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return true if this call cancelled the run, false if it was already cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
