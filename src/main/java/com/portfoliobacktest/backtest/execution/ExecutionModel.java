package com.portfoliobacktest.backtest.execution;

import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.ledger.Fill;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Turns an order into fills against a session bar.
 *
 * Implementations must be deterministic: the same order against the same bar yields the same
 * fills. The engine may discard the returned fills (for example when a buy cannot be funded),
 * so implementations must not keep state about what they returned.
 */
public interface ExecutionModel {

    /**
     * @param order     order to execute
     * @param bar       the instrument's bar for the session
     * @param timestamp fill timestamp to stamp on every fill
     * @return zero or more fills; empty when the bar has no usable price
     */
    List<Fill> execute(Order order, Bar bar, LocalDateTime timestamp);
}
