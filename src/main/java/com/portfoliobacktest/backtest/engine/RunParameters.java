package com.portfoliobacktest.backtest.engine;

import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.execution.ExecutionModel;
import com.portfoliobacktest.backtest.execution.PricePolicy;
import com.portfoliobacktest.backtest.strategy.BacktestStrategy;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything one engine run needs, resolved from the request and configuration.
 */
@Getter
@Builder
public class RunParameters {

    private final String backtestId;

    private final BacktestStrategy strategy;

    private final LocalDate startDate;

    private final LocalDate endDate;

    private final BigDecimal initialCapital;

    private final ExecutionModel executionModel;

    /** Price used for order sizing; should match the execution model's fill price. */
    @Builder.Default
    private final PricePolicy pricePolicy = PricePolicy.CLOSE;

    @Builder.Default
    private final String interval = "1d";

    /** Overrides the configured minimum rebalance notional when set. */
    private final BigDecimal minRebalanceNotional;

    /** Overrides the configured position cap when set. */
    private final Integer maxPositions;

    /** Single-instrument mode only: the replayed instrument and its series. */
    private final String instrumentId;

    private final List<Bar> series;
}
