package com.portfoliobacktest.backtest.strategy;

import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.dto.MarketSnapshot;
import com.portfoliobacktest.backtest.ledger.Fill;
import com.portfoliobacktest.backtest.portfolio.AccountView;
import com.portfoliobacktest.backtest.portfolio.Position;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strategy interface for backtesting.
 *
 * A strategy runs in one of two modes, chosen by {@link #hasUniverseSelection()}:
 * <ul>
 *   <li>single instrument: the engine replays one OHLC series and calls {@link #onBar} per bar</li>
 *   <li>portfolio: each session the engine asks for a universe ({@link #selectUniverse}) and target
 *       weights ({@link #targetWeights}), then rebalances toward them</li>
 * </ul>
 *
 * A new instance is created per run, so implementations may keep state between calls.
 * The engine never hands out its own mutable state: positions and account are copies.
 */
public interface BacktestStrategy {

    /**
     * Get the strategy name for identification.
     */
    String getStrategyName();

    /**
     * Decide on orders for the latest bar.
     *
     * @param history   all bars up to and including the current one, oldest first
     * @param positions open positions
     * @param account   cash and equity before this bar's orders
     * @return orders to execute at this bar; empty for no action
     */
    List<OrderSignal> onBar(List<Bar> history, List<Position> positions, AccountView account);

    /**
     * Whether this strategy selects a universe and allocates across it (portfolio mode).
     */
    default boolean hasUniverseSelection() {
        return false;
    }

    /**
     * Instruments to hold after this session's rebalance, in priority order.
     * An empty list means hold cash.
     */
    default List<String> selectUniverse(LocalDate date, MarketSnapshot snapshot) {
        throw new UnsupportedOperationException(getStrategyName() + " does not select a universe");
    }

    /**
     * Target weight per instrument of the selected universe. Equal weighting unless overridden.
     */
    default Map<String, Double> targetWeights(List<String> universe, MarketSnapshot snapshot, AccountView account) {
        Map<String, Double> weights = new LinkedHashMap<>();
        if (universe.isEmpty()) {
            return weights;
        }
        double weight = 1.0 / universe.size();
        universe.forEach(instrumentId -> weights.put(instrumentId, weight));
        return weights;
    }

    /**
     * Notification after a fill of this strategy's order has been settled.
     */
    default void onFill(Fill fill, Position position) {
    }

    /**
     * Bar interval the strategy expects. Null means the configured default.
     */
    default String getRequiredInterval() {
        return null;
    }
}
