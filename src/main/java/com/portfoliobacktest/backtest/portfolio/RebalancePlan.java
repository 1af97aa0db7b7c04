package com.portfoliobacktest.backtest.portfolio;

import java.util.List;

/**
 * Sequenced rebalancing orders for one session.
 *
 * @param sells       signed deltas below zero, executed first to free cash
 * @param buys        signed deltas above zero, in strategy-reported order
 * @param rejections  orders refused while planning (missing price)
 */
public record RebalancePlan(List<PlannedOrder> sells, List<PlannedOrder> buys, List<RejectedOrder> rejections) {

    public record PlannedOrder(String instrumentId, long delta) {
    }
}
