package com.portfoliobacktest.backtest.portfolio;

import com.portfoliobacktest.backtest.ledger.CompletedTrade;
import com.portfoliobacktest.backtest.ledger.Fill;
import com.portfoliobacktest.backtest.ledger.Side;
import com.portfoliobacktest.backtest.portfolio.RebalancePlan.PlannedOrder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks positions, cash and equity for one backtest run and sizes rebalancing orders.
 * <p>
 * Sizing rule: target shares = floor(weight x equity / price), delta = target - held. Instruments
 * held but absent from the target set are driven to zero. Deltas whose notional is below the
 * minimum rebalance notional are dropped.
 * <p>
 * Thread safety: NOT thread-safe. One tracker per run.
 */
@Slf4j
public class PortfolioTracker {

    private static final MathContext MC = new MathContext(16, RoundingMode.HALF_UP);
    private static final int PRICE_SCALE = 8;

    @Getter
    private final Account account;

    private final BigDecimal minRebalanceNotional;

    /** Maximum simultaneously held instruments; 0 or less means unlimited. */
    private final int maxPositions;

    public PortfolioTracker(Account account, BigDecimal minRebalanceNotional, int maxPositions) {
        this.account = account;
        this.minRebalanceNotional = minRebalanceNotional != null ? minRebalanceNotional : BigDecimal.ZERO;
        this.maxPositions = maxPositions;
    }

    // ==================== WEIGHTS ====================

    /**
     * Current weight of every open position: market value / account equity.
     * Returns an empty map when equity is not positive.
     */
    public Map<String, Double> computeWeights(Account source) {
        Map<String, Double> weights = new LinkedHashMap<>();
        BigDecimal equity = source.getEquity();
        if (equity == null || equity.signum() <= 0) {
            return weights;
        }
        for (Position position : source.getPositions().values()) {
            if (position.isOpen()) {
                weights.put(position.getInstrumentId(),
                        position.getMarketValue().divide(equity, MC).doubleValue());
            }
        }
        return weights;
    }

    // ==================== REBALANCING ====================

    /**
     * Signed share deltas moving current holdings toward {@code targetWeights}.
     * Target instruments come first in the order given, then held instruments being liquidated.
     * Instruments without a positive price are left out.
     */
    public Map<String, Long> computeRebalanceOrders(Map<String, Double> targetWeights,
                                                    Map<String, BigDecimal> currentPrices,
                                                    BigDecimal totalEquity) {
        Map<String, Long> deltas = new LinkedHashMap<>();
        for (String instrumentId : instrumentsToReconcile(targetWeights)) {
            BigDecimal price = currentPrices.get(instrumentId);
            if (price == null || price.signum() <= 0) {
                continue;
            }
            long targetShares = targetShares(targetWeights.getOrDefault(instrumentId, 0.0), totalEquity, price);
            long delta = targetShares - account.heldQuantity(instrumentId);
            if (delta == 0) {
                continue;
            }
            BigDecimal notional = price.multiply(BigDecimal.valueOf(Math.abs(delta)));
            if (notional.compareTo(minRebalanceNotional) < 0) {
                log.debug("Dropping {} delta {} for {}: notional {} below minimum {}",
                        delta > 0 ? "buy" : "sell", delta, instrumentId, notional, minRebalanceNotional);
                continue;
            }
            deltas.put(instrumentId, delta);
        }
        return deltas;
    }

    /**
     * Sequence one session's rebalancing: sells first, then buys in strategy order. Instruments
     * with no price that still need a change are rejected as {@code NO_PRICE}. The position cap
     * and cash sufficiency are checked at execution time, against the holdings at that moment.
     */
    public RebalancePlan planRebalance(LocalDate sessionDate,
                                       Map<String, Double> targetWeights,
                                       Map<String, BigDecimal> currentPrices,
                                       BigDecimal totalEquity) {
        List<RejectedOrder> rejections = new ArrayList<>();
        for (String instrumentId : instrumentsToReconcile(targetWeights)) {
            BigDecimal price = currentPrices.get(instrumentId);
            if (price != null && price.signum() > 0) {
                continue;
            }
            double weight = targetWeights.getOrDefault(instrumentId, 0.0);
            long held = account.heldQuantity(instrumentId);
            if (held == 0) {
                if (weight > 0) {
                    rejections.add(new RejectedOrder(sessionDate, instrumentId, 0, RejectedOrder.Reason.NO_PRICE));
                }
                continue;
            }
            long estimate = estimateDeltaAtLastPrice(instrumentId, weight, totalEquity);
            if (estimate != 0) {
                rejections.add(new RejectedOrder(sessionDate, instrumentId, estimate, RejectedOrder.Reason.NO_PRICE));
            }
        }

        Map<String, Long> deltas = computeRebalanceOrders(targetWeights, currentPrices, totalEquity);

        List<PlannedOrder> sells = new ArrayList<>();
        List<PlannedOrder> buys = new ArrayList<>();
        deltas.forEach((instrumentId, delta) -> {
            if (delta < 0) {
                sells.add(new PlannedOrder(instrumentId, delta));
            } else {
                buys.add(new PlannedOrder(instrumentId, delta));
            }
        });
        return new RebalancePlan(sells, buys, rejections);
    }

    /**
     * Delta a held but unpriced instrument would need, sized at its last known price. Zero when
     * no change is needed or the change is below the minimum rebalance notional.
     */
    private long estimateDeltaAtLastPrice(String instrumentId, double weight, BigDecimal totalEquity) {
        long held = account.heldQuantity(instrumentId);
        BigDecimal lastPrice = account.getPosition(instrumentId)
                .map(Position::getLastPrice)
                .orElse(null);
        if (lastPrice == null || lastPrice.signum() <= 0) {
            // Nothing to size against; only a full exit is known to be a change
            return weight > 0 ? 0 : -held;
        }
        long delta = targetShares(weight, totalEquity, lastPrice) - held;
        if (delta == 0) {
            return 0;
        }
        BigDecimal notional = lastPrice.multiply(BigDecimal.valueOf(Math.abs(delta)));
        return notional.compareTo(minRebalanceNotional) < 0 ? 0 : delta;
    }

    /**
     * True if buying {@code instrumentId} now would open a position beyond the cap. Adding to an
     * instrument already held never counts against it.
     */
    public boolean exceedsPositionLimit(String instrumentId) {
        return maxPositions > 0
                && account.heldQuantity(instrumentId) == 0
                && account.getHeldInstruments().size() >= maxPositions;
    }

    private Set<String> instrumentsToReconcile(Map<String, Double> targetWeights) {
        Set<String> instruments = new LinkedHashSet<>(targetWeights.keySet());
        instruments.addAll(account.getHeldInstruments());
        return instruments;
    }

    private long targetShares(double weight, BigDecimal totalEquity, BigDecimal price) {
        if (weight <= 0 || totalEquity == null || totalEquity.signum() <= 0) {
            return 0;
        }
        return BigDecimal.valueOf(weight)
                .multiply(totalEquity)
                .divide(price, 0, RoundingMode.FLOOR)
                .longValueExact();
    }

    // ==================== SETTLEMENT ====================

    /**
     * True if settling these buy fills would leave cash below zero.
     */
    public boolean wouldOverdraw(List<Fill> fills) {
        BigDecimal cash = account.getCash();
        for (Fill fill : fills) {
            cash = cash.add(cashDelta(fill));
        }
        return cash.signum() < 0;
    }

    /**
     * Apply a fill to cash and the instrument's position. Commission is deducted at fill time.
     *
     * @param closedTrades round trips the ledger closed with this fill; their pnl is realized here
     */
    public void applyFill(Fill fill, List<CompletedTrade> closedTrades) {
        account.adjustCash(cashDelta(fill));

        Position position = account.positionFor(fill.getInstrumentId());
        long oldQty = position.getQuantity();
        long signedQty = fill.getSide().sign() * fill.getQuantity();
        long newQty = oldQty + signedQty;

        if (oldQty == 0 || Long.signum(oldQty) == Long.signum(signedQty)) {
            // Opening or extending: weighted average of old cost and fill price
            BigDecimal totalCost = position.getAverageCost().multiply(BigDecimal.valueOf(Math.abs(oldQty)))
                    .add(fill.notional());
            position.setAverageCost(totalCost.divide(BigDecimal.valueOf(Math.abs(newQty)),
                    PRICE_SCALE, RoundingMode.HALF_UP));
        } else if (newQty == 0) {
            position.setAverageCost(BigDecimal.ZERO);
        } else if (Long.signum(newQty) != Long.signum(oldQty)) {
            // Flipped through zero: the remainder was opened at the fill price
            position.setAverageCost(fill.getPrice());
        }

        position.setQuantity(newQty);
        position.setLastPrice(fill.getPrice());
        for (CompletedTrade trade : closedTrades) {
            position.setRealizedPnl(position.getRealizedPnl().add(trade.getPnl()));
        }

        log.debug("Settled {} {} {} @ {} (commission {}): qty {} -> {}, cash={}",
                fill.getSide(), fill.getQuantity(), fill.getInstrumentId(), fill.getPrice(),
                fill.getCommission(), oldQty, newQty, account.getCash());
    }

    /**
     * Update last prices and recompute equity.
     */
    public BigDecimal markToMarket(Map<String, BigDecimal> prices) {
        return account.markToMarket(prices);
    }

    private BigDecimal cashDelta(Fill fill) {
        BigDecimal notional = fill.notional();
        return fill.getSide() == Side.BUY
                ? notional.negate().subtract(fill.getCommission())
                : notional.subtract(fill.getCommission());
    }
}
