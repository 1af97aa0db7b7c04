package com.portfoliobacktest.backtest.portfolio;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Portfolio-wide simulated account: cash plus one {@link Position} per instrument ever traded.
 * <p>
 * Owned by a single backtest run and mutated only through {@link PortfolioTracker}.
 */
@Getter
public class Account {

    private final BigDecimal initialCapital;

    private BigDecimal cash;

    /** Cash + sum of position market values, refreshed by {@link #markToMarket(Map)}. */
    private BigDecimal equity;

    private final Map<String, Position> positions = new TreeMap<>();

    public Account(BigDecimal initialCapital) {
        this.initialCapital = initialCapital;
        this.cash = initialCapital;
        this.equity = initialCapital;
    }

    /**
     * Update last prices of held instruments and recompute equity.
     * Instruments with no entry in {@code prices} keep their last known price.
     */
    public BigDecimal markToMarket(Map<String, BigDecimal> prices) {
        BigDecimal marketValue = BigDecimal.ZERO;
        for (Position position : positions.values()) {
            BigDecimal price = prices.get(position.getInstrumentId());
            if (price != null && price.signum() > 0) {
                position.setLastPrice(price);
            }
            marketValue = marketValue.add(position.getMarketValue());
        }
        equity = cash.add(marketValue);
        return equity;
    }

    public Optional<Position> getPosition(String instrumentId) {
        return Optional.ofNullable(positions.get(instrumentId));
    }

    public long heldQuantity(String instrumentId) {
        Position position = positions.get(instrumentId);
        return position == null ? 0 : position.getQuantity();
    }

    /** Instruments with a non-zero quantity, in instrument id order. */
    public List<String> getHeldInstruments() {
        List<String> held = new ArrayList<>();
        positions.values().stream()
                .filter(Position::isOpen)
                .forEach(p -> held.add(p.getInstrumentId()));
        return held;
    }

    /** Detached copies of open positions, safe to hand to strategy code. */
    public List<Position> openPositionsCopy() {
        List<Position> copies = new ArrayList<>();
        positions.values().stream()
                .filter(Position::isOpen)
                .forEach(p -> copies.add(p.toBuilder().build()));
        return Collections.unmodifiableList(copies);
    }

    public AccountView view() {
        return new AccountView(cash, equity, openPositionsCopy());
    }

    Position positionFor(String instrumentId) {
        return positions.computeIfAbsent(instrumentId,
                id -> Position.builder().instrumentId(id).build());
    }

    void adjustCash(BigDecimal delta) {
        cash = cash.add(delta);
    }
}
