package com.portfoliobacktest.backtest.portfolio;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read-only account state handed to strategy decision functions.
 */
public record AccountView(BigDecimal cash, BigDecimal equity, List<Position> positions) {

    public long quantityOf(String instrumentId) {
        return positions.stream()
                .filter(p -> p.getInstrumentId().equals(instrumentId))
                .mapToLong(Position::getQuantity)
                .findFirst()
                .orElse(0L);
    }
}
