package com.portfoliobacktest.backtest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time cross-section of the market used for universe selection:
 * one row of price, traded value and fundamental ratios per instrument.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarketSnapshot {

    private LocalDate date;

    private Map<String, Row> rows = new LinkedHashMap<>();

    public static MarketSnapshot empty(LocalDate date) {
        return new MarketSnapshot(date, new LinkedHashMap<>());
    }

    public static MarketSnapshot of(LocalDate date, Collection<Row> rows) {
        Map<String, Row> byInstrument = new LinkedHashMap<>();
        rows.forEach(row -> byInstrument.put(row.getInstrumentId(), row));
        return new MarketSnapshot(date, byInstrument);
    }

    public boolean isEmpty() {
        return rows == null || rows.isEmpty();
    }

    public Optional<Row> get(String instrumentId) {
        return Optional.ofNullable(rows.get(instrumentId));
    }

    public List<Row> rowList() {
        return Collections.unmodifiableList(new ArrayList<>(rows.values()));
    }

    /**
     * Snapshot fields for one instrument. Fundamental ratios are null when unknown.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Row {
        private String instrumentId;
        private BigDecimal price;
        /** Traded value (price x volume) for the day. */
        private double volumeAmount;
        private Double per;
        private Double pbr;
        private Double roe;
    }
}
