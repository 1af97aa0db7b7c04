package com.portfoliobacktest.backtest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Represents a single OHLC bar for one instrument.
 *
 * Note: All price fields use BigDecimal so that fills and equity marks
 * are exact and reproducible run to run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Bar {

    /**
     * Instrument this bar belongs to.
     */
    private String instrumentId;

    /**
     * Timestamp of the bar start.
     */
    private LocalDateTime timestamp;

    private BigDecimal open;

    private BigDecimal high;

    private BigDecimal low;

    private BigDecimal close;

    /**
     * Traded volume during the bar period.
     */
    private long volume;

    public LocalDate getDate() {
        return timestamp.toLocalDate();
    }
}
