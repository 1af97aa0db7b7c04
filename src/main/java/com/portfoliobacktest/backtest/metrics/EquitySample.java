package com.portfoliobacktest.backtest.metrics;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Account equity observed at the end of one session.
 */
public record EquitySample(LocalDateTime timestamp, BigDecimal equity) {
}
