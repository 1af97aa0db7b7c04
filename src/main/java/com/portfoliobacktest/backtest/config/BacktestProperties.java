package com.portfoliobacktest.backtest.config;

import com.portfoliobacktest.backtest.execution.PricePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.LocalTime;

/**
 * Backtest Configuration
 * Defaults for simulation runs; request fields override the execution settings per run.
 */
@Configuration
@ConfigurationProperties(prefix = "backtest")
@Data
public class BacktestProperties {

    // Master flag
    private boolean enabled = true;
    private BigDecimal defaultInitialCapital = new BigDecimal("10000000");

    // Execution
    private BigDecimal commissionRate = new BigDecimal("0.0015"); // 0.15% of turnover
    private BigDecimal slippageRate = BigDecimal.ZERO;
    private PricePolicy pricePolicy = PricePolicy.CLOSE;
    private String interval = "1d";

    // Portfolio policy
    private BigDecimal minRebalanceNotional = BigDecimal.ZERO;
    private int maxPositions = 0; // 0 = unlimited
    private BigDecimal minimumCash = BigDecimal.ZERO;
    private boolean longOnly = true;

    // Metrics
    private int periodsPerYear = 252;
    private double riskFreeRate = 0.0;

    // Session calendar
    private boolean skipWeekends = true;
    private LocalTime marketOpen = LocalTime.of(9, 0);
    private LocalTime marketClose = LocalTime.of(15, 30);

    // Result store
    private int maxStoredResults = 100;

    // Parameter optimization
    private int maxOptimizationCombinations = 1000;

    // Shared OHLC cache
    private int cacheMaxEntries = 512;

    // Async execution
    private int executorCorePoolSize = 2;
    private int executorMaxPoolSize = 4;
    private int executorQueueCapacity = 100;
}
