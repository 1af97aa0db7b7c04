package com.portfoliobacktest.backtest.dto;

import com.portfoliobacktest.backtest.execution.PricePolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for running a strategy over historical data.
 * Execution fields left null fall back to the configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class BacktestRequest {

    /**
     * Registered strategy name (e.g. "MACrossStrategy").
     */
    @NotBlank(message = "Strategy name is required")
    private String strategyName;

    /**
     * Strategy parameters, passed through to the strategy's constructor.
     */
    @Builder.Default
    private Map<String, Object> strategyParams = new HashMap<>();

    /**
     * Instrument to replay. Required for single-instrument strategies, ignored in portfolio mode.
     */
    private String instrumentId;

    /**
     * First session date (inclusive). Format: yyyy-MM-dd
     */
    @NotNull(message = "Start date is required")
    private LocalDate startDate;

    /**
     * Last session date (inclusive). Format: yyyy-MM-dd
     */
    @NotNull(message = "End date is required")
    private LocalDate endDate;

    @DecimalMin(value = "0.0", inclusive = false, message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    @DecimalMin(value = "0.0", message = "Commission rate must not be negative")
    private BigDecimal commissionRate;

    @DecimalMin(value = "0.0", message = "Slippage rate must not be negative")
    @DecimalMax(value = "1.0", inclusive = false, message = "Slippage rate must be below 1")
    private BigDecimal slippageRate;

    private PricePolicy pricePolicy;

    /**
     * Bar interval (e.g. "1d").
     */
    private String interval;

    @DecimalMin(value = "0.0", message = "Minimum rebalance notional must not be negative")
    private BigDecimal minRebalanceNotional;

    /**
     * Maximum simultaneously held instruments, 0 for unlimited.
     */
    @PositiveOrZero(message = "Max positions must not be negative")
    private Integer maxPositions;
}
