package com.portfoliobacktest.backtest.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for a parameter grid search: one backtest per combination of the grid's values,
 * each run on a copy of the base request with the combination merged into its strategy parameters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptimizationRequest {

    @NotNull(message = "Base request is required")
    @Valid
    private BacktestRequest baseRequest;

    /**
     * Strategy parameter name to the values to try, e.g. {"short_period": [5, 10], "long_period": [20, 60]}.
     */
    @NotEmpty(message = "Parameter grid must name at least one parameter")
    @Builder.Default
    private Map<String, List<Object>> parameterGrid = new LinkedHashMap<>();

    @Builder.Default
    private OptimizationMetric metric = OptimizationMetric.SHARPE_RATIO;

    /**
     * Number of ranked runs to return.
     */
    @Positive(message = "topN must be positive")
    @Builder.Default
    private Integer topN = 10;
}
