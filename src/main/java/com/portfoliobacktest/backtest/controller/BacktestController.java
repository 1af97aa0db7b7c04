package com.portfoliobacktest.backtest.controller;

import com.portfoliobacktest.backtest.dto.BacktestRequest;
import com.portfoliobacktest.backtest.dto.BacktestResult;
import com.portfoliobacktest.backtest.dto.BacktestRunStatus;
import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.dto.OptimizationRequest;
import com.portfoliobacktest.backtest.dto.OptimizationResult;
import com.portfoliobacktest.backtest.dto.SymbolDetail;
import com.portfoliobacktest.backtest.service.AsyncRun;
import com.portfoliobacktest.backtest.service.BacktestService;
import com.portfoliobacktest.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for backtesting operations.
 *
 * Provides endpoints for:
 * - Running backtests synchronously, asynchronously or as a batch
 * - Grid searching strategy parameters
 * - Cancelling running backtests
 * - Retrieving, listing and deleting stored results
 * - Drilling into one instrument's trades, fills and price series
 * - Querying supported strategies
 *
 * Errors are mapped to HTTP statuses by the global exception handler.
 */
@RestController
@RequestMapping("/api/backtest")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Backtesting", description = "Portfolio and single-instrument strategy backtesting over historical data")
public class BacktestController {

    private final BacktestService backtestService;

    @PostMapping("/run")
    @Operation(
            summary = "Run a backtest",
            description = "Execute a strategy over the requested date range and return performance metrics, " +
                    "the equity curve and per-instrument statistics."
    )
    public ResponseEntity<ApiResponse<BacktestResult>> runBacktest(@Valid @RequestBody BacktestRequest request) {
        log.info("Backtest request received: strategy={}, instrument={}, from={}, to={}",
                request.getStrategyName(), request.getInstrumentId(), request.getStartDate(), request.getEndDate());

        BacktestResult result = backtestService.runBacktest(request);
        return ResponseEntity.ok(ApiResponse.success("Backtest completed successfully", result));
    }

    @PostMapping("/run-async")
    @Operation(
            summary = "Run a backtest asynchronously",
            description = "Start a backtest in the background. Returns immediately with a tracking ID " +
                    "that can be used to poll for status and results."
    )
    public ResponseEntity<ApiResponse<String>> runBacktestAsync(@Valid @RequestBody BacktestRequest request) {
        log.info("Async backtest request received: strategy={}, from={}, to={}",
                request.getStrategyName(), request.getStartDate(), request.getEndDate());

        AsyncRun run = backtestService.runBacktestAsync(request);
        String message = "Backtest started. Poll /api/backtest/result/" + run.backtestId() + " for results.";
        return ResponseEntity.accepted().body(ApiResponse.success(message, run.backtestId()));
    }

    @PostMapping("/batch")
    @Operation(
            summary = "Run several backtests",
            description = "Execute independent backtests concurrently. Failed runs are left out of the response."
    )
    public ResponseEntity<ApiResponse<List<BacktestResult>>> runBatchBacktest(
            @RequestBody @NotEmpty(message = "At least one backtest request is required")
            List<@Valid BacktestRequest> requests) {
        log.info("Batch backtest request: {} runs", requests.size());

        List<BacktestResult> results = backtestService.runBatch(requests);
        String message = String.format("Batch backtest completed: %d of %d runs succeeded",
                results.size(), requests.size());
        return ResponseEntity.ok(ApiResponse.success(message, results));
    }

    @PostMapping("/optimize")
    @Operation(
            summary = "Optimize strategy parameters",
            description = "Run one backtest per combination of the parameter grid and rank the completed runs " +
                    "by total return, Sharpe ratio (default) or maximum drawdown."
    )
    public ResponseEntity<ApiResponse<OptimizationResult>> optimize(@Valid @RequestBody OptimizationRequest request) {
        log.info("Optimization request received: strategy={}, parameters={}, metric={}",
                request.getBaseRequest().getStrategyName(), request.getParameterGrid().keySet(), request.getMetric());

        OptimizationResult result = backtestService.optimize(request);
        String message = String.format("Optimization completed: %d of %d combinations succeeded",
                result.getCompletedRuns(), result.getTotalCombinations());
        return ResponseEntity.ok(ApiResponse.success(message, result));
    }

    @PostMapping("/cancel/{backtestId}")
    @Operation(summary = "Cancel a running backtest")
    public ResponseEntity<ApiResponse<Boolean>> cancel(
            @PathVariable @Parameter(description = "Backtest ID") String backtestId) {
        boolean cancelled = backtestService.cancel(backtestId);
        String message = cancelled ? "Cancellation requested" : "Backtest is not running";
        return ResponseEntity.ok(ApiResponse.success(message, cancelled));
    }

    @GetMapping("/status/{backtestId}")
    @Operation(summary = "Get the lifecycle state of a backtest")
    public ResponseEntity<ApiResponse<BacktestRunStatus>> getStatus(@PathVariable String backtestId) {
        return ResponseEntity.ok(ApiResponse.success(backtestService.getRunStatus(backtestId)));
    }

    @GetMapping("/results")
    @Operation(summary = "List stored backtest results", description = "Oldest first.")
    public ResponseEntity<ApiResponse<List<BacktestResult>>> getAllResults() {
        return ResponseEntity.ok(ApiResponse.success(backtestService.listResults()));
    }

    @GetMapping("/result/{backtestId}")
    @Operation(summary = "Get a backtest result by ID")
    public ResponseEntity<ApiResponse<BacktestResult>> getResult(
            @PathVariable @Parameter(description = "Backtest ID") String backtestId) {
        return ResponseEntity.ok(ApiResponse.success(backtestService.getResult(backtestId)));
    }

    @GetMapping("/result/{backtestId}/symbols/{instrumentId}")
    @Operation(summary = "Get one instrument's statistics, trades and fills from a backtest")
    public ResponseEntity<ApiResponse<SymbolDetail>> getSymbolDetail(@PathVariable String backtestId,
                                                                     @PathVariable String instrumentId) {
        return ResponseEntity.ok(ApiResponse.success(backtestService.getSymbolDetail(backtestId, instrumentId)));
    }

    @GetMapping("/result/{backtestId}/ohlc/{instrumentId}")
    @Operation(summary = "Get an instrument's OHLC bars over the backtest's date range")
    public ResponseEntity<ApiResponse<List<Bar>>> getOhlc(@PathVariable String backtestId,
                                                          @PathVariable String instrumentId) {
        return ResponseEntity.ok(ApiResponse.success(backtestService.getOhlc(backtestId, instrumentId)));
    }

    @DeleteMapping("/result/{backtestId}")
    @Operation(summary = "Delete a stored backtest result")
    public ResponseEntity<ApiResponse<Void>> deleteResult(@PathVariable String backtestId) {
        backtestService.deleteResult(backtestId);
        return ResponseEntity.ok(ApiResponse.success("Backtest result deleted", null));
    }

    @GetMapping("/strategies")
    @Operation(summary = "List supported backtest strategies")
    public ResponseEntity<ApiResponse<List<String>>> getSupportedStrategies() {
        return ResponseEntity.ok(ApiResponse.success(backtestService.getSupportedStrategies()));
    }
}
