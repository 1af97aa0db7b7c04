package com.portfoliobacktest.backtest.service;

import com.portfoliobacktest.backtest.adapter.MarketDataAdapter.MarketDataException;
import com.portfoliobacktest.backtest.adapter.MarketDataRepository;
import com.portfoliobacktest.backtest.config.BacktestProperties;
import com.portfoliobacktest.backtest.dto.BacktestRequest;
import com.portfoliobacktest.backtest.dto.BacktestResult;
import com.portfoliobacktest.backtest.dto.BacktestRunStatus;
import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.dto.OptimizationMetric;
import com.portfoliobacktest.backtest.dto.OptimizationRequest;
import com.portfoliobacktest.backtest.dto.OptimizationResult;
import com.portfoliobacktest.backtest.dto.SymbolDetail;
import com.portfoliobacktest.backtest.engine.BacktestEngine;
import com.portfoliobacktest.backtest.engine.BacktestException;
import com.portfoliobacktest.backtest.engine.CancellationToken;
import com.portfoliobacktest.backtest.engine.RunParameters;
import com.portfoliobacktest.backtest.execution.PercentageCommissionModel;
import com.portfoliobacktest.backtest.execution.PricePolicy;
import com.portfoliobacktest.backtest.execution.SimulatedExecutionModel;
import com.portfoliobacktest.backtest.ledger.CompletedTrade;
import com.portfoliobacktest.backtest.ledger.FifoLedger;
import com.portfoliobacktest.backtest.ledger.Fill;
import com.portfoliobacktest.backtest.metrics.SymbolPerformance;
import com.portfoliobacktest.backtest.strategy.BacktestStrategy;
import com.portfoliobacktest.backtest.strategy.BacktestStrategyFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Orchestrates backtest execution: request validation → strategy resolution → data loading →
 * simulation → result storage.
 * <p>
 * Every run gets its own {@link BacktestEngine}, account and ledger; the only state shared between
 * concurrent runs is the OHLC cache behind {@link MarketDataRepository} and the result store here.
 */
@Service
@Slf4j
public class BacktestService {

    private final BacktestProperties backtestProperties;
    private final BacktestStrategyFactory strategyFactory;
    private final MarketDataRepository marketDataRepository;
    private final Executor backtestExecutor;

    /** Finished runs, kept for result queries and drill-down. */
    private final Map<String, StoredRun> resultStore = new ConcurrentHashMap<>();

    private final Map<String, BacktestRunStatus> runStatuses = new ConcurrentHashMap<>();

    private final Map<String, CancellationToken> activeRuns = new ConcurrentHashMap<>();

    private final AtomicLong storeSequence = new AtomicLong();

    public BacktestService(BacktestProperties backtestProperties,
                           BacktestStrategyFactory strategyFactory,
                           MarketDataRepository marketDataRepository,
                           @Qualifier("backtestExecutor") Executor backtestExecutor) {
        this.backtestProperties = backtestProperties;
        this.strategyFactory = strategyFactory;
        this.marketDataRepository = marketDataRepository;
        this.backtestExecutor = backtestExecutor;
    }

    // ==================== RUNS ====================

    /**
     * Run a backtest synchronously and store its result.
     *
     * @throws BacktestException if the request is invalid, data cannot be loaded or the run fails
     */
    public BacktestResult runBacktest(BacktestRequest request) {
        checkEnabled();
        validateRequest(request);
        String backtestId = UUID.randomUUID().toString();
        CancellationToken token = new CancellationToken();
        activeRuns.put(backtestId, token);
        markRunning(backtestId, request);
        try {
            BacktestResult result = execute(backtestId, request, token);
            markFinished(backtestId, BacktestRunStatus.State.COMPLETED, null);
            return result;
        } catch (RuntimeException e) {
            markFailed(backtestId, e);
            throw e;
        } finally {
            activeRuns.remove(backtestId);
        }
    }

    /**
     * Start a backtest on the backtest executor. The id is returned immediately; validation
     * problems are still reported synchronously.
     */
    public AsyncRun runBacktestAsync(BacktestRequest request) {
        checkEnabled();
        validateRequest(request);
        String backtestId = UUID.randomUUID().toString();
        CancellationToken token = new CancellationToken();
        activeRuns.put(backtestId, token);
        markRunning(backtestId, request);

        CompletableFuture<BacktestResult> future = CompletableFuture
                .supplyAsync(() -> execute(backtestId, request, token), backtestExecutor)
                .whenComplete((result, error) -> {
                    activeRuns.remove(backtestId);
                    if (error == null) {
                        markFinished(backtestId, BacktestRunStatus.State.COMPLETED, null);
                    } else {
                        markFailed(backtestId, unwrap(error));
                    }
                });

        log.info("Submitted async backtest {} ({})", backtestId, request.getStrategyName());
        return new AsyncRun(backtestId, future);
    }

    /**
     * Run independent backtests concurrently. Runs that fail are logged and left out of the result;
     * the rest are returned in request order.
     */
    public List<BacktestResult> runBatch(List<BacktestRequest> requests) {
        checkEnabled();
        log.info("Starting batch backtest: {} runs", requests.size());
        List<BacktestResult> results = runAll(requests).stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        log.info("Batch backtest complete: {} of {} runs succeeded", results.size(), requests.size());
        return results;
    }

    /**
     * Grid search over strategy parameters: one run per combination of the grid's values, executed
     * as a batch and ranked by the requested metric. Failed combinations are left out of the ranking.
     *
     * @throws BacktestException with {@code INVALID_REQUEST} if the grid is empty or too large
     */
    public OptimizationResult optimize(OptimizationRequest request) {
        checkEnabled();
        if (request == null || request.getBaseRequest() == null) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                    "Optimization request needs a base backtest request");
        }
        validateRequest(request.getBaseRequest());
        List<Map<String, Object>> combinations = expandGrid(request.getParameterGrid());
        int limit = backtestProperties.getMaxOptimizationCombinations();
        if (limit > 0 && combinations.size() > limit) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                    "Parameter grid has " + combinations.size() + " combinations, limit is " + limit);
        }
        OptimizationMetric metric = request.getMetric() != null ? request.getMetric() : OptimizationMetric.SHARPE_RATIO;
        int topN = request.getTopN() != null && request.getTopN() > 0 ? request.getTopN() : combinations.size();

        log.info("Starting parameter optimization of {}: {} combinations, ranked by {}",
                request.getBaseRequest().getStrategyName(), combinations.size(), metric);

        List<BacktestRequest> runs = new ArrayList<>();
        for (Map<String, Object> combination : combinations) {
            Map<String, Object> params = new HashMap<>();
            if (request.getBaseRequest().getStrategyParams() != null) {
                params.putAll(request.getBaseRequest().getStrategyParams());
            }
            params.putAll(combination);
            runs.add(request.getBaseRequest().toBuilder().strategyParams(params).build());
        }
        List<BacktestResult> results = runAll(runs);

        List<OptimizationResult.RankedRun> completed = new ArrayList<>();
        for (int i = 0; i < combinations.size(); i++) {
            if (results.get(i) != null) {
                completed.add(OptimizationResult.RankedRun.builder()
                        .parameters(combinations.get(i))
                        .result(results.get(i))
                        .build());
            }
        }
        List<OptimizationResult.RankedRun> ranked = completed.stream()
                .sorted(Comparator.comparing(OptimizationResult.RankedRun::getResult, metric.ranking()))
                .limit(topN)
                .collect(Collectors.toList());
        for (int i = 0; i < ranked.size(); i++) {
            ranked.get(i).setRank(i + 1);
        }

        if (!ranked.isEmpty()) {
            BacktestResult best = ranked.get(0).getResult();
            log.info("Optimization complete: {} of {} runs succeeded, best {} with return={}%, mdd={}%, sharpe={}",
                    completed.size(), combinations.size(), ranked.get(0).getParameters(),
                    String.format("%.2f", best.getTotalReturn() * 100), String.format("%.2f", best.getMdd() * 100),
                    String.format("%.2f", best.getSharpeRatio()));
        } else {
            log.warn("Optimization complete: none of {} runs succeeded", combinations.size());
        }
        return OptimizationResult.builder()
                .metric(metric)
                .totalCombinations(combinations.size())
                .completedRuns(completed.size())
                .rankings(ranked)
                .build();
    }

    /**
     * Every combination of the grid's values, last parameter varying fastest.
     */
    static List<Map<String, Object>> expandGrid(Map<String, List<Object>> grid) {
        if (grid == null || grid.isEmpty()) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                    "Parameter grid must name at least one parameter");
        }
        List<Map<String, Object>> combinations = new ArrayList<>();
        combinations.add(new LinkedHashMap<>());
        for (Map.Entry<String, List<Object>> entry : grid.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                        "Parameter " + entry.getKey() + " has no values to try");
            }
            List<Map<String, Object>> expanded = new ArrayList<>();
            for (Map<String, Object> partial : combinations) {
                for (Object value : entry.getValue()) {
                    Map<String, Object> next = new LinkedHashMap<>(partial);
                    next.put(entry.getKey(), value);
                    expanded.add(next);
                }
            }
            combinations = expanded;
        }
        return combinations;
    }

    /**
     * Submit every request to the backtest executor and wait for all of them. The returned list is
     * aligned with {@code requests}; a failed or rejected run leaves a null in its slot.
     */
    private List<BacktestResult> runAll(List<BacktestRequest> requests) {
        List<AsyncRun> submitted = new ArrayList<>();
        for (BacktestRequest request : requests) {
            try {
                submitted.add(runBacktestAsync(request));
            } catch (BacktestException e) {
                log.error("Batch run for {} rejected: {}", request.getStrategyName(), e.getMessage());
                submitted.add(null);
            }
        }

        List<BacktestResult> results = new ArrayList<>();
        for (AsyncRun run : submitted) {
            if (run == null) {
                results.add(null);
                continue;
            }
            try {
                results.add(run.result().join());
            } catch (CompletionException e) {
                log.error("Batch run {} failed: {}", run.backtestId(), unwrap(e).getMessage());
                results.add(null);
            }
        }
        return results;
    }

    /**
     * Request cancellation of a running backtest.
     *
     * @return true if the run was still active and is now flagged for cancellation
     */
    public boolean cancel(String backtestId) {
        CancellationToken token = activeRuns.get(backtestId);
        if (token == null) {
            if (!runStatuses.containsKey(backtestId)) {
                throw notFound(backtestId);
            }
            return false;
        }
        log.info("Cancellation requested for backtest {}", backtestId);
        return token.cancel();
    }

    // ==================== RESULT ACCESS ====================

    public BacktestResult getResult(String backtestId) {
        return storedRun(backtestId).result();
    }

    public BacktestRunStatus getRunStatus(String backtestId) {
        BacktestRunStatus status = runStatuses.get(backtestId);
        if (status == null) {
            throw notFound(backtestId);
        }
        return status;
    }

    /**
     * Stored results, oldest first.
     */
    public List<BacktestResult> listResults() {
        return resultStore.values().stream()
                .sorted(Comparator.comparingLong(StoredRun::sequence))
                .map(StoredRun::result)
                .collect(Collectors.toList());
    }

    public void deleteResult(String backtestId) {
        if (resultStore.remove(backtestId) == null) {
            throw notFound(backtestId);
        }
        runStatuses.remove(backtestId);
        log.info("Deleted backtest result {}", backtestId);
    }

    /**
     * Statistics, matched trades and raw fills of one instrument in a stored run.
     */
    public SymbolDetail getSymbolDetail(String backtestId, String instrumentId) {
        StoredRun run = storedRun(backtestId);
        List<CompletedTrade> trades = run.ledger().getCompletedTrades(instrumentId);
        List<Fill> fills = run.ledger().getFills(instrumentId);
        if (trades.isEmpty() && fills.isEmpty()) {
            throw new BacktestException(BacktestException.ErrorCode.RESULT_NOT_FOUND,
                    "Instrument " + instrumentId + " was not traded in backtest " + backtestId);
        }
        SymbolPerformance performance = run.result().getSymbolPerformances().stream()
                .filter(p -> p.getInstrumentId().equals(instrumentId))
                .findFirst()
                .orElse(null);
        return SymbolDetail.builder()
                .instrumentId(instrumentId)
                .performance(performance)
                .trades(new ArrayList<>(trades))
                .fills(new ArrayList<>(fills))
                .build();
    }

    /**
     * OHLC bars of an instrument restricted to the stored run's date range.
     */
    public List<Bar> getOhlc(String backtestId, String instrumentId) {
        BacktestResult result = getResult(backtestId);
        LocalDate start = result.getStartDate();
        LocalDate end = result.getEndDate();
        List<Bar> bars = loadSeries(instrumentId, result.getInterval(), start, end);
        return bars.stream()
                .filter(bar -> !bar.getDate().isBefore(start) && !bar.getDate().isAfter(end))
                .collect(Collectors.toList());
    }

    public List<String> getSupportedStrategies() {
        return new ArrayList<>(strategyFactory.getSupportedStrategies());
    }

    // ==================== INTERNAL HELPERS ====================

    private BacktestResult execute(String backtestId, BacktestRequest request, CancellationToken token) {
        long startMs = System.currentTimeMillis();
        BacktestStrategy strategy = strategyFactory.create(request.getStrategyName(), request.getStrategyParams());

        String interval = firstNonNull(request.getInterval(), strategy.getRequiredInterval(),
                backtestProperties.getInterval());
        PricePolicy pricePolicy = firstNonNull(request.getPricePolicy(), backtestProperties.getPricePolicy());
        BigDecimal commissionRate = firstNonNull(request.getCommissionRate(), backtestProperties.getCommissionRate());
        BigDecimal slippageRate = firstNonNull(request.getSlippageRate(), backtestProperties.getSlippageRate());

        List<Bar> series = null;
        if (!strategy.hasUniverseSelection()) {
            if (request.getInstrumentId() == null || request.getInstrumentId().isBlank()) {
                throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                        strategy.getStrategyName() + " is a single-instrument strategy: instrumentId is required");
            }
            series = loadSeries(request.getInstrumentId(), interval, request.getStartDate(), request.getEndDate());
            if (series.isEmpty()) {
                throw new BacktestException(BacktestException.ErrorCode.DATA_FETCH_FAILED,
                        "No " + interval + " bars for " + request.getInstrumentId() + " between "
                                + request.getStartDate() + " and " + request.getEndDate());
            }
        }

        RunParameters params = RunParameters.builder()
                .backtestId(backtestId)
                .strategy(strategy)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .initialCapital(firstNonNull(request.getInitialCapital(), backtestProperties.getDefaultInitialCapital()))
                .executionModel(new SimulatedExecutionModel(pricePolicy, slippageRate,
                        new PercentageCommissionModel(commissionRate)))
                .pricePolicy(pricePolicy)
                .interval(interval)
                .minRebalanceNotional(request.getMinRebalanceNotional())
                .maxPositions(request.getMaxPositions())
                .instrumentId(request.getInstrumentId())
                .series(series)
                .build();

        BacktestEngine engine = new BacktestEngine(params, marketDataRepository, backtestProperties, token);
        try {
            BacktestResult result = engine.run();
            store(backtestId, result, engine.getLedger());
            return result;
        } catch (BacktestException e) {
            log.error("Backtest {} failed after {}ms: {}", backtestId, System.currentTimeMillis() - startMs,
                    e.getMessage());
            throw e;
        }
    }

    private List<Bar> loadSeries(String instrumentId, String interval, LocalDate start, LocalDate end) {
        try {
            return marketDataRepository.getSeries(instrumentId, interval, start, end);
        } catch (MarketDataException e) {
            throw new BacktestException(BacktestException.ErrorCode.DATA_FETCH_FAILED,
                    "Error fetching " + interval + " bars for " + instrumentId + ": " + e.getMessage(), e);
        }
    }

    private void validateRequest(BacktestRequest request) {
        if (request == null) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST, "Backtest request is required");
        }
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_DATE_RANGE,
                    "Start and end dates are required");
        }
        if (request.getStartDate().isAfter(request.getEndDate())) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_DATE_RANGE,
                    "Start date " + request.getStartDate() + " is after end date " + request.getEndDate());
        }
        BigDecimal slippageRate = firstNonNull(request.getSlippageRate(), backtestProperties.getSlippageRate());
        if (slippageRate != null
                && (slippageRate.signum() < 0 || slippageRate.compareTo(BigDecimal.ONE) >= 0)) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                    "Slippage rate must be in [0, 1): " + slippageRate);
        }
        if (!strategyFactory.isSupported(request.getStrategyName())) {
            throw new BacktestException(BacktestException.ErrorCode.STRATEGY_NOT_BOUND,
                    "Unsupported backtest strategy: " + request.getStrategyName()
                            + ". Supported: " + strategyFactory.getSupportedStrategies());
        }
    }

    private void checkEnabled() {
        if (!backtestProperties.isEnabled()) {
            throw new BacktestException(BacktestException.ErrorCode.BACKTEST_DISABLED,
                    "Backtest module is disabled in configuration");
        }
    }

    private void store(String backtestId, BacktestResult result, FifoLedger ledger) {
        int limit = backtestProperties.getMaxStoredResults();
        while (limit > 0 && resultStore.size() >= limit) {
            resultStore.values().stream()
                    .min(Comparator.comparingLong(StoredRun::sequence))
                    .ifPresent(oldest -> {
                        resultStore.remove(oldest.result().getBacktestId());
                        runStatuses.remove(oldest.result().getBacktestId());
                        log.debug("Evicted stored backtest result {}", oldest.result().getBacktestId());
                    });
        }
        resultStore.put(backtestId, new StoredRun(result, ledger, storeSequence.incrementAndGet()));
    }

    private StoredRun storedRun(String backtestId) {
        StoredRun run = resultStore.get(backtestId);
        if (run == null) {
            throw notFound(backtestId);
        }
        return run;
    }

    private void markRunning(String backtestId, BacktestRequest request) {
        runStatuses.put(backtestId, BacktestRunStatus.builder()
                .backtestId(backtestId)
                .strategyName(request.getStrategyName())
                .state(BacktestRunStatus.State.RUNNING)
                .submittedAt(LocalDateTime.now())
                .build());
    }

    private void markFailed(String backtestId, Throwable error) {
        boolean cancelled = error instanceof BacktestException be
                && be.getErrorCode() == BacktestException.ErrorCode.CANCELLED;
        markFinished(backtestId,
                cancelled ? BacktestRunStatus.State.CANCELLED : BacktestRunStatus.State.FAILED,
                error.getMessage());
    }

    private void markFinished(String backtestId, BacktestRunStatus.State state, String errorMessage) {
        runStatuses.computeIfPresent(backtestId, (id, status) -> status.toBuilder()
                .state(state)
                .errorMessage(errorMessage)
                .finishedAt(LocalDateTime.now())
                .build());
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static BacktestException notFound(String backtestId) {
        return new BacktestException(BacktestException.ErrorCode.RESULT_NOT_FOUND,
                "No backtest found with id " + backtestId);
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * A finished run: its result plus the ledger kept for drill-down.
     */
    private record StoredRun(BacktestResult result, FifoLedger ledger, long sequence) {
    }
}
