package com.portfoliobacktest.backtest.engine;

import com.portfoliobacktest.backtest.adapter.MarketDataAdapter.MarketDataException;
import com.portfoliobacktest.backtest.adapter.MarketDataRepository;
import com.portfoliobacktest.backtest.config.BacktestProperties;
import com.portfoliobacktest.backtest.dto.BacktestResult;
import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.dto.MarketSnapshot;
import com.portfoliobacktest.backtest.execution.Order;
import com.portfoliobacktest.backtest.execution.PricePolicy;
import com.portfoliobacktest.backtest.ledger.CompletedTrade;
import com.portfoliobacktest.backtest.ledger.FifoLedger;
import com.portfoliobacktest.backtest.ledger.Fill;
import com.portfoliobacktest.backtest.ledger.Side;
import com.portfoliobacktest.backtest.metrics.MetricsEngine;
import com.portfoliobacktest.backtest.portfolio.Account;
import com.portfoliobacktest.backtest.portfolio.PortfolioTracker;
import com.portfoliobacktest.backtest.portfolio.RebalancePlan;
import com.portfoliobacktest.backtest.portfolio.RebalancePlan.PlannedOrder;
import com.portfoliobacktest.backtest.portfolio.RejectedOrder;
import com.portfoliobacktest.backtest.strategy.BacktestStrategy;
import com.portfoliobacktest.backtest.strategy.OrderSignal;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Core backtest simulation loop.
 * <p>
 * Portfolio mode (strategy selects a universe), per session date:
 * <ol>
 *   <li>Snapshot: fetch the market snapshot; a failed fetch skips the session, an empty one means the market was closed</li>
 *   <li>Select: ask the strategy for the universe</li>
 *   <li>Allocate: ask for target weights, clamping each to [0, 1]</li>
 *   <li>Rebalance: size deltas, execute sells then buys at the session trade price</li>
 *   <li>Settle: every fill goes to the ledger, the account and the strategy</li>
 *   <li>Mark: value the book at the close and record one equity sample</li>
 * </ol>
 * Single-instrument mode replays one OHLC series bar by bar through {@link BacktestStrategy#onBar}.
 * <p>
 * Per-session problems are recorded on the result and never end the run. Setup problems fail
 * before the first session.
 * <p>
 * Thread safety: NOT thread-safe. Each backtest should create its own engine instance.
 */
@Slf4j
public class BacktestEngine {

    // ==================== CONFIGURATION ====================

    private final RunParameters params;
    private final BacktestStrategy strategy;
    private final MarketDataRepository marketDataRepository;
    private final BacktestProperties properties;
    private final CancellationToken cancellationToken;

    // ==================== RUN STATE ====================

    private final Account account;
    private final PortfolioTracker tracker;
    @Getter
    private final FifoLedger ledger;
    @Getter
    private final BacktestContext context;

    /** Portfolio mode: bars fetched so far, by instrument then date. */
    private final Map<String, Map<LocalDate, Bar>> barIndex = new HashMap<>();

    public BacktestEngine(RunParameters params,
                          MarketDataRepository marketDataRepository,
                          BacktestProperties properties,
                          CancellationToken cancellationToken) {
        this.params = params;
        this.strategy = params.getStrategy();
        this.marketDataRepository = marketDataRepository;
        this.properties = properties;
        this.cancellationToken = cancellationToken != null ? cancellationToken : new CancellationToken();

        this.account = new Account(params.getInitialCapital());
        this.tracker = new PortfolioTracker(account,
                params.getMinRebalanceNotional() != null
                        ? params.getMinRebalanceNotional() : properties.getMinRebalanceNotional(),
                params.getMaxPositions() != null ? params.getMaxPositions() : properties.getMaxPositions());
        this.ledger = new FifoLedger(properties.isLongOnly());
        this.context = new BacktestContext(params.getBacktestId());
    }

    /**
     * Run the whole simulation and reduce it to a result.
     *
     * @throws BacktestException on a setup error, or with {@code CANCELLED} if the run was cancelled
     */
    public BacktestResult run() {
        long startMillis = System.currentTimeMillis();
        validateSetup();

        boolean portfolioMode = strategy.hasUniverseSelection();
        log.info("[{}] Starting {} backtest of {} from {} to {} with capital {}",
                params.getBacktestId(), portfolioMode ? "portfolio" : "single-instrument",
                strategy.getStrategyName(), params.getStartDate(), params.getEndDate(),
                String.format("%.2f", params.getInitialCapital()));

        if (portfolioMode) {
            runPortfolio();
        } else {
            runSingleInstrument(prepareSeries());
        }

        MetricsEngine metricsEngine = new MetricsEngine(properties.getPeriodsPerYear(), properties.getRiskFreeRate());
        BacktestResult result = metricsEngine
                .reduce(ledger.getCompletedTrades(), context.getEquitySamples(), params.getInitialCapital())
                .toBuilder()
                .backtestId(params.getBacktestId())
                .strategyName(strategy.getStrategyName())
                .mode(portfolioMode ? BacktestResult.Mode.PORTFOLIO : BacktestResult.Mode.SINGLE_INSTRUMENT)
                .interval(params.getInterval())
                .startDate(params.getStartDate())
                .endDate(params.getEndDate())
                .totalFills(ledger.getFillCount())
                .skippedSessions(context.getSkippedSessions())
                .rejectedOrders(new ArrayList<>(context.getRejectedOrders()))
                .rejectedOrderCount(context.getRejectedOrders().size())
                .matchingViolations(ledger.getMatchingViolations())
                .forcedLiquidations(context.getForcedLiquidations())
                .warnings(new ArrayList<>(context.getWarnings()))
                .executionDurationMs(System.currentTimeMillis() - startMillis)
                .build();

        log.info("[{}] Backtest completed: {} sessions ({} skipped), {} trades, return={}%, mdd={}%, {}ms",
                params.getBacktestId(), context.getSessionCount(), context.getSkippedSessions(),
                result.getTotalTrades(), String.format("%.2f", result.getTotalReturn() * 100),
                String.format("%.2f", result.getMdd() * 100), result.getExecutionDurationMs());
        return result;
    }

    // ==================== SETUP ====================

    private void validateSetup() {
        if (strategy == null) {
            throw new BacktestException(BacktestException.ErrorCode.STRATEGY_NOT_BOUND,
                    "No strategy bound to backtest " + params.getBacktestId());
        }
        if (params.getStartDate() == null || params.getEndDate() == null) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_DATE_RANGE,
                    "Start and end dates are required");
        }
        if (params.getStartDate().isAfter(params.getEndDate())) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_DATE_RANGE,
                    "Start date " + params.getStartDate() + " is after end date " + params.getEndDate());
        }
        if (params.getInitialCapital() == null || params.getInitialCapital().signum() <= 0) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                    "Initial capital must be positive: " + params.getInitialCapital());
        }
        if (params.getExecutionModel() == null) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                    "No execution model configured");
        }
        if (!strategy.hasUniverseSelection() && (params.getSeries() == null || params.getSeries().isEmpty())) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                    strategy.getStrategyName() + " is a single-instrument strategy but no price series was supplied");
        }
    }

    /**
     * The supplied series restricted to the run's dates, oldest first.
     */
    private List<Bar> prepareSeries() {
        List<Bar> series = params.getSeries().stream()
                .filter(bar -> !bar.getDate().isBefore(params.getStartDate())
                        && !bar.getDate().isAfter(params.getEndDate()))
                .sorted(Comparator.comparing(Bar::getTimestamp))
                .collect(Collectors.toList());
        if (series.isEmpty()) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                    "Price series has no bars between " + params.getStartDate() + " and " + params.getEndDate());
        }
        for (int i = 1; i < series.size(); i++) {
            if (!series.get(i).getTimestamp().isAfter(series.get(i - 1).getTimestamp())) {
                throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                        "Price series has duplicate bars at " + series.get(i).getTimestamp());
            }
        }
        return series;
    }

    // ==================== PORTFOLIO MODE ====================

    private void runPortfolio() {
        for (LocalDate date = params.getStartDate(); !date.isAfter(params.getEndDate()); date = date.plusDays(1)) {
            if (properties.isSkipWeekends() && isWeekend(date)) {
                continue;
            }
            context.setCurrentDate(date);
            runPortfolioSession(date);
            checkCancelled(date);
        }
    }

    private void runPortfolioSession(LocalDate date) {
        // Step 1: Snapshot
        MarketSnapshot snapshot;
        try {
            snapshot = marketDataRepository.getMarketSnapshot(date, null);
        } catch (MarketDataException e) {
            context.recordSkippedSession(date, "snapshot fetch failed: " + e.getMessage());
            return;
        }
        if (snapshot.isEmpty()) {
            log.debug("[{}] No market data on {}, treating as closed", params.getBacktestId(), date);
            return;
        }

        // Step 2: Select
        List<String> universe = strategy.selectUniverse(date, snapshot);
        if (universe == null) {
            universe = List.of();
        }

        // Step 3: Allocate
        Map<String, Double> weights = sanitizeWeights(date,
                strategy.targetWeights(universe, snapshot, account.view()));

        // Prices for everything targeted or held
        Set<String> instruments = new LinkedHashSet<>(weights.keySet());
        instruments.addAll(account.getHeldInstruments());
        Map<String, Bar> bars;
        try {
            bars = barsFor(instruments, date);
        } catch (MarketDataException e) {
            context.recordSkippedSession(date, "OHLC fetch failed: " + e.getMessage());
            return;
        }

        // Step 4: Rebalance
        PricePolicy pricePolicy = params.getPricePolicy();
        LocalDateTime fillTime = pricePolicy == PricePolicy.OPEN
                ? date.atTime(properties.getMarketOpen())
                : date.atTime(properties.getMarketClose());
        Map<String, BigDecimal> tradePrices = new LinkedHashMap<>();
        bars.forEach((instrumentId, bar) -> tradePrices.put(instrumentId, pricePolicy.priceOf(bar)));

        BigDecimal equity = tracker.markToMarket(tradePrices);
        if (log.isDebugEnabled()) {
            logDrift(date, weights);
        }
        RebalancePlan plan = tracker.planRebalance(date, weights, tradePrices, equity);
        plan.rejections().forEach(context::recordRejection);

        for (PlannedOrder sell : plan.sells()) {
            execute(date, sell.instrumentId(), Side.SELL, -sell.delta(), bars.get(sell.instrumentId()), fillTime);
        }
        // Cap is checked against what is actually held once earlier orders have settled
        for (PlannedOrder buy : plan.buys()) {
            if (tracker.exceedsPositionLimit(buy.instrumentId())) {
                log.warn("[{}] {}: rejecting buy of {} {}, position limit reached",
                        params.getBacktestId(), date, buy.delta(), buy.instrumentId());
                context.recordRejection(new RejectedOrder(date, buy.instrumentId(), buy.delta(),
                        RejectedOrder.Reason.POSITION_LIMIT));
                continue;
            }
            execute(date, buy.instrumentId(), Side.BUY, buy.delta(), bars.get(buy.instrumentId()), fillTime);
        }

        // Step 5: Settle (minimum cash)
        enforceMinimumCash(date, bars, fillTime);

        // Step 6: Mark
        Map<String, BigDecimal> closePrices = new LinkedHashMap<>();
        bars.forEach((instrumentId, bar) -> closePrices.put(instrumentId, bar.getClose()));
        tracker.markToMarket(closePrices);
        context.recordSample(date.atTime(properties.getMarketClose()), account.getEquity());

        log.debug("[{}] {}: universe={}, fills={}, cash={}, equity={}", params.getBacktestId(), date,
                universe.size(), ledger.getFillCount(), account.getCash(), account.getEquity());
    }

    private void logDrift(LocalDate date, Map<String, Double> targetWeights) {
        Map<String, Double> current = tracker.computeWeights(account);
        Set<String> instruments = new LinkedHashSet<>(targetWeights.keySet());
        instruments.addAll(current.keySet());
        for (String instrumentId : instruments) {
            double held = current.getOrDefault(instrumentId, 0.0);
            double target = targetWeights.getOrDefault(instrumentId, 0.0);
            log.debug("[{}] {}: {} weight {} -> {} (drift {})", params.getBacktestId(), date, instrumentId,
                    String.format("%.4f", held), String.format("%.4f", target),
                    String.format("%+.4f", target - held));
        }
    }

    /**
     * Clamp each weight to [0, 1]. The total is not renormalised; a total above 1 is only flagged
     * and the excess buys fail the cash check.
     */
    private Map<String, Double> sanitizeWeights(LocalDate date, Map<String, Double> rawWeights) {
        Map<String, Double> weights = new LinkedHashMap<>();
        if (rawWeights == null) {
            return weights;
        }
        double total = 0.0;
        for (Map.Entry<String, Double> entry : rawWeights.entrySet()) {
            Double weight = entry.getValue();
            double clamped;
            if (weight == null || weight.isNaN()) {
                context.addWarning(String.format("%s: weight for %s is not a number, using 0", date, entry.getKey()));
                clamped = 0.0;
            } else if (weight < 0.0 || weight > 1.0) {
                clamped = Math.max(0.0, Math.min(1.0, weight));
                context.addWarning(String.format("%s: weight %.4f for %s clamped to %.4f",
                        date, weight, entry.getKey(), clamped));
            } else {
                clamped = weight;
            }
            weights.put(entry.getKey(), clamped);
            total += clamped;
        }
        if (total > 1.0 + 1e-9) {
            context.addWarning(String.format("%s: target weights sum to %.4f, above 1.0", date, total));
        }
        return weights;
    }

    /**
     * Bars for the session date. Each instrument's series for the whole run is fetched once,
     * through the shared cache; instruments without a bar on this date are absent.
     */
    private Map<String, Bar> barsFor(Set<String> instruments, LocalDate date) {
        List<String> unknown = instruments.stream()
                .filter(instrumentId -> !barIndex.containsKey(instrumentId))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            Map<String, List<Bar>> fetched = marketDataRepository.getSeries(unknown, params.getInterval(),
                    params.getStartDate(), params.getEndDate());
            for (String instrumentId : unknown) {
                Map<LocalDate, Bar> byDate = new HashMap<>();
                for (Bar bar : fetched.getOrDefault(instrumentId, List.of())) {
                    // Last bar of a date wins for intraday intervals
                    byDate.put(bar.getDate(), bar);
                }
                barIndex.put(instrumentId, byDate);
            }
        }

        Map<String, Bar> bars = new LinkedHashMap<>();
        for (String instrumentId : instruments) {
            Bar bar = barIndex.get(instrumentId).get(date);
            if (bar != null) {
                bars.put(instrumentId, bar);
            }
        }
        return bars;
    }

    // ==================== SINGLE-INSTRUMENT MODE ====================

    private void runSingleInstrument(List<Bar> series) {
        String instrumentId = params.getInstrumentId() != null
                ? params.getInstrumentId()
                : series.get(0).getInstrumentId();
        List<Bar> history = new ArrayList<>();

        for (Bar bar : series) {
            LocalDate date = bar.getDate();
            context.setCurrentDate(date);
            history.add(bar);

            tracker.markToMarket(Map.of(instrumentId, bar.getClose()));
            List<OrderSignal> signals = strategy.onBar(Collections.unmodifiableList(history),
                    account.openPositionsCopy(), account.view());

            for (OrderSignal signal : signals != null ? signals : List.<OrderSignal>of()) {
                String target = signal.instrumentId() != null ? signal.instrumentId() : instrumentId;
                if (signal.quantity() <= 0 || signal.side() == null) {
                    context.addWarning(String.format("%s: ignoring malformed signal %s", date, signal));
                    continue;
                }
                if (!target.equals(instrumentId)) {
                    context.recordRejection(new RejectedOrder(date, target,
                            signal.side().sign() * signal.quantity(), RejectedOrder.Reason.NO_PRICE));
                    continue;
                }
                execute(date, target, signal.side(), signal.quantity(), bar, bar.getTimestamp());
            }

            enforceMinimumCash(date, Map.of(instrumentId, bar), bar.getTimestamp());

            tracker.markToMarket(Map.of(instrumentId, bar.getClose()));
            context.recordSample(bar.getTimestamp(), account.getEquity());
            checkCancelled(date);
        }
    }

    // ==================== EXECUTION ====================

    /**
     * Execute one order against the bar and settle its fills. Buys that would overdraw cash are
     * rejected as a whole.
     *
     * @return true if the order was filled
     */
    private boolean execute(LocalDate date, String instrumentId, Side side, long quantity, Bar bar,
                            LocalDateTime fillTime) {
        long signedQuantity = side.sign() * quantity;
        Order order = new Order(context.nextOrderId(), instrumentId, side, quantity);
        List<Fill> fills = params.getExecutionModel().execute(order, bar, fillTime);
        if (fills.isEmpty()) {
            context.recordRejection(new RejectedOrder(date, instrumentId, signedQuantity, RejectedOrder.Reason.NO_PRICE));
            return false;
        }
        for (Fill fill : fills) {
            if (fill.getPrice() == null || fill.getPrice().signum() <= 0 || fill.getQuantity() <= 0) {
                log.warn("[{}] {}: discarding unusable fill for {}: {} @ {}", params.getBacktestId(), date,
                        instrumentId, fill.getQuantity(), fill.getPrice());
                context.addWarning(String.format("%s: execution returned an unusable fill for %s (qty %d @ %s)",
                        date, instrumentId, fill.getQuantity(), fill.getPrice()));
                context.recordRejection(new RejectedOrder(date, instrumentId, signedQuantity,
                        RejectedOrder.Reason.NO_PRICE));
                return false;
            }
        }
        if (side == Side.BUY && tracker.wouldOverdraw(fills)) {
            log.warn("[{}] {}: rejecting buy of {} {}, insufficient cash {}",
                    params.getBacktestId(), date, quantity, instrumentId, account.getCash());
            context.recordRejection(new RejectedOrder(date, instrumentId, signedQuantity,
                    RejectedOrder.Reason.INSUFFICIENT_CASH));
            return false;
        }
        fills.forEach(this::settle);
        return true;
    }

    private void settle(Fill fill) {
        List<CompletedTrade> closed = ledger.applyFill(fill);
        tracker.applyFill(fill, closed);
        strategy.onFill(fill, account.getPosition(fill.getInstrumentId())
                .map(position -> position.toBuilder().build())
                .orElse(null));
    }

    /**
     * Liquidate every open position when cash has fallen below the configured minimum.
     */
    private void enforceMinimumCash(LocalDate date, Map<String, Bar> bars, LocalDateTime fillTime) {
        BigDecimal minimumCash = properties.getMinimumCash();
        if (minimumCash == null || minimumCash.signum() <= 0
                || account.getCash().compareTo(minimumCash) >= 0
                || account.getHeldInstruments().isEmpty()) {
            return;
        }

        context.addWarning(String.format("%s: cash %.2f below minimum %.2f, liquidating all positions",
                date, account.getCash(), minimumCash));
        context.recordForcedLiquidation();
        for (String instrumentId : account.getHeldInstruments()) {
            long held = account.heldQuantity(instrumentId);
            Bar bar = bars.get(instrumentId);
            if (bar == null) {
                context.recordRejection(new RejectedOrder(date, instrumentId, -held, RejectedOrder.Reason.NO_PRICE));
                continue;
            }
            Side side = held > 0 ? Side.SELL : Side.BUY;
            execute(date, instrumentId, side, Math.abs(held), bar, fillTime);
        }
    }

    private void checkCancelled(LocalDate date) {
        if (cancellationToken.isCancelled()) {
            log.info("[{}] Backtest cancelled after {}", params.getBacktestId(), date);
            throw new BacktestException(BacktestException.ErrorCode.CANCELLED,
                    "Backtest " + params.getBacktestId() + " was cancelled at " + date);
        }
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
