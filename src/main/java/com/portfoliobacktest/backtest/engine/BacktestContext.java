package com.portfoliobacktest.backtest.engine;

import com.portfoliobacktest.backtest.metrics.EquitySample;
import com.portfoliobacktest.backtest.portfolio.RejectedOrder;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable bookkeeping for one backtest run: equity samples, session counters,
 * rejected orders and warnings. Positions and cash live in the account, not here.
 */
@Slf4j
@Getter
public class BacktestContext {

    private final String backtestId;

    @Setter
    private LocalDate currentDate;

    private int sessionCount;

    private int skippedSessions;

    private int forcedLiquidations;

    private long orderSequence;

    private final List<EquitySample> equitySamples = new ArrayList<>();

    private final List<RejectedOrder> rejectedOrders = new ArrayList<>();

    private final List<String> warnings = new ArrayList<>();

    public BacktestContext(String backtestId) {
        this.backtestId = backtestId;
    }

    public String nextOrderId() {
        orderSequence++;
        return String.format("ORD-%06d", orderSequence);
    }

    public void recordSample(LocalDateTime timestamp, BigDecimal equity) {
        equitySamples.add(new EquitySample(timestamp, equity));
        sessionCount++;
    }

    public void recordSkippedSession(LocalDate date, String reason) {
        skippedSessions++;
        log.error("[{}] Skipping session {}: {}", backtestId, date, reason);
    }

    public void recordRejection(RejectedOrder rejection) {
        rejectedOrders.add(rejection);
    }

    public void recordForcedLiquidation() {
        forcedLiquidations++;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
        log.warn("[{}] {}", backtestId, warning);
    }

    public List<EquitySample> getEquitySamples() {
        return Collections.unmodifiableList(equitySamples);
    }

    public List<RejectedOrder> getRejectedOrders() {
        return Collections.unmodifiableList(rejectedOrders);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
