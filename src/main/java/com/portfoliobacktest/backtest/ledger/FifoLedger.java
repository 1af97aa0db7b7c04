package com.portfoliobacktest.backtest.ledger;

import com.portfoliobacktest.backtest.engine.BacktestException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Append-only trade ledger that turns fills into completed round trips using strict FIFO matching.
 * <p>
 * Each instrument keeps two deques of open lots, one for long exposure (opened by buys) and one for
 * short exposure (opened by sells). An incoming fill first closes lots on the opposite deque, oldest
 * first, taking the lesser of the two quantities each time. Every lot closure yields exactly one
 * {@link CompletedTrade}. Whatever quantity is left opens a new lot on the fill's own side.
 * <p>
 * Thread safety: NOT thread-safe. A ledger belongs to exactly one backtest run.
 */
@Slf4j
public class FifoLedger {

    private static final MathContext MC = new MathContext(16, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final boolean longOnly;

    /** Sorted by instrument id so that iteration order never depends on fill arrival. */
    private final Map<String, InstrumentBook> books = new TreeMap<>();

    private final List<CompletedTrade> completedTrades = new ArrayList<>();

    private int matchingViolations = 0;

    public FifoLedger() {
        this(false);
    }

    /**
     * @param longOnly when true, a sell that ends up opening a short lot is counted as a
     *                 matching invariant violation (the lot is still recorded)
     */
    public FifoLedger(boolean longOnly) {
        this.longOnly = longOnly;
    }

    /**
     * Apply one fill and return the round trips it closed, in the order the lots were consumed.
     *
     * @throws BacktestException with {@code LEDGER_ORDER_VIOLATION} if the fill is older than the
     *                           previous fill for the same instrument
     */
    public List<CompletedTrade> applyFill(Fill fill) {
        validate(fill);

        InstrumentBook book = books.computeIfAbsent(fill.getInstrumentId(), InstrumentBook::new);
        if (book.lastFillTime != null && fill.getTimestamp().isBefore(book.lastFillTime)) {
            throw new BacktestException(BacktestException.ErrorCode.LEDGER_ORDER_VIOLATION,
                    "Fill for " + fill.getInstrumentId() + " at " + fill.getTimestamp()
                            + " is older than previous fill at " + book.lastFillTime);
        }
        book.lastFillTime = fill.getTimestamp();
        book.fills.add(fill);

        Deque<Lot> opposite = book.lots(fill.getSide().opposite());
        long remaining = fill.getQuantity();
        BigDecimal unallocatedExitCommission = fill.getCommission();
        List<CompletedTrade> closed = new ArrayList<>();

        while (remaining > 0 && !opposite.isEmpty()) {
            Lot lot = opposite.peekFirst();
            long matched = Math.min(remaining, lot.getRemainingQuantity());

            BigDecimal entryCommission = lot.consume(matched);
            BigDecimal exitCommission = matched == remaining
                    ? unallocatedExitCommission
                    : fill.getCommission()
                        .multiply(BigDecimal.valueOf(matched))
                        .divide(BigDecimal.valueOf(fill.getQuantity()), Lot.COMMISSION_SCALE, RoundingMode.HALF_UP);
            unallocatedExitCommission = unallocatedExitCommission.subtract(exitCommission);
            remaining -= matched;

            closed.add(closeTrade(lot, fill, matched, entryCommission.add(exitCommission)));
            if (lot.isClosed()) {
                opposite.pollFirst();
            }
        }

        if (remaining > 0) {
            if (longOnly && fill.getSide() == Side.SELL) {
                matchingViolations++;
                log.warn("Sell of {} {} at {} has no long exposure to close; opening short lot of {}",
                        fill.getQuantity(), fill.getInstrumentId(), fill.getTimestamp(), remaining);
            }
            book.lots(fill.getSide()).addLast(new Lot(fill.getInstrumentId(), fill.getSide(), remaining,
                    fill.getPrice(), fill.getTimestamp(), unallocatedExitCommission, fill.getOrderId()));
        }

        book.trades.addAll(closed);
        completedTrades.addAll(closed);

        if (!closed.isEmpty()) {
            log.debug("Fill {} {} {} @ {} closed {} lot(s)", fill.getSide(), fill.getQuantity(),
                    fill.getInstrumentId(), fill.getPrice(), closed.size());
        }
        return closed;
    }

    private CompletedTrade closeTrade(Lot lot, Fill fill, long matched, BigDecimal commission) {
        BigDecimal quantity = BigDecimal.valueOf(matched);
        BigDecimal gross = fill.getPrice().subtract(lot.getEntryPrice())
                .multiply(quantity)
                .multiply(BigDecimal.valueOf(lot.getSide().sign()));
        BigDecimal pnl = gross.subtract(commission);
        BigDecimal entryNotional = lot.getEntryPrice().multiply(quantity);
        double returnPct = entryNotional.signum() == 0
                ? 0.0
                : pnl.divide(entryNotional, MC).multiply(HUNDRED).doubleValue();

        return CompletedTrade.builder()
                .instrumentId(lot.getInstrumentId())
                .side(lot.getSide())
                .entryTime(lot.getEntryTime())
                .entryPrice(lot.getEntryPrice())
                .exitTime(fill.getTimestamp())
                .exitPrice(fill.getPrice())
                .quantity(matched)
                .commission(commission)
                .pnl(pnl)
                .returnPct(returnPct)
                .holdingDays(ChronoUnit.DAYS.between(lot.getEntryTime().toLocalDate(),
                        fill.getTimestamp().toLocalDate()))
                .build();
    }

    private void validate(Fill fill) {
        if (fill == null || fill.getInstrumentId() == null || fill.getSide() == null
                || fill.getTimestamp() == null || fill.getPrice() == null) {
            throw new IllegalArgumentException("Fill is missing required fields: " + fill);
        }
        if (fill.getQuantity() <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive: " + fill);
        }
        if (fill.getPrice().signum() <= 0) {
            throw new IllegalArgumentException("Fill price must be positive: " + fill);
        }
        if (fill.getCommission() == null || fill.getCommission().signum() < 0) {
            throw new IllegalArgumentException("Fill commission must be non-negative: " + fill);
        }
    }

    // ==================== QUERIES ====================

    /** All completed trades in the order they were closed. */
    public List<CompletedTrade> getCompletedTrades() {
        return Collections.unmodifiableList(completedTrades);
    }

    public List<CompletedTrade> getCompletedTrades(String instrumentId) {
        InstrumentBook book = books.get(instrumentId);
        return book == null ? List.of() : Collections.unmodifiableList(book.trades);
    }

    /** Raw fills for one instrument, in replay order. */
    public List<Fill> getFills(String instrumentId) {
        InstrumentBook book = books.get(instrumentId);
        return book == null ? List.of() : Collections.unmodifiableList(book.fills);
    }

    /** Open lots for one instrument, oldest first (long lots, then short lots). */
    public List<Lot> getOpenLots(String instrumentId) {
        InstrumentBook book = books.get(instrumentId);
        if (book == null) {
            return List.of();
        }
        List<Lot> lots = new ArrayList<>(book.longLots);
        lots.addAll(book.shortLots);
        return lots;
    }

    /** Signed net quantity of unclosed lots: positive when long, negative when short. */
    public long getNetOpenQuantity(String instrumentId) {
        long net = 0;
        for (Lot lot : getOpenLots(instrumentId)) {
            net += lot.getSide().sign() * lot.getRemainingQuantity();
        }
        return net;
    }

    public Set<String> getInstruments() {
        return Collections.unmodifiableSet(books.keySet());
    }

    public int getFillCount() {
        return books.values().stream().mapToInt(b -> b.fills.size()).sum();
    }

    public int getMatchingViolations() {
        return matchingViolations;
    }

    private static final class InstrumentBook {
        private final String instrumentId;
        private final Deque<Lot> longLots = new ArrayDeque<>();
        private final Deque<Lot> shortLots = new ArrayDeque<>();
        private final List<Fill> fills = new ArrayList<>();
        private final List<CompletedTrade> trades = new ArrayList<>();
        private LocalDateTime lastFillTime;

        private InstrumentBook(String instrumentId) {
            this.instrumentId = instrumentId;
        }

        private Deque<Lot> lots(Side side) {
            return side == Side.BUY ? longLots : shortLots;
        }
    }
}
