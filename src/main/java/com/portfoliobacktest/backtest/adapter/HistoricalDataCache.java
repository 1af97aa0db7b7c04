package com.portfoliobacktest.backtest.adapter;

import com.portfoliobacktest.backtest.dto.Bar;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded LRU cache of OHLC series shared by concurrently running backtests.
 *
 * Key Features:
 * - One entry per (instrument, interval, start, end) request
 * - Least recently used entry evicted once the bound is reached
 * - An evicted series is simply fetched again on the next miss
 * - Thread-safe: every access goes through one lock, since an LRU read reorders the map
 */
@Slf4j
public class HistoricalDataCache {

    private final int maxEntries;

    private final LinkedHashMap<SeriesKey, List<Bar>> entries;

    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public HistoricalDataCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<SeriesKey, List<Bar>> eldest) {
                boolean evict = size() > HistoricalDataCache.this.maxEntries;
                if (evict) {
                    evictions.incrementAndGet();
                    log.debug("Evicting cached series {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    public Optional<List<Bar>> get(SeriesKey key) {
        lock.lock();
        try {
            List<Bar> bars = entries.get(key);
            if (bars == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(bars);
        } finally {
            lock.unlock();
        }
    }

    public void put(SeriesKey key, List<Bar> bars) {
        List<Bar> frozen = List.copyOf(bars);
        lock.lock();
        try {
            entries.put(key, frozen);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.info("Historical data cache cleared");
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    /**
     * Identity of one cached series request.
     */
    public record SeriesKey(String instrumentId, String interval, LocalDate startDate, LocalDate endDate) {
    }
}
