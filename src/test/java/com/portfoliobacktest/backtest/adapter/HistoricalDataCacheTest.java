package com.portfoliobacktest.backtest.adapter;

import com.portfoliobacktest.backtest.adapter.HistoricalDataCache.SeriesKey;
import com.portfoliobacktest.backtest.dto.Bar;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HistoricalDataCacheTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 12, 31);

    private static SeriesKey key(String instrument) {
        return new SeriesKey(instrument, "1d", START, END);
    }

    private static List<Bar> series(String instrument) {
        return List.of(Bar.builder()
                .instrumentId(instrument)
                .timestamp(START.atStartOfDay())
                .open(BigDecimal.ONE).high(BigDecimal.ONE).low(BigDecimal.ONE).close(BigDecimal.ONE)
                .build());
    }

    @Test
    void hitAndMissAreCounted() {
        HistoricalDataCache cache = new HistoricalDataCache(4);
        cache.put(key("A"), series("A"));

        assertTrue(cache.get(key("A")).isPresent());
        assertTrue(cache.get(key("B")).isEmpty());
        assertEquals(1, cache.getHits());
        assertEquals(1, cache.getMisses());
    }

    @Test
    void evictsLeastRecentlyUsed() {
        HistoricalDataCache cache = new HistoricalDataCache(2);
        cache.put(key("A"), series("A"));
        cache.put(key("B"), series("B"));
        cache.get(key("A"));
        cache.put(key("C"), series("C"));

        assertEquals(2, cache.size());
        assertTrue(cache.get(key("A")).isPresent());
        assertTrue(cache.get(key("B")).isEmpty(), "B was least recently used");
        assertTrue(cache.get(key("C")).isPresent());
        assertEquals(1, cache.getEvictions());
    }

    @Test
    void differentRangesAreDifferentEntries() {
        HistoricalDataCache cache = new HistoricalDataCache(4);
        cache.put(key("A"), series("A"));

        assertTrue(cache.get(new SeriesKey("A", "1d", START, END.minusDays(1))).isEmpty());
        assertTrue(cache.get(new SeriesKey("A", "1h", START, END)).isEmpty());
    }

    @Test
    void cachedSeriesIsImmutable() {
        HistoricalDataCache cache = new HistoricalDataCache(4);
        cache.put(key("A"), new ArrayList<>(series("A")));

        List<Bar> cached = cache.get(key("A")).orElseThrow();
        assertThrows(UnsupportedOperationException.class, () -> cached.add(series("B").get(0)));
    }

    @Test
    void rejectsNonPositiveBound() {
        assertThrows(IllegalArgumentException.class, () -> new HistoricalDataCache(0));
    }

    @Test
    void concurrentAccessStaysBounded() throws Exception {
        HistoricalDataCache cache = new HistoricalDataCache(8);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        String instrument = "I" + ((i + thread) % 20);
                        if (cache.get(key(instrument)).isEmpty()) {
                            cache.put(key(instrument), series(instrument));
                        }
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(cache.size() <= 8);
        assertEquals(800, cache.getHits() + cache.getMisses());
    }
}
