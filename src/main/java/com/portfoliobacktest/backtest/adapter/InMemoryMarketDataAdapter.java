package com.portfoliobacktest.backtest.adapter;

import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.dto.MarketSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Market data held in memory, loaded through {@link #addBars} and {@link #addSnapshot}.
 * Used for tests and local runs when no external store is configured.
 * Bars are stored per instrument and interval.
 */
@Slf4j
public class InMemoryMarketDataAdapter implements MarketDataAdapter {

    private final Map<String, List<Bar>> barsByKey = new ConcurrentHashMap<>();
    private final Map<LocalDate, MarketSnapshot> snapshots = new ConcurrentHashMap<>();

    public void addBars(String instrumentId, String interval, List<Bar> bars) {
        barsByKey.merge(key(instrumentId, interval), new ArrayList<>(bars), (existing, added) -> {
            List<Bar> merged = new ArrayList<>(existing);
            merged.addAll(added);
            return merged;
        });
        log.debug("Loaded {} {} bars for {}", bars.size(), interval, instrumentId);
    }

    public void addSnapshot(MarketSnapshot snapshot) {
        snapshots.put(snapshot.getDate(), snapshot);
    }

    @Override
    public MarketSnapshot getMarketSnapshot(LocalDate date, Set<String> instrumentFilter) {
        MarketSnapshot snapshot = snapshots.get(date);
        if (snapshot == null) {
            return MarketSnapshot.empty(date);
        }
        if (instrumentFilter == null) {
            return snapshot;
        }
        return MarketSnapshot.of(date, snapshot.rowList().stream()
                .filter(row -> instrumentFilter.contains(row.getInstrumentId()))
                .collect(Collectors.toList()));
    }

    @Override
    public Map<String, List<Bar>> getMultiOHLC(Collection<String> instruments,
                                                String interval,
                                                LocalDate startDate,
                                                LocalDate endDate) {
        Map<String, List<Bar>> result = new LinkedHashMap<>();
        for (String instrumentId : instruments) {
            List<Bar> bars = barsByKey.get(key(instrumentId, interval));
            if (bars == null) {
                continue;
            }
            List<Bar> inRange = bars.stream()
                    .filter(bar -> !bar.getDate().isBefore(startDate) && !bar.getDate().isAfter(endDate))
                    .sorted(Comparator.comparing(Bar::getTimestamp))
                    .collect(Collectors.toList());
            if (!inRange.isEmpty()) {
                result.put(instrumentId, inRange);
            }
        }
        return result;
    }

    private static String key(String instrumentId, String interval) {
        return instrumentId + "|" + interval;
    }
}
