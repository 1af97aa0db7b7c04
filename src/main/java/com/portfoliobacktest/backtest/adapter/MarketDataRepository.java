package com.portfoliobacktest.backtest.adapter;

import com.portfoliobacktest.backtest.adapter.HistoricalDataCache.SeriesKey;
import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.dto.MarketSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read path for market data used by backtest runs. OHLC series go through the shared
 * {@link HistoricalDataCache}; snapshots are passed straight to the adapter.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarketDataRepository {

    private final MarketDataAdapter marketDataAdapter;
    private final HistoricalDataCache historicalDataCache;

    public MarketSnapshot getMarketSnapshot(LocalDate date, Set<String> instrumentFilter) {
        MarketSnapshot snapshot = marketDataAdapter.getMarketSnapshot(date, instrumentFilter);
        return snapshot != null ? snapshot : MarketSnapshot.empty(date);
    }

    /**
     * Series for each instrument over [startDate, endDate]. Cached series are served from the cache,
     * the rest are fetched in one batch call. Instruments the store has no data for are absent keys
     * and are not cached, so a later run fetches them again.
     *
     * @throws MarketDataAdapter.MarketDataException if the batch fetch fails
     */
    public Map<String, List<Bar>> getSeries(Collection<String> instruments,
                                            String interval,
                                            LocalDate startDate,
                                            LocalDate endDate) {
        Map<String, List<Bar>> result = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();

        for (String instrumentId : instruments) {
            SeriesKey key = new SeriesKey(instrumentId, interval, startDate, endDate);
            historicalDataCache.get(key).ifPresentOrElse(
                    bars -> result.put(instrumentId, bars),
                    () -> missing.add(instrumentId));
        }

        if (missing.isEmpty()) {
            log.debug("Cache HIT for all {} series ({} {} - {})", result.size(), interval, startDate, endDate);
            return result;
        }

        log.debug("Cache MISS for {} of {} series - fetching from store", missing.size(), instruments.size());
        Map<String, List<Bar>> fetched = marketDataAdapter.getMultiOHLC(missing, interval, startDate, endDate);
        for (String instrumentId : missing) {
            List<Bar> bars = fetched != null ? fetched.get(instrumentId) : null;
            if (bars == null || bars.isEmpty()) {
                continue;
            }
            historicalDataCache.put(new SeriesKey(instrumentId, interval, startDate, endDate), bars);
            result.put(instrumentId, bars);
        }
        return result;
    }

    public List<Bar> getSeries(String instrumentId, String interval, LocalDate startDate, LocalDate endDate) {
        return getSeries(List.of(instrumentId), interval, startDate, endDate)
                .getOrDefault(instrumentId, List.of());
    }
}
