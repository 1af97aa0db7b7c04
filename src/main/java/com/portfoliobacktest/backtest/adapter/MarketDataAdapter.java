package com.portfoliobacktest.backtest.adapter;

import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.dto.MarketSnapshot;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adapter interface for the historical market data store.
 *
 * This interface abstracts the data source allowing easy swapping between:
 * - A database or vendor feed (production)
 * - In-memory fixtures (testing, local runs)
 * - Mocks (unit testing)
 *
 * Implementations must be stateless with respect to a backtest run and thread-safe,
 * since independent runs may call them concurrently.
 */
public interface MarketDataAdapter {

    /**
     * Cross-section of the market on a date, used for universe selection.
     *
     * @param date             the session date
     * @param instrumentFilter restrict the snapshot to these instruments; null means all
     * @return snapshot for the date, empty when the market has no data for it
     * @throws MarketDataException if the fetch fails
     */
    MarketSnapshot getMarketSnapshot(LocalDate date, Set<String> instrumentFilter) throws MarketDataException;

    /**
     * Fetch OHLC bars for several instruments in one call.
     *
     * @param instruments instrument ids to fetch
     * @param interval    bar interval (e.g. "1d")
     * @param startDate   first date (inclusive)
     * @param endDate     last date (inclusive)
     * @return bars per instrument sorted by timestamp ascending; instruments without data are absent keys
     * @throws MarketDataException if the fetch fails
     */
    Map<String, List<Bar>> getMultiOHLC(Collection<String> instruments,
                                         String interval,
                                         LocalDate startDate,
                                         LocalDate endDate) throws MarketDataException;

    /**
     * Exception for market data fetch failures.
     */
    class MarketDataException extends RuntimeException {
        public MarketDataException(String message) {
            super(message);
        }

        public MarketDataException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
