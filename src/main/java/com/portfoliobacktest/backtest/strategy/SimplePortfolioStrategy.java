package com.portfoliobacktest.backtest.strategy;

import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.dto.MarketSnapshot;
import com.portfoliobacktest.backtest.portfolio.AccountView;
import com.portfoliobacktest.backtest.portfolio.Position;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Holds the {@code max_stocks} (10) most traded instruments of each session, equally weighted.
 */
public class SimplePortfolioStrategy extends AbstractBacktestStrategy {

    public static final String NAME = "SimplePortfolioStrategy";

    private final int maxStocks;

    public SimplePortfolioStrategy(Map<String, Object> params) {
        super(params);
        this.maxStocks = getInt("max_stocks", 10);
        if (maxStocks <= 0) {
            throw new IllegalArgumentException("max_stocks must be positive: " + maxStocks);
        }
    }

    @Override
    public String getStrategyName() {
        return NAME;
    }

    @Override
    public boolean hasUniverseSelection() {
        return true;
    }

    @Override
    public List<String> selectUniverse(LocalDate date, MarketSnapshot snapshot) {
        return snapshot.rowList().stream()
                .filter(row -> row.getVolumeAmount() > 0)
                .sorted(byVolumeAmountDesc())
                .limit(maxStocks)
                .map(MarketSnapshot.Row::getInstrumentId)
                .collect(Collectors.toList());
    }

    @Override
    public List<OrderSignal> onBar(List<Bar> history, List<Position> positions, AccountView account) {
        return List.of();
    }

    /** Highest traded value first; ties broken by instrument id. */
    static Comparator<MarketSnapshot.Row> byVolumeAmountDesc() {
        return Comparator.comparingDouble(MarketSnapshot.Row::getVolumeAmount).reversed()
                .thenComparing(MarketSnapshot.Row::getInstrumentId);
    }
}
