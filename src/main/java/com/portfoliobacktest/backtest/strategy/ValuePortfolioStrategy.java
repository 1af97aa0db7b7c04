package com.portfoliobacktest.backtest.strategy;

import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.dto.MarketSnapshot;
import com.portfoliobacktest.backtest.portfolio.AccountView;
import com.portfoliobacktest.backtest.portfolio.Position;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Value screen: instruments with 0 < PER < {@code per_max}, 0 < PBR < {@code pbr_max} and
 * ROE > {@code roe_min}, the {@code max_stocks} most traded of them, equally weighted.
 * The selection is only refreshed every {@code rebalance_days} calendar days; in between the
 * previous universe is kept.
 */
@Slf4j
public class ValuePortfolioStrategy extends AbstractBacktestStrategy {

    public static final String NAME = "ValuePortfolioStrategy";

    private final double perMax;
    private final double pbrMax;
    private final double roeMin;
    private final int maxStocks;
    private final int rebalanceDays;

    private LocalDate lastSelectionDate;
    private List<String> currentUniverse = List.of();

    public ValuePortfolioStrategy(Map<String, Object> params) {
        super(params);
        this.perMax = getDouble("per_max", 10);
        this.pbrMax = getDouble("pbr_max", 1);
        this.roeMin = getDouble("roe_min", 10);
        this.maxStocks = getInt("max_stocks", 20);
        this.rebalanceDays = getInt("rebalance_days", 30);
        if (maxStocks <= 0 || rebalanceDays <= 0) {
            throw new IllegalArgumentException("max_stocks and rebalance_days must be positive");
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
        if (lastSelectionDate != null && ChronoUnit.DAYS.between(lastSelectionDate, date) < rebalanceDays) {
            return currentUniverse;
        }
        currentUniverse = snapshot.rowList().stream()
                .filter(this::passesScreen)
                .sorted(SimplePortfolioStrategy.byVolumeAmountDesc())
                .limit(maxStocks)
                .map(MarketSnapshot.Row::getInstrumentId)
                .collect(Collectors.toUnmodifiableList());
        lastSelectionDate = date;
        log.debug("{}: value screen selected {} instruments", date, currentUniverse.size());
        return currentUniverse;
    }

    @Override
    public List<OrderSignal> onBar(List<Bar> history, List<Position> positions, AccountView account) {
        return List.of();
    }

    private boolean passesScreen(MarketSnapshot.Row row) {
        return row.getPer() != null && row.getPer() > 0 && row.getPer() < perMax
                && row.getPbr() != null && row.getPbr() > 0 && row.getPbr() < pbrMax
                && row.getRoe() != null && row.getRoe() > roeMin;
    }
}
