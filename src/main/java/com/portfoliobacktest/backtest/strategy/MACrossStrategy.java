package com.portfoliobacktest.backtest.strategy;

import com.portfoliobacktest.backtest.dto.Bar;
import com.portfoliobacktest.backtest.portfolio.AccountView;
import com.portfoliobacktest.backtest.portfolio.Position;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * Single-instrument moving-average crossover.
 *
 * Buys when the short moving average of closes crosses above the long one and the
 * position is flat, sizing the order at {@code position_size} of equity. Sells the whole
 * position when the short average crosses back below.
 *
 * Parameters: {@code symbol}, {@code short_period} (5), {@code long_period} (20),
 * {@code position_size} (0.1).
 */
@Slf4j
public class MACrossStrategy extends AbstractBacktestStrategy {

    public static final String NAME = "MACrossStrategy";

    private final String symbol;
    private final int shortPeriod;
    private final int longPeriod;
    private final double positionSize;

    public MACrossStrategy(Map<String, Object> params) {
        super(params);
        this.symbol = getString("symbol", null);
        this.shortPeriod = getInt("short_period", 5);
        this.longPeriod = getInt("long_period", 20);
        this.positionSize = getDouble("position_size", 0.1);
        if (shortPeriod <= 0 || longPeriod <= shortPeriod) {
            throw new IllegalArgumentException(String.format(
                    "Require 0 < short_period < long_period, got %d / %d", shortPeriod, longPeriod));
        }
        if (positionSize <= 0 || positionSize > 1) {
            throw new IllegalArgumentException("position_size must be in (0, 1]: " + positionSize);
        }
    }

    @Override
    public String getStrategyName() {
        return NAME;
    }

    @Override
    public List<OrderSignal> onBar(List<Bar> history, List<Position> positions, AccountView account) {
        if (history.size() < longPeriod + 1) {
            return List.of();
        }

        int last = history.size() - 1;
        double shortNow = average(history, last, shortPeriod);
        double longNow = average(history, last, longPeriod);
        double shortPrev = average(history, last - 1, shortPeriod);
        double longPrev = average(history, last - 1, longPeriod);

        Bar bar = history.get(last);
        String instrumentId = symbol != null ? symbol : bar.getInstrumentId();
        long held = account.quantityOf(instrumentId);

        if (shortPrev <= longPrev && shortNow > longNow && held == 0) {
            long quantity = account.equity()
                    .multiply(BigDecimal.valueOf(positionSize))
                    .divide(bar.getClose(), 0, RoundingMode.FLOOR)
                    .longValue();
            if (quantity > 0) {
                log.debug("{} golden cross on {}: buy {}", instrumentId, bar.getDate(), quantity);
                return List.of(OrderSignal.buy(instrumentId, quantity));
            }
        } else if (shortPrev >= longPrev && shortNow < longNow && held > 0) {
            log.debug("{} dead cross on {}: sell {}", instrumentId, bar.getDate(), held);
            return List.of(OrderSignal.sell(instrumentId, held));
        }
        return List.of();
    }

    private static double average(List<Bar> history, int endIndex, int period) {
        double sum = 0.0;
        for (int i = endIndex - period + 1; i <= endIndex; i++) {
            sum += history.get(i).getClose().doubleValue();
        }
        return sum / period;
    }
}
