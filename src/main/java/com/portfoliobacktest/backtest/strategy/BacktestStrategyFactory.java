package com.portfoliobacktest.backtest.strategy;

import com.portfoliobacktest.backtest.engine.BacktestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of backtest strategies by name.
 *
 * Strategies may keep state between sessions, so the registry stores factories and
 * {@link #create} returns a fresh instance for every run.
 */
@Component
@Slf4j
public class BacktestStrategyFactory {

    private final Map<String, Function<Map<String, Object>, BacktestStrategy>> strategyRegistry =
            new ConcurrentHashMap<>();

    public BacktestStrategyFactory() {
        registerStrategy(MACrossStrategy.NAME, MACrossStrategy::new);
        registerStrategy(SimplePortfolioStrategy.NAME, SimplePortfolioStrategy::new);
        registerStrategy(ValuePortfolioStrategy.NAME, ValuePortfolioStrategy::new);
    }

    /**
     * Register a backtest strategy implementation, replacing any previous one of that name.
     */
    public void registerStrategy(String name, Function<Map<String, Object>, BacktestStrategy> factory) {
        strategyRegistry.put(name, factory);
        log.info("Registered backtest strategy: {}", name);
    }

    /**
     * Create a new strategy instance.
     *
     * @throws BacktestException with {@code STRATEGY_NOT_BOUND} if the name is unknown,
     *                           or {@code INVALID_REQUEST} if the parameters are rejected
     */
    public BacktestStrategy create(String name, Map<String, Object> params) {
        Function<Map<String, Object>, BacktestStrategy> factory = name != null ? strategyRegistry.get(name) : null;
        if (factory == null) {
            throw new BacktestException(BacktestException.ErrorCode.STRATEGY_NOT_BOUND,
                    "Unsupported backtest strategy: " + name + ". Supported: " + getSupportedStrategies());
        }
        try {
            return factory.apply(params != null ? params : Map.of());
        } catch (IllegalArgumentException e) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_REQUEST,
                    "Invalid parameters for " + name + ": " + e.getMessage(), e);
        }
    }

    public boolean isSupported(String name) {
        return name != null && strategyRegistry.containsKey(name);
    }

    public Set<String> getSupportedStrategies() {
        return new TreeSet<>(strategyRegistry.keySet());
    }
}
