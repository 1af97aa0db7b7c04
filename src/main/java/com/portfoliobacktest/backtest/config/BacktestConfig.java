package com.portfoliobacktest.backtest.config;

import com.portfoliobacktest.backtest.adapter.HistoricalDataCache;
import com.portfoliobacktest.backtest.adapter.InMemoryMarketDataAdapter;
import com.portfoliobacktest.backtest.adapter.MarketDataAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Beans shared by all backtest runs.
 *
 * Provides:
 * - a dedicated thread pool so async and batch runs don't block request threads
 * - the bounded OHLC cache, the only state shared between concurrent runs
 * - an in-memory market data adapter unless another adapter bean is defined
 */
@Configuration
@EnableAsync
@RequiredArgsConstructor
@Slf4j
public class BacktestConfig {

    private final BacktestProperties backtestProperties;

    @Bean(name = "backtestExecutor")
    public Executor backtestExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(backtestProperties.getExecutorCorePoolSize());
        executor.setMaxPoolSize(backtestProperties.getExecutorMaxPoolSize());
        executor.setQueueCapacity(backtestProperties.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("Backtest-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Backtest task rejected, queue full. Consider reducing batch size.");
            throw new RejectedExecutionException(
                    "Backtest queue full. Please wait for current backtests to complete.");
        });
        executor.initialize();
        log.info("Backtest executor initialized: corePool={}, maxPool={}, queue={}",
                backtestProperties.getExecutorCorePoolSize(),
                backtestProperties.getExecutorMaxPoolSize(),
                backtestProperties.getExecutorQueueCapacity());
        return executor;
    }

    @Bean
    public HistoricalDataCache historicalDataCache() {
        log.info("Historical data cache initialized: maxEntries={}", backtestProperties.getCacheMaxEntries());
        return new HistoricalDataCache(backtestProperties.getCacheMaxEntries());
    }

    @Bean
    @ConditionalOnMissingBean(MarketDataAdapter.class)
    public MarketDataAdapter marketDataAdapter() {
        log.info("No market data adapter configured, using in-memory adapter");
        return new InMemoryMarketDataAdapter();
    }
}
