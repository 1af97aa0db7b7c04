package com.portfoliobacktest.backtest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Lifecycle of an asynchronously submitted backtest.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class BacktestRunStatus {

    private String backtestId;

    private String strategyName;

    private State state;

    private String errorMessage;

    private LocalDateTime submittedAt;

    private LocalDateTime finishedAt;

    public enum State {
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED
    }
}
