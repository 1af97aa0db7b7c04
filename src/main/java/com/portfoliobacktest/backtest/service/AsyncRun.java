package com.portfoliobacktest.backtest.service;

import com.portfoliobacktest.backtest.dto.BacktestResult;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a submitted run: its id, known immediately, and the eventual result.
 */
public record AsyncRun(String backtestId, CompletableFuture<BacktestResult> result) {
}
