package com.portfoliobacktest.backtest.controller;

import com.portfoliobacktest.backtest.dto.BacktestRequest;
import com.portfoliobacktest.backtest.dto.BacktestResult;
import com.portfoliobacktest.backtest.dto.OptimizationMetric;
import com.portfoliobacktest.backtest.dto.OptimizationRequest;
import com.portfoliobacktest.backtest.dto.OptimizationResult;
import com.portfoliobacktest.backtest.engine.BacktestException;
import com.portfoliobacktest.backtest.service.AsyncRun;
import com.portfoliobacktest.backtest.service.BacktestService;
import com.portfoliobacktest.dto.ApiResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BacktestControllerTest {

    @Mock
    private BacktestService backtestService;

    @InjectMocks
    private BacktestController controller;

    private static BacktestRequest request() {
        return BacktestRequest.builder()
                .strategyName("SimplePortfolioStrategy")
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 3, 31))
                .build();
    }

    @Test
    void runReturnsResult() {
        BacktestResult result = BacktestResult.builder().backtestId("bt-1").build();
        when(backtestService.runBacktest(any())).thenReturn(result);

        ResponseEntity<ApiResponse<BacktestResult>> response = controller.runBacktest(request());

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().isSuccess());
        assertSame(result, response.getBody().getData());
    }

    @Test
    void asyncRunIsAccepted() {
        when(backtestService.runBacktestAsync(any()))
                .thenReturn(new AsyncRun("bt-2", new CompletableFuture<>()));

        ResponseEntity<ApiResponse<String>> response = controller.runBacktestAsync(request());

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertEquals("bt-2", response.getBody().getData());
    }

    @Test
    void optimizeReturnsRankings() {
        OptimizationResult result = OptimizationResult.builder()
                .metric(OptimizationMetric.SHARPE_RATIO)
                .totalCombinations(4)
                .completedRuns(3)
                .build();
        when(backtestService.optimize(any())).thenReturn(result);
        OptimizationRequest request = OptimizationRequest.builder()
                .baseRequest(request())
                .parameterGrid(Map.of("max_stocks", List.of(1, 2, 3, 4)))
                .build();

        ResponseEntity<ApiResponse<OptimizationResult>> response = controller.optimize(request);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(result, response.getBody().getData());
        assertTrue(response.getBody().getMessage().contains("3 of 4"));
    }

    @Test
    void serviceErrorsPropagateToHandler() {
        when(backtestService.getResult("missing"))
                .thenThrow(new BacktestException(BacktestException.ErrorCode.RESULT_NOT_FOUND, "No backtest found"));

        assertThrows(BacktestException.class, () -> controller.getResult("missing"));
    }

    @Test
    void deleteDelegates() {
        ResponseEntity<ApiResponse<Void>> response = controller.deleteResult("bt-3");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        verify(backtestService).deleteResult("bt-3");
    }

    @Test
    void strategiesAreListed() {
        when(backtestService.getSupportedStrategies()).thenReturn(List.of("MACrossStrategy"));

        assertEquals(List.of("MACrossStrategy"), controller.getSupportedStrategies().getBody().getData());
    }
}
