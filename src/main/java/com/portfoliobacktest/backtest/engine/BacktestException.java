package com.portfoliobacktest.backtest.engine;

/**
 * Exception for backtest-specific errors.
 * Carries a structured error code for API responses.
 */
public class BacktestException extends RuntimeException {

    public enum ErrorCode {
        INVALID_DATE_RANGE,
        STRATEGY_NOT_BOUND,
        INVALID_REQUEST,
        DATA_FETCH_FAILED,
        LEDGER_ORDER_VIOLATION,
        CANCELLED,
        RESULT_NOT_FOUND,
        BACKTEST_DISABLED
    }

    private final ErrorCode errorCode;

    public BacktestException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BacktestException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
