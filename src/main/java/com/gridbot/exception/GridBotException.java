package com.gridbot.exception;

/**
 * Base class for all engine errors.
 * Carries a structured error code so callers can branch on the failure category.
 */
public class GridBotException extends RuntimeException {

    public enum ErrorCode {
        INSUFFICIENT_BALANCE,
        INSUFFICIENT_CRYPTO_BALANCE,
        GRID_LEVEL_NOT_READY,
        INVALID_ORDER_QUANTITY,
        ORDER_EXECUTION_FAILED,
        DATA_FETCH_FAILED,
        ORDER_CANCELLATION_FAILED,
        UNSUPPORTED_EXCHANGE,
        MISSING_ENVIRONMENT_VARIABLE,
        INVALID_ORDER_STATUS
    }

    private final ErrorCode errorCode;

    public GridBotException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GridBotException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
