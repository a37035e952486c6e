package com.gridbot.exception;

/**
 * Raised when the exchange adapter fails to deliver data (order status, balances, prices).
 */
public class DataFetchException extends GridBotException {

    public DataFetchException(String message) {
        super(ErrorCode.DATA_FETCH_FAILED, message);
    }

    public DataFetchException(String message, Throwable cause) {
        super(ErrorCode.DATA_FETCH_FAILED, message, cause);
    }
}
