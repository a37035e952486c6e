package com.gridbot.exception;

/**
 * Raised when the configured trading mode needs an exchange adapter that is not available.
 */
public class UnsupportedExchangeException extends GridBotException {

    public UnsupportedExchangeException(String message) {
        super(ErrorCode.UNSUPPORTED_EXCHANGE, message);
    }

    public UnsupportedExchangeException(String message, Throwable cause) {
        super(ErrorCode.UNSUPPORTED_EXCHANGE, message, cause);
    }
}
