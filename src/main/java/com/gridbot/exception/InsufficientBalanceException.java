package com.gridbot.exception;

/**
 * Raised when available fiat cannot cover a buy reservation.
 */
public class InsufficientBalanceException extends GridBotException {

    public InsufficientBalanceException(String message) {
        super(ErrorCode.INSUFFICIENT_BALANCE, message);
    }

    public InsufficientBalanceException(String message, Throwable cause) {
        super(ErrorCode.INSUFFICIENT_BALANCE, message, cause);
    }
}
