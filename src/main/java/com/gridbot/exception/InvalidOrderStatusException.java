package com.gridbot.exception;

/**
 * Raised when an exchange order response carries no usable status.
 */
public class InvalidOrderStatusException extends GridBotException {

    public InvalidOrderStatusException(String message) {
        super(ErrorCode.INVALID_ORDER_STATUS, message);
    }

    public InvalidOrderStatusException(String message, Throwable cause) {
        super(ErrorCode.INVALID_ORDER_STATUS, message, cause);
    }
}
