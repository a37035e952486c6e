package com.gridbot.exception;

/**
 * Raised when an order quantity is zero, negative or otherwise unusable.
 */
public class InvalidOrderQuantityException extends GridBotException {

    public InvalidOrderQuantityException(String message) {
        super(ErrorCode.INVALID_ORDER_QUANTITY, message);
    }

    public InvalidOrderQuantityException(String message, Throwable cause) {
        super(ErrorCode.INVALID_ORDER_QUANTITY, message, cause);
    }
}
