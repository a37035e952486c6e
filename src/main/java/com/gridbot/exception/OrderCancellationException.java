package com.gridbot.exception;

/**
 * Raised by the exchange adapter when an order cannot be cancelled.
 */
public class OrderCancellationException extends GridBotException {

    public OrderCancellationException(String message) {
        super(ErrorCode.ORDER_CANCELLATION_FAILED, message);
    }

    public OrderCancellationException(String message, Throwable cause) {
        super(ErrorCode.ORDER_CANCELLATION_FAILED, message, cause);
    }
}
