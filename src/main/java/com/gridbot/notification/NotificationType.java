package com.gridbot.notification;

import lombok.Getter;

/**
 * Notification kinds with their title and message template.
 * Templates reference fields as {@code {name}}.
 */
@Getter
public enum NotificationType {
    ORDER_PLACED("Order Placement Successful", "Order placed: {orderDetails}"),
    ORDER_FILLED("Order Filled", "Order has been filled: {orderDetails}"),
    ORDER_FAILED("Order Placement Failed", "Failed to place order: {errorDetails}"),
    ORDER_EXECUTION_FAILED("Order Execution Failed",
            "Failed to execute {orderType} {orderSide} order for {pair} (quantity {quantity} @ {price}, filled {filledQuantity}): {errorDetails}"),
    ERROR_OCCURRED("Error Occurred", "An error occurred in the trading bot: {errorDetails}"),
    TAKE_PROFIT_TRIGGERED("Take Profit Triggered", "Take profit triggered with order details: {orderDetails}"),
    STOP_LOSS_TRIGGERED("Stop Loss Triggered", "Stop loss triggered with order details: {orderDetails}");

    private final String title;
    private final String messageTemplate;

    NotificationType(String title, String messageTemplate) {
        this.title = title;
        this.messageTemplate = messageTemplate;
    }
}
