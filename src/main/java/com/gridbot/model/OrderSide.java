package com.gridbot.model;

/**
 * Direction of an order.
 */
public enum OrderSide {
    BUY,
    SELL;

    public static OrderSide fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Order side must not be null");
        }
        return OrderSide.valueOf(value.trim().toUpperCase());
    }
}
