package com.gridbot.model;

public enum OrderType {
    MARKET,
    LIMIT;

    public static OrderType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Order type must not be null");
        }
        return OrderType.valueOf(value.trim().toUpperCase());
    }

    public String exchangeValue() {
        return name().toLowerCase();
    }
}
