package com.gridbot.model;

/**
 * Order status as reported by the exchange.
 * Values follow the ccxt unified order structure.
 */
public enum OrderStatus {
    /**
     * Accepted by the exchange, not (fully) filled yet
     */
    OPEN,

    /**
     * Fully filled
     */
    CLOSED,

    /**
     * Cancelled before being fully filled
     */
    CANCELED,

    EXPIRED,

    REJECTED,

    /**
     * Status missing or reported as {@code unknown}; never a valid remote state
     */
    UNKNOWN,

    /**
     * A status string this engine does not handle; the raw value is kept on the order
     */
    UNRECOGNIZED;

    public boolean isTerminal() {
        return this == CLOSED || this == CANCELED || this == EXPIRED || this == REJECTED;
    }

    /**
     * Parse an exchange status string. A missing value or {@code unknown} maps to {@link #UNKNOWN},
     * any other unhandled string to {@link #UNRECOGNIZED}.
     */
    public static OrderStatus fromExchangeValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        switch (value.trim().toLowerCase()) {
            case "open":
                return OPEN;
            case "closed":
            case "filled":
                return CLOSED;
            case "canceled":
            case "cancelled":
                return CANCELED;
            case "expired":
                return EXPIRED;
            case "rejected":
                return REJECTED;
            case "unknown":
                return UNKNOWN;
            default:
                return UNRECOGNIZED;
        }
    }
}
