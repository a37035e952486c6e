package com.gridbot.model;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Where orders go: simulated fills over historical prices, an exchange sandbox, or the live exchange.
 */
public enum TradingMode {
    BACKTEST,
    PAPER_TRADING,
    LIVE;

    public static TradingMode fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase().replace('-', '_');
            for (TradingMode mode : values()) {
                if (mode.name().equals(normalized)) {
                    return mode;
                }
            }
        }
        String available = Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Invalid trading mode: '" + value + "'. Available modes are: " + available);
    }

    public boolean isBacktest() {
        return this == BACKTEST;
    }
}
