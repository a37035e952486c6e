package com.gridbot.service.order;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Flat-rate trading fee: {@code tradeValue x rate}.
 */
public class FeeCalculator {

    private static final MathContext MC = new MathContext(16, RoundingMode.HALF_UP);
    private static final MathContext COST_MC = MathContext.DECIMAL64;

    private final BigDecimal tradingFee;

    public FeeCalculator(BigDecimal tradingFee) {
        Objects.requireNonNull(tradingFee, "tradingFee");
        if (tradingFee.signum() < 0) {
            throw new IllegalArgumentException("Trading fee must not be negative: " + tradingFee);
        }
        this.tradingFee = tradingFee;
    }

    public BigDecimal calculateFee(BigDecimal tradeValue) {
        if (tradeValue == null || tradeValue.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return tradeValue.multiply(tradingFee, MC);
    }

    /**
     * Fiat spent buying {@code quantity} at {@code price}, fee included.
     */
    public BigDecimal calculateCostWithFee(BigDecimal quantity, BigDecimal price) {
        BigDecimal cost = quantity.multiply(price, COST_MC);
        return cost.add(calculateFee(cost));
    }

    public BigDecimal getTradingFee() {
        return tradingFee;
    }
}
