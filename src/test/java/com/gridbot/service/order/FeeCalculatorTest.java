package com.gridbot.service.order;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class FeeCalculatorTest {

    private final FeeCalculator feeCalculator = new FeeCalculator(new BigDecimal("0.001"));

    @Test
    void testFeeIsTradeValueTimesRate() {
        assertEquals(0, new BigDecimal("1.0").compareTo(feeCalculator.calculateFee(new BigDecimal("1000"))));
        assertEquals(0, new BigDecimal("0.0505").compareTo(feeCalculator.calculateFee(new BigDecimal("50.5"))));
    }

    @Test
    void testZeroTradeValueHasNoFee() {
        assertEquals(0, BigDecimal.ZERO.compareTo(feeCalculator.calculateFee(BigDecimal.ZERO)));
    }

    @Test
    void testNegativeRateIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FeeCalculator(new BigDecimal("-0.01")));
    }

    @Test
    void testCostWithFeeAddsFeeOnTopOfTradeValue() {
        // 10 @ 100 = 1000, plus 0.1%
        assertEquals(0, new BigDecimal("1001").compareTo(
                feeCalculator.calculateCostWithFee(BigDecimal.TEN, new BigDecimal("100"))));
    }
}
