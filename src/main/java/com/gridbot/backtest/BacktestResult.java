package com.gridbot.backtest;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Outcome of replaying a price series through the bot.
 */
@Value
@Builder
public class BacktestResult {

    /** Account value after a tick has been processed */
    @Value
    public static class AccountValuePoint {
        long timestamp;
        BigDecimal price;
        BigDecimal accountValue;
    }

    int ticksProcessed;
    BigDecimal initialValue;
    BigDecimal finalValue;
    BigDecimal totalFees;
    int ordersPlaced;
    boolean stoppedEarly;
    List<AccountValuePoint> accountValues;

    public BigDecimal getProfitAndLoss() {
        return finalValue.subtract(initialValue);
    }

    /**
     * @return ROI in percent, zero when the initial value is zero
     */
    public BigDecimal getRoiPercent() {
        if (initialValue.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return getProfitAndLoss().multiply(BigDecimal.valueOf(100)).divide(initialValue, MathContext.DECIMAL64);
    }
}
