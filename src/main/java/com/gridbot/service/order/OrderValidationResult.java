package com.gridbot.service.order;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Outcome of an affordability check before an order is placed.
 * <p>
 * {@link Outcome#OK} carries the (possibly reduced) quantity to trade; the other outcomes carry
 * a reason for the log line only.
 */
@Getter
public final class OrderValidationResult {

    public enum Outcome {
        OK,
        /** Not enough fiat or crypto to place any order */
        INSUFFICIENT_FUNDS,
        /** Quantity is zero, negative or otherwise unusable */
        INVALID_QUANTITY
    }

    private final Outcome outcome;
    private final BigDecimal quantity;
    private final String reason;

    private OrderValidationResult(Outcome outcome, BigDecimal quantity, String reason) {
        this.outcome = outcome;
        this.quantity = quantity;
        this.reason = reason;
    }

    public static OrderValidationResult ok(BigDecimal quantity) {
        return new OrderValidationResult(Outcome.OK, quantity, null);
    }

    public static OrderValidationResult insufficientFunds(String reason) {
        return new OrderValidationResult(Outcome.INSUFFICIENT_FUNDS, null, reason);
    }

    public static OrderValidationResult invalidQuantity(String reason) {
        return new OrderValidationResult(Outcome.INVALID_QUANTITY, null, reason);
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }

    @Override
    public String toString() {
        return isOk()
                ? "OrderValidationResult{OK, quantity=" + quantity + "}"
                : "OrderValidationResult{" + outcome + ", reason='" + reason + "'}";
    }
}
