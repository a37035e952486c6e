package com.gridbot.service.order;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Checks an intended order against the available balance and shrinks it when it only fits partially.
 * Buys are sized against their cost including the trading fee.
 */
@Slf4j
public class OrderValidator {

    static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.000001");
    private static final MathContext MC = MathContext.DECIMAL64;
    // never round a shrunk quantity up past the balance
    private static final MathContext SHRINK_MC = new MathContext(16, RoundingMode.DOWN);

    private final FeeCalculator feeCalculator;
    private final BigDecimal tolerance;

    public OrderValidator(FeeCalculator feeCalculator) {
        this(feeCalculator, DEFAULT_TOLERANCE);
    }

    public OrderValidator(FeeCalculator feeCalculator, BigDecimal tolerance) {
        this.feeCalculator = Objects.requireNonNull(feeCalculator, "feeCalculator");
        this.tolerance = tolerance;
    }

    /**
     * @param balance  available fiat
     * @param quantity requested base-currency quantity
     * @param price    order price
     * @return OK with a quantity whose cost plus fee fits {@code balance}
     */
    public OrderValidationResult validateBuy(BigDecimal balance, BigDecimal quantity, BigDecimal price) {
        if (quantity == null || quantity.signum() <= 0 || price == null || price.signum() <= 0) {
            return OrderValidationResult.invalidQuantity(
                    "Invalid buy quantity " + quantity + " at price " + price);
        }
        if (balance.compareTo(tolerance) < 0) {
            return OrderValidationResult.insufficientFunds(
                    "Balance " + balance + " is below the minimum required to place a buy order");
        }

        BigDecimal cost = feeCalculator.calculateCostWithFee(quantity, price);
        if (cost.compareTo(balance) <= 0) {
            return OrderValidationResult.ok(quantity);
        }

        BigDecimal unitCost = price.multiply(BigDecimal.ONE.add(feeCalculator.getTradingFee()), MC);
        BigDecimal adjusted = balance.subtract(tolerance).divide(unitCost, SHRINK_MC);
        if (adjusted.signum() <= 0) {
            return OrderValidationResult.insufficientFunds(
                    "Balance " + balance + " cannot cover any quantity at price " + price);
        }
        log.info("Insufficient balance for {} @ {} (cost {}, balance {}), adjusting quantity to {}",
                quantity, price, cost, balance, adjusted);
        return OrderValidationResult.ok(adjusted);
    }

    /**
     * @param cryptoBalance available base currency
     * @param quantity      requested quantity to sell
     */
    public OrderValidationResult validateSell(BigDecimal cryptoBalance, BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            return OrderValidationResult.invalidQuantity("Invalid sell quantity " + quantity);
        }
        if (cryptoBalance.compareTo(tolerance) < 0) {
            return OrderValidationResult.insufficientFunds(
                    "Crypto balance " + cryptoBalance + " is below the minimum required to place a sell order");
        }
        if (quantity.compareTo(cryptoBalance) <= 0) {
            return OrderValidationResult.ok(quantity);
        }

        BigDecimal adjusted = cryptoBalance.subtract(tolerance);
        if (adjusted.signum() <= 0) {
            return OrderValidationResult.insufficientFunds(
                    "Crypto balance " + cryptoBalance + " cannot cover any sell quantity");
        }
        log.info("Insufficient crypto balance for sell of {} (available {}), adjusting quantity to {}",
                quantity, cryptoBalance, adjusted);
        return OrderValidationResult.ok(adjusted);
    }
}
