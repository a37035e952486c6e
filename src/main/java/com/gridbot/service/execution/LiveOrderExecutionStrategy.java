package com.gridbot.service.execution;

import com.gridbot.exception.DataFetchException;
import com.gridbot.exception.OrderExecutionFailedException;
import com.gridbot.exchange.ExchangeService;
import com.gridbot.model.Order;
import com.gridbot.model.OrderSide;
import com.gridbot.model.OrderStatus;
import com.gridbot.model.OrderType;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.Objects;

/**
 * Places orders on a real exchange.
 * <p>
 * Market orders are retried up to {@code maxRetries} times with a fixed delay. A partially filled
 * attempt is cancelled and the remaining quantity is retried at a price widened by
 * {@code maxSlippage / maxRetries} per retry.
 */
@Slf4j
public class LiveOrderExecutionStrategy implements OrderExecutionStrategy {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final ExchangeService exchangeService;
    private final int maxRetries;
    private final Duration retryDelay;
    private final BigDecimal maxSlippage;

    public LiveOrderExecutionStrategy(ExchangeService exchangeService, int maxRetries,
                                      Duration retryDelay, BigDecimal maxSlippage) {
        this.exchangeService = Objects.requireNonNull(exchangeService, "exchangeService");
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
        this.maxSlippage = Objects.requireNonNull(maxSlippage, "maxSlippage");
    }

    /**
     * Fills accumulated over partially filled, cancelled attempts are folded into the returned
     * order: its amount is the requested quantity, its filled quantity the total over all attempts
     * and its average the volume-weighted fill price.
     *
     * @throws OrderExecutionFailedException when retries run out; carries the quantity filled so far
     */
    @Override
    public Order executeMarketOrder(OrderSide side, String pair, BigDecimal quantity, BigDecimal price) {
        BigDecimal remainingQuantity = quantity;
        BigDecimal attemptPrice = price;
        BigDecimal filledSoFar = BigDecimal.ZERO;
        BigDecimal filledValue = BigDecimal.ZERO;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                JSONObject raw = exchangeService.placeOrder(pair, OrderType.MARKET, side, remainingQuantity, attemptPrice);
                Order order = OrderResponseParser.parse(raw);

                if (order.getStatus() == OrderStatus.CLOSED) {
                    if (filledSoFar.signum() == 0) {
                        return order;
                    }
                    BigDecimal filled = order.getFilled() != null ? order.getFilled() : remainingQuantity;
                    return aggregate(order, quantity, filledSoFar.add(filled),
                            filledValue.add(filled.multiply(order.getExecutionPrice(), MC)));
                }
                if (order.getStatus() == OrderStatus.OPEN) {
                    handlePartialFill(order, pair);
                    BigDecimal filled = order.getFilled() != null ? order.getFilled() : BigDecimal.ZERO;
                    if (filled.signum() > 0) {
                        filledSoFar = filledSoFar.add(filled);
                        filledValue = filledValue.add(filled.multiply(order.getExecutionPrice(), MC));
                    }
                    remainingQuantity = remainingQuantity.subtract(filled);
                    if (remainingQuantity.signum() <= 0) {
                        log.info("Order {} filled the full quantity before it could be cancelled", order.getIdentifier());
                        return aggregate(order, quantity, filledSoFar, filledValue);
                    }
                } else {
                    log.warn("Market {} order on {} returned status {}, retrying", side, pair, order.getStatus());
                }

                attemptPrice = adjustPrice(side, price, attempt + 1);
                log.info("Retrying order. Attempt {}/{} for {} {} at {}.", attempt + 1, maxRetries, remainingQuantity, pair, attemptPrice);
            } catch (RuntimeException e) {
                log.error("Attempt {} failed with error: {}", attempt + 1, e.getMessage());
            }
            if (attempt < maxRetries - 1 && !sleepQuietly()) {
                throw executionFailed("Interrupted while retrying Market order.",
                        side, pair, quantity, attemptPrice, filledSoFar, filledValue);
            }
        }

        throw executionFailed("Failed to execute Market order after maximum retries.",
                side, pair, quantity, attemptPrice, filledSoFar, filledValue);
    }

    @Override
    public Order executeLimitOrder(OrderSide side, String pair, BigDecimal quantity, BigDecimal price) {
        try {
            return OrderResponseParser.parse(exchangeService.placeOrder(pair, OrderType.LIMIT, side, quantity, price));
        } catch (DataFetchException e) {
            log.error("DataFetchException during order execution for {} - {}", pair, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error in executeLimitOrder: {}", e.getMessage());
            throw new OrderExecutionFailedException("Failed to execute Limit order on " + pair + ": " + e.getMessage(),
                    side, OrderType.LIMIT, pair, quantity, price, e);
        }
    }

    @Override
    public Order getOrder(String orderId, String pair) {
        try {
            return OrderResponseParser.parse(exchangeService.fetchOrder(orderId, pair));
        } catch (DataFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DataFetchException("Unexpected error during order status retrieval: " + e.getMessage(), e);
        }
    }

    /**
     * Price for the given retry: widened against the trader by {@code maxSlippage / maxRetries x retry}.
     */
    BigDecimal adjustPrice(OrderSide side, BigDecimal originalPrice, int retry) {
        BigDecimal adjustment = maxSlippage
                .divide(BigDecimal.valueOf(maxRetries), MC)
                .multiply(BigDecimal.valueOf(retry), MC);
        BigDecimal factor = side == OrderSide.BUY
                ? BigDecimal.ONE.add(adjustment)
                : BigDecimal.ONE.subtract(adjustment);
        return originalPrice.multiply(factor, MC);
    }

    private void handlePartialFill(Order order, String pair) {
        log.info("Order {} partially filled with {}. Attempting to cancel and retry the remaining quantity.",
                order.getIdentifier(), order.getFilled());
        if (!retryCancelOrder(order.getIdentifier(), pair)) {
            log.error("Unable to cancel partially filled order {} after {} attempts, fill of {} is unresolved",
                    order.getIdentifier(), maxRetries, order.getFilled());
        }
    }

    boolean retryCancelOrder(String orderId, String pair) {
        for (int cancelAttempt = 0; cancelAttempt < maxRetries; cancelAttempt++) {
            try {
                JSONObject result = exchangeService.cancelOrder(orderId, pair);
                if (OrderStatus.fromExchangeValue(result.optString("status", null)) == OrderStatus.CANCELED) {
                    log.info("Successfully canceled order {}.", orderId);
                    return true;
                }
                log.warn("Cancel attempt {} for order {} failed.", cancelAttempt + 1, orderId);
            } catch (RuntimeException e) {
                log.warn("Error during cancel attempt {} for order {}: {}", cancelAttempt + 1, orderId, e.getMessage());
            }
            if (cancelAttempt < maxRetries - 1 && !sleepQuietly()) {
                return false;
            }
        }
        return false;
    }

    private static Order aggregate(Order last, BigDecimal quantity, BigDecimal filled, BigDecimal filledValue) {
        return last.toBuilder()
                .status(OrderStatus.CLOSED)
                .amount(quantity)
                .filled(filled)
                .remaining(BigDecimal.ZERO)
                .average(filledValue.divide(filled, MC))
                .cost(filledValue)
                .build();
    }

    private static OrderExecutionFailedException executionFailed(String message, OrderSide side, String pair,
                                                                 BigDecimal quantity, BigDecimal price,
                                                                 BigDecimal filled, BigDecimal filledValue) {
        if (filled.signum() > 0) {
            log.warn("Market {} order on {} failed with {} of {} already filled", side, pair, filled, quantity);
            return new OrderExecutionFailedException(message, side, OrderType.MARKET, pair, quantity, price,
                    filled, filledValue.divide(filled, MC));
        }
        return new OrderExecutionFailedException(message, side, OrderType.MARKET, pair, quantity, price);
    }

    private boolean sleepQuietly() {
        if (retryDelay.isZero() || retryDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
