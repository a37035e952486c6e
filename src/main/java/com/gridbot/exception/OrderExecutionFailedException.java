package com.gridbot.exception;

import com.gridbot.model.OrderSide;
import com.gridbot.model.OrderType;

import java.math.BigDecimal;

/**
 * Raised when an order could not be placed, typically after all retries are exhausted.
 * Keeps the order parameters for diagnostics and notifications, and whatever quantity was filled
 * by earlier attempts before the failure.
 */
public class OrderExecutionFailedException extends GridBotException {

    private final OrderSide side;
    private final OrderType orderType;
    private final String pair;
    private final BigDecimal quantity;
    private final BigDecimal price;
    private final BigDecimal filledQuantity;
    private final BigDecimal averageFillPrice;

    public OrderExecutionFailedException(String message, OrderSide side, OrderType orderType,
                                         String pair, BigDecimal quantity, BigDecimal price) {
        this(message, side, orderType, pair, quantity, price, null);
    }

    public OrderExecutionFailedException(String message, OrderSide side, OrderType orderType,
                                         String pair, BigDecimal quantity, BigDecimal price, Throwable cause) {
        this(message, side, orderType, pair, quantity, price, BigDecimal.ZERO, null, cause);
    }

    /**
     * @param filledQuantity   quantity filled before the failure
     * @param averageFillPrice average price of that quantity, {@code null} when nothing was filled
     */
    public OrderExecutionFailedException(String message, OrderSide side, OrderType orderType,
                                         String pair, BigDecimal quantity, BigDecimal price,
                                         BigDecimal filledQuantity, BigDecimal averageFillPrice) {
        this(message, side, orderType, pair, quantity, price, filledQuantity, averageFillPrice, null);
    }

    private OrderExecutionFailedException(String message, OrderSide side, OrderType orderType,
                                          String pair, BigDecimal quantity, BigDecimal price,
                                          BigDecimal filledQuantity, BigDecimal averageFillPrice, Throwable cause) {
        super(ErrorCode.ORDER_EXECUTION_FAILED, message, cause);
        this.side = side;
        this.orderType = orderType;
        this.pair = pair;
        this.quantity = quantity;
        this.price = price;
        this.filledQuantity = filledQuantity != null ? filledQuantity : BigDecimal.ZERO;
        this.averageFillPrice = averageFillPrice;
    }

    public OrderSide getSide() {
        return side;
    }

    public OrderType getOrderType() {
        return orderType;
    }

    public String getPair() {
        return pair;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public BigDecimal getFilledQuantity() {
        return filledQuantity;
    }

    public BigDecimal getAverageFillPrice() {
        return averageFillPrice;
    }

    public boolean isPartiallyFilled() {
        return filledQuantity.signum() > 0;
    }
}
