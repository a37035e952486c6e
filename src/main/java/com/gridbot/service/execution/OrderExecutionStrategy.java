package com.gridbot.service.execution;

import com.gridbot.model.Order;
import com.gridbot.model.OrderSide;

import java.math.BigDecimal;

/**
 * Turns an order intent into an order placed on an exchange (or a simulated one).
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link LiveOrderExecutionStrategy} - real exchange adapter, retries market orders with
 *       widening slippage</li>
 *   <li>{@link BacktestOrderExecutionStrategy} - in-memory fills for historical replay</li>
 * </ul>
 */
public interface OrderExecutionStrategy {

    /**
     * @throws com.gridbot.exception.OrderExecutionFailedException when the order could not be placed
     */
    Order executeMarketOrder(OrderSide side, String pair, BigDecimal quantity, BigDecimal price);

    /**
     * @throws com.gridbot.exception.DataFetchException             on exchange transport failure
     * @throws com.gridbot.exception.OrderExecutionFailedException for any other placement failure
     */
    Order executeLimitOrder(OrderSide side, String pair, BigDecimal quantity, BigDecimal price);

    /**
     * Current remote view of an order.
     *
     * @throws com.gridbot.exception.DataFetchException when the order cannot be fetched
     */
    Order getOrder(String orderId, String pair);
}
