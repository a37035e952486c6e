package com.gridbot.service.execution;

import com.gridbot.exception.DataFetchException;
import com.gridbot.model.Order;
import com.gridbot.model.OrderSide;
import com.gridbot.model.OrderStatus;
import com.gridbot.model.OrderType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory execution for historical replay.
 * <p>
 * Market orders fill completely at the requested price and come back CLOSED; limit orders come back
 * OPEN with nothing filled. No retries, no exchange calls.
 */
@Slf4j
public class BacktestOrderExecutionStrategy implements OrderExecutionStrategy {

    private static final String ORDER_ID_PREFIX = "backtest-";

    private final AtomicLong orderSequence = new AtomicLong();
    private final Map<String, Order> placedOrders = new ConcurrentHashMap<>();

    @Override
    public Order executeMarketOrder(OrderSide side, String pair, BigDecimal quantity, BigDecimal price) {
        Order order = Order.builder()
                .identifier(nextOrderId())
                .orderType(OrderType.MARKET)
                .side(side)
                .symbol(pair)
                .price(price)
                .amount(quantity)
                .filled(quantity)
                .remaining(BigDecimal.ZERO)
                .average(price)
                .cost(quantity.multiply(price, MathContext.DECIMAL64))
                .status(OrderStatus.CLOSED)
                .timestamp(System.currentTimeMillis())
                .build();
        placedOrders.put(order.getIdentifier(), order);
        log.debug("[BACKTEST] Filled market {} {} {} @ {}", side, quantity, pair, price);
        return order;
    }

    @Override
    public Order executeLimitOrder(OrderSide side, String pair, BigDecimal quantity, BigDecimal price) {
        Order order = Order.builder()
                .identifier(nextOrderId())
                .orderType(OrderType.LIMIT)
                .side(side)
                .symbol(pair)
                .price(price)
                .amount(quantity)
                .filled(BigDecimal.ZERO)
                .remaining(quantity)
                .status(OrderStatus.OPEN)
                .timestamp(System.currentTimeMillis())
                .build();
        placedOrders.put(order.getIdentifier(), order);
        log.debug("[BACKTEST] Placed limit {} {} {} @ {}", side, quantity, pair, price);
        return order;
    }

    @Override
    public Order getOrder(String orderId, String pair) {
        Order order = placedOrders.get(orderId);
        if (order == null) {
            throw new DataFetchException("Unknown backtest order: " + orderId);
        }
        return order;
    }

    private String nextOrderId() {
        return ORDER_ID_PREFIX + orderSequence.incrementAndGet();
    }
}
