package com.gridbot.service.order;

import com.gridbot.grid.GridLevel;
import com.gridbot.model.Order;
import com.gridbot.model.OrderSide;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Index of every order the bot has placed.
 * <p>
 * Grid orders are kept in the buy or sell list with their {@link GridLevel}; take-profit and
 * stop-loss exits are kept in the non-grid list without one. An order is only ever in one list.
 */
@Slf4j
public class OrderBook {

    private final List<Order> buyOrders = new CopyOnWriteArrayList<>();
    private final List<Order> sellOrders = new CopyOnWriteArrayList<>();
    private final List<Order> nonGridOrders = new CopyOnWriteArrayList<>();
    private final Map<Order, GridLevel> orderToGridMap = new ConcurrentHashMap<>();

    /**
     * @param gridLevel level the order was placed for, or null for a non-grid order
     */
    public void addOrder(Order order, GridLevel gridLevel) {
        if (gridLevel == null) {
            addNonGridOrder(order);
            return;
        }
        if (orderToGridMap.putIfAbsent(order, gridLevel) != null) {
            log.warn("Order {} is already tracked, ignoring duplicate add", order.getIdentifier());
            return;
        }
        if (order.getSide() == OrderSide.BUY) {
            buyOrders.add(order);
        } else {
            sellOrders.add(order);
        }
    }

    public void addNonGridOrder(Order order) {
        nonGridOrders.add(order);
    }

    public List<Order> getAllBuyOrders() {
        return List.copyOf(buyOrders);
    }

    public List<Order> getAllSellOrders() {
        return List.copyOf(sellOrders);
    }

    public List<Order> getNonGridOrders() {
        return List.copyOf(nonGridOrders);
    }

    public List<Order> getOpenOrders() {
        return allOrders().filter(Order::isOpen).toList();
    }

    public List<Order> getCompletedOrders() {
        return allOrders().filter(Order::isFilled).toList();
    }

    /**
     * Grid buy orders with their level, in placement order.
     */
    public List<Map.Entry<Order, GridLevel>> getBuyOrdersWithGrid() {
        return withGrid(buyOrders);
    }

    public List<Map.Entry<Order, GridLevel>> getSellOrdersWithGrid() {
        return withGrid(sellOrders);
    }

    public Optional<GridLevel> getGridLevel(Order order) {
        return Optional.ofNullable(orderToGridMap.get(order));
    }

    public Optional<Order> findOrder(String orderId) {
        return allOrders().filter(byId(orderId)).findFirst();
    }

    /**
     * Apply a freshly fetched remote view to the tracked order with the same id.
     * Terminal orders are never changed.
     *
     * @return true when the local order was updated
     */
    public boolean updateOrderStatus(String orderId, Order remoteOrder) {
        Optional<Order> local = findOrder(orderId);
        if (local.isEmpty()) {
            log.warn("No order found with ID {}, status update to {} ignored", orderId, remoteOrder.getStatus());
            return false;
        }
        Order order = local.get();
        if (!order.applyRemoteUpdate(remoteOrder)) {
            log.debug("Order {} is already {}, ignoring remote status {}", orderId, order.getStatus(), remoteOrder.getStatus());
            return false;
        }
        return true;
    }

    public int size() {
        return buyOrders.size() + sellOrders.size() + nonGridOrders.size();
    }

    private Stream<Order> allOrders() {
        return Stream.of(buyOrders, sellOrders, nonGridOrders).flatMap(List::stream);
    }

    private List<Map.Entry<Order, GridLevel>> withGrid(List<Order> orders) {
        List<Map.Entry<Order, GridLevel>> result = new ArrayList<>(orders.size());
        for (Order order : orders) {
            GridLevel level = orderToGridMap.get(order);
            if (level != null) {
                result.add(Map.entry(order, level));
            }
        }
        return result;
    }

    private static Predicate<Order> byId(String orderId) {
        return order -> order.getIdentifier().equals(orderId);
    }
}
