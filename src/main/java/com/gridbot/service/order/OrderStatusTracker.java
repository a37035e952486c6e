package com.gridbot.service.order;

import com.gridbot.event.EventBus;
import com.gridbot.event.EventType;
import com.gridbot.exception.InvalidOrderStatusException;
import com.gridbot.model.Order;
import com.gridbot.model.OrderStatus;
import com.gridbot.service.execution.OrderExecutionStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Polls the exchange for every open order and publishes completion and cancellation events.
 *
 * <h2>Cycle</h2>
 * <ol>
 *   <li>One status query per open order, all running concurrently on the query executor</li>
 *   <li>Wait for the whole batch; a failed query only affects its own order</li>
 *   <li>Apply the results one by one: CLOSED publishes {@link EventType#ORDER_COMPLETED},
 *       CANCELED publishes {@link EventType#ORDER_CANCELLED}, both on the polling thread</li>
 * </ol>
 * {@link #stopTracking()} cancels the schedule and pending queries and waits for a running cycle,
 * so nothing is applied after it returns.
 */
@Slf4j
public class OrderStatusTracker {

    private final OrderBook orderBook;
    private final OrderExecutionStrategy orderExecutionStrategy;
    private final EventBus eventBus;
    private final TaskScheduler taskScheduler;
    private final Executor queryExecutor;
    private final Duration pollingInterval;
    private final String tradingPair;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final Set<CompletableFuture<Order>> inFlight = ConcurrentHashMap.newKeySet();
    private ScheduledFuture<?> scheduledTask;
    private volatile boolean stopRequested;

    public OrderStatusTracker(OrderBook orderBook, OrderExecutionStrategy orderExecutionStrategy, EventBus eventBus,
                              TaskScheduler taskScheduler, Executor queryExecutor, Duration pollingInterval,
                              String tradingPair) {
        this.orderBook = orderBook;
        this.orderExecutionStrategy = orderExecutionStrategy;
        this.eventBus = eventBus;
        this.taskScheduler = taskScheduler;
        this.queryExecutor = queryExecutor;
        this.pollingInterval = pollingInterval;
        this.tradingPair = tradingPair;
    }

    public synchronized void startTracking() {
        if (scheduledTask != null && !scheduledTask.isDone()) {
            log.warn("OrderStatusTracker is already running.");
            return;
        }
        stopRequested = false;
        scheduledTask = taskScheduler.scheduleWithFixedDelay(this::trackOpenOrders, pollingInterval);
        log.info("OrderStatusTracker has started tracking open orders every {}.", pollingInterval);
    }

    public void stopTracking() {
        ScheduledFuture<?> task;
        synchronized (this) {
            stopRequested = true;
            task = scheduledTask;
            scheduledTask = null;
        }
        if (task != null) {
            task.cancel(false);
        }
        inFlight.forEach(query -> query.cancel(true));

        // wait for a cycle that is still applying results
        cycleLock.lock();
        try {
            log.info("OrderStatusTracker has stopped tracking open orders.");
        } finally {
            cycleLock.unlock();
        }
    }

    public synchronized boolean isTracking() {
        return scheduledTask != null && !scheduledTask.isDone();
    }

    /**
     * One polling cycle. Never throws, so the schedule keeps running.
     */
    void trackOpenOrders() {
        cycleLock.lock();
        try {
            if (!stopRequested) {
                processOpenOrders();
            }
        } catch (Exception e) {
            log.error("Error during order tracking: {}", e.getMessage(), e);
        } finally {
            cycleLock.unlock();
        }
    }

    private void processOpenOrders() {
        List<Order> openOrders = orderBook.getOpenOrders();
        if (openOrders.isEmpty()) {
            return;
        }

        Map<Order, CompletableFuture<Order>> queries = new LinkedHashMap<>();
        for (Order localOrder : openOrders) {
            queries.put(localOrder, queryRemoteOrder(localOrder));
        }
        CompletableFuture.allOf(queries.values().toArray(CompletableFuture[]::new))
                .exceptionally(error -> null)
                .join();

        for (Map.Entry<Order, CompletableFuture<Order>> query : queries.entrySet()) {
            if (stopRequested) {
                log.info("Tracking stopped, discarding remaining status results of this cycle");
                return;
            }
            Order localOrder = query.getKey();
            try {
                handleOrderStatusChange(localOrder, query.getValue().join());
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Failed to query remote order with identifier {}: {}", localOrder.getIdentifier(), cause.getMessage());
            } catch (InvalidOrderStatusException e) {
                log.error("Invalid status for order {}: {}", localOrder.getIdentifier(), e.getMessage());
            } catch (Exception e) {
                log.error("Error while processing status of order {}", localOrder.getIdentifier(), e);
            }
        }
    }

    private CompletableFuture<Order> queryRemoteOrder(Order localOrder) {
        CompletableFuture<Order> query = CompletableFuture.supplyAsync(
                () -> orderExecutionStrategy.getOrder(localOrder.getIdentifier(), tradingPair), queryExecutor);
        inFlight.add(query);
        query.whenComplete((result, error) -> inFlight.remove(query));
        return query;
    }

    /**
     * Apply a remote view to the locally tracked order and publish the matching event.
     *
     * Statuses other than OPEN, CLOSED and CANCELED are logged and leave the order untouched.
     *
     * @throws InvalidOrderStatusException when the remote status is missing or {@code unknown}
     */
    void handleOrderStatusChange(Order localOrder, Order remoteOrder) {
        OrderStatus status = remoteOrder.getStatus() != null ? remoteOrder.getStatus() : OrderStatus.UNKNOWN;
        switch (status) {
            case UNKNOWN -> {
                log.error("Missing or unknown 'status' in remote order object: {}", remoteOrder);
                throw new InvalidOrderStatusException(
                        "Order " + localOrder.getIdentifier() + " has no valid status in the exchange response");
            }
            case CLOSED -> {
                if (orderBook.updateOrderStatus(localOrder.getIdentifier(), remoteOrder)) {
                    log.info("Order {} completed.", localOrder.getIdentifier());
                    eventBus.publishSync(EventType.ORDER_COMPLETED, localOrder);
                }
            }
            case CANCELED -> {
                if (orderBook.updateOrderStatus(localOrder.getIdentifier(), remoteOrder)) {
                    eventBus.publishSync(EventType.ORDER_CANCELLED, localOrder);
                    log.warn("Order {} was canceled.", localOrder.getIdentifier());
                }
            }
            case OPEN -> {
                orderBook.updateOrderStatus(localOrder.getIdentifier(), remoteOrder);
                if (remoteOrder.getFilled() != null && remoteOrder.getFilled().signum() > 0) {
                    log.info("Order {} partially filled. Filled: {}, Remaining: {}.",
                            localOrder.getIdentifier(), remoteOrder.getFilled(), remoteOrder.getRemaining());
                } else {
                    log.debug("Order {} is still open. No fills yet.", localOrder.getIdentifier());
                }
            }
            default -> log.warn("Unhandled order status '{}' for order {}.",
                    remoteOrder.getRawStatus() != null ? remoteOrder.getRawStatus() : status, localOrder.getIdentifier());
        }
    }
}
