package com.gridbot.service.order;

import com.gridbot.event.EventBus;
import com.gridbot.event.EventType;
import com.gridbot.exception.DataFetchException;
import com.gridbot.exception.InvalidOrderStatusException;
import com.gridbot.model.Order;
import com.gridbot.model.OrderSide;
import com.gridbot.model.OrderStatus;
import com.gridbot.model.OrderType;
import com.gridbot.service.execution.OrderExecutionStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OrderStatusTrackerTest {

    private static final String PAIR = "SOL/USDT";

    @Mock
    private OrderExecutionStrategy executionStrategy;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> scheduledFuture;

    private OrderBook orderBook;
    private OrderStatusTracker tracker;
    private final List<Object> completed = new CopyOnWriteArrayList<>();
    private final List<Object> cancelled = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        try (AutoCloseable mocks = MockitoAnnotations.openMocks(this)) {
            EventBus eventBus = new EventBus(Runnable::run);
            eventBus.subscribe(EventType.ORDER_COMPLETED, completed::add);
            eventBus.subscribe(EventType.ORDER_CANCELLED, cancelled::add);
            orderBook = new OrderBook();
            tracker = new OrderStatusTracker(orderBook, executionStrategy, eventBus, taskScheduler,
                    Runnable::run, Duration.ofSeconds(15), PAIR);
        } catch (Exception e) {
            throw new RuntimeException("Failed to initialize mocks", e);
        }
    }

    @Test
    void testClosedOrderIsUpdatedAndPublishedOnce() {
        // Given
        Order local = open("o-1");
        orderBook.addNonGridOrder(local);
        when(executionStrategy.getOrder("o-1", PAIR)).thenReturn(remote("o-1", OrderStatus.CLOSED, "1"));

        // When: two polling cycles
        tracker.trackOpenOrders();
        tracker.trackOpenOrders();

        // Then: the closed order is no longer polled and the event fired once
        assertEquals(OrderStatus.CLOSED, local.getStatus());
        assertEquals(List.of(local), completed);
        verify(executionStrategy, times(1)).getOrder("o-1", PAIR);
    }

    @Test
    void testTerminalOrderIgnoresLaterRemoteStatus() {
        Order local = open("o-1");
        orderBook.addNonGridOrder(local);
        tracker.handleOrderStatusChange(local, remote("o-1", OrderStatus.CLOSED, "1"));

        tracker.handleOrderStatusChange(local, remote("o-1", OrderStatus.CANCELED, "0"));
        tracker.handleOrderStatusChange(local, remote("o-1", OrderStatus.OPEN, "0"));

        assertEquals(OrderStatus.CLOSED, local.getStatus());
        assertEquals(0, BigDecimal.ONE.compareTo(local.getFilled()));
        assertEquals(1, completed.size());
        assertTrue(cancelled.isEmpty());
    }

    @Test
    void testOneFailedQueryDoesNotAbortTheBatch() {
        // Given: two open orders, the first query fails
        Order failing = open("o-1");
        Order closing = open("o-2");
        orderBook.addNonGridOrder(failing);
        orderBook.addNonGridOrder(closing);
        when(executionStrategy.getOrder("o-1", PAIR)).thenThrow(new DataFetchException("timeout"));
        when(executionStrategy.getOrder("o-2", PAIR)).thenReturn(remote("o-2", OrderStatus.CLOSED, "1"));

        // When
        assertDoesNotThrow(() -> tracker.trackOpenOrders());

        // Then
        assertEquals(OrderStatus.OPEN, failing.getStatus());
        assertEquals(OrderStatus.CLOSED, closing.getStatus());
        assertEquals(List.of(closing), completed);
    }

    @Test
    void testCancelledOrderPublishesCancellation() {
        Order local = open("o-1");
        orderBook.addNonGridOrder(local);
        when(executionStrategy.getOrder("o-1", PAIR)).thenReturn(remote("o-1", OrderStatus.CANCELED, "0"));

        tracker.trackOpenOrders();

        assertEquals(OrderStatus.CANCELED, local.getStatus());
        assertEquals(List.of(local), cancelled);
        assertTrue(completed.isEmpty());
    }

    @Test
    void testPartialFillIsRecordedWithoutEvent() {
        Order local = open("o-1");
        orderBook.addNonGridOrder(local);
        when(executionStrategy.getOrder("o-1", PAIR)).thenReturn(remote("o-1", OrderStatus.OPEN, "0.4"));

        tracker.trackOpenOrders();

        assertEquals(OrderStatus.OPEN, local.getStatus());
        assertEquals(0, new BigDecimal("0.4").compareTo(local.getFilled()));
        assertTrue(completed.isEmpty());
        assertTrue(cancelled.isEmpty());
    }

    @Test
    void testUnknownRemoteStatusIsAnError() {
        Order local = open("o-1");
        orderBook.addNonGridOrder(local);
        Order unknown = remote("o-1", OrderStatus.UNKNOWN, "0");

        assertThrows(InvalidOrderStatusException.class, () -> tracker.handleOrderStatusChange(local, unknown));

        // The polling cycle logs it and carries on
        when(executionStrategy.getOrder("o-1", PAIR)).thenReturn(unknown);
        assertDoesNotThrow(() -> tracker.trackOpenOrders());
        assertEquals(OrderStatus.OPEN, local.getStatus());
        assertTrue(completed.isEmpty());
    }

    @Test
    void testUnrecognizedRemoteStatusLeavesOrderUntouched() {
        // Given: the exchange reports a status the engine has no mapping for
        Order local = open("o-1");
        orderBook.addNonGridOrder(local);
        Order pending = remote("o-1", OrderStatus.UNRECOGNIZED, "0.2").toBuilder().rawStatus("pending_new").build();

        // When
        assertDoesNotThrow(() -> tracker.handleOrderStatusChange(local, pending));

        // Then: no event and no state change
        assertEquals(OrderStatus.OPEN, local.getStatus());
        assertEquals(0, BigDecimal.ZERO.compareTo(local.getFilled()));
        assertTrue(completed.isEmpty());
        assertTrue(cancelled.isEmpty());
    }

    @Test
    void testCancellationReachesSubscribersBeforeReturning() {
        // Given: a dispatcher that never runs queued work
        EventBus eventBus = new EventBus(task -> { });
        List<Object> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe(EventType.ORDER_CANCELLED, received::add);
        OrderStatusTracker syncTracker = new OrderStatusTracker(orderBook, executionStrategy, eventBus, taskScheduler,
                Runnable::run, Duration.ofSeconds(15), PAIR);
        Order local = open("o-1");
        orderBook.addNonGridOrder(local);

        // When
        syncTracker.handleOrderStatusChange(local, remote("o-1", OrderStatus.CANCELED, "0"));

        // Then
        assertEquals(List.of(local), received);
    }

    @Test
    void testStartAndStopTracking() {
        // Given
        doReturn(scheduledFuture).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        orderBook.addNonGridOrder(open("o-1"));

        // When
        tracker.startTracking();
        tracker.startTracking();

        // Then: scheduled once at the polling interval
        verify(taskScheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofSeconds(15)));
        assertTrue(tracker.isTracking());

        // When: stopped, a late cycle does nothing
        tracker.stopTracking();
        tracker.trackOpenOrders();

        verify(scheduledFuture).cancel(false);
        assertFalse(tracker.isTracking());
        verifyNoInteractions(executionStrategy);
    }

    private static Order open(String id) {
        return Order.builder()
                .identifier(id)
                .side(OrderSide.BUY)
                .orderType(OrderType.LIMIT)
                .symbol(PAIR)
                .price(new BigDecimal("100"))
                .amount(BigDecimal.ONE)
                .filled(BigDecimal.ZERO)
                .remaining(BigDecimal.ONE)
                .status(OrderStatus.OPEN)
                .build();
    }

    private static Order remote(String id, OrderStatus status, String filled) {
        BigDecimal filledAmount = new BigDecimal(filled);
        return Order.builder()
                .identifier(id)
                .side(OrderSide.BUY)
                .orderType(OrderType.LIMIT)
                .symbol(PAIR)
                .price(new BigDecimal("100"))
                .amount(BigDecimal.ONE)
                .filled(filledAmount)
                .remaining(BigDecimal.ONE.subtract(filledAmount))
                .status(status)
                .build();
    }
}
