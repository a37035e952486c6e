package com.gridbot.notification;

import com.gridbot.event.EventBus;
import com.gridbot.event.EventType;
import com.gridbot.model.TradingMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class NotificationHandlerTest {

    @Mock
    private NotificationChannel channel;

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        try (AutoCloseable mocks = MockitoAnnotations.openMocks(this)) {
            when(channel.getName()).thenReturn("mock");
            eventBus = new EventBus(Runnable::run);
        } catch (Exception e) {
            throw new RuntimeException("Failed to initialize mocks", e);
        }
    }

    private NotificationHandler handler(Executor executor, Duration timeout, TradingMode mode) {
        return new NotificationHandler(eventBus, List.of(channel), executor, timeout, true, mode);
    }

    @Test
    void testSendNotificationRendersTemplate() throws Exception {
        NotificationHandler handler = handler(Runnable::run, Duration.ofSeconds(1), TradingMode.LIVE);

        handler.sendNotificationAsync(NotificationType.ORDER_PLACED, Map.of("orderDetails", "x")).join();

        verify(channel).send("Order Placement Successful", "Order placed: x");
    }

    @Test
    void testMissingPlaceholderRendersNotAvailable() {
        String message = NotificationHandler.formatMessage(NotificationType.ORDER_EXECUTION_FAILED,
                Map.of("orderType", "MARKET", "orderSide", "BUY", "pair", "SOL/USDT", "quantity", "1"));

        assertEquals("Failed to execute MARKET BUY order for SOL/USDT (quantity 1 @ N/A, filled N/A): N/A", message);
    }

    @Test
    void testDisabledInBacktestMode() throws Exception {
        NotificationHandler handler = handler(Runnable::run, Duration.ofSeconds(1), TradingMode.BACKTEST);

        handler.sendNotification(NotificationType.ERROR_OCCURRED, Map.of("errorDetails", "boom"));

        assertFalse(handler.isEnabled());
        assertEquals(0, eventBus.getSubscriberCount(EventType.ORDER_COMPLETED));
        verify(channel, never()).send(anyString(), anyString());
    }

    @Test
    void testDisabledWithoutChannels() {
        NotificationHandler handler = new NotificationHandler(eventBus, List.of(), Runnable::run,
                Duration.ofSeconds(1), true, TradingMode.LIVE);

        assertFalse(handler.isEnabled());
    }

    @Test
    void testChannelFailureIsNotPropagated() throws Exception {
        // Given
        doThrow(new Exception("channel down")).when(channel).send(anyString(), anyString());
        NotificationChannel healthy = mock(NotificationChannel.class);
        NotificationHandler handler = new NotificationHandler(eventBus, List.of(channel, healthy), Runnable::run,
                Duration.ofSeconds(1), true, TradingMode.LIVE);

        // When
        assertDoesNotThrow(() -> handler.sendNotification(NotificationType.ERROR_OCCURRED, Map.of("errorDetails", "boom")));

        // Then: the other channel still receives it
        verify(healthy).send("Error Occurred", "An error occurred in the trading bot: boom");
    }

    @Test
    void testSlowDeliveryTimesOutWithoutFailing() throws Exception {
        Executor neverRuns = task -> { };
        NotificationHandler handler = handler(neverRuns, Duration.ofMillis(50), TradingMode.LIVE);

        CompletableFuture<Void> delivery = handler.sendNotificationAsync(NotificationType.ORDER_PLACED, Map.of("orderDetails", "x"));

        assertDoesNotThrow(() -> delivery.join());
        assertFalse(delivery.isCompletedExceptionally());
        verify(channel, never()).send(anyString(), anyString());
    }
}
