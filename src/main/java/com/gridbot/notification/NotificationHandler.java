package com.gridbot.notification;

import com.gridbot.event.EventBus;
import com.gridbot.event.EventType;
import com.gridbot.model.Order;
import com.gridbot.model.TradingMode;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders notification templates and delivers them through the configured channels.
 * <p>
 * Delivery runs on the injected executor and is bounded by a timeout. Failures are logged and
 * never reach the caller. Notifications are disabled in BACKTEST mode.
 */
@Slf4j
public class NotificationHandler {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");
    static final String MISSING_VALUE = "N/A";

    private final List<NotificationChannel> channels;
    private final Executor executor;
    private final Duration timeout;
    private final boolean enabled;

    public NotificationHandler(EventBus eventBus, List<NotificationChannel> channels, Executor executor,
                               Duration timeout, boolean enabled, TradingMode tradingMode) {
        this.channels = List.copyOf(channels);
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.enabled = enabled && !tradingMode.isBacktest() && !this.channels.isEmpty();

        if (this.enabled) {
            eventBus.subscribeAsync(EventType.ORDER_COMPLETED, this::onOrderCompleted);
            log.info("Notifications enabled on channels {}", this.channels.stream().map(NotificationChannel::getName).toList());
        } else {
            log.info("[{}] Notifications disabled", tradingMode);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Deliver on the caller's thread.
     */
    public void sendNotification(NotificationType type, Map<String, ?> fields) {
        if (!enabled) {
            return;
        }
        String body = formatMessage(type, fields);
        for (NotificationChannel channel : channels) {
            try {
                channel.send(type.getTitle(), body);
            } catch (Exception e) {
                log.error("Failed to send {} notification via {}: {}", type, channel.getName(), e.getMessage(), e);
            }
        }
    }

    /**
     * Deliver on the notification executor.
     *
     * @return future that completes when delivery finished or timed out; never completes exceptionally
     */
    public CompletableFuture<Void> sendNotificationAsync(NotificationType type, Map<String, ?> fields) {
        if (!enabled) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.runAsync(() -> sendNotification(type, fields), executor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(error -> {
                        log.error("Notification {} was not delivered within {}: {}", type, timeout, error.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Notification {} dropped, executor is saturated", type);
            return CompletableFuture.completedFuture(null);
        }
    }

    private CompletionStage<Void> onOrderCompleted(Object data) {
        if (data instanceof Order order) {
            return sendNotificationAsync(NotificationType.ORDER_FILLED, Map.of("orderDetails", order.toString()));
        }
        return CompletableFuture.completedFuture(null);
    }

    static String formatMessage(NotificationType type, Map<String, ?> fields) {
        Matcher matcher = PLACEHOLDER.matcher(type.getMessageTemplate());
        StringBuilder message = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            Object value = fields == null ? null : fields.get(key);
            if (value == null) {
                log.warn("Missing placeholder '{}' for notification {}", key, type);
            }
            matcher.appendReplacement(message, Matcher.quoteReplacement(value == null ? MISSING_VALUE : value.toString()));
        }
        matcher.appendTail(message);
        return message.toString();
    }
}
