package com.gridbot.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Publish/subscribe hub for order and bot lifecycle events.
 * <p>
 * Subscriber failures are logged and never reach the publisher or sibling subscribers.
 *
 * <h2>Dispatch</h2>
 * <ul>
 *   <li>{@link #publish} fans out to every subscriber concurrently: sync handlers run on the
 *       dispatch executor, async handlers are started and awaited through their stage. The returned
 *       future completes once every subscriber has finished.</li>
 *   <li>{@link #publishSync} runs sync handlers inline on the caller's thread and hands async
 *       handlers to the dispatch executor without waiting for them.</li>
 * </ul>
 */
@Slf4j
public class EventBus {

    private enum DispatchMode { SYNC, ASYNC }

    private record Subscription(EventHandler handler, DispatchMode mode) {
    }

    private final Map<EventType, List<Subscription>> subscribers = new ConcurrentHashMap<>();
    private final Executor dispatchExecutor;

    public EventBus(Executor dispatchExecutor) {
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
    }

    public void subscribe(EventType eventType, EventHandler.SyncHandler handler) {
        addSubscription(eventType, new Subscription(handler, DispatchMode.SYNC));
    }

    public void subscribeAsync(EventType eventType, EventHandler.AsyncHandler handler) {
        addSubscription(eventType, new Subscription(handler, DispatchMode.ASYNC));
    }

    private void addSubscription(EventType eventType, Subscription subscription) {
        Objects.requireNonNull(subscription.handler(), "handler");
        subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(subscription);
        log.info("{} callback subscribed to event: {}", subscription.mode(), eventType);
    }

    public void unsubscribe(EventType eventType, EventHandler handler) {
        List<Subscription> current = subscribers.get(eventType);
        if (current != null && current.removeIf(s -> s.handler() == handler)) {
            log.info("Callback unsubscribed from event: {}", eventType);
            if (current.isEmpty()) {
                subscribers.remove(eventType, current);
            }
        } else {
            log.warn("Attempted to unsubscribe non-existing callback from event: {}", eventType);
        }
    }

    public void clear(EventType eventType) {
        if (subscribers.remove(eventType) != null) {
            log.info("Cleared all subscribers for event: {}", eventType);
        } else {
            log.warn("Attempted to clear non-existing event type: {}", eventType);
        }
    }

    public void clear() {
        subscribers.clear();
        log.info("Cleared all subscribers for all events");
    }

    public int getSubscriberCount(EventType eventType) {
        List<Subscription> current = subscribers.get(eventType);
        return current == null ? 0 : current.size();
    }

    /**
     * Publish to all subscribers concurrently.
     *
     * @return future completing once every subscriber has finished; never completes exceptionally
     */
    public CompletableFuture<Void> publish(EventType eventType, Object data) {
        List<Subscription> current = subscribers.get(eventType);
        if (current == null || current.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("Publishing async event: {} with data: {}", eventType, data);

        CompletableFuture<?>[] invocations = current.stream()
                .map(subscription -> subscription.mode() == DispatchMode.ASYNC
                        ? invokeAsyncSafely(subscription, eventType, data)
                        : runOnDispatcher(() -> invokeSyncSafely(subscription, eventType, data), eventType))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(invocations);
    }

    /**
     * Publish from a non-async context. Sync subscribers have run when this returns;
     * async subscribers are scheduled but not awaited.
     */
    public void publishSync(EventType eventType, Object data) {
        List<Subscription> current = subscribers.get(eventType);
        if (current == null || current.isEmpty()) {
            return;
        }
        log.info("Publishing sync event: {} with data: {}", eventType, data);

        for (Subscription subscription : current) {
            if (subscription.mode() == DispatchMode.ASYNC) {
                runOnDispatcher(() -> invokeAsyncSafely(subscription, eventType, data), eventType);
            } else {
                invokeSyncSafely(subscription, eventType, data);
            }
        }
    }

    private CompletableFuture<Void> runOnDispatcher(Runnable task, EventType eventType) {
        try {
            return CompletableFuture.runAsync(task, dispatchExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Dispatch executor rejected subscriber for event {}: {}", eventType, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    private CompletableFuture<Void> invokeAsyncSafely(Subscription subscription, EventType eventType, Object data) {
        try {
            EventHandler.AsyncHandler handler = (EventHandler.AsyncHandler) subscription.handler();
            return handler.handle(data)
                    .toCompletableFuture()
                    .handle((ignored, error) -> {
                        if (error != null) {
                            log.error("Error in async subscriber callback for event {}", eventType, error);
                        }
                        return null;
                    });
        } catch (Exception e) {
            log.error("Error in async subscriber callback for event {}", eventType, e);
            return CompletableFuture.completedFuture(null);
        }
    }

    private void invokeSyncSafely(Subscription subscription, EventType eventType, Object data) {
        try {
            ((EventHandler.SyncHandler) subscription.handler()).handle(data);
        } catch (Exception e) {
            log.error("Error in sync subscriber callback for event {}", eventType, e);
        }
    }
}
