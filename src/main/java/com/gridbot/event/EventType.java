package com.gridbot.event;

/**
 * Lifecycle events carried by the {@link EventBus}.
 */
public enum EventType {
    /**
     * An order reached CLOSED. Payload: the local {@link com.gridbot.model.Order}.
     */
    ORDER_COMPLETED,

    /**
     * An order reached CANCELED. Payload: the local {@link com.gridbot.model.Order}.
     */
    ORDER_CANCELLED,

    /**
     * Request to start (or restart) the bot. Payload: reason string.
     */
    START_BOT,

    /**
     * Request to stop the bot. Payload: reason string.
     */
    STOP_BOT
}
