package com.gridbot.event;

import java.util.concurrent.CompletionStage;

/**
 * Subscriber callback. Exactly one of the two shapes is chosen when subscribing,
 * so the bus never has to inspect a callback at publish time.
 */
public interface EventHandler {

    /**
     * Runs to completion on the thread it is invoked on.
     */
    @FunctionalInterface
    interface SyncHandler extends EventHandler {
        void handle(Object data) throws Exception;
    }

    /**
     * Starts work and reports completion through the returned stage.
     */
    @FunctionalInterface
    interface AsyncHandler extends EventHandler {
        CompletionStage<Void> handle(Object data);
    }
}
