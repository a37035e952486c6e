package com.gridbot.model;

/**
 * Lifecycle state of a single grid level.
 */
public enum GridCycleState {
    /**
     * Level accepts a buy order
     */
    READY_TO_BUY,

    /**
     * Level holds an unmatched buy (buy levels) or accepts sells (sell levels)
     */
    READY_TO_SELL,

    /**
     * Level was closed out by a take-profit or stop-loss liquidation and takes no further orders
     */
    COMPLETED,

    /**
     * Reserved for hedged buy+sell levels. Never entered by the current state machine.
     */
    READY_TO_BUY_SELL
}
