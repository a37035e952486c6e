package com.gridbot.model;

/**
 * Reason for liquidating the whole crypto position outside the grid.
 */
public enum ExitTrigger {
    TAKE_PROFIT,
    STOP_LOSS
}
