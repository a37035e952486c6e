package com.gridbot.exception;

/**
 * Raised when a grid level is not in the state required for the requested order side.
 */
public class GridLevelNotReadyException extends GridBotException {

    public GridLevelNotReadyException(String message) {
        super(ErrorCode.GRID_LEVEL_NOT_READY, message);
    }

    public GridLevelNotReadyException(String message, Throwable cause) {
        super(ErrorCode.GRID_LEVEL_NOT_READY, message, cause);
    }
}
