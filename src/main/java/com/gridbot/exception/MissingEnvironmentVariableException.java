package com.gridbot.exception;

/**
 * Raised when a required environment variable, such as an exchange API key, is not set.
 */
public class MissingEnvironmentVariableException extends GridBotException {

    public MissingEnvironmentVariableException(String message) {
        super(ErrorCode.MISSING_ENVIRONMENT_VARIABLE, message);
    }
}
