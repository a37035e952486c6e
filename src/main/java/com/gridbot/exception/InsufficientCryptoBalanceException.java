package com.gridbot.exception;

/**
 * Raised when available crypto cannot cover a sell reservation.
 */
public class InsufficientCryptoBalanceException extends GridBotException {

    public InsufficientCryptoBalanceException(String message) {
        super(ErrorCode.INSUFFICIENT_CRYPTO_BALANCE, message);
    }

    public InsufficientCryptoBalanceException(String message, Throwable cause) {
        super(ErrorCode.INSUFFICIENT_CRYPTO_BALANCE, message, cause);
    }
}
