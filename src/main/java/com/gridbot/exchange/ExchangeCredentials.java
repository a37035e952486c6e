package com.gridbot.exchange;

import com.gridbot.exception.MissingEnvironmentVariableException;

import java.util.Map;

/**
 * API credentials an exchange adapter authenticates with, read from the environment.
 */
public record ExchangeCredentials(String apiKey, String secretKey) {

    public static final String API_KEY_VARIABLE = "EXCHANGE_API_KEY";
    public static final String SECRET_KEY_VARIABLE = "EXCHANGE_SECRET_KEY";

    public static ExchangeCredentials fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * @throws MissingEnvironmentVariableException when either variable is unset or blank
     */
    public static ExchangeCredentials fromEnvironment(Map<String, String> environment) {
        return new ExchangeCredentials(require(environment, API_KEY_VARIABLE), require(environment, SECRET_KEY_VARIABLE));
    }

    private static String require(Map<String, String> environment, String name) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            throw new MissingEnvironmentVariableException("Environment variable " + name + " is not set");
        }
        return value;
    }

    @Override
    public String toString() {
        return "ExchangeCredentials(apiKey=****, secretKey=****)";
    }
}
