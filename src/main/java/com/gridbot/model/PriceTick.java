package com.gridbot.model;

import java.math.BigDecimal;

/**
 * A single observed market price.
 *
 * @param timestamp epoch milliseconds
 * @param price     last traded (or close) price
 */
public record PriceTick(long timestamp, BigDecimal price) {
}
