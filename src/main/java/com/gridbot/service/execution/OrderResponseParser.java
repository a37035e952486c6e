package com.gridbot.service.execution;

import com.gridbot.model.Order;
import com.gridbot.model.OrderSide;
import com.gridbot.model.OrderStatus;
import com.gridbot.model.OrderType;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONObject;

import java.math.BigDecimal;

/**
 * Maps a unified (ccxt-style) exchange order structure to {@link Order}.
 */
@Slf4j
public final class OrderResponseParser {

    private OrderResponseParser() {
    }

    public static Order parse(JSONObject raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Exchange returned no order payload");
        }
        String status = raw.isNull("status") ? null : raw.optString("status", null);
        return Order.builder()
                .identifier(raw.optString("id", ""))
                .status(OrderStatus.fromExchangeValue(status))
                .rawStatus(status)
                .orderType(OrderType.fromString(raw.optString("type", OrderType.MARKET.name())))
                .side(OrderSide.fromString(raw.getString("side")))
                .symbol(raw.optString("symbol", ""))
                .price(raw.optBigDecimal("price", BigDecimal.ZERO))
                .amount(raw.optBigDecimal("amount", BigDecimal.ZERO))
                .filled(raw.optBigDecimal("filled", BigDecimal.ZERO))
                .remaining(raw.optBigDecimal("remaining", BigDecimal.ZERO))
                .average(raw.optBigDecimal("average", null))
                .timestamp(raw.optLong("timestamp", 0L))
                .lastTradeTimestamp(raw.has("lastTradeTimestamp") && !raw.isNull("lastTradeTimestamp")
                        ? raw.getLong("lastTradeTimestamp") : null)
                .timeInForce(raw.isNull("timeInForce") ? null : raw.optString("timeInForce", null))
                .fee(parseFee(raw))
                .cost(raw.optBigDecimal("cost", null))
                .info(raw.optJSONObject("info", raw))
                .build();
    }

    // fee is either a plain number or {"cost": ..., "currency": ...}
    private static BigDecimal parseFee(JSONObject raw) {
        JSONObject fee = raw.optJSONObject("fee");
        if (fee != null) {
            return fee.optBigDecimal("cost", null);
        }
        return raw.optBigDecimal("fee", null);
    }
}
