package com.gridbot.exchange;

import com.gridbot.model.OrderSide;
import com.gridbot.model.OrderType;
import org.json.JSONObject;

import java.math.BigDecimal;

/**
 * Exchange adapter boundary.
 * <p>
 * Responses are returned as raw JSON in the unified (ccxt-style) order and balance structures;
 * callers parse them once with {@link com.gridbot.service.execution.OrderResponseParser}.
 * Implementations raise {@link com.gridbot.exception.DataFetchException} on transport failures and
 * {@link com.gridbot.exception.OrderCancellationException} when a cancel is refused.
 */
public interface ExchangeService {

    JSONObject placeOrder(String pair, OrderType orderType, OrderSide side, BigDecimal amount, BigDecimal price);

    JSONObject cancelOrder(String orderId, String pair);

    JSONObject fetchOrder(String orderId, String pair);

    /**
     * @return balance structure with at least a {@code free} object keyed by currency code
     */
    JSONObject getBalance();

    BigDecimal getCurrentPrice(String pair);
}
