package com.gridbot.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Order as known to the engine.
 * <p>
 * Built once from the exchange (or simulator) response by an execution strategy. Identity fields
 * never change after construction; status and fill fields are only updated through
 * {@link #applyRemoteUpdate(Order)}, which refuses any change once the order is terminal.
 * Exchange fields that are not always present are exposed as {@link Optional}.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "info")
public class Order {

    private final String identifier;
    private final OrderType orderType;
    private final OrderSide side;
    private final String symbol;
    private final BigDecimal price;
    private final BigDecimal amount;
    private final long timestamp;

    private volatile OrderStatus status;
    // status string as reported by the exchange
    private final String rawStatus;
    private volatile BigDecimal filled;
    private volatile BigDecimal remaining;

    @Getter(AccessLevel.NONE)
    private volatile BigDecimal average;
    @Getter(AccessLevel.NONE)
    private volatile Long lastTradeTimestamp;
    @Getter(AccessLevel.NONE)
    private final String timeInForce;
    @Getter(AccessLevel.NONE)
    private volatile BigDecimal fee;
    @Getter(AccessLevel.NONE)
    private volatile BigDecimal cost;
    @Getter(AccessLevel.NONE)
    private final JSONObject info;

    public Optional<BigDecimal> getAverage() {
        return Optional.ofNullable(average);
    }

    public Optional<Long> getLastTradeTimestamp() {
        return Optional.ofNullable(lastTradeTimestamp);
    }

    public Optional<String> getTimeInForce() {
        return Optional.ofNullable(timeInForce);
    }

    public Optional<BigDecimal> getFee() {
        return Optional.ofNullable(fee);
    }

    public Optional<BigDecimal> getCost() {
        return Optional.ofNullable(cost);
    }

    /**
     * Raw exchange payload, kept for auditing.
     */
    public Optional<JSONObject> getInfo() {
        return Optional.ofNullable(info);
    }

    /**
     * Price the fill was executed at: the average fill price when reported, otherwise the order price.
     */
    public BigDecimal getExecutionPrice() {
        return average != null && average.signum() > 0 ? average : price;
    }

    public boolean isOpen() {
        return status == OrderStatus.OPEN;
    }

    public boolean isFilled() {
        return status == OrderStatus.CLOSED;
    }

    public boolean isCanceled() {
        return status == OrderStatus.CANCELED;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Copy status and fill fields from a freshly fetched remote view of this order.
     *
     * @return false when this order is already terminal and was left untouched
     */
    public synchronized boolean applyRemoteUpdate(Order remote) {
        if (isTerminal()) {
            return false;
        }
        this.status = remote.status;
        if (remote.filled != null) {
            this.filled = remote.filled;
        }
        if (remote.remaining != null) {
            this.remaining = remote.remaining;
        }
        if (remote.average != null) {
            this.average = remote.average;
        }
        if (remote.lastTradeTimestamp != null) {
            this.lastTradeTimestamp = remote.lastTradeTimestamp;
        }
        if (remote.fee != null) {
            this.fee = remote.fee;
        }
        if (remote.cost != null) {
            this.cost = remote.cost;
        }
        return true;
    }
}
