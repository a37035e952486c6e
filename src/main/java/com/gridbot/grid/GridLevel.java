package com.gridbot.grid;

import com.gridbot.exception.GridLevelNotReadyException;
import com.gridbot.model.GridCycleState;
import com.gridbot.model.Order;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One price point of the grid and the orders placed at it.
 * <p>
 * Created once by {@link GridManager} when the grid is initialized and never removed.
 * Only {@link GridManager} mutates a level; everything else sees read-only views.
 */
public class GridLevel {

    private final BigDecimal price;
    private final List<Order> buyOrders = new CopyOnWriteArrayList<>();
    private final List<Order> sellOrders = new CopyOnWriteArrayList<>();
    private volatile GridCycleState state;

    GridLevel(BigDecimal price, GridCycleState state) {
        this.price = price;
        this.state = state;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public GridCycleState getState() {
        return state;
    }

    public List<Order> getBuyOrders() {
        return Collections.unmodifiableList(buyOrders);
    }

    public List<Order> getSellOrders() {
        return Collections.unmodifiableList(sellOrders);
    }

    public Optional<Order> getLatestBuyOrder() {
        return buyOrders.isEmpty() ? Optional.empty() : Optional.of(buyOrders.get(buyOrders.size() - 1));
    }

    public Optional<Order> getLatestSellOrder() {
        return sellOrders.isEmpty() ? Optional.empty() : Optional.of(sellOrders.get(sellOrders.size() - 1));
    }

    public boolean canPlaceBuyOrder() {
        return state == GridCycleState.READY_TO_BUY;
    }

    public boolean canPlaceSellOrder() {
        return state == GridCycleState.READY_TO_SELL;
    }

    void recordBuyOrder(Order buyOrder) {
        if (!canPlaceBuyOrder()) {
            throw new GridLevelNotReadyException(
                    "Grid level " + price + " is not ready for a buy order, current state: " + state);
        }
        buyOrders.add(buyOrder);
        state = GridCycleState.READY_TO_SELL;
    }

    // Sell levels keep accepting sells; the cycle is closed on the buy level.
    void recordSellOrder(Order sellOrder) {
        if (!canPlaceSellOrder()) {
            throw new GridLevelNotReadyException(
                    "Grid level " + price + " is not ready for a sell order, current state: " + state);
        }
        sellOrders.add(sellOrder);
    }

    void resetBuyLevelCycle() {
        state = GridCycleState.READY_TO_BUY;
    }

    void markCompleted() {
        state = GridCycleState.COMPLETED;
    }

    @Override
    public String toString() {
        return "GridLevel(price=" + price
                + ", state=" + state
                + ", numBuyOrders=" + buyOrders.size()
                + ", numSellOrders=" + sellOrders.size()
                + ", latestBuyOrder=" + getLatestBuyOrder().map(Order::getIdentifier).orElse(null)
                + ", latestSellOrder=" + getLatestSellOrder().map(Order::getIdentifier).orElse(null)
                + ")";
    }
}
