package com.gridbot.grid;

import com.gridbot.exception.GridLevelNotReadyException;
import com.gridbot.model.GridCycleState;
import com.gridbot.model.Order;
import com.gridbot.model.OrderSide;
import com.gridbot.model.OrderStatus;
import com.gridbot.model.OrderType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class GridLevelTest {

    @Test
    void testLevelNeverAcceptsTwoBuysWithoutReset() {
        GridLevel level = new GridLevel(new BigDecimal("1000"), GridCycleState.READY_TO_BUY);

        level.recordBuyOrder(order("b-1", OrderSide.BUY));

        assertFalse(level.canPlaceBuyOrder());
        assertTrue(level.canPlaceSellOrder());
        assertThrows(GridLevelNotReadyException.class, () -> level.recordBuyOrder(order("b-2", OrderSide.BUY)));
        assertEquals(1, level.getBuyOrders().size());
        assertEquals("b-1", level.getLatestBuyOrder().map(Order::getIdentifier).orElseThrow());
    }

    @Test
    void testSellLevelRejectsBuyAndKeepsStateAfterSell() {
        GridLevel level = new GridLevel(new BigDecimal("1600"), GridCycleState.READY_TO_SELL);

        assertThrows(GridLevelNotReadyException.class, () -> level.recordBuyOrder(order("b-1", OrderSide.BUY)));
        level.recordSellOrder(order("s-1", OrderSide.SELL));

        assertEquals(GridCycleState.READY_TO_SELL, level.getState());
        assertEquals(1, level.getSellOrders().size());
    }

    @Test
    void testCompletedLevelAcceptsNothing() {
        GridLevel level = new GridLevel(new BigDecimal("1000"), GridCycleState.READY_TO_BUY);
        level.markCompleted();

        assertThrows(GridLevelNotReadyException.class, () -> level.recordBuyOrder(order("b-1", OrderSide.BUY)));
        assertThrows(GridLevelNotReadyException.class, () -> level.recordSellOrder(order("s-1", OrderSide.SELL)));
    }

    @Test
    void testOrderListsAreReadOnly() {
        GridLevel level = new GridLevel(new BigDecimal("1000"), GridCycleState.READY_TO_BUY);

        assertThrows(UnsupportedOperationException.class, () -> level.getBuyOrders().add(order("x", OrderSide.BUY)));
    }

    private static Order order(String id, OrderSide side) {
        return Order.builder()
                .identifier(id)
                .side(side)
                .orderType(OrderType.MARKET)
                .price(new BigDecimal("1000"))
                .amount(BigDecimal.ONE)
                .status(OrderStatus.OPEN)
                .build();
    }
}
