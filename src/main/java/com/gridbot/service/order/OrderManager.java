package com.gridbot.service.order;

import com.gridbot.event.EventBus;
import com.gridbot.event.EventType;
import com.gridbot.exception.GridLevelNotReadyException;
import com.gridbot.exception.InsufficientBalanceException;
import com.gridbot.exception.InsufficientCryptoBalanceException;
import com.gridbot.exception.InvalidOrderQuantityException;
import com.gridbot.exception.OrderExecutionFailedException;
import com.gridbot.grid.GridLevel;
import com.gridbot.grid.GridManager;
import com.gridbot.model.ExitTrigger;
import com.gridbot.model.Order;
import com.gridbot.model.OrderSide;
import com.gridbot.model.TradingMode;
import com.gridbot.notification.NotificationHandler;
import com.gridbot.notification.NotificationType;
import com.gridbot.service.execution.OrderExecutionStrategy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns price ticks into grid orders.
 * <p>
 * Per crossing: validate, reserve funds, execute, then bind the reservation to the placed order and
 * record the order on its grid level and in the order book. The record step runs under one lock shared by buy, sell and take-profit/stop-loss
 * finalization, so grid state and balance updates of two orders never interleave.
 * <p>
 * A failing tick never propagates: validation failures are logged and skipped, execution failures
 * and unexpected errors are logged and reported through {@link NotificationHandler}.
 */
@Slf4j
public class OrderManager {

    private final GridManager gridManager;
    private final OrderValidator orderValidator;
    private final BalanceTracker balanceTracker;
    private final OrderBook orderBook;
    private final EventBus eventBus;
    private final OrderExecutionStrategy orderExecutionStrategy;
    private final NotificationHandler notificationHandler;
    private final TradingMode tradingMode;
    private final String tradingPair;

    private final ReentrantLock finalizeLock = new ReentrantLock();

    public OrderManager(GridManager gridManager, OrderValidator orderValidator, BalanceTracker balanceTracker,
                        OrderBook orderBook, EventBus eventBus, OrderExecutionStrategy orderExecutionStrategy,
                        NotificationHandler notificationHandler, TradingMode tradingMode, String tradingPair) {
        this.gridManager = gridManager;
        this.orderValidator = orderValidator;
        this.balanceTracker = balanceTracker;
        this.orderBook = orderBook;
        this.eventBus = eventBus;
        this.orderExecutionStrategy = orderExecutionStrategy;
        this.notificationHandler = notificationHandler;
        this.tradingMode = tradingMode;
        this.tradingPair = tradingPair;
    }

    /**
     * Place the grid order for {@code side} if the move from {@code previousPrice} to
     * {@code currentPrice} crossed one of its levels.
     */
    public void executeOrder(OrderSide side, BigDecimal currentPrice, BigDecimal previousPrice, long timestamp) {
        Optional<GridLevel> crossed = gridManager.detectCrossing(currentPrice, previousPrice, side);
        if (crossed.isEmpty()) {
            log.debug("No {} grid level crossed between {} and {}", side, previousPrice, currentPrice);
            return;
        }
        GridLevel gridLevel = crossed.get();

        try {
            if (side == OrderSide.BUY) {
                processBuyOrder(gridLevel, currentPrice, timestamp);
            } else {
                processSellOrder(gridLevel, currentPrice, timestamp);
            }
        } catch (GridLevelNotReadyException | InsufficientBalanceException | InsufficientCryptoBalanceException
                 | InvalidOrderQuantityException e) {
            log.info("Skipping {} at grid level {}: {}", side, gridLevel.getPrice(), e.getMessage());
        } catch (OrderExecutionFailedException e) {
            log.error("[{}] Failed to execute {} order at grid level {}: {}", tradingMode, side, gridLevel.getPrice(), e.getMessage());
            notifyExecutionFailure(e);
        } catch (Exception e) {
            log.error("[{}] Unexpected error while processing {} order at grid level {}", tradingMode, side, gridLevel.getPrice(), e);
            notificationHandler.sendNotificationAsync(NotificationType.ERROR_OCCURRED,
                    Map.of("errorDetails", "Error while processing " + side + " order: " + e.getMessage()));
        }
    }

    private void processBuyOrder(GridLevel gridLevel, BigDecimal currentPrice, long timestamp) {
        if (!gridLevel.canPlaceBuyOrder()) {
            throw new GridLevelNotReadyException(
                    "Grid level " + gridLevel.getPrice() + " is not ready for a buy order, current state: " + gridLevel.getState());
        }

        BigDecimal totalValue = balanceTracker.getTotalBalanceValue(currentPrice);
        BigDecimal quantity = gridManager.getOrderSizeForGridLevel(totalValue, currentPrice);
        OrderValidationResult validation = orderValidator.validateBuy(balanceTracker.getBalance(), quantity, currentPrice);
        if (!validation.isOk()) {
            log.info("Buy at grid level {} skipped: {}", gridLevel.getPrice(), validation);
            return;
        }

        BigDecimal orderQuantity = validation.getQuantity();
        BigDecimal reservation = balanceTracker.calculateBuyReservation(orderQuantity, currentPrice);
        balanceTracker.reserveFundsForBuy(reservation);

        Order buyOrder;
        try {
            buyOrder = orderExecutionStrategy.executeMarketOrder(OrderSide.BUY, tradingPair, orderQuantity, currentPrice);
        } catch (OrderExecutionFailedException e) {
            settleFailedOrder(e, reservation);
            throw e;
        } catch (RuntimeException e) {
            balanceTracker.releaseFundsForBuy(reservation);
            throw e;
        }

        finalizeLock.lock();
        try {
            balanceTracker.bindReservation(buyOrder.getIdentifier(), OrderSide.BUY, reservation);
            if (recordOnGrid(buyOrder, gridLevel)) {
                log.info("[{}] Buy order {} placed at grid level {} for {} @ {} (ts {})",
                        tradingMode, buyOrder.getIdentifier(), gridLevel.getPrice(), orderQuantity, currentPrice, timestamp);
            }
            publishIfFilled(buyOrder);
        } finally {
            finalizeLock.unlock();
        }
        notifyOrderPlaced(buyOrder);
    }

    private void processSellOrder(GridLevel sellLevel, BigDecimal currentPrice, long timestamp) {
        if (!sellLevel.canPlaceSellOrder()) {
            throw new GridLevelNotReadyException(
                    "Grid level " + sellLevel.getPrice() + " is not ready for a sell order, current state: " + sellLevel.getState());
        }

        Optional<GridLevel> buyLevel = gridManager.findLowestCompletedBuyGrid();
        if (buyLevel.isEmpty()) {
            log.info("No open buy cycle to close at sell grid level {}", sellLevel.getPrice());
            return;
        }
        Optional<Order> buyOrder = buyLevel.get().getLatestBuyOrder();
        if (buyOrder.isEmpty()) {
            log.warn("Buy grid level {} is waiting for a sell but holds no buy order", buyLevel.get().getPrice());
            return;
        }

        BigDecimal boughtQuantity = filledOrRequested(buyOrder.get());
        OrderValidationResult validation = orderValidator.validateSell(balanceTracker.getCryptoBalance(), boughtQuantity);
        if (!validation.isOk()) {
            log.info("Sell at grid level {} skipped: {}", sellLevel.getPrice(), validation);
            return;
        }

        BigDecimal orderQuantity = validation.getQuantity();
        balanceTracker.reserveFundsForSell(orderQuantity);

        Order sellOrder;
        try {
            sellOrder = orderExecutionStrategy.executeMarketOrder(OrderSide.SELL, tradingPair, orderQuantity, currentPrice);
        } catch (OrderExecutionFailedException e) {
            settleFailedOrder(e, orderQuantity);
            throw e;
        } catch (RuntimeException e) {
            balanceTracker.releaseFundsForSell(orderQuantity);
            throw e;
        }

        finalizeLock.lock();
        try {
            balanceTracker.bindReservation(sellOrder.getIdentifier(), OrderSide.SELL, orderQuantity);
            if (recordOnGrid(sellOrder, sellLevel)) {
                gridManager.resetGridCycle(buyLevel.get());
                log.info("[{}] Sell order {} placed at grid level {} for {} @ {} (ts {}), closing buy cycle at {}",
                        tradingMode, sellOrder.getIdentifier(), sellLevel.getPrice(), orderQuantity, currentPrice,
                        timestamp, buyLevel.get().getPrice());
            }
            publishIfFilled(sellOrder);
        } finally {
            finalizeLock.unlock();
        }
        notifyOrderPlaced(sellOrder);
    }

    /**
     * Liquidate all available crypto with a market sell outside the grid and retire every grid level.
     *
     * @return true when the exit order was placed
     */
    public boolean executeTakeProfitOrStopLossOrder(BigDecimal currentPrice, long timestamp, ExitTrigger trigger) {
        BigDecimal quantity = balanceTracker.getCryptoBalance();
        if (quantity.signum() <= 0) {
            log.warn("{} triggered at {} but there is no crypto balance to sell", trigger, currentPrice);
            return false;
        }

        try {
            balanceTracker.reserveFundsForSell(quantity);
            Order exitOrder;
            try {
                exitOrder = orderExecutionStrategy.executeMarketOrder(OrderSide.SELL, tradingPair, quantity, currentPrice);
            } catch (OrderExecutionFailedException e) {
                settleFailedOrder(e, quantity);
                throw e;
            } catch (RuntimeException e) {
                balanceTracker.releaseFundsForSell(quantity);
                throw e;
            }

            finalizeLock.lock();
            try {
                balanceTracker.bindReservation(exitOrder.getIdentifier(), OrderSide.SELL, quantity);
                orderBook.addNonGridOrder(exitOrder);
                publishIfFilled(exitOrder);
                gridManager.completeAllLevels();
            } finally {
                finalizeLock.unlock();
            }

            NotificationType type = trigger == ExitTrigger.TAKE_PROFIT
                    ? NotificationType.TAKE_PROFIT_TRIGGERED
                    : NotificationType.STOP_LOSS_TRIGGERED;
            notificationHandler.sendNotificationAsync(type, Map.of("orderDetails", exitOrder.toString()));
            log.info("[{}] {} executed: sold {} @ {} (ts {}), order {}",
                    tradingMode, trigger, quantity, currentPrice, timestamp, exitOrder.getIdentifier());
            return true;
        } catch (InsufficientCryptoBalanceException e) {
            log.info("{} skipped: {}", trigger, e.getMessage());
        } catch (OrderExecutionFailedException e) {
            log.error("[{}] Failed to execute {} order: {}", tradingMode, trigger, e.getMessage());
            notifyExecutionFailure(e);
        } catch (Exception e) {
            log.error("[{}] Unexpected error while executing {} order", tradingMode, trigger, e);
            notificationHandler.sendNotificationAsync(NotificationType.ERROR_OCCURRED,
                    Map.of("errorDetails", "Error while executing " + trigger + " order: " + e.getMessage()));
        }
        return false;
    }

    // Caller holds finalizeLock. A level that changed state since the pre-check keeps the order off the grid.
    private boolean recordOnGrid(Order order, GridLevel gridLevel) {
        try {
            if (order.getSide() == OrderSide.BUY) {
                gridManager.recordBuyOrder(gridLevel, order);
            } else {
                gridManager.recordSellOrder(gridLevel, order);
            }
            orderBook.addOrder(order, gridLevel);
            return true;
        } catch (GridLevelNotReadyException e) {
            log.error("Grid level {} rejected placed order {}, tracking it as a non-grid order: {}",
                    gridLevel.getPrice(), order.getIdentifier(), e.getMessage());
            orderBook.addNonGridOrder(order);
            return false;
        }
    }

    // Pays what earlier attempts filled out of the reservation and returns the rest.
    private void settleFailedOrder(OrderExecutionFailedException e, BigDecimal reservation) {
        if (e.isPartiallyFilled()) {
            log.warn("[{}] {} order on {} failed after filling {} of {} @ {}, settling the filled part",
                    tradingMode, e.getSide(), e.getPair(), e.getFilledQuantity(), e.getQuantity(), e.getAverageFillPrice());
        }
        if (e.getSide() == OrderSide.BUY) {
            balanceTracker.settleBuy(reservation, e.getFilledQuantity(), e.getAverageFillPrice());
        } else {
            balanceTracker.settleSell(reservation, e.getFilledQuantity(), e.getAverageFillPrice());
        }
    }

    private void publishIfFilled(Order order) {
        if (order.isFilled()) {
            eventBus.publishSync(EventType.ORDER_COMPLETED, order);
        }
    }

    private void notifyOrderPlaced(Order order) {
        notificationHandler.sendNotificationAsync(NotificationType.ORDER_PLACED, Map.of("orderDetails", order.toString()));
    }

    private void notifyExecutionFailure(OrderExecutionFailedException e) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("orderType", e.getOrderType());
        fields.put("orderSide", e.getSide());
        fields.put("pair", e.getPair());
        fields.put("quantity", e.getQuantity());
        fields.put("price", e.getPrice());
        fields.put("filledQuantity", e.getFilledQuantity());
        fields.put("errorDetails", e.getMessage());
        notificationHandler.sendNotificationAsync(NotificationType.ORDER_EXECUTION_FAILED, fields);
    }

    private static BigDecimal filledOrRequested(Order order) {
        BigDecimal filled = order.getFilled();
        return filled != null && filled.signum() > 0 ? filled : order.getAmount();
    }
}
