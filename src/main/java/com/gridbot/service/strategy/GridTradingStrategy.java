package com.gridbot.service.strategy;

import com.gridbot.backtest.BacktestResult;
import com.gridbot.backtest.BacktestResult.AccountValuePoint;
import com.gridbot.config.GridTradingConfig;
import com.gridbot.event.EventBus;
import com.gridbot.event.EventType;
import com.gridbot.grid.GridManager;
import com.gridbot.model.ExitTrigger;
import com.gridbot.model.OrderSide;
import com.gridbot.model.PriceTick;
import com.gridbot.service.order.BalanceTracker;
import com.gridbot.service.order.OrderBook;
import com.gridbot.service.order.OrderManager;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Feeds price ticks to the order manager.
 * <p>
 * Each tick first checks the take-profit and stop-loss exits (only while crypto is held), then
 * tries a grid buy and a grid sell against the previous tick's price. A triggered exit stops the
 * strategy and publishes {@link EventType#STOP_BOT}.
 */
@Slf4j
public class GridTradingStrategy {

    private final GridTradingConfig config;
    private final GridManager gridManager;
    private final OrderManager orderManager;
    private final BalanceTracker balanceTracker;
    private final OrderBook orderBook;
    private final EventBus eventBus;

    private BigDecimal previousPrice;
    private volatile boolean stopped;
    private boolean initialized;

    public GridTradingStrategy(GridTradingConfig config, GridManager gridManager, OrderManager orderManager,
                               BalanceTracker balanceTracker, OrderBook orderBook, EventBus eventBus) {
        this.config = config;
        this.gridManager = gridManager;
        this.orderManager = orderManager;
        this.balanceTracker = balanceTracker;
        this.orderBook = orderBook;
        this.eventBus = eventBus;
    }

    public synchronized void initialize() {
        if (!initialized) {
            gridManager.initializeGridLevels();
            initialized = true;
        }
        stopped = false;
    }

    public synchronized void onPriceUpdate(BigDecimal currentPrice, long timestamp) {
        if (stopped) {
            log.debug("Strategy stopped, ignoring price {}", currentPrice);
            return;
        }
        if (previousPrice == null) {
            previousPrice = currentPrice;
            log.info("First price received: {}", currentPrice);
            return;
        }

        if (checkTakeProfitOrStopLoss(currentPrice, timestamp)) {
            return;
        }

        orderManager.executeOrder(OrderSide.BUY, currentPrice, previousPrice, timestamp);
        orderManager.executeOrder(OrderSide.SELL, currentPrice, previousPrice, timestamp);
        previousPrice = currentPrice;
    }

    private boolean checkTakeProfitOrStopLoss(BigDecimal currentPrice, long timestamp) {
        if (balanceTracker.getCryptoBalance().signum() <= 0) {
            return false;
        }
        GridTradingConfig.Exit takeProfit = config.getTakeProfit();
        if (takeProfit.isEnabled() && currentPrice.compareTo(takeProfit.getThreshold()) >= 0) {
            log.info("Take-profit triggered at {} (threshold {})", currentPrice, takeProfit.getThreshold());
            return exit(currentPrice, timestamp, ExitTrigger.TAKE_PROFIT);
        }
        GridTradingConfig.Exit stopLoss = config.getStopLoss();
        if (stopLoss.isEnabled() && currentPrice.compareTo(stopLoss.getThreshold()) <= 0) {
            log.info("Stop-loss triggered at {} (threshold {})", currentPrice, stopLoss.getThreshold());
            return exit(currentPrice, timestamp, ExitTrigger.STOP_LOSS);
        }
        return false;
    }

    private boolean exit(BigDecimal currentPrice, long timestamp, ExitTrigger trigger) {
        if (!orderManager.executeTakeProfitOrStopLossOrder(currentPrice, timestamp, trigger)) {
            return false;
        }
        stopped = true;
        eventBus.publish(EventType.STOP_BOT, trigger + " triggered at " + currentPrice);
        return true;
    }

    /**
     * Replay {@code ticks} in order through {@link #onPriceUpdate} and record the account value after each one.
     */
    public BacktestResult runBacktest(List<PriceTick> ticks) {
        initialize();
        List<AccountValuePoint> accountValues = new ArrayList<>(ticks.size());
        BigDecimal initialValue = ticks.isEmpty()
                ? balanceTracker.getAdjustedFiatBalance()
                : balanceTracker.getTotalBalanceValue(ticks.get(0).price());

        int processed = 0;
        for (PriceTick tick : ticks) {
            if (stopped) {
                log.info("[BACKTEST] Strategy stopped after {} of {} ticks", processed, ticks.size());
                break;
            }
            onPriceUpdate(tick.price(), tick.timestamp());
            accountValues.add(new AccountValuePoint(tick.timestamp(), tick.price(),
                    balanceTracker.getTotalBalanceValue(tick.price())));
            processed++;
        }

        BigDecimal finalValue = accountValues.isEmpty()
                ? initialValue
                : accountValues.get(accountValues.size() - 1).getAccountValue();
        return BacktestResult.builder()
                .ticksProcessed(processed)
                .initialValue(initialValue)
                .finalValue(finalValue)
                .totalFees(balanceTracker.getTotalFees())
                .ordersPlaced(orderBook.size())
                .stoppedEarly(stopped)
                .accountValues(List.copyOf(accountValues))
                .build();
    }

    public boolean isStopped() {
        return stopped;
    }

    public void stop() {
        stopped = true;
    }
}
