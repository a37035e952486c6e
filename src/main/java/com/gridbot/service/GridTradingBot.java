package com.gridbot.service;

import com.gridbot.backtest.BacktestResult;
import com.gridbot.config.GridTradingConfig;
import com.gridbot.event.EventBus;
import com.gridbot.event.EventType;
import com.gridbot.exchange.ExchangeService;
import com.gridbot.model.BalanceSnapshot;
import com.gridbot.model.PriceTick;
import com.gridbot.model.TradingMode;
import com.gridbot.service.order.BalanceTracker;
import com.gridbot.service.order.OrderStatusTracker;
import com.gridbot.service.strategy.GridTradingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Lifecycle of one bot instance: balances, grid, status tracking and, outside backtests, price polling.
 * <p>
 * Reacts to {@link EventType#START_BOT} and {@link EventType#STOP_BOT}. {@link #stop()} returns only
 * after the status tracker has drained, so no order updates are applied afterwards.
 */
@Slf4j
public class GridTradingBot {

    private final GridTradingConfig config;
    private final BalanceTracker balanceTracker;
    private final GridTradingStrategy strategy;
    private final OrderStatusTracker orderStatusTracker;
    private final ExchangeService exchangeService;
    private final TaskScheduler taskScheduler;
    private final TradingMode tradingMode;

    private volatile boolean running;
    private boolean balancesLoaded;
    private ScheduledFuture<?> pricePollingTask;

    public GridTradingBot(GridTradingConfig config, EventBus eventBus, BalanceTracker balanceTracker,
                          GridTradingStrategy strategy, OrderStatusTracker orderStatusTracker,
                          ExchangeService exchangeService, TaskScheduler taskScheduler) {
        this.config = config;
        this.balanceTracker = balanceTracker;
        this.strategy = strategy;
        this.orderStatusTracker = orderStatusTracker;
        this.exchangeService = exchangeService;
        this.taskScheduler = taskScheduler;
        this.tradingMode = config.getTradingMode();

        eventBus.subscribe(EventType.START_BOT, reason -> start());
        eventBus.subscribe(EventType.STOP_BOT, this::onStopRequested);
    }

    public synchronized void start() {
        if (running) {
            log.warn("[{}] Bot is already running", tradingMode);
            return;
        }
        if (!balancesLoaded) {
            balanceTracker.setupBalances(config.getInitialBalance(), config.getInitialCryptoBalance(), exchangeService);
            balancesLoaded = true;
        }
        strategy.initialize();

        if (!tradingMode.isBacktest()) {
            orderStatusTracker.startTracking();
            pricePollingTask = taskScheduler.scheduleWithFixedDelay(this::pollPrice, config.getPricePollingInterval());
        }
        running = true;
        log.info("[{}] Grid trading bot started for {}", tradingMode, config.getTradingPair());
    }

    public void stop() {
        ScheduledFuture<?> polling;
        synchronized (this) {
            if (!running) {
                log.debug("[{}] Bot is not running", tradingMode);
                return;
            }
            running = false;
            polling = pricePollingTask;
            pricePollingTask = null;
        }
        strategy.stop();
        if (polling != null) {
            polling.cancel(false);
        }
        orderStatusTracker.stopTracking();
        log.info("[{}] Grid trading bot stopped", tradingMode);
    }

    private void onStopRequested(Object reason) {
        log.info("[{}] Stop requested: {}", tradingMode, reason);
        stop();
    }

    /**
     * Replay historical ticks; the bot is started before and stopped after the run.
     */
    public BacktestResult runBacktest(List<PriceTick> ticks) {
        if (!tradingMode.isBacktest()) {
            throw new IllegalStateException("Backtests can only run in BACKTEST mode, current mode: " + tradingMode);
        }
        start();
        try {
            BacktestResult result = strategy.runBacktest(ticks);
            log.info("[BACKTEST] Finished: {} ticks, {} orders, value {} -> {} (ROI {}%), fees {}",
                    result.getTicksProcessed(), result.getOrdersPlaced(), result.getInitialValue(),
                    result.getFinalValue(), result.getRoiPercent(), result.getTotalFees());
            return result;
        } finally {
            stop();
        }
    }

    /**
     * Entry point for externally streamed prices.
     */
    public void onPriceUpdate(BigDecimal price, long timestamp) {
        if (!running) {
            log.debug("[{}] Bot not running, ignoring price {}", tradingMode, price);
            return;
        }
        strategy.onPriceUpdate(price, timestamp);
    }

    private void pollPrice() {
        try {
            BigDecimal price = exchangeService.getCurrentPrice(config.getTradingPair());
            onPriceUpdate(price, System.currentTimeMillis());
        } catch (Exception e) {
            log.error("[{}] Failed to fetch current price for {}: {}", tradingMode, config.getTradingPair(), e.getMessage());
        }
    }

    public boolean isRunning() {
        return running;
    }

    public BalanceSnapshot getBalanceSnapshot() {
        return balanceTracker.snapshot();
    }

    public Map<String, Object> getHealthStatus() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("running", running);
        health.put("tradingMode", tradingMode);
        health.put("tradingPair", config.getTradingPair());
        health.put("orderStatusTracking", orderStatusTracker.isTracking());
        health.put("strategyStopped", strategy.isStopped());
        health.put("balances", balanceTracker.snapshot());
        return health;
    }
}
