package com.gridbot.config;

import com.gridbot.event.EventBus;
import com.gridbot.exchange.ExchangeService;
import com.gridbot.grid.GridManager;
import com.gridbot.model.TradingMode;
import com.gridbot.notification.LoggingNotificationChannel;
import com.gridbot.notification.NotificationChannel;
import com.gridbot.notification.NotificationHandler;
import com.gridbot.service.GridTradingBot;
import com.gridbot.service.execution.OrderExecutionStrategy;
import com.gridbot.service.execution.OrderExecutionStrategyFactory;
import com.gridbot.service.order.BalanceTracker;
import com.gridbot.service.order.FeeCalculator;
import com.gridbot.service.order.OrderBook;
import com.gridbot.service.order.OrderManager;
import com.gridbot.service.order.OrderStatusTracker;
import com.gridbot.service.order.OrderValidator;
import com.gridbot.service.strategy.GridTradingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.List;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wires one bot instance: thread pools, the event bus and the order pipeline.
 *
 * Thread pools:
 * 1. Scheduler for order status polling and price polling
 * 2. Event dispatch pool for subscribers run off the publisher's thread
 * 3. Status query pool, one task per open order per polling cycle
 * 4. Notification pool, bounded and dropping on overflow
 */
@Configuration
@Slf4j
public class GridBotConfiguration {

    @Bean
    public ThreadPoolTaskScheduler gridTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("grid-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "eventDispatchExecutor")
    public ThreadPoolTaskExecutor eventDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("event-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "orderQueryExecutor")
    public ThreadPoolTaskExecutor orderQueryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("order-query-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor(NotificationConfig notificationConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notificationConfig.getPoolSize());
        executor.setMaxPoolSize(notificationConfig.getPoolSize());
        executor.setQueueCapacity(notificationConfig.getQueueCapacity());
        executor.setThreadNamePrefix("notify-");
        // Notifications must never block the trading thread
        executor.setRejectedExecutionHandler(new DroppingRejectionHandler());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("Notification executor initialized: pool={}, queue={}",
                notificationConfig.getPoolSize(), notificationConfig.getQueueCapacity());
        return executor;
    }

    @Bean
    public EventBus eventBus(@Qualifier("eventDispatchExecutor") ThreadPoolTaskExecutor eventDispatchExecutor) {
        return new EventBus(eventDispatchExecutor);
    }

    @Bean
    public FeeCalculator feeCalculator(GridTradingConfig config) {
        return new FeeCalculator(config.getTradingFee());
    }

    @Bean
    public GridManager gridManager(GridTradingConfig config) {
        return new GridManager(config.getBottom(), config.getTop(), config.getNumGrids(),
                config.getSpacing(), config.getPercentageSpacing());
    }

    @Bean
    public OrderBook orderBook() {
        return new OrderBook();
    }

    @Bean
    public OrderValidator orderValidator(FeeCalculator feeCalculator) {
        return new OrderValidator(feeCalculator);
    }

    @Bean
    public BalanceTracker balanceTracker(EventBus eventBus, FeeCalculator feeCalculator, GridTradingConfig config) {
        return new BalanceTracker(eventBus, feeCalculator, config.getTradingMode(),
                config.getBaseCurrency(), config.getQuoteCurrency());
    }

    @Bean
    public OrderExecutionStrategy orderExecutionStrategy(GridTradingConfig config, ExecutionConfig executionConfig,
                                                         ObjectProvider<ExchangeService> exchangeService) {
        return OrderExecutionStrategyFactory.create(config.getTradingMode(), exchangeService.getIfAvailable(),
                executionConfig.getMaxRetries(), executionConfig.getRetryDelay(), executionConfig.getMaxSlippage());
    }

    @Bean
    public LoggingNotificationChannel loggingNotificationChannel() {
        return new LoggingNotificationChannel();
    }

    @Bean
    public NotificationHandler notificationHandler(EventBus eventBus, List<NotificationChannel> channels,
                                                   @Qualifier("notificationExecutor") ThreadPoolTaskExecutor notificationExecutor,
                                                   NotificationConfig notificationConfig, GridTradingConfig config) {
        return new NotificationHandler(eventBus, channels, notificationExecutor, notificationConfig.getTimeout(),
                notificationConfig.isEnabled(), config.getTradingMode());
    }

    @Bean
    public OrderManager orderManager(GridManager gridManager, OrderValidator orderValidator,
                                     BalanceTracker balanceTracker, OrderBook orderBook, EventBus eventBus,
                                     OrderExecutionStrategy orderExecutionStrategy,
                                     NotificationHandler notificationHandler, GridTradingConfig config) {
        return new OrderManager(gridManager, orderValidator, balanceTracker, orderBook, eventBus,
                orderExecutionStrategy, notificationHandler, config.getTradingMode(), config.getTradingPair());
    }

    @Bean
    public OrderStatusTracker orderStatusTracker(OrderBook orderBook, OrderExecutionStrategy orderExecutionStrategy,
                                                 EventBus eventBus, TaskScheduler gridTaskScheduler,
                                                 @Qualifier("orderQueryExecutor") ThreadPoolTaskExecutor orderQueryExecutor,
                                                 GridTradingConfig config) {
        return new OrderStatusTracker(orderBook, orderExecutionStrategy, eventBus, gridTaskScheduler,
                orderQueryExecutor, config.getStatusPollingInterval(), config.getTradingPair());
    }

    @Bean
    public GridTradingStrategy gridTradingStrategy(GridTradingConfig config, GridManager gridManager,
                                                   OrderManager orderManager, BalanceTracker balanceTracker,
                                                   OrderBook orderBook, EventBus eventBus) {
        return new GridTradingStrategy(config, gridManager, orderManager, balanceTracker, orderBook, eventBus);
    }

    @Bean(destroyMethod = "stop")
    public GridTradingBot gridTradingBot(GridTradingConfig config, EventBus eventBus, BalanceTracker balanceTracker,
                                         GridTradingStrategy gridTradingStrategy, OrderStatusTracker orderStatusTracker,
                                         ObjectProvider<ExchangeService> exchangeService, TaskScheduler gridTaskScheduler) {
        TradingMode mode = config.getTradingMode();
        log.info("Creating grid trading bot in {} mode for {}", mode, config.getTradingPair());
        return new GridTradingBot(config, eventBus, balanceTracker, gridTradingStrategy, orderStatusTracker,
                exchangeService.getIfAvailable(), gridTaskScheduler);
    }

    /**
     * Logs and discards the task instead of running it on the caller.
     */
    private static class DroppingRejectionHandler implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("Notification dropped - queue full ({} queued). Trading continues unaffected.",
                    executor.getQueue().size());
        }
    }
}
