package com.gridbot.service;

import com.gridbot.backtest.BacktestResult;
import com.gridbot.config.GridTradingConfig;
import com.gridbot.event.EventBus;
import com.gridbot.event.EventType;
import com.gridbot.exchange.ExchangeService;
import com.gridbot.model.PriceTick;
import com.gridbot.model.TradingMode;
import com.gridbot.service.order.BalanceTracker;
import com.gridbot.service.order.OrderStatusTracker;
import com.gridbot.service.strategy.GridTradingStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GridTradingBotTest {

    @Mock
    private BalanceTracker balanceTracker;

    @Mock
    private GridTradingStrategy strategy;

    @Mock
    private OrderStatusTracker orderStatusTracker;

    @Mock
    private ExchangeService exchangeService;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> pricePolling;

    private GridTradingConfig config;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        try (AutoCloseable mocks = MockitoAnnotations.openMocks(this)) {
            config = new GridTradingConfig();
            eventBus = new EventBus(Runnable::run);
        } catch (Exception e) {
            throw new RuntimeException("Failed to initialize mocks", e);
        }
    }

    private GridTradingBot newBot() {
        return new GridTradingBot(config, eventBus, balanceTracker, strategy, orderStatusTracker, exchangeService, taskScheduler);
    }

    @Test
    void testBacktestRunStartsAndStopsBot() {
        // Given
        config.setTradingMode(TradingMode.BACKTEST);
        BacktestResult result = BacktestResult.builder()
                .initialValue(BigDecimal.TEN).finalValue(BigDecimal.TEN).totalFees(BigDecimal.ZERO)
                .accountValues(List.of()).build();
        when(strategy.runBacktest(anyList())).thenReturn(result);
        GridTradingBot bot = newBot();

        // When
        BacktestResult actual = bot.runBacktest(List.of(new PriceTick(1L, BigDecimal.TEN)));

        // Then
        assertSame(result, actual);
        assertFalse(bot.isRunning());
        verify(balanceTracker).setupBalances(config.getInitialBalance(), config.getInitialCryptoBalance(), exchangeService);
        verify(strategy).initialize();
        verify(strategy).stop();
        verifyNoInteractions(taskScheduler);
        verify(orderStatusTracker, never()).startTracking();
    }

    @Test
    void testBacktestRefusedOutsideBacktestMode() {
        config.setTradingMode(TradingMode.LIVE);

        assertThrows(IllegalStateException.class, () -> newBot().runBacktest(List.of()));
    }

    @Test
    void testLiveStartSchedulesPollingAndTracking() {
        // Given
        config.setTradingMode(TradingMode.LIVE);
        doReturn(pricePolling).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        GridTradingBot bot = newBot();

        // When
        bot.start();
        bot.start();

        // Then: second start is ignored
        assertTrue(bot.isRunning());
        verify(orderStatusTracker, times(1)).startTracking();
        verify(taskScheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), eq(config.getPricePollingInterval()));
    }

    @Test
    void testStopBotEventStopsPollingAndDrainsTracker() {
        // Given
        config.setTradingMode(TradingMode.LIVE);
        doReturn(pricePolling).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        GridTradingBot bot = newBot();
        bot.start();

        // When
        eventBus.publishSync(EventType.STOP_BOT, "take profit");

        // Then
        assertFalse(bot.isRunning());
        verify(pricePolling).cancel(false);
        verify(orderStatusTracker).stopTracking();
        verify(strategy).stop();
    }

    @Test
    void testPriceUpdatesIgnoredWhileStopped() {
        GridTradingBot bot = newBot();

        bot.onPriceUpdate(BigDecimal.ONE, 1L);

        verify(strategy, never()).onPriceUpdate(any(), anyLong());
    }
}
