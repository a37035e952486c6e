package com.gridbot.service.execution;

import com.gridbot.exception.UnsupportedExchangeException;
import com.gridbot.exchange.ExchangeService;
import com.gridbot.model.TradingMode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Picks the execution strategy for a trading mode.
 */
@Slf4j
public final class OrderExecutionStrategyFactory {

    private OrderExecutionStrategyFactory() {
    }

    /**
     * @param exchangeService exchange adapter, may be null in BACKTEST mode
     * @throws UnsupportedExchangeException when LIVE or PAPER_TRADING is requested without an exchange adapter
     */
    public static OrderExecutionStrategy create(TradingMode tradingMode, ExchangeService exchangeService,
                                                int maxRetries, Duration retryDelay, BigDecimal maxSlippage) {
        switch (tradingMode) {
            case LIVE:
            case PAPER_TRADING:
                if (exchangeService == null) {
                    throw new UnsupportedExchangeException(
                            "No exchange adapter configured for " + tradingMode + " mode");
                }
                log.info("[{}] Using live order execution (maxRetries={}, retryDelay={}, maxSlippage={})",
                        tradingMode, maxRetries, retryDelay, maxSlippage);
                return new LiveOrderExecutionStrategy(exchangeService, maxRetries, retryDelay, maxSlippage);
            case BACKTEST:
            default:
                log.info("[{}] Using simulated order execution", tradingMode);
                return new BacktestOrderExecutionStrategy();
        }
    }
}
