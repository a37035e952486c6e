package com.gridbot;

import com.gridbot.backtest.BacktestResult;
import com.gridbot.backtest.PriceTickLoader;
import com.gridbot.config.GridTradingConfig;
import com.gridbot.model.PriceTick;
import com.gridbot.service.GridTradingBot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Starts the bot once the context is up: replays the configured price file in BACKTEST mode,
 * starts live trading otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GridBotRunner implements CommandLineRunner {

    private final GridTradingConfig config;
    private final GridTradingBot gridTradingBot;

    @Override
    public void run(String... args) {
        if (!config.getTradingMode().isBacktest()) {
            gridTradingBot.start();
            return;
        }

        String dataFile = args.length > 0 ? args[0] : config.getBacktestDataFile();
        if (dataFile == null || dataFile.isBlank()) {
            log.info("[BACKTEST] No price data file configured (grid.backtest-data-file), nothing to replay");
            return;
        }

        List<PriceTick> ticks = PriceTickLoader.load(Path.of(dataFile));
        BacktestResult result = gridTradingBot.runBacktest(ticks);
        log.info("[BACKTEST] Result: P&L {}, ROI {}%, {} orders, stopped early: {}",
                result.getProfitAndLoss(), result.getRoiPercent(), result.getOrdersPlaced(), result.isStoppedEarly());
    }
}
