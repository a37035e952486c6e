package com.gridbot.config;

import com.gridbot.model.SpacingType;
import com.gridbot.model.TradingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Grid Trading Configuration
 * Trading pair, starting balances, grid layout and risk exits for one bot instance
 */
@Configuration
@ConfigurationProperties(prefix = "grid")
@Validated
@Data
public class GridTradingConfig {

    @NotNull
    private TradingMode tradingMode = TradingMode.BACKTEST;

    @NotBlank
    private String baseCurrency = "SOL";
    @NotBlank
    private String quoteCurrency = "USDT";

    @NotNull
    @PositiveOrZero
    private BigDecimal tradingFee = new BigDecimal("0.001"); // 0.1%

    // Backtest seed balances; live and paper modes read them from the exchange
    @PositiveOrZero
    private BigDecimal initialBalance = new BigDecimal("10000");
    @PositiveOrZero
    private BigDecimal initialCryptoBalance = BigDecimal.ZERO;

    // Grid layout
    @NotNull
    @Positive
    private BigDecimal bottom = new BigDecimal("1000");
    @NotNull
    @Positive
    private BigDecimal top = new BigDecimal("2000");
    @Min(2)
    private int numGrids = 10;
    @NotNull
    private SpacingType spacing = SpacingType.ARITHMETIC;
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal percentageSpacing = new BigDecimal("0.05");

    @Valid
    private Exit takeProfit = new Exit();
    @Valid
    private Exit stopLoss = new Exit();

    private Duration statusPollingInterval = Duration.ofSeconds(15);
    private Duration pricePollingInterval = Duration.ofSeconds(5);

    // CSV of timestamp,close rows replayed in BACKTEST mode
    private String backtestDataFile;

    @Data
    public static class Exit {
        private boolean enabled = false;
        @Positive
        private BigDecimal threshold;
    }

    public String getTradingPair() {
        return baseCurrency + "/" + quoteCurrency;
    }

    @AssertTrue(message = "grid.top must be greater than grid.bottom")
    public boolean isRangeValid() {
        return bottom == null || top == null || top.compareTo(bottom) > 0;
    }

    @AssertTrue(message = "an enabled take-profit or stop-loss needs a threshold")
    public boolean isExitThresholdsValid() {
        return (!takeProfit.isEnabled() || takeProfit.getThreshold() != null)
                && (!stopLoss.isEnabled() || stopLoss.getThreshold() != null);
    }
}
