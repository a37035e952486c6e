package com.gridbot.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Live order execution: retry count, delay between attempts and the slippage reached on the last retry
 */
@Configuration
@ConfigurationProperties(prefix = "grid.execution")
@Validated
@Data
public class ExecutionConfig {

    @Min(1)
    private int maxRetries = 3;

    @NotNull
    private Duration retryDelay = Duration.ofSeconds(1);

    @NotNull
    @DecimalMin("0")
    private BigDecimal maxSlippage = new BigDecimal("0.01"); // 1%
}
