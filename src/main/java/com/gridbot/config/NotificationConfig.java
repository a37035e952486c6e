package com.gridbot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Notification delivery settings
 */
@Configuration
@ConfigurationProperties(prefix = "grid.notification")
@Data
public class NotificationConfig {

    private boolean enabled = true;

    // Delivery pool
    private int poolSize = 3;
    private int queueCapacity = 100;
    private Duration timeout = Duration.ofSeconds(5);
}
