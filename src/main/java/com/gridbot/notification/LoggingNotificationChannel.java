package com.gridbot.notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Default channel: writes notifications to the application log.
 */
@Slf4j
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public String getName() {
        return "log";
    }

    @Override
    public void send(String title, String body) {
        log.info("[NOTIFICATION] {} - {}", title, body);
    }
}
