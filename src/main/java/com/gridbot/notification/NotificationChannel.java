package com.gridbot.notification;

/**
 * Delivery target for rendered notifications (log, chat webhook, mail, ...).
 * Implementations may block; they are always called off the trading path.
 */
public interface NotificationChannel {

    String getName();

    void send(String title, String body) throws Exception;
}
