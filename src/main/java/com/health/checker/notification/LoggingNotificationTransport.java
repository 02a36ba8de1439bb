package com.health.checker.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default transport that writes every message to the log instead of delivering it.
 */
public class LoggingNotificationTransport implements NotificationTransport {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationTransport.class);

    @Override
    public void sendEmail(String sender, String subject, String body, List<String> recipients) {
        log.info("notification.email from={} subject=\"{}\" recipients={}\n{}", sender, subject, recipients, body);
    }

    @Override
    public void notify(String message, String channel) {
        log.info("notification.chat channel={} message=\"{}\"", channel, message);
    }
}
