package com.autopilot.execution.notify;

import com.autopilot.execution.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the application log. Stands in wherever no chat or mail channel is wired.
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notify(String title, String message) {
        log.info("[NOTIFY] {}: {}", title, message);
    }
}
