package com.autopilot.execution.spi;

/**
 * Operator-facing notifications. Implementations must not throw.
 */
public interface NotificationSink {

    void notify(String title, String message);
}
