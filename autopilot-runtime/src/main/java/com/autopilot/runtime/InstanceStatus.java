package com.autopilot.runtime;

import java.time.Instant;

/**
 * Point-in-time view of one trading instance.
 *
 * @param lastRestart null until the instance has been restarted once
 */
public record InstanceStatus(
    String instanceId,
    boolean running,
    boolean enabled,
    String pair,
    int restartCount,
    Instant lastRestart,
    boolean tradingHoursActive
) {}
