package com.autopilot.runtime.watchdog;

import java.time.Instant;

/**
 * Watchdog bookkeeping for one instance. Only touched from the watchdog thread.
 */
public class HeartbeatRecord {

    private final String instanceId;
    private volatile Instant lastSeen;
    private volatile int failureCount;
    private volatile int restartCount;
    private volatile boolean fatal;
    private volatile String lastFailure;

    public HeartbeatRecord(String instanceId) {
        this.instanceId = instanceId;
    }

    void healthy(Instant at) {
        lastSeen = at;
        failureCount = 0;
        lastFailure = null;
    }

    int failed(String reason) {
        lastFailure = reason;
        return ++failureCount;
    }

    void restarted() {
        failureCount = 0;
        restartCount++;
    }

    void markFatal() {
        fatal = true;
        failureCount = 0;
    }

    void clearFatal() {
        fatal = false;
        restartCount = 0;
    }

    public String getInstanceId() { return instanceId; }
    public Instant getLastSeen() { return lastSeen; }
    public int getFailureCount() { return failureCount; }
    public int getRestartCount() { return restartCount; }
    public boolean isFatal() { return fatal; }
    public String getLastFailure() { return lastFailure; }
}
