package com.autopilot.execution.harness;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running success/failure and latency totals for one strategy.
 */
public class ExecutionRecord {

    private final String strategyName;
    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicLong totalTimeMs = new AtomicLong();

    public ExecutionRecord(String strategyName) {
        this.strategyName = strategyName;
    }

    public void record(boolean success, long elapsedMs) {
        if (success) {
            successCount.incrementAndGet();
        } else {
            failureCount.incrementAndGet();
        }
        totalTimeMs.addAndGet(Math.max(0, elapsedMs));
    }

    public String getStrategyName() { return strategyName; }
    public long getSuccessCount() { return successCount.get(); }
    public long getFailureCount() { return failureCount.get(); }
    public long getTotalTimeMs() { return totalTimeMs.get(); }

    public long getExecutions() {
        return successCount.get() + failureCount.get();
    }

    /**
     * Percentage of successful evaluations, 0 before the first one.
     */
    public double getSuccessRate() {
        long total = getExecutions();
        return total > 0 ? successCount.get() * 100.0 / total : 0;
    }

    public double getAverageTimeMs() {
        long total = getExecutions();
        return total > 0 ? (double) totalTimeMs.get() / total : 0;
    }

    @Override
    public String toString() {
        return String.format("%s: %d ok / %d failed, success %.1f%%, avg %.0f ms",
                strategyName, getSuccessCount(), getFailureCount(), getSuccessRate(), getAverageTimeMs());
    }
}
