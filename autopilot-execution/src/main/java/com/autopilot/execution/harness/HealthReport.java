package com.autopilot.execution.harness;

public record HealthReport(
    boolean apiReachable,
    boolean balanceAvailable,
    boolean configComplete,
    boolean strategiesLoaded,
    HealthStatus status
) {
    /**
     * All four checks give HEALTHY; either connectivity check alone keeps the system DEGRADED.
     */
    public static HealthReport of(boolean apiReachable, boolean balanceAvailable,
                                  boolean configComplete, boolean strategiesLoaded) {
        HealthStatus status;
        if (apiReachable && balanceAvailable && configComplete && strategiesLoaded) {
            status = HealthStatus.HEALTHY;
        } else if (apiReachable || balanceAvailable) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.UNHEALTHY;
        }
        return new HealthReport(apiReachable, balanceAvailable, configComplete, strategiesLoaded, status);
    }
}
