package com.autopilot.execution.harness;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
