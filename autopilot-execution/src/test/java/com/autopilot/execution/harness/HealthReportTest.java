package com.autopilot.execution.harness;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HealthReportTest {

    @Test
    void allChecksPassing() {
        assertEquals(HealthStatus.HEALTHY, HealthReport.of(true, true, true, true).status());
    }

    @Test
    void eitherConnectivityCheckKeepsItDegraded() {
        assertEquals(HealthStatus.DEGRADED, HealthReport.of(true, false, true, true).status());
        assertEquals(HealthStatus.DEGRADED, HealthReport.of(false, true, true, true).status());
        assertEquals(HealthStatus.DEGRADED, HealthReport.of(true, true, false, false).status());
    }

    @Test
    void noConnectivityIsUnhealthy() {
        HealthReport report = HealthReport.of(false, false, true, true);

        assertEquals(HealthStatus.UNHEALTHY, report.status());
        assertTrue(report.configComplete());
        assertTrue(report.strategiesLoaded());
    }
}
