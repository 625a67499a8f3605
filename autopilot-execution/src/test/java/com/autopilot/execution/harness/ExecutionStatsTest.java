package com.autopilot.execution.harness;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionStatsTest {

    @Test
    void emptyRecord() {
        ExecutionRecord record = new ExecutionRecord("RSI");

        assertEquals(0, record.getSuccessRate());
        assertEquals(0, record.getAverageTimeMs());
    }

    @Test
    void successRateAndAverageTime() {
        ExecutionStats stats = new ExecutionStats();
        stats.record("RSI", true, 100);
        stats.record("RSI", true, 200);
        stats.record("RSI", false, 300);
        ExecutionRecord record = stats.record("RSI", true, 200);

        assertEquals(4, record.getExecutions());
        assertEquals(75.0, record.getSuccessRate(), 1e-9);
        assertEquals(200.0, record.getAverageTimeMs(), 1e-9);
        assertEquals("RSI: 3 ok / 1 failed, success 75.0%, avg 200 ms", record.toString());
    }

    @Test
    void snapshotIsSortedByStrategy() {
        ExecutionStats stats = new ExecutionStats();
        stats.record("GRID", true, 1);
        stats.record("ADVANCED", false, 1);

        assertEquals(List.of("ADVANCED", "GRID"), List.copyOf(stats.snapshot().keySet()));
        assertSame(stats.get("GRID"), stats.snapshot().get("GRID"));
    }
}
