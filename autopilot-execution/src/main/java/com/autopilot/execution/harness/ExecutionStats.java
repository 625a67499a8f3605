package com.autopilot.execution.harness;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public class ExecutionStats {

    private final Map<String, ExecutionRecord> records = new ConcurrentHashMap<>();

    public ExecutionRecord record(String strategyName, boolean success, long elapsedMs) {
        ExecutionRecord record = records.computeIfAbsent(strategyName, ExecutionRecord::new);
        record.record(success, elapsedMs);
        return record;
    }

    public ExecutionRecord get(String strategyName) {
        return records.get(strategyName);
    }

    public Map<String, ExecutionRecord> snapshot() {
        return new TreeMap<>(records);
    }
}
