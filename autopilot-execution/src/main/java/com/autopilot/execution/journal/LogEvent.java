package com.autopilot.execution.journal;

public class LogEvent extends ExecutionEvent {

    private String instanceId;
    private String level;
    private String message;

    // For Jackson
    public LogEvent() {}

    public LogEvent(String instanceId, String level, String message) {
        this.instanceId = instanceId;
        this.level = level;
        this.message = message;
    }

    @Override
    public String getEventType() { return "log"; }

    @Override
    public String getSummary() {
        return String.format("[%s] %s %s", instanceId, level, message);
    }

    public String getInstanceId() { return instanceId; }
    public String getLevel() { return level; }
    public String getMessage() { return message; }
}
