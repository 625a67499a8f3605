package com.autopilot.execution.risk;

public record RiskDecision(boolean approved, String reason) {

    public static RiskDecision approve() {
        return new RiskDecision(true, "Approved");
    }

    public static RiskDecision reject(String reason) {
        return new RiskDecision(false, reason);
    }
}
