package com.autopilot.core.model;

public enum SignalAction {
    BUY,
    SELL,
    HOLD
}
