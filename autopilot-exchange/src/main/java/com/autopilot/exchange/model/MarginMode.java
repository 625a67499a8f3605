package com.autopilot.exchange.model;

public enum MarginMode {
    CROSS,
    ISOLATED
}
