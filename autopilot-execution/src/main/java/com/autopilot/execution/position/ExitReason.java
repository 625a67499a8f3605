package com.autopilot.execution.position;

public enum ExitReason {
    STOP_LOSS,
    BREAKEVEN_STOP,
    TRAILING_STOP,
    TAKE_PROFIT_2,
    RISK_REDUCTION,
    MANUAL
}
