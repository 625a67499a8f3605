package com.autopilot.execution.position;

/**
 * Main lifecycle of a managed position. Breakeven and trailing are tracked as separate flags.
 */
public enum PositionPhase {
    OPENED,
    TP1_HIT,
    TP2_HIT,
    CLOSED
}
