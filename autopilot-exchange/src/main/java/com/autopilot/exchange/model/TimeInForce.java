package com.autopilot.exchange.model;

public enum TimeInForce {
    GTC,  // Good til cancelled
    IOC,  // Immediate or cancel
    FOK   // Fill or kill
}
