package com.autopilot.core.strategy;

import com.autopilot.core.model.Signal;

/**
 * A stateless signal generator. Identical inputs must always produce an identical signal
 * (timestamp aside), so the same implementations can be replayed over historical data.
 */
public interface Strategy {

    StrategyType type();

    Signal evaluate(MarketSnapshot snapshot, StrategyParameters params);
}
