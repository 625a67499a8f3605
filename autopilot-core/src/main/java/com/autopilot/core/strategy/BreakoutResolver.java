package com.autopilot.core.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses a single direction when both breakout conditions hold at once.
 */
public final class BreakoutResolver {

    private static final Logger log = LoggerFactory.getLogger(BreakoutResolver.class);

    public enum Direction {
        LONG,
        SHORT,
        NONE,
        CONFLICT
    }

    private BreakoutResolver() {}

    /**
     * @param longLevel  price above which a long breakout triggers
     * @param shortLevel price below which a short breakout triggers
     */
    public static Direction resolve(double price, double longLevel, double shortLevel) {
        boolean longTriggered = price > longLevel;
        boolean shortTriggered = price < shortLevel;

        if (longTriggered && shortTriggered) {
            double longDistance = price - longLevel;
            double shortDistance = shortLevel - price;
            if (longDistance > shortDistance) return Direction.LONG;
            if (shortDistance > longDistance) return Direction.SHORT;
            log.warn("Breakout conflict at {}: long level {} and short level {} equidistant", price, longLevel, shortLevel);
            return Direction.CONFLICT;
        }
        if (longTriggered) return Direction.LONG;
        if (shortTriggered) return Direction.SHORT;
        return Direction.NONE;
    }
}
