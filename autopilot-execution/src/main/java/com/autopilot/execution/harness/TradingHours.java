package com.autopilot.execution.harness;

import com.autopilot.exchange.model.TradingConfig;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Daily trading window in a fixed zone. A window whose start is after its end wraps past midnight;
 * both ends are inclusive.
 */
public record TradingHours(boolean enabled, LocalTime start, LocalTime end, ZoneId zone) {

    public static TradingHours always() {
        return new TradingHours(false, LocalTime.MIN, LocalTime.MAX, ZoneId.of("UTC"));
    }

    /**
     * @throws IllegalArgumentException on an unparseable time or zone id
     */
    public static TradingHours fromConfig(TradingConfig.TradingHoursConfig config) {
        try {
            return new TradingHours(config.isEnabled(),
                    LocalTime.parse(config.getStart()),
                    LocalTime.parse(config.getEnd()),
                    ZoneId.of(config.getTimezone()));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid trading hours " + config.getStart() + "-"
                    + config.getEnd() + " " + config.getTimezone() + ": " + e.getMessage(), e);
        }
    }

    public boolean isOpen(Instant now) {
        if (!enabled) {
            return true;
        }
        LocalTime time = now.atZone(zone).toLocalTime();
        if (start.isAfter(end)) {
            return !time.isBefore(start) || !time.isAfter(end);
        }
        return !time.isBefore(start) && !time.isAfter(end);
    }
}
