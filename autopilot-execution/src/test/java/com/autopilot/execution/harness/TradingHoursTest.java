package com.autopilot.execution.harness;

import com.autopilot.exchange.model.TradingConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class TradingHoursTest {

    private static final ZoneId NEW_YORK = ZoneId.of("UTC-5");

    @ParameterizedTest(name = "{0} -> {1}")
    @DisplayName("Window 19:30-01:30 UTC-5 wraps past midnight, both ends inclusive")
    @CsvSource({
            "2026-03-03T00:29:59Z, false",
            "2026-03-03T00:30:00Z, true",
            "2026-03-03T04:59:00Z, true",
            "2026-03-03T05:00:00Z, true",
            "2026-03-03T06:30:00Z, true",
            "2026-03-03T06:30:01Z, false",
            "2026-03-03T15:00:00Z, false"
    })
    void wrapsPastMidnight(String instant, boolean open) {
        TradingHours hours = new TradingHours(true, LocalTime.of(19, 30), LocalTime.of(1, 30), NEW_YORK);

        assertEquals(open, hours.isOpen(Instant.parse(instant)));
    }

    @Test
    void sameDayWindow() {
        TradingHours hours = new TradingHours(true, LocalTime.of(9, 0), LocalTime.of(17, 0), ZoneId.of("UTC"));

        assertTrue(hours.isOpen(Instant.parse("2026-03-03T09:00:00Z")));
        assertTrue(hours.isOpen(Instant.parse("2026-03-03T17:00:00Z")));
        assertFalse(hours.isOpen(Instant.parse("2026-03-03T17:00:01Z")));
        assertFalse(hours.isOpen(Instant.parse("2026-03-03T08:59:59Z")));
    }

    @Test
    void disabledIsAlwaysOpen() {
        assertTrue(TradingHours.always().isOpen(Instant.parse("2026-03-03T03:00:00Z")));
    }

    @Test
    void fromConfig() {
        TradingConfig.TradingHoursConfig config = new TradingConfig.TradingHoursConfig();
        config.setEnabled(true);

        TradingHours hours = TradingHours.fromConfig(config);

        assertEquals(LocalTime.of(19, 30), hours.start());
        assertEquals(LocalTime.of(1, 30), hours.end());
        assertEquals(NEW_YORK, hours.zone());
    }

    @Test
    void invalidConfigIsRejected() {
        TradingConfig.TradingHoursConfig config = new TradingConfig.TradingHoursConfig();
        config.setStart("25:00");

        assertThrows(IllegalArgumentException.class, () -> TradingHours.fromConfig(config));
    }
}
