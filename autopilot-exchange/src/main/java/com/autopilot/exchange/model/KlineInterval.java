package com.autopilot.exchange.model;

/**
 * Candle intervals supported by the kline endpoint, with their wire codes.
 */
public enum KlineInterval {
    M1("1M"),
    M5("5M"),
    M15("15M"),
    M30("30M"),
    H1("1H"),
    H4("4H"),
    H8("8H"),
    H12("12H"),
    D1("1D");

    private final String code;

    KlineInterval(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Accepts "5m", "5M", "1h", "1H" and the enum names.
     */
    public static KlineInterval parse(String value) {
        if (value == null) throw new IllegalArgumentException("interval is required");
        String v = value.trim();
        for (KlineInterval interval : values()) {
            if (interval.name().equalsIgnoreCase(v) || interval.code.equalsIgnoreCase(v)) {
                return interval;
            }
        }
        return switch (v.toLowerCase()) {
            case "1m" -> M1;
            case "5m" -> M5;
            case "15m" -> M15;
            case "30m" -> M30;
            case "1h" -> H1;
            case "4h" -> H4;
            case "8h" -> H8;
            case "12h" -> H12;
            case "1d" -> D1;
            default -> throw new IllegalArgumentException("Unsupported interval: " + value);
        };
    }
}
