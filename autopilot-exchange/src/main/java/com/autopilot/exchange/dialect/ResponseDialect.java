package com.autopilot.exchange.dialect;

import com.autopilot.exchange.model.AccountBalance;
import com.autopilot.exchange.model.ExchangePosition;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;

/**
 * Maps one account flavour's response shapes onto the normalized model.
 */
public interface ResponseDialect {

    String name();

    AccountBalance parseBalance(JsonNode data, String quoteCurrency);

    List<ExchangePosition> parsePositions(JsonNode data);

    boolean supportsLeverage();

    static ResponseDialect forName(String name) {
        String n = name == null ? "spot" : name.trim().toLowerCase(Locale.ROOT);
        return switch (n) {
            case "spot" -> new SpotDialect();
            case "futures", "perp", "perpetual" -> new FuturesDialect();
            default -> throw new IllegalArgumentException("Unknown account dialect: " + name);
        };
    }
}
