package com.autopilot.exchange.dialect;

import com.autopilot.exchange.model.AccountBalance;
import com.autopilot.exchange.model.ExchangePosition;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Spot accounts: {@code data.balances[]} rows of {coin, free, frozen}; no positions.
 */
public class SpotDialect implements ResponseDialect {

    @Override
    public String name() {
        return "spot";
    }

    @Override
    public AccountBalance parseBalance(JsonNode data, String quoteCurrency) {
        for (JsonNode row : data.path("balances")) {
            if (quoteCurrency.equalsIgnoreCase(row.path("coin").asText())) {
                double free = row.path("free").asDouble(0);
                double frozen = row.path("frozen").asDouble(0);
                return new AccountBalance(quoteCurrency, free + frozen, free, frozen, Instant.now());
            }
        }
        return AccountBalance.empty(quoteCurrency);
    }

    @Override
    public List<ExchangePosition> parsePositions(JsonNode data) {
        return List.of();
    }

    @Override
    public boolean supportsLeverage() {
        return false;
    }
}
