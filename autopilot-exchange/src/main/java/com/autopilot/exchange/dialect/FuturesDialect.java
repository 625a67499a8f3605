package com.autopilot.exchange.dialect;

import com.autopilot.exchange.model.AccountBalance;
import com.autopilot.exchange.model.ExchangePosition;
import com.autopilot.exchange.model.MarginMode;
import com.autopilot.exchange.model.OrderSide;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Futures accounts: balances keyed by {@code currency} with {@code available}, positions alongside.
 * Accepts both the wrapped ({@code data.balances}, {@code data.positions}) and bare array forms.
 */
public class FuturesDialect implements ResponseDialect {

    private static final Logger log = LoggerFactory.getLogger(FuturesDialect.class);

    @Override
    public String name() {
        return "futures";
    }

    @Override
    public AccountBalance parseBalance(JsonNode data, String quoteCurrency) {
        JsonNode rows = data.has("balances") ? data.get("balances") : data;
        for (JsonNode row : rows) {
            String currency = row.has("currency") ? row.path("currency").asText() : row.path("coin").asText();
            if (!quoteCurrency.equalsIgnoreCase(currency)) continue;

            double available = row.has("available") ? row.path("available").asDouble(0) : row.path("free").asDouble(0);
            double frozen = row.path("frozen").asDouble(0);
            double total = row.has("total") ? row.path("total").asDouble(0) : available + frozen;
            return new AccountBalance(quoteCurrency, total, available, frozen, Instant.now());
        }
        return AccountBalance.empty(quoteCurrency);
    }

    @Override
    public List<ExchangePosition> parsePositions(JsonNode data) {
        JsonNode rows = data.has("positions") ? data.get("positions") : data;
        List<ExchangePosition> positions = new ArrayList<>();
        if (!rows.isArray()) return positions;

        for (JsonNode row : rows) {
            if (!row.has("symbol")) continue;
            try {
                double size = row.path("size").asDouble(0);
                if (size == 0) continue;

                OrderSide side = row.has("side")
                        ? OrderSide.parse(row.path("side").asText())
                        : (size > 0 ? OrderSide.BUY : OrderSide.SELL);
                MarginMode marginMode = "cross".equalsIgnoreCase(row.path("marginMode").asText())
                        ? MarginMode.CROSS : MarginMode.ISOLATED;

                positions.add(new ExchangePosition(
                        row.path("symbol").asText(),
                        side,
                        Math.abs(size),
                        row.path("entryPrice").asDouble(0),
                        row.path("markPrice").asDouble(0),
                        row.path("unrealizedPnl").asDouble(0),
                        row.path("realizedPnl").asDouble(0),
                        row.path("leverage").asInt(1),
                        marginMode,
                        row.path("liquidationPrice").asDouble(0),
                        Instant.now()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed position row {}: {}", row, e.getMessage());
            }
        }
        return positions;
    }

    @Override
    public boolean supportsLeverage() {
        return true;
    }
}
