package com.autopilot.exchange;

import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.model.TradingConfig;
import com.autopilot.exchange.pionex.PionexClient;

public class ExchangeClientFactory {

    public static ExchangeClient create(TradingConfig config) throws ExchangeException {
        TradingConfig.ExchangeConfig exchange = config.getExchange();
        PionexClient live;
        try {
            live = new PionexClient(exchange);
        } catch (IllegalArgumentException e) {
            throw new ExchangeException("Invalid exchange configuration: " + e.getMessage(), e);
        }

        if (config.getPaperTrading().isEnabled()) {
            return new PaperExchangeClient(live, config.getPaperTrading().getInitialBalance(),
                    exchange.getQuoteCurrency());
        }
        return live;
    }
}
