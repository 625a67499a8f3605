package com.autopilot.execution.harness;

import com.autopilot.exchange.ExchangeClient;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.model.AccountBalance;
import com.autopilot.exchange.model.TradingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Readiness probe run before each strategy evaluation.
 */
public class HealthCheck {

    private static final Logger log = LoggerFactory.getLogger(HealthCheck.class);

    private final ExchangeClient client;

    public HealthCheck(ExchangeClient client) {
        this.client = client;
    }

    public HealthReport run(AccountBalance balance, TradingConfig config, boolean strategiesLoaded) {
        boolean apiReachable;
        try {
            client.testConnection();
            apiReachable = true;
        } catch (ExchangeException e) {
            log.warn("Health check: exchange not reachable: {}", e.getMessage());
            apiReachable = false;
        }

        boolean balanceAvailable = balance != null && balance.total() > 0;

        List<String> problems = config.validate();
        if (!problems.isEmpty()) {
            log.warn("Health check: config incomplete: {}", problems);
        }

        return HealthReport.of(apiReachable, balanceAvailable, problems.isEmpty(), strategiesLoaded);
    }
}
