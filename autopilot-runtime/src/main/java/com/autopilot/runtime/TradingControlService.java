package com.autopilot.runtime;

import com.autopilot.core.strategy.StrategyType;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.execution.spi.NotificationSink;
import com.autopilot.execution.spi.PersistenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Operations exposed to an external UI. Unknown instance ids fail with
 * {@link IllegalArgumentException}.
 */
public class TradingControlService {

    private static final Logger log = LoggerFactory.getLogger(TradingControlService.class);

    private final InstanceRegistry registry;
    private final InstanceFactory factory;
    private final PersistenceStore store;
    private final NotificationSink notifier;

    public TradingControlService(InstanceRegistry registry, InstanceFactory factory,
                                 PersistenceStore store, NotificationSink notifier) {
        this.registry = registry;
        this.factory = factory;
        this.store = store;
        this.notifier = notifier;
    }

    // ========== Lifecycle ==========

    public InstanceStatus enable(String instanceId) {
        TradingInstance instance = registry.require(instanceId);
        instance.enable();
        store.appendLog(instanceId, "INFO", "Auto trading enabled");
        notifier.notify("Auto Trading Enabled", "[" + instanceId + "] trading " + instance.getPair());
        return instance.status();
    }

    public InstanceStatus disable(String instanceId) {
        TradingInstance instance = registry.require(instanceId);
        instance.disable();
        store.appendLog(instanceId, "INFO", "Auto trading disabled");
        notifier.notify("Auto Trading Disabled", "[" + instanceId + "] stopped");
        return instance.status();
    }

    /**
     * @throws IllegalStateException when the instance is disabled
     */
    public InstanceStatus restart(String instanceId) {
        TradingInstance instance = registry.require(instanceId);
        instance.restart();
        store.appendLog(instanceId, "INFO", "Restarted by operator");
        return instance.status();
    }

    // ========== Queries ==========

    public InstanceStatus getStatus(String instanceId) {
        return registry.require(instanceId).status();
    }

    public PortfolioSnapshot getPortfolioSnapshot(String instanceId) throws ExchangeException {
        PortfolioSnapshot snapshot = registry.require(instanceId).portfolioSnapshot();
        store.appendLog(instanceId, "INFO", "Portfolio snapshot: " + snapshot);
        return snapshot;
    }

    public List<InstanceStatus> listInstances() {
        List<InstanceStatus> statuses = new ArrayList<>();
        for (TradingInstance instance : registry.all()) {
            statuses.add(instance.status());
        }
        return statuses;
    }

    // ========== Configuration ==========

    public String addStrategy(String instanceId, String symbol, StrategyType type, Map<String, Object> parameters) {
        if (type == null) {
            throw new IllegalArgumentException("strategy type is required");
        }
        TradingInstance instance = registry.require(instanceId);
        String strategyId = instance.addStrategy(symbol, type, parameters);
        store.appendLog(instanceId, "INFO", "Added strategy " + strategyId + " (" + type + ")");
        return strategyId;
    }

    public boolean removeStrategy(String instanceId, String strategyId) {
        boolean removed = registry.require(instanceId).removeStrategy(strategyId);
        if (removed) {
            store.appendLog(instanceId, "INFO", "Removed strategy " + strategyId);
        } else {
            log.warn("[{}] No strategy {} to remove", instanceId, strategyId);
        }
        return removed;
    }

    public InstanceStatus setTradingPair(String instanceId, String pair) {
        TradingInstance instance = registry.require(instanceId);
        instance.setTradingPair(pair);
        store.appendLog(instanceId, "INFO", "Trading pair set to " + pair);
        return instance.status();
    }

    /**
     * Builds and registers a new, stopped instance. It starts trading once enabled.
     *
     * @throws IllegalArgumentException for a blank or already used id
     */
    public InstanceStatus createInstance(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instance id is required");
        }
        if (registry.contains(instanceId)) {
            throw new IllegalArgumentException("Instance already exists: " + instanceId);
        }
        TradingInstance instance = registry.register(factory.create(instanceId));
        log.info("Created instance {} on {}", instanceId, instance.getPair());
        return instance.status();
    }
}
