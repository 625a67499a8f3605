package com.autopilot.runtime;

import com.autopilot.core.strategy.StrategyParameters;
import com.autopilot.core.strategy.StrategyType;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.model.AccountBalance;
import com.autopilot.exchange.model.TradingConfig;
import com.autopilot.execution.harness.CycleResult;
import com.autopilot.execution.harness.ExecutionHarness;
import com.autopilot.execution.harness.StrategyAssignment;
import com.autopilot.execution.position.ManagedPosition;
import com.autopilot.execution.spi.NotificationSink;
import com.autopilot.execution.spi.PersistenceStore;
import com.autopilot.execution.spi.StrategySettings;
import com.autopilot.execution.spi.UserSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One independently controllable trading loop: a daemon thread that runs a harness cycle, then
 * waits {@code heartbeatIntervalSeconds} (or {@code errorBackoffSeconds} after an error).
 *
 * <p>Two locks: {@code cycleLock} serializes harness access (cycles and portfolio snapshots) and
 * may be held for a whole cycle; {@code stateLock} guards assignments, settings and the loop wait
 * and is only ever held briefly. Stop, status and pair reads never wait for a running cycle.
 */
public class TradingInstance implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TradingInstance.class);

    static final String DEFAULT_ASSIGNMENT_ID = "default";

    private final String id;
    private final TradingConfig config;
    private final ExecutionHarness harness;
    private final PersistenceStore store;
    private final NotificationSink notifier;
    private final Clock clock;
    private final StrategyParameters baseParameters;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition wakeUp = stateLock.newCondition();

    private final List<StrategyAssignment> assignments = new ArrayList<>();
    private final Map<String, Map<String, Object>> overrides = new HashMap<>();
    private int nextAssignment;
    private volatile String pair;

    private volatile boolean enabled;
    private volatile boolean stopRequested;
    private volatile Thread loopThread;
    private volatile Instant lastCycleAt;
    private volatile Instant lastRestart;
    private volatile CycleResult lastResult;
    private volatile int restartCount;

    public TradingInstance(String id, TradingConfig config, ExecutionHarness harness,
                           PersistenceStore store, NotificationSink notifier, Clock clock) {
        this.id = id;
        this.config = config;
        this.harness = harness;
        this.store = store;
        this.notifier = notifier;
        this.clock = clock;
        this.baseParameters = config.getStrategy().toParameters();
        restoreSettings(store.getUserSettings(id));
    }

    private void restoreSettings(UserSettings settings) {
        this.enabled = settings.autoTradingEnabled();
        this.pair = settings.tradingPair() != null ? settings.tradingPair() : config.getTrading().getPair();
        for (StrategySettings s : settings.strategies()) {
            try {
                assignments.add(new StrategyAssignment(s.id(), s.symbol(), StrategyType.parse(s.type()),
                        baseParameters.toBuilder().apply(s.parameters()).build(), s.active()));
                overrides.put(s.id(), s.parameters());
            } catch (IllegalArgumentException e) {
                log.warn("[{}] Dropping unusable saved strategy {}: {}", id, s.id(), e.getMessage());
            }
        }
        log.info("[{}] Restored settings: enabled={}, pair={}, strategies={}", id, enabled, pair, assignments.size());
    }

    // ========== Lifecycle ==========

    public void start() {
        stateLock.lock();
        try {
            if (isRunning()) {
                return;
            }
            stopRequested = false;
            lastCycleAt = clock.instant();
            Thread thread = new Thread(this::loop, "autopilot-instance-" + id);
            thread.setDaemon(true);
            loopThread = thread;
            thread.start();
            log.info("[{}] Trading loop started on {}", id, pair);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Signals the loop to stop and waits up to {@code joinTimeoutSeconds} for it to finish.
     */
    public void stop() {
        Thread thread = loopThread;
        stopRequested = true;
        stateLock.lock();
        try {
            wakeUp.signalAll();
        } finally {
            stateLock.unlock();
        }
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(TimeUnit.SECONDS.toMillis(config.getTrading().getJoinTimeoutSeconds()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("[{}] Trading loop did not stop within {}s", id, config.getTrading().getJoinTimeoutSeconds());
        } else {
            log.info("[{}] Trading loop stopped", id);
        }
    }

    /**
     * Stops the loop, waits {@code restartDelaySeconds} and starts it again.
     *
     * @throws IllegalStateException when the instance is disabled
     */
    public void restart() {
        if (!enabled) {
            throw new IllegalStateException("Instance " + id + " is disabled");
        }
        log.info("[{}] Restarting trading loop", id);
        stop();
        try {
            Thread.sleep(TimeUnit.SECONDS.toMillis(config.getTrading().getRestartDelaySeconds()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Restart interrupted before the loop was started again", id);
            return;
        }
        restartCount++;
        lastRestart = clock.instant();
        start();
    }

    public void enable() {
        enabled = true;
        persist();
        start();
    }

    public void disable() {
        enabled = false;
        persist();
        stop();
    }

    private void loop() {
        long heartbeatMs = TimeUnit.SECONDS.toMillis(config.getTrading().getHeartbeatIntervalSeconds());
        long backoffMs = TimeUnit.SECONDS.toMillis(config.getTrading().getErrorBackoffSeconds());
        // a loop that outlived its join timeout exits once a newer loop has been started
        while (!stopRequested && loopThread == Thread.currentThread()) {
            long waitMs;
            try {
                runCycle();
                waitMs = heartbeatMs;
            } catch (RuntimeException e) {
                log.error("[{}] Trading cycle failed", id, e);
                store.appendLog(id, "ERROR", "Trading cycle failed: " + e.getMessage());
                if (config.getNotifications().isEnabled() && config.getNotifications().isErrors()) {
                    notifier.notify("Trading Error", "[" + id + "] " + e.getMessage());
                }
                lastCycleAt = clock.instant();
                waitMs = backoffMs;
            }
            awaitWakeUp(waitMs);
        }
    }

    private void awaitWakeUp(long millis) {
        stateLock.lock();
        try {
            long nanos = TimeUnit.MILLISECONDS.toNanos(millis);
            while (!stopRequested && nanos > 0) {
                nanos = wakeUp.awaitNanos(nanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Runs one cycle for the next active assignment, round robin.
     */
    public CycleResult runCycle() {
        StrategyAssignment assignment;
        stateLock.lock();
        try {
            assignment = nextAssignment();
        } finally {
            stateLock.unlock();
        }
        cycleLock.lock();
        try {
            CycleResult result = harness.runCycle(assignment);
            lastCycleAt = clock.instant();
            lastResult = result;
            return result;
        } finally {
            cycleLock.unlock();
        }
    }

    private StrategyAssignment nextAssignment() {
        List<StrategyAssignment> active = assignments.stream().filter(StrategyAssignment::active).toList();
        if (active.isEmpty()) {
            return defaultAssignment();
        }
        StrategyAssignment next = active.get(nextAssignment % active.size());
        nextAssignment = (nextAssignment + 1) % active.size();
        return next;
    }

    private StrategyAssignment defaultAssignment() {
        return new StrategyAssignment(DEFAULT_ASSIGNMENT_ID, pair,
                StrategyType.parse(config.getTrading().getStrategy()), baseParameters, true);
    }

    // ========== Strategies and pair ==========

    /**
     * Adds a strategy on {@code symbol} (the instance pair when null). Parameters override the
     * configured strategy defaults.
     *
     * @return the new strategy id
     * @throws IllegalArgumentException for unknown or out-of-range parameters
     */
    public String addStrategy(String symbol, StrategyType type, Map<String, Object> parameters) {
        stateLock.lock();
        try {
            String target = symbol != null && !symbol.isBlank() ? symbol : pair;
            StrategyParameters params = baseParameters.toBuilder().apply(parameters).build();
            String strategyId = "s-" + UUID.randomUUID().toString().substring(0, 8);
            assignments.add(new StrategyAssignment(strategyId, target, type, params, true));
            overrides.put(strategyId, parameters != null ? parameters : Map.of());
            persist();
            log.info("[{}] Added strategy {} ({} on {})", id, strategyId, type, target);
            return strategyId;
        } finally {
            stateLock.unlock();
        }
    }

    public boolean removeStrategy(String strategyId) {
        stateLock.lock();
        try {
            boolean removed = assignments.removeIf(a -> a.id().equals(strategyId));
            if (removed) {
                overrides.remove(strategyId);
                nextAssignment = 0;
                persist();
                log.info("[{}] Removed strategy {}", id, strategyId);
            }
            return removed;
        } finally {
            stateLock.unlock();
        }
    }

    public void setTradingPair(String newPair) {
        if (newPair == null || newPair.isBlank()) {
            throw new IllegalArgumentException("pair is required");
        }
        stateLock.lock();
        try {
            log.info("[{}] Trading pair {} -> {}", id, pair, newPair);
            pair = newPair;
            persist();
        } finally {
            stateLock.unlock();
        }
    }

    public List<StrategyAssignment> getAssignments() {
        stateLock.lock();
        try {
            return List.copyOf(assignments);
        } finally {
            stateLock.unlock();
        }
    }

    private void persist() {
        stateLock.lock();
        try {
            List<StrategySettings> strategies = new ArrayList<>();
            for (StrategyAssignment a : assignments) {
                strategies.add(new StrategySettings(a.id(), a.symbol(), a.type().name(),
                        overrides.getOrDefault(a.id(), Map.of()), a.active()));
            }
            store.saveUserSettings(id, new UserSettings(enabled, pair, strategies));
        } finally {
            stateLock.unlock();
        }
    }

    // ========== Status ==========

    public InstanceStatus status() {
        return new InstanceStatus(id, isRunning(), enabled, getPair(), restartCount, lastRestart,
                harness.getTradingHours().isOpen(clock.instant()));
    }

    /**
     * Balance plus open positions marked at their last tick price.
     */
    public PortfolioSnapshot portfolioSnapshot() throws ExchangeException {
        cycleLock.lock();
        try {
            AccountBalance balance = harness.getClient().getBalance();
            List<PortfolioSnapshot.PositionView> views = new ArrayList<>();
            for (ManagedPosition p : harness.getPositions().getOpenPositions()) {
                views.add(PortfolioSnapshot.PositionView.of(p));
            }
            return PortfolioSnapshot.of(balance, views, clock.instant());
        } finally {
            cycleLock.unlock();
        }
    }

    public boolean isRunning() {
        Thread thread = loopThread;
        return thread != null && thread.isAlive() && !stopRequested;
    }

    public String getId() { return id; }
    public boolean isEnabled() { return enabled; }
    public int getRestartCount() { return restartCount; }
    public Instant getLastRestart() { return lastRestart; }
    public Instant getLastCycleAt() { return lastCycleAt; }
    public CycleResult getLastResult() { return lastResult; }
    public ExecutionHarness getHarness() { return harness; }
    public TradingConfig getConfig() { return config; }

    public String getPair() { return pair; }

    /**
     * Time since the loop last finished a cycle, or since it was started.
     */
    public Duration sinceLastCycle() {
        Instant last = lastCycleAt;
        return last == null ? Duration.ZERO : Duration.between(last, clock.instant());
    }

    @Override
    public void close() {
        stop();
        harness.close();
    }
}
