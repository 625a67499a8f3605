package com.autopilot.execution.harness;

import com.autopilot.core.model.OrderType;
import com.autopilot.core.model.Signal;
import com.autopilot.core.strategy.RsiFilter;
import com.autopilot.exchange.ExchangeClient;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.feed.PriceSource;
import com.autopilot.exchange.model.AccountBalance;
import com.autopilot.exchange.model.ExchangePosition;
import com.autopilot.exchange.model.KlineInterval;
import com.autopilot.exchange.model.OrderRequest;
import com.autopilot.exchange.model.OrderSide;
import com.autopilot.exchange.model.OrderStatus;
import com.autopilot.exchange.model.TimeInForce;
import com.autopilot.exchange.model.TradingConfig;
import com.autopilot.execution.journal.ExecutionJournal;
import com.autopilot.execution.order.LiveOrder;
import com.autopilot.execution.order.OrderManager;
import com.autopilot.execution.position.ExitReason;
import com.autopilot.execution.position.ExitSettings;
import com.autopilot.execution.position.ManagedPosition;
import com.autopilot.execution.position.PositionBook;
import com.autopilot.execution.position.PositionStateMachine;
import com.autopilot.execution.position.TickResult;
import com.autopilot.execution.risk.RiskAssessment;
import com.autopilot.execution.risk.RiskDecision;
import com.autopilot.execution.risk.RiskLimits;
import com.autopilot.execution.risk.RiskManager;
import com.autopilot.execution.spi.NotificationSink;
import com.autopilot.execution.spi.PersistenceStore;
import com.autopilot.execution.spi.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * One trading cycle for one instance: manage what is open, then turn a fresh signal into at most
 * one order. Every decision ends as a {@link CycleResult}; exchange and strategy failures become
 * HOLD with a reason instead of propagating.
 *
 * <p>Not thread-safe. The owning instance calls {@link #runCycle} from one thread at a time.
 */
public class ExecutionHarness implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHarness.class);

    private final String instanceId;
    private final TradingConfig config;
    private final ExchangeClient client;
    private final PriceSource prices;
    private final PersistenceStore store;
    private final NotificationSink notifier;
    private final Clock clock;

    private final TradingHours tradingHours;
    private final PositionBook positions;
    private final OrderManager orders;
    private final RiskManager riskManager;
    private final PositionStateMachine stateMachine;
    private final HealthCheck healthCheck;
    private final StrategyEvaluator evaluator;
    private final MarketSnapshotLoader snapshots;
    private final ExecutionStats stats = new ExecutionStats();
    private final Set<String> leverageApplied = new HashSet<>();

    private volatile HealthReport lastHealth;

    public ExecutionHarness(String instanceId, TradingConfig config, ExchangeClient client, PriceSource prices,
                            ExecutionJournal journal, PersistenceStore store, NotificationSink notifier, Clock clock) {
        this.instanceId = instanceId;
        this.config = config;
        this.client = client;
        this.prices = prices;
        this.store = store;
        this.notifier = notifier;
        this.clock = clock;

        TradingConfig.TradingSection trading = config.getTrading();
        this.tradingHours = TradingHours.fromConfig(config.getTradingHours());
        this.positions = new PositionBook(journal);
        this.orders = new OrderManager(client, positions, journal);
        this.riskManager = new RiskManager(RiskLimits.fromConfig(config.getRisk()), positions, orders, clock);
        this.stateMachine = new PositionStateMachine(client, positions, riskManager, journal,
                ExitSettings.fromConfig(config.getExits()));
        this.healthCheck = new HealthCheck(client);
        this.evaluator = new StrategyEvaluator(instanceId, trading.getStrategyTimeoutSeconds() * 1000L);
        this.snapshots = new MarketSnapshotLoader(client, prices,
                KlineInterval.parse(trading.getInterval()), KlineInterval.parse(trading.getHigherInterval()),
                trading.getCandleLimit(), clock);
    }

    public CycleResult runCycle(StrategyAssignment assignment) {
        String symbol = assignment.symbol();
        String strategyName = assignment.type().name();

        riskManager.rollDayIfNeeded();
        manageOpenPositions();

        // 1. trading hours
        if (!tradingHours.isOpen(clock.instant())) {
            log.debug("[{}] Outside trading hours, skipping", instanceId);
            return CycleResult.skipped(Signal.hold(symbol, strategyName, "Outside trading hours"));
        }

        // 2. balance
        AccountBalance balance;
        try {
            balance = client.getBalance();
        } catch (ExchangeException e) {
            log.warn("[{}] Failed to get balance: {}", instanceId, e.getMessage());
            return CycleResult.hold(Signal.hold(symbol, strategyName, "Failed to get balance: " + e.getMessage()));
        }
        double minBalance = config.getTrading().getMinBalance();
        if (balance.total() < minBalance) {
            log.warn("[{}] Balance {} below minimum {}", instanceId, balance.total(), minBalance);
            return CycleResult.hold(Signal.hold(symbol, strategyName,
                    String.format("Insufficient balance: %.2f (minimum %.2f)", balance.total(), minBalance)));
        }
        assessRisk(balance);

        // 3. health
        HealthReport health = healthCheck.run(balance, config, assignment.active());
        lastHealth = health;
        if (health.status() == HealthStatus.UNHEALTHY) {
            log.error("[{}] System unhealthy, skipping evaluation: {}", instanceId, health);
            return CycleResult.hold(Signal.hold(symbol, strategyName, "System unhealthy"));
        }
        if (health.status() == HealthStatus.DEGRADED) {
            log.warn("[{}] System degraded, proceeding with caution: {}", instanceId, health);
        }

        // 4-6. evaluate under timeout, fallback, stats
        boolean withHigher = MarketSnapshotLoader.needsHigherTimeframe(assignment.type(), assignment.parameters());
        double available = balance.available();
        StrategyEvaluator.Evaluation evaluation = evaluator.evaluate(assignment,
                () -> snapshots.load(symbol, available, withHigher));
        ExecutionRecord record = stats.record(strategyName, evaluation.success(), evaluation.elapsedMs());
        log.info("[{}] {} -> {} ({}), {}", instanceId, strategyName, evaluation.signal().action(),
                evaluation.signal().reason(), record);

        Signal signal = evaluation.signal();
        if (signal.isHold()) {
            return CycleResult.hold(signal);
        }

        // 7. validate, filter, gate, submit
        try {
            SignalValidator.validate(signal);
        } catch (IllegalArgumentException e) {
            log.warn("[{}] Invalid signal from {}: {}", instanceId, strategyName, e.getMessage());
            return CycleResult.hold(signal.withHold("Invalid signal: " + e.getMessage()));
        }

        if (evaluation.snapshot() != null) {
            signal = RsiFilter.apply(signal, evaluation.snapshot(), assignment.parameters());
            if (signal.isHold()) {
                log.info("[{}] {}", instanceId, signal.reason());
                return CycleResult.hold(signal);
            }
        }

        int leverage = config.getTrading().getLeverage();
        RiskDecision decision = riskManager.check(signal, balance, leverage);
        if (!decision.approved()) {
            return CycleResult.rejected(signal.withHold(decision.reason()));
        }

        return submit(signal, leverage);
    }

    private CycleResult submit(Signal signal, int leverage) {
        LiveOrder order;
        try {
            OrderRequest request = buildRequest(signal);
            ensureLeverage(signal.symbol(), leverage);
            order = orders.submitOrder(request, signal.strategyName(), signal.price(), signal.stopLoss(), leverage);
        } catch (ExchangeException e) {
            log.error("[{}] Order failed for {} {}: {}", instanceId, signal.action(), signal.symbol(), e.getMessage());
            notifyError("Order Failed", signal.action() + " " + signal.symbol() + ": " + e.getMessage());
            return CycleResult.failed(signal.withHold("Order failed: " + e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.warn("[{}] Unusable order request: {}", instanceId, e.getMessage());
            return CycleResult.hold(signal.withHold("Invalid signal: " + e.getMessage()));
        }

        store.appendTrade(new TradeRecord(instanceId, signal.strategyName(), signal.symbol(),
                order.getSide(), order.getType(), order.getRequestedQuantity(), signal.price(),
                order.getOrderId(), order.getStatus(), signal.confidence(), signal.reason(), null, clock.instant()));
        notifyTrade("Order Placed", String.format("%s %.8f %s @ %.2f (order %s, %s)",
                signal.action(), signal.quantity(), signal.symbol(), signal.price(),
                order.getOrderId(), order.getStatus()));
        return CycleResult.submitted(signal, order);
    }

    OrderRequest buildRequest(Signal signal) {
        OrderType type = signal.orderType() != null ? signal.orderType() : config.getTrading().getOrderType();
        OrderRequest.Builder builder = OrderRequest.builder()
                .symbol(signal.symbol())
                .side(OrderSide.fromAction(signal.action()))
                .type(type)
                .quantity(signal.quantity())
                .clientOrderId("ap-" + UUID.randomUUID().toString().substring(0, 12));
        switch (type) {
            case MARKET -> builder.timeInForce(config.getTrading().getTimeInForce());
            case LIMIT -> builder.price(signal.price()).timeInForce(TimeInForce.GTC);
            case STOP_MARKET -> builder.triggerPrice(signal.stopLoss() > 0 ? signal.stopLoss() : signal.price());
            case TAKE_PROFIT_MARKET -> builder.triggerPrice(signal.takeProfit() > 0 ? signal.takeProfit() : signal.price());
            case TRAILING_STOP_MARKET -> builder.callbackRate(config.getExits().getTrailingDistancePercent());
        }
        return builder.build();
    }

    private void ensureLeverage(String symbol, int leverage) throws ExchangeException {
        if (leverageApplied.contains(symbol)) {
            return;
        }
        client.setLeverage(symbol, leverage, config.getTrading().getMarginMode());
        leverageApplied.add(symbol);
    }

    // ========== Housekeeping ==========

    /**
     * Fill monitor plus one state machine tick per open position. Never throws.
     */
    void manageOpenPositions() {
        for (LiveOrder order : orders.pollOpenOrders()) {
            if (order.getStatus() == OrderStatus.FILLED) {
                notifyTrade("Order Filled", String.format("%s %.8f %s @ %.2f",
                        order.getSide(), order.getFilledQuantity(), order.getSymbol(), order.getAvgFillPrice()));
            } else {
                log.info("[{}] Order {} ended {}", instanceId, order.getOrderId(), order.getStatus());
            }
        }

        Map<String, Double> marks = new HashMap<>();
        for (ManagedPosition position : positions.getOpenPositions()) {
            Double price = marks.get(position.getSymbol());
            if (price == null) {
                try {
                    price = prices.currentPrice(position.getSymbol());
                    marks.put(position.getSymbol(), price);
                } catch (ExchangeException e) {
                    log.warn("[{}] No price for {}, position not ticked: {}",
                            instanceId, position.getSymbol(), e.getMessage());
                    continue;
                }
            }
            onTick(stateMachine.tick(position, price));
        }
    }

    private void assessRisk(AccountBalance balance) {
        List<ManagedPosition> open = positions.getOpenPositions();
        if (open.isEmpty()) {
            return;
        }
        refreshLiquidationPrices(open);
        RiskAssessment assessment = riskManager.assess(open, balance.total());
        if (!assessment.needsReduction()) {
            return;
        }
        if (!riskManager.getLimits().autoReduce()) {
            assessment.toReduce().forEach(p -> log.warn("[{}] Risk suggests reducing {} ({}x, notional {})",
                    instanceId, p.key(), p.getLeverage(), String.format("%.2f", p.notionalValue())));
            return;
        }
        for (ManagedPosition position : assessment.toReduce()) {
            log.warn("[{}] Auto-reducing {}: {}", instanceId, position.key(), assessment.warnings());
            onTick(stateMachine.close(position, ExitReason.RISK_REDUCTION, position.getMarkPrice()));
        }
    }

    private void refreshLiquidationPrices(List<ManagedPosition> open) {
        try {
            for (ExchangePosition remote : client.getPositions()) {
                for (ManagedPosition local : open) {
                    if (local.getSymbol().equals(remote.symbol()) && local.getSide() == remote.side()) {
                        local.setLiquidationPrice(remote.liquidationPrice());
                    }
                }
            }
        } catch (ExchangeException e) {
            log.debug("[{}] Could not refresh liquidation prices: {}", instanceId, e.getMessage());
        }
    }

    private void onTick(TickResult result) {
        if (!result.isClosed()) {
            return;
        }
        ManagedPosition position = result.position();
        store.appendTrade(new TradeRecord(instanceId, position.getStrategyName(), position.getSymbol(),
                position.getSide().opposite(), OrderType.MARKET, result.closedQuantity(),
                result.exitPrice(), null, OrderStatus.FILLED, 0,
                String.valueOf(position.getExitReason()), result.realizedPnl(), clock.instant()));
        notifyTrade("Position Closed", String.format("%s %s closed (%s) @ %.2f, PnL %.2f",
                position.getSymbol(), position.getSide(), position.getExitReason(),
                result.exitPrice(), result.realizedPnl()));
    }

    // ========== Notifications ==========

    private void notifyTrade(String title, String message) {
        TradingConfig.NotificationConfig n = config.getNotifications();
        if (n.isEnabled() && n.isTrades()) {
            notifier.notify(title, "[" + instanceId + "] " + message);
        }
    }

    private void notifyError(String title, String message) {
        TradingConfig.NotificationConfig n = config.getNotifications();
        if (n.isEnabled() && n.isErrors()) {
            notifier.notify(title, "[" + instanceId + "] " + message);
        }
    }

    // ========== Accessors ==========

    public String getInstanceId() { return instanceId; }
    public TradingConfig getConfig() { return config; }
    public ExchangeClient getClient() { return client; }
    public TradingHours getTradingHours() { return tradingHours; }
    public PositionBook getPositions() { return positions; }
    public OrderManager getOrders() { return orders; }
    public RiskManager getRiskManager() { return riskManager; }
    public ExecutionStats getStats() { return stats; }
    public HealthReport getLastHealth() { return lastHealth; }

    @Override
    public void close() {
        evaluator.close();
    }
}
