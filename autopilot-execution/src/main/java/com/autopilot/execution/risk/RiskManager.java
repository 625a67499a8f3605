package com.autopilot.execution.risk;

import com.autopilot.core.model.Signal;
import com.autopilot.exchange.model.AccountBalance;
import com.autopilot.exchange.model.OrderSide;
import com.autopilot.execution.order.OrderManager;
import com.autopilot.execution.position.ManagedPosition;
import com.autopilot.execution.position.PositionBook;
import com.autopilot.execution.position.PositionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pre-trade gate, post-trade assessment and daily loss/trade bookkeeping for one instance.
 */
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private volatile RiskLimits limits;
    private final PositionBook positions;
    private final OrderManager orders;
    private final Clock clock;

    private LocalDate tradingDay;
    private double dailyRealizedPnl;
    private int dailyTradeCount;

    public RiskManager(RiskLimits limits, PositionBook positions, OrderManager orders, Clock clock) {
        this.limits = limits;
        this.positions = positions;
        this.orders = orders;
        this.clock = clock;
        this.tradingDay = LocalDate.now(clock);
    }

    // ========== Pre-trade ==========

    /**
     * Approves or rejects an actionable signal. Approval counts towards the daily trade limit.
     */
    public synchronized RiskDecision check(Signal signal, AccountBalance balance, int leverage) {
        rollDayIfNeeded();
        RiskLimits l = limits;

        if (-dailyRealizedPnl > l.maxDailyLoss()) {
            return reject(String.format("Daily loss limit reached: %.2f > %.2f", -dailyRealizedPnl, l.maxDailyLoss()));
        }
        if (dailyTradeCount >= l.maxDailyTrades()) {
            return reject(String.format("Daily trade limit reached: %d", dailyTradeCount));
        }
        if (signal.confidence() < l.minConfidence()) {
            return reject(String.format("Confidence %.2f below minimum %.2f", signal.confidence(), l.minConfidence()));
        }

        OrderSide side = OrderSide.fromAction(signal.action());
        PositionKey key = new PositionKey(signal.symbol(), side);
        if (positions.contains(key)) {
            return reject("Position already open for " + key);
        }
        if (orders.hasOpenOrder(signal.symbol(), side)) {
            return reject("Order already pending for " + key);
        }

        double requiredMargin = signal.notionalValue() / Math.max(1, leverage) * l.marginBuffer();
        if (balance.available() < requiredMargin) {
            return reject(String.format("Insufficient margin: need %.2f, available %.2f",
                    requiredMargin, balance.available()));
        }

        dailyTradeCount++;
        return RiskDecision.approve();
    }

    private RiskDecision reject(String reason) {
        log.info("Risk rejected: {}", reason);
        return RiskDecision.reject(reason);
    }

    // ========== Post-trade ==========

    public RiskAssessment assess(List<ManagedPosition> open, double totalBalance) {
        RiskLimits l = limits;
        double largest = open.stream().mapToDouble(ManagedPosition::notionalValue).max().orElse(0);
        double concentration;
        if (totalBalance > 0) {
            concentration = largest / totalBalance;
        } else {
            concentration = largest > 0 ? Double.POSITIVE_INFINITY : 0;
        }
        double closest = open.stream()
                .mapToDouble(ManagedPosition::liquidationDistance)
                .min().orElse(Double.POSITIVE_INFINITY);

        List<String> warnings = new ArrayList<>();
        if (concentration > l.maxConcentration()) {
            warnings.add(String.format("Concentration %.2f exceeds %.2f", concentration, l.maxConcentration()));
        }
        if (closest < l.minLiquidationDistance()) {
            warnings.add(String.format("Liquidation distance %.3f below %.3f", closest, l.minLiquidationDistance()));
        }

        List<ManagedPosition> toReduce = List.of();
        if (!warnings.isEmpty()) {
            toReduce = open.stream()
                    .sorted(Comparator.comparingInt(ManagedPosition::getLeverage).reversed()
                            .thenComparing(Comparator.comparingDouble(ManagedPosition::notionalValue).reversed()))
                    .limit(Math.max(0, l.maxPositionsToReduce()))
                    .toList();
            warnings.forEach(w -> log.warn("Risk assessment: {}", w));
        }
        return new RiskAssessment(concentration, closest, toReduce, warnings);
    }

    // ========== Daily bookkeeping ==========

    public synchronized void recordRealizedPnl(double pnl) {
        rollDayIfNeeded();
        dailyRealizedPnl += pnl;
        if (isDailyLossBreached()) {
            log.warn("Daily loss limit reached: realized {}", String.format("%.2f", dailyRealizedPnl));
        }
    }

    public synchronized boolean isDailyLossBreached() {
        return -dailyRealizedPnl > limits.maxDailyLoss();
    }

    /**
     * Resets the daily counters when the calendar date has changed. Returns true if it did.
     */
    public synchronized boolean rollDayIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (today.equals(tradingDay)) {
            return false;
        }
        log.info("New trading day {}: resetting daily PnL {} and trade count {}",
                today, String.format("%.2f", dailyRealizedPnl), dailyTradeCount);
        tradingDay = today;
        resetDaily();
        return true;
    }

    public synchronized void resetDaily() {
        dailyRealizedPnl = 0;
        dailyTradeCount = 0;
    }

    public synchronized double getDailyRealizedPnl() {
        return dailyRealizedPnl;
    }

    public synchronized int getDailyTradeCount() {
        return dailyTradeCount;
    }

    public void updateLimits(RiskLimits newLimits) {
        this.limits = newLimits;
    }

    public RiskLimits getLimits() {
        return limits;
    }
}
