package com.autopilot.execution.position;

import com.autopilot.core.model.OrderType;
import com.autopilot.exchange.ExchangeClient;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.model.OrderRequest;
import com.autopilot.exchange.model.OrderResponse;
import com.autopilot.exchange.model.TimeInForce;
import com.autopilot.execution.journal.ExecutionJournal;
import com.autopilot.execution.journal.PositionEvent;
import com.autopilot.execution.risk.RiskManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Drives each open position through its exit ladder on every price tick:
 * hard stop, breakeven, TP1, trailing stop, TP2.
 *
 * <p>Closing is a reduce-only market order on the opposite side. A position leaves the book only
 * once the exchange reports the close order filled; until then every tick retries the close.
 */
public class PositionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PositionStateMachine.class);
    private static final double SIZE_EPSILON = 1e-9;

    private final ExchangeClient client;
    private final PositionBook book;
    private final RiskManager riskManager;
    private final ExecutionJournal journal;
    private volatile ExitSettings settings;

    public PositionStateMachine(ExchangeClient client, PositionBook book, RiskManager riskManager,
                                ExecutionJournal journal, ExitSettings settings) {
        this.client = client;
        this.book = book;
        this.riskManager = riskManager;
        this.journal = journal;
        this.settings = settings;
    }

    public TickResult tick(ManagedPosition position, double price) {
        if (position.isClosed()) {
            return TickResult.closed(position, position.getMarkPrice(), 0, 0);
        }

        // 1. a close that did not go through last time
        if (position.isExitTriggered()) {
            return submitClose(position, price);
        }

        // 2. mark to market
        position.markToMarket(price);
        double profit = position.profitPercent(price);
        ExitSettings s = settings;

        // 3. hard stop
        if (position.stopHit(price)) {
            ExitReason reason = switch (position.getStopSource()) {
                case INITIAL -> ExitReason.STOP_LOSS;
                case BREAKEVEN -> ExitReason.BREAKEVEN_STOP;
                case TRAILING -> ExitReason.TRAILING_STOP;
            };
            log.info("{} stop hit at {} (stop {}, {})", position.key(), price, position.getStopLossPrice(), reason);
            return close(position, reason, price);
        }

        // 4. breakeven, once
        if (s.breakevenEnabled() && !position.isBreakevenMoved() && profit >= s.breakevenPercent()) {
            if (position.improvesStop(position.getEntryPrice())) {
                position.moveStop(position.getEntryPrice(), ManagedPosition.StopSource.BREAKEVEN);
                journal.log(PositionEvent.stopMoved(position));
                log.info("{} stop moved to breakeven {}", position.key(), position.getEntryPrice());
            }
            position.markBreakevenMoved();
        }

        // 5. TP1 arms trailing, keeps the position open
        if (!position.isTp1Hit() && profit >= s.tp1Percent()) {
            position.markTp1(s.trailingEnabled(), price);
            log.info("{} TP1 reached at {} ({}%)", position.key(), price, String.format("%.2f", profit));
        }

        // 6. trailing
        if (position.isTp1Hit() && position.isTrailingEnabled()) {
            trail(position, price, s);
        }

        // 7. TP2 closes
        if (position.isTp1Hit() && !position.isTp2Hit() && profit >= s.tp2Percent()) {
            position.markTp2();
            log.info("{} TP2 reached at {} ({}%)", position.key(), price, String.format("%.2f", profit));
            return close(position, ExitReason.TAKE_PROFIT_2, price);
        }

        return TickResult.held(position);
    }

    private void trail(ManagedPosition position, double price, ExitSettings s) {
        double reference = position.getTrailingReferencePrice();
        double favourable = position.isLong()
                ? (price - reference) / reference * 100
                : (reference - price) / reference * 100;
        if (favourable < s.trailingStepPercent()) {
            return;
        }
        double candidate = position.isLong()
                ? price * (1 - s.trailingDistancePercent() / 100)
                : price * (1 + s.trailingDistancePercent() / 100);
        if (position.improvesStop(candidate)) {
            position.moveStop(candidate, ManagedPosition.StopSource.TRAILING);
            journal.log(PositionEvent.stopMoved(position));
            log.info("{} trailing stop moved to {}", position.key(), String.format("%.4f", candidate));
        }
        position.setTrailingReferencePrice(price);
    }

    /**
     * Starts closing a position for a reason decided outside the ladder, such as risk reduction.
     */
    public TickResult close(ManagedPosition position, ExitReason reason, double price) {
        position.triggerExit(reason);
        return submitClose(position, price);
    }

    private TickResult submitClose(ManagedPosition position, double price) {
        try {
            String pendingId = position.getPendingCloseOrderId();
            if (pendingId != null) {
                OrderResponse status = client.getOrder(position.getSymbol(), pendingId);
                TickResult result = onCloseResponse(position, status, price);
                if (result != null) {
                    return result;
                }
            }

            OrderRequest request = OrderRequest.builder()
                    .symbol(position.getSymbol())
                    .side(position.getSide().opposite())
                    .type(OrderType.MARKET)
                    .quantity(position.getSize())
                    .timeInForce(TimeInForce.IOC)
                    .reduceOnly(true)
                    .clientOrderId("ap-close-" + UUID.randomUUID().toString().substring(0, 8))
                    .build();
            OrderResponse response = client.placeOrder(request);
            position.setPendingCloseOrderId(response.orderId());
            log.info("{} close submitted ({}), order {}", position.key(), position.getExitReason(), response.orderId());

            if (!response.isFilled() && !response.status().isTerminal()) {
                response = client.getOrder(position.getSymbol(), response.orderId());
            }
            TickResult result = onCloseResponse(position, response, price);
            return result != null ? result : TickResult.pending(position);
        } catch (ExchangeException e) {
            log.warn("{} close failed, retrying next tick: {}", position.key(), e.getMessage());
            return TickResult.pending(position);
        }
    }

    /**
     * Returns the final result for a filled close, null when a new close order is needed,
     * or pending while the order is still working.
     */
    private TickResult onCloseResponse(ManagedPosition position, OrderResponse response, double price) {
        double exitPrice = response.avgFillPrice() != null && response.avgFillPrice() > 0
                ? response.avgFillPrice() : price;

        boolean fullyFilled = response.isFilled()
                || (response.status().isTerminal() && response.filledQuantity() >= position.getSize() - SIZE_EPSILON);
        if (fullyFilled) {
            if (!response.isFilled()) {
                log.warn("{} close order {} ended {} with the full size filled", position.key(),
                        response.orderId(), response.status());
            }
            double quantity = position.getSize();
            double pnl = position.pnlAt(exitPrice, quantity);
            PositionEvent event = PositionEvent.closed(position, exitPrice, pnl);
            position.reduce(quantity, exitPrice);
            position.markToMarket(exitPrice);
            position.markClosed();
            book.remove(position);
            riskManager.recordRealizedPnl(pnl);
            journal.log(event);
            log.info("{} closed at {} ({}), PnL {}", position.key(), exitPrice, position.getExitReason(),
                    String.format("%.2f", pnl));
            return TickResult.closed(position, exitPrice, quantity, pnl);
        }

        if (response.status().isTerminal()) {
            position.setPendingCloseOrderId(null);
            if (response.filledQuantity() > 0) {
                double pnl = position.pnlAt(exitPrice, response.filledQuantity());
                position.reduce(response.filledQuantity(), exitPrice);
                riskManager.recordRealizedPnl(pnl);
                log.warn("{} close order {} ended {} after partial fill {}, {} left",
                        position.key(), response.orderId(), response.status(),
                        response.filledQuantity(), position.getSize());
            } else {
                log.warn("{} close order {} ended {}", position.key(), response.orderId(), response.status());
            }
            return null;
        }
        return TickResult.pending(position);
    }

    public void updateSettings(ExitSettings newSettings) {
        this.settings = newSettings;
    }

    public ExitSettings getSettings() {
        return settings;
    }
}
