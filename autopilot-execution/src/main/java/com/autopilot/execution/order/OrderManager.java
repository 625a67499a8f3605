package com.autopilot.execution.order;

import com.autopilot.exchange.ExchangeClient;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.model.OrderRequest;
import com.autopilot.exchange.model.OrderResponse;
import com.autopilot.exchange.model.OrderSide;
import com.autopilot.exchange.model.OrderStatus;
import com.autopilot.execution.journal.ExecutionJournal;
import com.autopilot.execution.journal.OrderEvent;
import com.autopilot.execution.position.PositionBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Submits entry orders and follows them to a terminal status by polling the exchange.
 * Filled quantity of an entry opens (or adds to) the position for its (symbol, side).
 */
public class OrderManager {

    private static final Logger log = LoggerFactory.getLogger(OrderManager.class);

    private final ExchangeClient client;
    private final PositionBook positions;
    private final ExecutionJournal journal;

    // orderId -> LiveOrder
    private final Map<String, LiveOrder> activeOrders = new ConcurrentHashMap<>();

    public OrderManager(ExchangeClient client, PositionBook positions, ExecutionJournal journal) {
        this.client = client;
        this.positions = positions;
        this.journal = journal;
    }

    /**
     * Submit an entry order and track it. Exchange errors propagate to the caller untouched.
     */
    public LiveOrder submitOrder(OrderRequest request, String strategyName,
                                 double referencePrice, double stopLoss, int leverage) throws ExchangeException {
        OrderResponse response = client.placeOrder(request);

        LiveOrder order = new LiveOrder(response.orderId(), strategyName, request,
                referencePrice, stopLoss, leverage);
        journal.log(OrderEvent.placed(order));
        log.info("Order submitted: {} {} {} {} @ {} (id={})",
                strategyName, request.side(), request.quantity(), request.symbol(),
                referencePrice, response.orderId());

        order.applyUpdate(response);
        if (order.isTerminal()) {
            journal.log(OrderEvent.updated(order));
            complete(order);
        } else {
            activeOrders.put(order.getOrderId(), order);
        }
        return order;
    }

    /**
     * Refreshes every non-terminal order. Returns the orders that reached a terminal status.
     * A failed lookup leaves the order active for the next poll.
     */
    public List<LiveOrder> pollOpenOrders() {
        List<LiveOrder> completed = new ArrayList<>();
        for (LiveOrder order : List.copyOf(activeOrders.values())) {
            OrderResponse update;
            try {
                update = client.getOrder(order.getSymbol(), order.getOrderId());
            } catch (ExchangeException e) {
                log.warn("Order status lookup failed for {} {}: {}",
                        order.getSymbol(), order.getOrderId(), e.getMessage());
                continue;
            }
            if (order.applyUpdate(update)) {
                journal.log(OrderEvent.updated(order));
            }
            if (order.isTerminal()) {
                activeOrders.remove(order.getOrderId());
                complete(order);
                completed.add(order);
            }
        }
        return completed;
    }

    public void cancelOrder(String symbol, String orderId) throws ExchangeException {
        OrderResponse response = client.cancelOrder(symbol, orderId);
        LiveOrder order = activeOrders.get(orderId);
        if (order != null) {
            order.applyUpdate(response);
            if (!order.isTerminal()) {
                order.updateStatus(OrderStatus.CANCELED);
            }
            activeOrders.remove(orderId);
            journal.log(OrderEvent.updated(order));
            complete(order);
        }
    }

    public boolean hasOpenOrder(String symbol, OrderSide side) {
        return activeOrders.values().stream()
                .anyMatch(o -> !o.isTerminal() && o.getSymbol().equals(symbol) && o.getSide() == side);
    }

    public List<LiveOrder> getActiveOrders() {
        return activeOrders.values().stream()
                .filter(o -> !o.isTerminal())
                .toList();
    }

    private void complete(LiveOrder order) {
        if (order.getFilledQuantity() > 0) {
            positions.onEntryFill(order);
        }
        log.info("Order {} {} {} finished as {} (filled {} @ {})",
                order.getOrderId(), order.getSide(), order.getSymbol(), order.getStatus(),
                order.getFilledQuantity(), order.getAvgFillPrice());
    }
}
