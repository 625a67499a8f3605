package com.autopilot.execution.position;

import com.autopilot.execution.journal.ExecutionJournal;
import com.autopilot.execution.journal.PositionEvent;
import com.autopilot.execution.order.LiveOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open positions of one instance, keyed by (symbol, side).
 */
public class PositionBook {

    private static final Logger log = LoggerFactory.getLogger(PositionBook.class);

    private final Map<PositionKey, ManagedPosition> positions = new ConcurrentHashMap<>();
    private final ExecutionJournal journal;

    public PositionBook(ExecutionJournal journal) {
        this.journal = journal;
    }

    /**
     * Opens the position for a filled entry, or averages into the existing one on the same key.
     */
    public ManagedPosition onEntryFill(LiveOrder order) {
        PositionKey key = new PositionKey(order.getSymbol(), order.getSide());
        double quantity = order.getFilledQuantity();
        double price = order.getAvgFillPrice() > 0 ? order.getAvgFillPrice() : order.getPrice();

        ManagedPosition position = positions.get(key);
        if (position == null) {
            position = new ManagedPosition(order.getStrategyName(), order.getSymbol(), order.getSide(),
                    quantity, price, order.getStopLoss(), order.getLeverage());
            positions.put(key, position);
            journal.log(PositionEvent.opened(position));
            log.info("Position opened: {} {} {} @ {} stop={}",
                    key, order.getStrategyName(), quantity, price, order.getStopLoss());
        } else {
            position.addFill(quantity, price);
            log.info("Position increased: {} size={} avg={}", key, position.getSize(), position.getEntryPrice());
        }
        return position;
    }

    /**
     * Put back a position recovered from the exchange or a previous run.
     */
    public void restore(ManagedPosition position) {
        positions.put(position.key(), position);
    }

    public Optional<ManagedPosition> get(PositionKey key) {
        return Optional.ofNullable(positions.get(key));
    }

    public boolean contains(PositionKey key) {
        return positions.containsKey(key);
    }

    public List<ManagedPosition> getOpenPositions() {
        return new ArrayList<>(positions.values());
    }

    public int size() {
        return positions.size();
    }

    void remove(ManagedPosition position) {
        positions.remove(position.key(), position);
    }
}
