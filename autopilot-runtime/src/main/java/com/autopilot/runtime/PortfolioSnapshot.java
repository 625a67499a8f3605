package com.autopilot.runtime;

import com.autopilot.exchange.model.AccountBalance;
import com.autopilot.exchange.model.OrderSide;
import com.autopilot.execution.position.ManagedPosition;
import com.autopilot.execution.position.PositionPhase;

import java.time.Instant;
import java.util.List;

/**
 * Account balance plus open positions. {@code totalValue} is the balance total plus unrealized PnL.
 */
public record PortfolioSnapshot(
    AccountBalance balance,
    List<PositionView> positions,
    double totalValue,
    double totalUnrealizedPnl,
    Instant timestamp
) {
    public PortfolioSnapshot {
        positions = positions != null ? List.copyOf(positions) : List.of();
    }

    public static PortfolioSnapshot of(AccountBalance balance, List<PositionView> positions, Instant at) {
        double unrealized = positions.stream().mapToDouble(PositionView::unrealizedPnl).sum();
        return new PortfolioSnapshot(balance, positions, balance.total() + unrealized, unrealized, at);
    }

    public record PositionView(
        String symbol,
        OrderSide side,
        double size,
        double entryPrice,
        double markPrice,
        double unrealizedPnl,
        int leverage,
        double stopLossPrice,
        PositionPhase phase
    ) {
        public static PositionView of(ManagedPosition p) {
            return new PositionView(p.getSymbol(), p.getSide(), p.getSize(), p.getEntryPrice(),
                    p.getMarkPrice(), p.getUnrealizedPnl(), p.getLeverage(), p.getStopLossPrice(), p.phase());
        }
    }

    @Override
    public String toString() {
        return String.format("balance %.2f %s (available %.2f), %d open positions, unrealized %.2f, total %.2f",
                balance.total(), balance.currency(), balance.available(), positions.size(),
                totalUnrealizedPnl, totalValue);
    }
}
