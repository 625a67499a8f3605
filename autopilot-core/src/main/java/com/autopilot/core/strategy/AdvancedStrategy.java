package com.autopilot.core.strategy;

import com.autopilot.core.indicators.BollingerBands;
import com.autopilot.core.indicators.EMA;
import com.autopilot.core.indicators.MACD;
import com.autopilot.core.indicators.RSI;
import com.autopilot.core.indicators.Volume;
import com.autopilot.core.model.Signal;
import com.autopilot.core.model.SignalAction;

/**
 * Majority vote over RSI, price vs EMA and MACD vs its signal line.
 * Bollinger band touches and volume spikes raise confidence but do not vote.
 */
public class AdvancedStrategy implements Strategy {

    static final double CONFIRMATION_BONUS = 0.1;

    @Override
    public StrategyType type() {
        return StrategyType.ADVANCED;
    }

    @Override
    public Signal evaluate(MarketSnapshot snapshot, StrategyParameters params) {
        Signal invalid = Signals.precheck(snapshot, type(), params.warmupBars());
        if (invalid != null) return invalid;

        var candles = snapshot.candles();
        int last = candles.size() - 1;
        double price = snapshot.price();

        double rsi = RSI.latest(candles, params.rsiPeriod());
        double ema = EMA.calculate(candles, params.emaPeriod())[last];
        MACD.Result macd = MACD.calculate(candles, params.macdFast(), params.macdSlow(), params.macdSignal());
        double macdLine = macd.line()[last];
        double macdSignal = macd.signal()[last];

        int buyVotes = 0;
        int sellVotes = 0;

        String rsiVote = "neutral";
        if (rsi < params.rsiOversold()) {
            buyVotes++;
            rsiVote = "buy";
        } else if (rsi > params.rsiOverbought()) {
            sellVotes++;
            rsiVote = "sell";
        }

        String emaVote;
        if (price > ema) {
            buyVotes++;
            emaVote = "buy";
        } else {
            sellVotes++;
            emaVote = "sell";
        }

        String macdVote;
        if (macdLine > macdSignal) {
            buyVotes++;
            macdVote = "buy";
        } else {
            sellVotes++;
            macdVote = "sell";
        }

        String votes = String.format("(RSI:%s %.2f, EMA:%s, MACD:%s)", rsiVote, rsi, emaVote, macdVote);
        if (buyVotes < 2 && sellVotes < 2) {
            return Signal.hold(snapshot.symbol(), type().name(), "Advanced: no majority " + votes);
        }

        SignalAction action = buyVotes >= 2 ? SignalAction.BUY : SignalAction.SELL;
        int winning = action == SignalAction.BUY ? buyVotes : sellVotes;
        double confidence = winning / 3.0;

        BollingerBands.Result bands = BollingerBands.calculate(candles, params.bollingerPeriod(), params.bollingerStdDev());
        boolean bandConfirms = action == SignalAction.BUY
                ? price <= bands.lower()[last]
                : price >= bands.upper()[last];
        if (bandConfirms) {
            confidence += CONFIRMATION_BONUS;
        }
        if (Volume.isSpike(candles, params.volumeEmaPeriod(), params.volumeMultiplier())) {
            confidence += CONFIRMATION_BONUS;
        }

        String reason = String.format("Advanced: %d/3 %s signals %s", winning,
                action == SignalAction.BUY ? "buy" : "sell", votes);
        return Signals.entry(snapshot, params, type(), action, Math.min(1.0, confidence), reason);
    }
}
