package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.indicator.IndicatorSpec;

import java.util.List;

/**
 * Simple buy-and-hold benchmark.
 * Signals BUY on every bar with a price; the engine opens once and holds until the data ends.
 * Stop-loss and take-profit levels do not apply, so the benchmark makes exactly one round trip.
 */
public class BuyAndHoldStrategy implements Strategy {

    @Override
    public Signal generateSignal(StrategyContext context) {
        return context.close(context.index()) != null ? Signal.BUY : Signal.HOLD;
    }

    @Override
    public List<IndicatorSpec> requiredIndicators() {
        return List.of();
    }

    @Override
    public int minimumBars() {
        return 1;
    }

    @Override
    public boolean allowsRiskExits() {
        return false;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.BUY_AND_HOLD;
    }

    @Override
    public String getName() {
        return "BuyAndHold";
    }
}
