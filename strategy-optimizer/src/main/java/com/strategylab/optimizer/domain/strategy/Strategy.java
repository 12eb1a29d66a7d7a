package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.indicator.IndicatorSpec;

import java.util.List;

/**
 * Strategy interface for trading decisions.
 * Implementations are immutable and derive each signal only from the context they are given,
 * so one instance can serve many runs and re-running a series gives the same signals.
 */
public interface Strategy {

    /**
     * Called once per bar in increasing index order.
     *
     * @param context bars and indicators up to the current bar
     * @return the decision for the current bar; HOLD while warming up or on missing data
     */
    Signal generateSignal(StrategyContext context);

    /**
     * Indicators the engine must compute before the first call.
     */
    List<IndicatorSpec> requiredIndicators();

    /**
     * Bars needed before the first non-HOLD signal is possible.
     */
    int minimumBars();

    /**
     * Whether the engine may close this strategy's positions on stop-loss or take-profit levels.
     */
    default boolean allowsRiskExits() {
        return true;
    }

    StrategyType getType();

    /**
     * Get the strategy name, including its parameters.
     */
    String getName();
}
