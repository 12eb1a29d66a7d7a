package com.strategylab.optimizer.support;

import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.domain.strategy.Strategy;
import com.strategylab.optimizer.domain.strategy.StrategyContext;
import com.strategylab.optimizer.domain.strategy.StrategyType;
import com.strategylab.optimizer.indicator.IndicatorSpec;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits preset signals by bar index and HOLD everywhere else.
 */
public class ScriptedStrategy implements Strategy {

    private final Map<Integer, Signal> script = new HashMap<>();
    private final int minimumBars;

    public ScriptedStrategy() {
        this(1);
    }

    public ScriptedStrategy(int minimumBars) {
        this.minimumBars = minimumBars;
    }

    public ScriptedStrategy at(int index, Signal signal) {
        script.put(index, signal);
        return this;
    }

    @Override
    public Signal generateSignal(StrategyContext context) {
        return script.getOrDefault(context.index(), Signal.HOLD);
    }

    @Override
    public List<IndicatorSpec> requiredIndicators() {
        return List.of();
    }

    @Override
    public int minimumBars() {
        return minimumBars;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.BUY_AND_HOLD;
    }

    @Override
    public String getName() {
        return "Scripted" + script;
    }
}
