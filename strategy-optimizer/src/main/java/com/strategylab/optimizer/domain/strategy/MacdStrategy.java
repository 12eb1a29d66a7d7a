package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.indicator.IndicatorSeries;
import com.strategylab.optimizer.indicator.IndicatorSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * MACD signal-line crossover strategy.
 * Buys when the MACD line crosses above its signal line, sells when it crosses below.
 */
@Slf4j
public class MacdStrategy implements Strategy {

    public static final int DEFAULT_FAST = 12;
    public static final int DEFAULT_SLOW = 26;
    public static final int DEFAULT_SIGNAL = 9;

    private final int fast;
    private final int slow;
    private final int signal;
    private final IndicatorSpec macd;

    public MacdStrategy(int fast, int slow, int signal) {
        if (fast <= 0 || fast >= slow) {
            throw new InvalidParameterException("MACD periods must satisfy 0 < fast < slow, got " + fast + "/" + slow);
        }
        if (signal <= 0) {
            throw new InvalidParameterException("MACD signal period must be positive: " + signal);
        }
        this.fast = fast;
        this.slow = slow;
        this.signal = signal;
        this.macd = IndicatorSpec.macd(fast, slow, signal);
    }

    @Override
    public Signal generateSignal(StrategyContext context) {
        int t = context.index();
        if (t < 1 || context.close(t) == null) {
            return Signal.HOLD;
        }

        Signal decision = Crossovers.cross(
                context.indicator(macd, IndicatorSeries.MACD_LINE, t - 1),
                context.indicator(macd, IndicatorSeries.SIGNAL_LINE, t - 1),
                context.indicator(macd, IndicatorSeries.MACD_LINE, t),
                context.indicator(macd, IndicatorSeries.SIGNAL_LINE, t));

        if (decision != Signal.HOLD) {
            log.debug("MACD: {} at bar {}", decision, t);
        }
        return decision;
    }

    @Override
    public List<IndicatorSpec> requiredIndicators() {
        return List.of(macd);
    }

    @Override
    public int minimumBars() {
        // signal line first defined at slow + signal - 2; a cross needs the bar after it
        return slow + signal;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.MACD;
    }

    @Override
    public String getName() {
        return "MACD(" + fast + "," + slow + "," + signal + ")";
    }
}
