package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.indicator.IndicatorSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * RSI mean-reversion strategy.
 * Buys when RSI drops below the oversold threshold, sells when it rises above the overbought one.
 */
@Slf4j
public class RsiStrategy implements Strategy {

    public static final int DEFAULT_PERIOD = 14;
    public static final double DEFAULT_OVERSOLD = 30;
    public static final double DEFAULT_OVERBOUGHT = 70;

    private final int rsiPeriod;
    private final double oversold;
    private final double overbought;
    private final IndicatorSpec rsi;

    public RsiStrategy(int rsiPeriod, double oversold, double overbought) {
        if (rsiPeriod <= 0) {
            throw new InvalidParameterException("RSI period must be positive: " + rsiPeriod);
        }
        if (oversold < 0 || overbought > 100 || oversold >= overbought) {
            throw new InvalidParameterException("RSI thresholds must satisfy 0 <= oversold < overbought <= 100, got "
                    + oversold + "/" + overbought);
        }
        this.rsiPeriod = rsiPeriod;
        this.oversold = oversold;
        this.overbought = overbought;
        this.rsi = IndicatorSpec.rsi(rsiPeriod);
    }

    @Override
    public Signal generateSignal(StrategyContext context) {
        int t = context.index();
        if (context.close(t) == null) {
            return Signal.HOLD;
        }

        double value = context.indicator(rsi, t);
        if (Double.isNaN(value)) {
            return Signal.HOLD;
        }

        if (value < oversold) {
            log.debug("RSI: BUY at bar {} (RSI {} < {})", t, value, oversold);
            return Signal.BUY;
        }
        if (value > overbought) {
            log.debug("RSI: SELL at bar {} (RSI {} > {})", t, value, overbought);
            return Signal.SELL;
        }
        return Signal.HOLD;
    }

    @Override
    public List<IndicatorSpec> requiredIndicators() {
        return List.of(rsi);
    }

    @Override
    public int minimumBars() {
        return rsiPeriod + 1;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.RSI;
    }

    @Override
    public String getName() {
        return "RSI(" + rsiPeriod + "," + oversold + "," + overbought + ")";
    }
}
