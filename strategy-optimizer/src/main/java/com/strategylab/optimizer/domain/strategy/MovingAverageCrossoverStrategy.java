package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.indicator.IndicatorSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Moving Average Crossover Strategy.
 * Buys when the fast MA crosses above the slow MA, sells when the fast MA crosses below
 * the slow MA.
 */
@Slf4j
public class MovingAverageCrossoverStrategy implements Strategy {

    public static final int DEFAULT_FAST_WINDOW = 10;
    public static final int DEFAULT_SLOW_WINDOW = 30;

    private final int fastWindow;
    private final int slowWindow;
    private final MovingAverageType maType;
    private final IndicatorSpec fastMa;
    private final IndicatorSpec slowMa;

    public MovingAverageCrossoverStrategy(int fastWindow, int slowWindow) {
        this(fastWindow, slowWindow, MovingAverageType.SMA);
    }

    public MovingAverageCrossoverStrategy(int fastWindow, int slowWindow, MovingAverageType maType) {
        if (fastWindow <= 0 || fastWindow >= slowWindow) {
            throw new InvalidParameterException("Fast window must be positive and less than slow window, got "
                    + fastWindow + "/" + slowWindow);
        }
        this.fastWindow = fastWindow;
        this.slowWindow = slowWindow;
        this.maType = maType;
        this.fastMa = maType == MovingAverageType.EMA ? IndicatorSpec.ema(fastWindow) : IndicatorSpec.sma(fastWindow);
        this.slowMa = maType == MovingAverageType.EMA ? IndicatorSpec.ema(slowWindow) : IndicatorSpec.sma(slowWindow);
    }

    @Override
    public Signal generateSignal(StrategyContext context) {
        int t = context.index();
        // Wait until we have enough data
        if (t < 1 || context.close(t) == null) {
            return Signal.HOLD;
        }

        double fastNow = context.indicator(fastMa, t);
        double slowNow = context.indicator(slowMa, t);
        Signal decision = Crossovers.cross(
                context.indicator(fastMa, t - 1), context.indicator(slowMa, t - 1), fastNow, slowNow);

        if (decision != Signal.HOLD) {
            log.debug("MA Crossover: {} at bar {} (fast MA: {}, slow MA: {})", decision, t, fastNow, slowNow);
        }
        return decision;
    }

    @Override
    public List<IndicatorSpec> requiredIndicators() {
        return List.of(fastMa, slowMa);
    }

    @Override
    public int minimumBars() {
        return slowWindow + 1;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.MOVING_AVERAGE_CROSS;
    }

    @Override
    public String getName() {
        return "MovingAverageCrossover(" + fastWindow + "," + slowWindow + "," + maType + ")";
    }
}
