package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.indicator.IndicatorSeries;
import com.strategylab.optimizer.indicator.IndicatorSpec;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;

/**
 * Bollinger band mean-reversion strategy.
 * Buys when the close touches or breaks the lower band, sells at or above the upper band.
 */
@Slf4j
public class BollingerBandsStrategy implements Strategy {

    public static final int DEFAULT_PERIOD = 20;
    public static final double DEFAULT_NUM_STD = 2.0;

    private final int period;
    private final double numStd;
    private final IndicatorSpec bands;

    public BollingerBandsStrategy(int period, double numStd) {
        if (period < 2) {
            throw new InvalidParameterException("Bollinger period must be at least 2: " + period);
        }
        if (!(numStd > 0)) {
            throw new InvalidParameterException("Bollinger width must be positive: " + numStd);
        }
        this.period = period;
        this.numStd = numStd;
        this.bands = IndicatorSpec.bollinger(period, numStd);
    }

    @Override
    public Signal generateSignal(StrategyContext context) {
        int t = context.index();
        BigDecimal close = context.close(t);
        if (close == null || !context.isDefined(bands, t)) {
            return Signal.HOLD;
        }

        double price = close.doubleValue();
        double lower = context.indicator(bands, IndicatorSeries.LOWER, t);
        double upper = context.indicator(bands, IndicatorSeries.UPPER, t);

        if (price <= lower) {
            log.debug("Bollinger: BUY at bar {} (close {} <= lower {})", t, price, lower);
            return Signal.BUY;
        }
        if (price >= upper) {
            log.debug("Bollinger: SELL at bar {} (close {} >= upper {})", t, price, upper);
            return Signal.SELL;
        }
        return Signal.HOLD;
    }

    @Override
    public List<IndicatorSpec> requiredIndicators() {
        return List.of(bands);
    }

    @Override
    public int minimumBars() {
        return period;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.BOLLINGER;
    }

    @Override
    public String getName() {
        return "Bollinger(" + period + "," + numStd + ")";
    }
}
