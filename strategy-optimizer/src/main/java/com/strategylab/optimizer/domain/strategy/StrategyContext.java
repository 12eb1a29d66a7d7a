package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.Bar;
import com.strategylab.optimizer.domain.PriceSeries;
import com.strategylab.optimizer.indicator.IndicatorSeries;
import com.strategylab.optimizer.indicator.IndicatorSpec;

import java.math.BigDecimal;
import java.util.Map;

/**
 * What a strategy may see at bar {@code index}: bars and indicator values at or before it.
 * Reading past the current index throws {@link IllegalStateException}.
 */
public final class StrategyContext {

    private final PriceSeries series;
    private final Map<IndicatorSpec, IndicatorSeries> indicators;
    private final int index;

    public StrategyContext(PriceSeries series, Map<IndicatorSpec, IndicatorSeries> indicators, int index) {
        if (index < 0 || index >= series.size()) {
            throw new IndexOutOfBoundsException("Bar index " + index + " outside series of " + series.size());
        }
        this.series = series;
        this.indicators = indicators;
        this.index = index;
    }

    public int index() {
        return index;
    }

    public Bar bar(int i) {
        checkVisible(i);
        return series.get(i);
    }

    /**
     * @return the close at {@code i}, or null for a gap
     */
    public BigDecimal close(int i) {
        return bar(i).getClose();
    }

    /**
     * @return the indicator value at {@code i}, {@code NaN} if undefined there
     */
    public double indicator(IndicatorSpec spec, String component, int i) {
        checkVisible(i);
        if (i < 0) {
            return Double.NaN;
        }
        return series(spec).value(component, i);
    }

    public double indicator(IndicatorSpec spec, int i) {
        return indicator(spec, IndicatorSeries.VALUE, i);
    }

    public boolean isDefined(IndicatorSpec spec, int i) {
        checkVisible(i);
        return series(spec).isDefined(i);
    }

    private IndicatorSeries series(IndicatorSpec spec) {
        IndicatorSeries values = indicators.get(spec);
        if (values == null) {
            throw new IllegalArgumentException("Indicator " + spec + " was not computed for this run");
        }
        return values;
    }

    private void checkVisible(int i) {
        if (i > index) {
            throw new IllegalStateException("Look-ahead: bar " + i + " requested while at bar " + index);
        }
    }
}
