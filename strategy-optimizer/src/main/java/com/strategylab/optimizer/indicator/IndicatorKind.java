package com.strategylab.optimizer.indicator;

import java.util.List;

/**
 * Indicator families and the named components each one produces.
 */
public enum IndicatorKind {

    SMA(List.of(IndicatorSeries.VALUE)),
    EMA(List.of(IndicatorSeries.VALUE)),
    RSI(List.of(IndicatorSeries.VALUE)),
    MACD(List.of(IndicatorSeries.MACD_LINE, IndicatorSeries.SIGNAL_LINE, IndicatorSeries.HISTOGRAM)),
    BOLLINGER(List.of(IndicatorSeries.UPPER, IndicatorSeries.MIDDLE, IndicatorSeries.LOWER));

    private final List<String> components;

    IndicatorKind(List<String> components) {
        this.components = components;
    }

    public List<String> getComponents() {
        return components;
    }
}
