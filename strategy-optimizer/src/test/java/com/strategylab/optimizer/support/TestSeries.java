package com.strategylab.optimizer.support;

import com.strategylab.optimizer.domain.Bar;
import com.strategylab.optimizer.domain.BarInterval;
import com.strategylab.optimizer.domain.PriceSeries;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.domain.strategy.Strategy;
import com.strategylab.optimizer.domain.strategy.StrategyContext;
import com.strategylab.optimizer.indicator.IndicatorSeries;
import com.strategylab.optimizer.indicator.IndicatorSpec;
import com.strategylab.optimizer.indicator.TechnicalIndicatorCalculator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for hourly price series used across tests.
 */
public final class TestSeries {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    public static final String SYMBOL = "BTCUSDT";

    private TestSeries() {
    }

    /**
     * Series with the given closes; a null entry is a gap. Open equals close.
     */
    public static PriceSeries closes(Double... closes) {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            BigDecimal close = closes[i] != null ? BigDecimal.valueOf(closes[i]) : null;
            bars.add(bar(i, close, close));
        }
        return PriceSeries.of(SYMBOL, BarInterval.H1, bars);
    }

    /**
     * Smooth oscillating series long enough for indicator warm-up and several crossovers.
     */
    public static PriceSeries wave(int length) {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            double value = 100 + 10 * Math.sin(i / 8.0) + 4 * Math.sin(i / 3.0) + i * 0.05;
            BigDecimal close = BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
            bars.add(bar(i, close, close));
        }
        return PriceSeries.of(SYMBOL, BarInterval.H1, bars);
    }

    public static Bar bar(int index, BigDecimal open, BigDecimal close) {
        return Bar.builder()
                .timestamp(timestamp(index))
                .open(open)
                .high(close)
                .low(close)
                .close(close)
                .volume(BigDecimal.TEN)
                .build();
    }

    public static Instant timestamp(int index) {
        return START.plus(Duration.ofHours(index));
    }

    /**
     * Signals of {@code strategy} at every bar, with indicators computed in-process.
     */
    public static List<Signal> signals(Strategy strategy, PriceSeries series) {
        TechnicalIndicatorCalculator calculator = new TechnicalIndicatorCalculator();
        Map<IndicatorSpec, IndicatorSeries> indicators = new HashMap<>();
        for (IndicatorSpec spec : strategy.requiredIndicators()) {
            indicators.put(spec, calculator.compute(series, spec));
        }

        List<Signal> signals = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            signals.add(strategy.generateSignal(new StrategyContext(series, indicators, i)));
        }
        return signals;
    }
}
