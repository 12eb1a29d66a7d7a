package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.PriceSeries;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.indicator.IndicatorSeries;
import com.strategylab.optimizer.indicator.IndicatorSpec;
import com.strategylab.optimizer.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RsiStrategy.
 */
class RsiStrategyTest {

    @Test
    void testThresholdSignals() {
        // Arrange
        RsiStrategy strategy = new RsiStrategy(RsiStrategy.DEFAULT_PERIOD,
                RsiStrategy.DEFAULT_OVERSOLD, RsiStrategy.DEFAULT_OVERBOUGHT);
        PriceSeries series = TestSeries.closes(100.0, 99.0, 100.0, 101.0);
        IndicatorSpec rsi = IndicatorSpec.rsi(RsiStrategy.DEFAULT_PERIOD);
        Map<IndicatorSpec, IndicatorSeries> indicators =
                Map.of(rsi, IndicatorSeries.single(rsi, new double[]{Double.NaN, 25, 50, 75}));

        // Act
        List<Signal> signals = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            signals.add(strategy.generateSignal(new StrategyContext(series, indicators, i)));
        }

        // Assert
        assertEquals(List.of(Signal.HOLD, Signal.BUY, Signal.HOLD, Signal.SELL), signals);
    }

    @Test
    void testThresholdsAreExclusive() {
        RsiStrategy strategy = new RsiStrategy(2, 30, 70);
        PriceSeries series = TestSeries.closes(1.0, 2.0);
        IndicatorSpec rsi = IndicatorSpec.rsi(2);
        Map<IndicatorSpec, IndicatorSeries> indicators =
                Map.of(rsi, IndicatorSeries.single(rsi, new double[]{30, 70}));

        assertEquals(Signal.HOLD, strategy.generateSignal(new StrategyContext(series, indicators, 0)));
        assertEquals(Signal.HOLD, strategy.generateSignal(new StrategyContext(series, indicators, 1)));
    }

    @Test
    void testDescriptor() {
        RsiStrategy strategy = new RsiStrategy(14, 30, 70);

        assertEquals(List.of(IndicatorSpec.rsi(14)), strategy.requiredIndicators());
        assertEquals(15, strategy.minimumBars());
        assertEquals(StrategyType.RSI, strategy.getType());
    }

    @Test
    void testRunsOnComputedIndicators() {
        List<Signal> signals = TestSeries.signals(new RsiStrategy(14, 30, 70), TestSeries.wave(200));

        assertTrue(signals.subList(0, 14).stream().allMatch(s -> s == Signal.HOLD));
        assertTrue(signals.contains(Signal.BUY));
        assertTrue(signals.contains(Signal.SELL));
    }

    @Test
    void testInvalidParameters() {
        assertThrows(InvalidParameterException.class, () -> new RsiStrategy(0, 30, 70));
        assertThrows(InvalidParameterException.class, () -> new RsiStrategy(14, 70, 30));
        assertThrows(InvalidParameterException.class, () -> new RsiStrategy(14, 30, 120));
    }
}
