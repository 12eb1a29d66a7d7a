package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.PriceSeries;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.indicator.IndicatorSeries;
import com.strategylab.optimizer.indicator.IndicatorSpec;
import com.strategylab.optimizer.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BollingerBandsStrategy.
 */
class BollingerBandsStrategyTest {

    @Test
    void testBandTouches() {
        // Arrange
        BollingerBandsStrategy strategy = new BollingerBandsStrategy(20, 2.0);
        IndicatorSpec spec = IndicatorSpec.bollinger(20, 2.0);
        PriceSeries series = TestSeries.closes(100.0, 90.0, 100.0, 115.0, 85.0);
        Map<String, double[]> components = new LinkedHashMap<>();
        components.put(IndicatorSeries.UPPER, new double[]{Double.NaN, 110, 110, 110, 110});
        components.put(IndicatorSeries.MIDDLE, new double[]{Double.NaN, 100, 100, 100, 100});
        components.put(IndicatorSeries.LOWER, new double[]{Double.NaN, 90, 90, 90, 90});
        Map<IndicatorSpec, IndicatorSeries> indicators = Map.of(spec, IndicatorSeries.of(spec, components));

        // Act & Assert - a close on the lower band counts as a touch
        assertEquals(Signal.HOLD, strategy.generateSignal(new StrategyContext(series, indicators, 0)));
        assertEquals(Signal.BUY, strategy.generateSignal(new StrategyContext(series, indicators, 1)));
        assertEquals(Signal.HOLD, strategy.generateSignal(new StrategyContext(series, indicators, 2)));
        assertEquals(Signal.SELL, strategy.generateSignal(new StrategyContext(series, indicators, 3)));
        assertEquals(Signal.BUY, strategy.generateSignal(new StrategyContext(series, indicators, 4)));
    }

    @Test
    void testDescriptor() {
        BollingerBandsStrategy strategy = new BollingerBandsStrategy(20, 2.0);

        assertEquals(20, strategy.minimumBars());
        assertEquals(StrategyType.BOLLINGER, strategy.getType());
        assertEquals(1, strategy.requiredIndicators().size());
    }

    @Test
    void testInvalidParameters() {
        assertThrows(InvalidParameterException.class, () -> new BollingerBandsStrategy(1, 2.0));
        assertThrows(InvalidParameterException.class, () -> new BollingerBandsStrategy(20, 0));
        assertThrows(InvalidParameterException.class, () -> new BollingerBandsStrategy(20, -1.5));
    }
}
