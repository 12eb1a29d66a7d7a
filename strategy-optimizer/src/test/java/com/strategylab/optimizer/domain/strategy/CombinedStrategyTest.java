package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.PriceSeries;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.indicator.IndicatorSpec;
import com.strategylab.optimizer.support.ScriptedStrategy;
import com.strategylab.optimizer.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CombinedStrategy.
 */
class CombinedStrategyTest {

    private final PriceSeries series = TestSeries.closes(100.0, 101.0, 102.0);

    @Test
    void testMajorityVote() {
        CombinedStrategy strategy = new CombinedStrategy(List.of(
                new ScriptedStrategy().at(1, Signal.BUY).at(2, Signal.SELL),
                new ScriptedStrategy().at(1, Signal.BUY),
                new ScriptedStrategy().at(1, Signal.SELL).at(2, Signal.SELL)), VotingRule.MAJORITY);

        assertEquals(Signal.HOLD, strategy.generateSignal(new StrategyContext(series, Map.of(), 0)));
        assertEquals(Signal.BUY, strategy.generateSignal(new StrategyContext(series, Map.of(), 1)));
        assertEquals(Signal.SELL, strategy.generateSignal(new StrategyContext(series, Map.of(), 2)));
    }

    @Test
    void testUnanimousVote() {
        CombinedStrategy strategy = new CombinedStrategy(List.of(
                new ScriptedStrategy().at(1, Signal.BUY).at(2, Signal.BUY),
                new ScriptedStrategy().at(1, Signal.BUY)), VotingRule.UNANIMOUS);

        assertEquals(Signal.BUY, strategy.generateSignal(new StrategyContext(series, Map.of(), 1)));
        assertEquals(Signal.HOLD, strategy.generateSignal(new StrategyContext(series, Map.of(), 2)));
    }

    @Test
    void testIndicatorUnionAndWarmup() {
        CombinedStrategy strategy = new CombinedStrategy(List.of(
                new RsiStrategy(14, 30, 70),
                new RsiStrategy(14, 20, 80),
                new MacdStrategy(12, 26, 9)), VotingRule.MAJORITY);

        assertEquals(List.of(IndicatorSpec.rsi(14), IndicatorSpec.macd(12, 26, 9)), strategy.requiredIndicators());
        assertEquals(35, strategy.minimumBars());
        assertEquals(StrategyType.COMBINED, strategy.getType());
    }

    @Test
    void testRunsOnComputedIndicators() {
        CombinedStrategy strategy = new CombinedStrategy(List.of(
                new RsiStrategy(14, 30, 70),
                new MacdStrategy(12, 26, 9),
                new BollingerBandsStrategy(20, 2.0)), VotingRule.MAJORITY);

        List<Signal> signals = TestSeries.signals(strategy, TestSeries.wave(150));

        assertEquals(150, signals.size());
    }

    @Test
    void testRequiresMembersAndRule() {
        assertThrows(InvalidParameterException.class, () -> new CombinedStrategy(List.of(), VotingRule.MAJORITY));
        assertThrows(InvalidParameterException.class,
                () -> new CombinedStrategy(List.of(new BuyAndHoldStrategy()), null));
    }
}
