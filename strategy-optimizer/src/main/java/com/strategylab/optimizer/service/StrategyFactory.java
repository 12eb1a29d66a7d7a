package com.strategylab.optimizer.service;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.strategy.BollingerBandsStrategy;
import com.strategylab.optimizer.domain.strategy.BuyAndHoldStrategy;
import com.strategylab.optimizer.domain.strategy.CombinedStrategy;
import com.strategylab.optimizer.domain.strategy.MacdStrategy;
import com.strategylab.optimizer.domain.strategy.MovingAverageCrossoverStrategy;
import com.strategylab.optimizer.domain.strategy.MovingAverageType;
import com.strategylab.optimizer.domain.strategy.RsiStrategy;
import com.strategylab.optimizer.domain.strategy.Strategy;
import com.strategylab.optimizer.domain.strategy.StrategyType;
import com.strategylab.optimizer.domain.strategy.VotingRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factory for creating strategy instances from a type and a parameter map.
 * Missing parameters take their defaults; unknown names and out-of-range values are rejected.
 */
@Service
@Slf4j
public class StrategyFactory {

    public static final String RSI_PERIOD = "rsiPeriod";
    public static final String OVERSOLD = "oversold";
    public static final String OVERBOUGHT = "overbought";
    public static final String FAST = "fast";
    public static final String SLOW = "slow";
    public static final String SIGNAL = "signal";
    public static final String PERIOD = "period";
    public static final String NUM_STD = "numStd";
    public static final String FAST_WINDOW = "fastWindow";
    public static final String SLOW_WINDOW = "slowWindow";
    public static final String MA_TYPE = "maType";
    public static final String VOTING_RULE = "votingRule";

    private static final Map<StrategyType, Set<String>> ACCEPTED_PARAMETERS = Map.of(
            StrategyType.RSI, Set.of(RSI_PERIOD, OVERSOLD, OVERBOUGHT),
            StrategyType.MACD, Set.of(FAST, SLOW, SIGNAL),
            StrategyType.BOLLINGER, Set.of(PERIOD, NUM_STD),
            StrategyType.MOVING_AVERAGE_CROSS, Set.of(FAST_WINDOW, SLOW_WINDOW, MA_TYPE),
            StrategyType.COMBINED, Set.of(RSI_PERIOD, OVERSOLD, OVERBOUGHT, FAST, SLOW, SIGNAL,
                    PERIOD, NUM_STD, VOTING_RULE),
            StrategyType.BUY_AND_HOLD, Set.of());

    public Strategy createStrategy(String strategyName, Map<String, ?> parameters) {
        return createStrategy(StrategyType.fromName(strategyName), parameters);
    }

    /**
     * Create a strategy instance.
     *
     * @throws InvalidParameterException for unknown parameter names or invalid values
     */
    public Strategy createStrategy(StrategyType type, Map<String, ?> parameters) {
        Map<String, ?> params = parameters != null ? parameters : Map.of();
        log.debug("Creating strategy: {} with parameters: {}", type, params);

        Set<String> unknown = new HashSet<>(params.keySet());
        unknown.removeAll(ACCEPTED_PARAMETERS.get(type));
        if (!unknown.isEmpty()) {
            throw new InvalidParameterException("Unknown parameters for " + type + ": " + unknown
                    + " (accepted: " + ACCEPTED_PARAMETERS.get(type) + ")");
        }

        return switch (type) {
            case RSI -> rsi(params);
            case MACD -> macd(params);
            case BOLLINGER -> bollinger(params);
            case MOVING_AVERAGE_CROSS -> new MovingAverageCrossoverStrategy(
                    intParam(params, FAST_WINDOW, MovingAverageCrossoverStrategy.DEFAULT_FAST_WINDOW),
                    intParam(params, SLOW_WINDOW, MovingAverageCrossoverStrategy.DEFAULT_SLOW_WINDOW),
                    params.containsKey(MA_TYPE)
                            ? MovingAverageType.fromName(String.valueOf(params.get(MA_TYPE)))
                            : MovingAverageType.SMA);
            case COMBINED -> new CombinedStrategy(
                    List.of(rsi(params), macd(params), bollinger(params)),
                    params.containsKey(VOTING_RULE)
                            ? VotingRule.fromName(String.valueOf(params.get(VOTING_RULE)))
                            : VotingRule.MAJORITY);
            case BUY_AND_HOLD -> new BuyAndHoldStrategy();
        };
    }

    private Strategy rsi(Map<String, ?> params) {
        return new RsiStrategy(
                intParam(params, RSI_PERIOD, RsiStrategy.DEFAULT_PERIOD),
                doubleParam(params, OVERSOLD, RsiStrategy.DEFAULT_OVERSOLD),
                doubleParam(params, OVERBOUGHT, RsiStrategy.DEFAULT_OVERBOUGHT));
    }

    private Strategy macd(Map<String, ?> params) {
        return new MacdStrategy(
                intParam(params, FAST, MacdStrategy.DEFAULT_FAST),
                intParam(params, SLOW, MacdStrategy.DEFAULT_SLOW),
                intParam(params, SIGNAL, MacdStrategy.DEFAULT_SIGNAL));
    }

    private Strategy bollinger(Map<String, ?> params) {
        return new BollingerBandsStrategy(
                intParam(params, PERIOD, BollingerBandsStrategy.DEFAULT_PERIOD),
                doubleParam(params, NUM_STD, BollingerBandsStrategy.DEFAULT_NUM_STD));
    }

    static int intParam(Map<String, ?> params, String name, int defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            BigDecimal number = new BigDecimal(value.toString().trim());
            return number.intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new InvalidParameterException("Parameter '" + name + "' must be an integer, got " + value, e);
        }
    }

    static double doubleParam(Map<String, ?> params, String name, double defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException("Parameter '" + name + "' must be a number, got " + value, e);
        }
    }
}
