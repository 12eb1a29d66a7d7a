package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Closed set of strategy variants understood by the factory.
 */
public enum StrategyType {

    RSI("rsi"),
    MACD("macd"),
    BOLLINGER("bollinger", "bollinger_bands", "bb"),
    MOVING_AVERAGE_CROSS("movingaveragecross", "movingaveragecrossover", "ma_crossover", "ma_cross", "sma_crossover"),
    COMBINED("combined", "voting"),
    BUY_AND_HOLD("buyandhold", "buy_and_hold");

    private final List<String> aliases;

    StrategyType(String... aliases) {
        this.aliases = List.of(aliases);
    }

    public static StrategyType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidParameterException("Strategy type is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(normalized) || t.aliases.contains(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidParameterException("Unknown strategy type: " + name));
    }
}
