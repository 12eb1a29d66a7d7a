package com.strategylab.optimizer.domain;

import java.util.Arrays;

/**
 * Bar spacing of a price series. Annualisation assumes a market open around the clock,
 * 365 days a year.
 */
public enum BarInterval {

    M1("1m", 365 * 24 * 60),
    M5("5m", 365 * 24 * 12),
    M15("15m", 365 * 24 * 4),
    M30("30m", 365 * 24 * 2),
    H1("1h", 365 * 24),
    H4("4h", 365 * 6),
    D1("1d", 365),
    W1("1w", 52);

    private final String code;
    private final int periodsPerYear;

    BarInterval(String code, int periodsPerYear) {
        this.code = code;
        this.periodsPerYear = periodsPerYear;
    }

    public String getCode() {
        return code;
    }

    public int getPeriodsPerYear() {
        return periodsPerYear;
    }

    /**
     * Resolve either the enum name ("H1") or the exchange code ("1h").
     */
    public static BarInterval fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidParameterException("Bar interval is required");
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(i -> i.code.equalsIgnoreCase(trimmed) || i.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new InvalidParameterException("Unknown bar interval: " + value));
    }
}
