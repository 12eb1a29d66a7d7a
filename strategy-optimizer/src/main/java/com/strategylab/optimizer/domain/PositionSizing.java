package com.strategylab.optimizer.domain;

/**
 * Quantity granularity used when a position is opened.
 */
public enum PositionSizing {
    /** Whole units only, rounded down. */
    WHOLE_UNITS,
    /** Fractional units, rounded down to 8 decimal places. */
    FRACTIONAL
}
