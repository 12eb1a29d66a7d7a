package com.strategylab.optimizer.domain;

/**
 * Raised when there are no bars to simulate, or too few for the strategy warm-up when
 * {@link BacktestSettings#isRequireFullWarmup()} is set.
 */
public class EmptySeriesException extends IllegalStateException {

    public EmptySeriesException(String message) {
        super(message);
    }
}
