package com.strategylab.optimizer.domain.optimization;

import com.strategylab.optimizer.domain.EmptySeriesException;
import com.strategylab.optimizer.domain.InvalidParameterException;

public enum FailureKind {
    INVALID_PARAMETER,
    EMPTY_SERIES,
    UNEXPECTED;

    public static FailureKind of(Throwable error) {
        if (error instanceof InvalidParameterException) {
            return INVALID_PARAMETER;
        }
        if (error instanceof EmptySeriesException) {
            return EMPTY_SERIES;
        }
        return UNEXPECTED;
    }
}
