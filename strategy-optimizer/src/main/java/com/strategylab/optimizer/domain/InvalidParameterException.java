package com.strategylab.optimizer.domain;

/**
 * Configuration mistake detected before a simulation starts: a bad strategy parameter,
 * backtest setting, parameter grid or walk-forward layout.
 */
public class InvalidParameterException extends IllegalArgumentException {

    public InvalidParameterException(String message) {
        super(message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
