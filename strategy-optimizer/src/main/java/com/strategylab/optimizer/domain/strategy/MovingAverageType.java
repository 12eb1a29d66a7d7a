package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;

public enum MovingAverageType {
    SMA,
    EMA;

    public static MovingAverageType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidParameterException("Unknown moving average type: " + name, e);
        }
    }
}
