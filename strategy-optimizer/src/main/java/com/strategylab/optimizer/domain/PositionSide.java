package com.strategylab.optimizer.domain;

public enum PositionSide {
    FLAT, LONG
}
