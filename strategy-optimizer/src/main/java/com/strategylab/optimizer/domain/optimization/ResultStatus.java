package com.strategylab.optimizer.domain.optimization;

public enum ResultStatus {
    COMPLETED,
    FAILED
}
