package com.strategylab.optimizer.domain;

/**
 * Per-bar decision emitted by a strategy.
 */
public enum Signal {
    BUY, SELL, HOLD
}
