package com.strategylab.optimizer.domain;

/**
 * Why a position was closed. {@link #END_OF_DATA} is the forced mark-to-market close on
 * the final bar, not a strategy decision.
 */
public enum ExitReason {
    SIGNAL,
    STOP_LOSS,
    TAKE_PROFIT,
    END_OF_DATA
}
