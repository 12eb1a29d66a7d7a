package com.strategylab.optimizer.domain;

/**
 * Price at which a signal is filled.
 */
public enum ExecutionTiming {
    /** Fill at the close of the bar that produced the signal. */
    CLOSE,
    /** Fill at the open of the following bar. A signal on the last bar is dropped. */
    NEXT_OPEN
}
