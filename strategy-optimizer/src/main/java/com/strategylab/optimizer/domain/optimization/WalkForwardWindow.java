package com.strategylab.optimizer.domain.optimization;

import lombok.Value;

/**
 * Bar ranges of one walk-forward window: train {@code [trainStart, testStart)} followed by
 * test {@code [testStart, testEnd)}.
 */
@Value
public class WalkForwardWindow {

    int index;
    int trainStart;
    int testStart;
    int testEnd;

    public int trainEnd() {
        return testStart;
    }

    public int testLength() {
        return testEnd - testStart;
    }
}
