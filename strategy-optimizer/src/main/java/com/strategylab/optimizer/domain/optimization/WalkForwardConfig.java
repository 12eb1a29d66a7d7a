package com.strategylab.optimizer.domain.optimization;

import com.strategylab.optimizer.domain.InvalidParameterException;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Train/test partitioning for walk-forward validation, in bars.
 */
@Value
@Builder(toBuilder = true)
public class WalkForwardConfig {

    int trainBars;
    int testBars;

    /** Advance between windows; defaults to {@code testBars} when null. */
    Integer stepBars;

    /** Upper bound on the number of windows, 0 for no bound. */
    int maxWindows;

    public int effectiveStep() {
        return stepBars != null ? stepBars : testBars;
    }

    public void validate() {
        if (trainBars <= 0) {
            throw new InvalidParameterException("Train window must be positive: " + trainBars);
        }
        if (testBars <= 0) {
            throw new InvalidParameterException("Test window must be positive: " + testBars);
        }
        if (effectiveStep() <= 0) {
            throw new InvalidParameterException("Step must be positive: " + stepBars);
        }
        if (maxWindows < 0) {
            throw new InvalidParameterException("Max windows must not be negative: " + maxWindows);
        }
    }

    /**
     * Lay out windows over a series of {@code seriesLength} bars. The last test range may be
     * shorter than {@code testBars}; a window with no test bar at all is not produced.
     */
    public List<WalkForwardWindow> plan(int seriesLength) {
        validate();
        List<WalkForwardWindow> windows = new ArrayList<>();
        int step = effectiveStep();
        for (int start = 0; start + trainBars < seriesLength; start += step) {
            if (maxWindows > 0 && windows.size() >= maxWindows) {
                break;
            }
            int testStart = start + trainBars;
            int testEnd = Math.min(testStart + testBars, seriesLength);
            windows.add(new WalkForwardWindow(windows.size(), start, testStart, testEnd));
        }
        return windows;
    }
}
