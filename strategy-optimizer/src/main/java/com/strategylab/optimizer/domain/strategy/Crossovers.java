package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.Signal;

/**
 * Line-crossing rule shared by the MACD and moving-average strategies.
 */
final class Crossovers {

    private Crossovers() {
    }

    /**
     * BUY when the fast line moves from at-or-below to above the slow line between the previous
     * and the current bar, SELL on the opposite move, HOLD otherwise or if any value is undefined.
     */
    static Signal cross(double fastPrevious, double slowPrevious, double fastCurrent, double slowCurrent) {
        if (!Double.isFinite(fastPrevious) || !Double.isFinite(slowPrevious)
                || !Double.isFinite(fastCurrent) || !Double.isFinite(slowCurrent)) {
            return Signal.HOLD;
        }

        // Golden cross
        if (fastCurrent > slowCurrent && fastPrevious <= slowPrevious) {
            return Signal.BUY;
        }
        // Death cross
        if (fastCurrent < slowCurrent && fastPrevious >= slowPrevious) {
            return Signal.SELL;
        }
        return Signal.HOLD;
    }
}
