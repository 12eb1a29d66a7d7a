package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.Signal;

import java.util.List;

/**
 * How a combined strategy turns its members' signals into one.
 */
public enum VotingRule {

    /** BUY when buys outnumber sells and make up at least half the votes; symmetric for SELL. */
    MAJORITY {
        @Override
        Signal decide(List<Signal> votes) {
            long buys = votes.stream().filter(s -> s == Signal.BUY).count();
            long sells = votes.stream().filter(s -> s == Signal.SELL).count();
            int n = votes.size();
            if (buys > sells && 2 * buys >= n) {
                return Signal.BUY;
            }
            if (sells > buys && 2 * sells >= n) {
                return Signal.SELL;
            }
            return Signal.HOLD;
        }
    },

    /** BUY or SELL only when every member agrees. */
    UNANIMOUS {
        @Override
        Signal decide(List<Signal> votes) {
            if (votes.isEmpty()) {
                return Signal.HOLD;
            }
            Signal first = votes.get(0);
            if (first != Signal.HOLD && votes.stream().allMatch(s -> s == first)) {
                return first;
            }
            return Signal.HOLD;
        }
    };

    abstract Signal decide(List<Signal> votes);

    public static VotingRule fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidParameterException("Unknown voting rule: " + name, e);
        }
    }
}
