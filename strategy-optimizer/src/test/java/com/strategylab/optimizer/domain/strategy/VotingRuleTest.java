package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.strategylab.optimizer.domain.Signal.BUY;
import static com.strategylab.optimizer.domain.Signal.HOLD;
import static com.strategylab.optimizer.domain.Signal.SELL;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for VotingRule.
 */
class VotingRuleTest {

    @Test
    void testMajority() {
        assertEquals(BUY, VotingRule.MAJORITY.decide(List.of(BUY, BUY, SELL)));
        assertEquals(SELL, VotingRule.MAJORITY.decide(List.of(SELL, SELL, HOLD)));
        assertEquals(HOLD, VotingRule.MAJORITY.decide(List.of(BUY, SELL, HOLD)));
        assertEquals(HOLD, VotingRule.MAJORITY.decide(List.of(BUY, HOLD, HOLD)));
        assertEquals(BUY, VotingRule.MAJORITY.decide(List.of(BUY, HOLD)));
        assertEquals(HOLD, VotingRule.MAJORITY.decide(List.of(BUY, SELL)));
    }

    @Test
    void testUnanimous() {
        assertEquals(BUY, VotingRule.UNANIMOUS.decide(List.of(BUY, BUY, BUY)));
        assertEquals(HOLD, VotingRule.UNANIMOUS.decide(List.of(BUY, BUY, HOLD)));
        assertEquals(HOLD, VotingRule.UNANIMOUS.decide(List.of(HOLD, HOLD)));
        assertEquals(HOLD, VotingRule.UNANIMOUS.decide(List.of()));
    }

    @Test
    void testFromName() {
        assertEquals(VotingRule.UNANIMOUS, VotingRule.fromName(" unanimous "));
        assertThrows(InvalidParameterException.class, () -> VotingRule.fromName("plurality"));
        assertThrows(InvalidParameterException.class, () -> VotingRule.fromName(null));
    }
}
