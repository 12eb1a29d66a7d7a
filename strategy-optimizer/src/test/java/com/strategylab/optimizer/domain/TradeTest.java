package com.strategylab.optimizer.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Trade.
 */
class TradeTest {

    @Test
    void testReturnPct_RelativeToEntryNotional() {
        Trade trade = trade("50", ExitReason.SIGNAL);

        // 50 / (100 * 10) = 5%
        assertEquals(new BigDecimal("5.0000"), trade.getReturnPct());
    }

    @Test
    void testWinAndLoss() {
        assertTrue(trade("1", ExitReason.SIGNAL).isWin());
        assertTrue(trade("-1", ExitReason.SIGNAL).isLoss());

        Trade breakEven = trade("0", ExitReason.SIGNAL);
        assertFalse(breakEven.isWin());
        assertFalse(breakEven.isLoss());
    }

    @Test
    void testForcedExitFlag() {
        assertTrue(trade("5", ExitReason.END_OF_DATA).isForcedExit());
        assertFalse(trade("5", ExitReason.STOP_LOSS).isForcedExit());
        assertFalse(trade("5", ExitReason.SIGNAL).isForcedExit());
    }

    @Test
    void testEquality() {
        assertEquals(trade("5", ExitReason.SIGNAL), trade("5", ExitReason.SIGNAL));
        assertNotEquals(trade("5", ExitReason.SIGNAL), trade("5", ExitReason.TAKE_PROFIT));
    }

    private Trade trade(String netPnl, ExitReason reason) {
        return Trade.builder()
                .entryTimestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .entryPrice(new BigDecimal("100"))
                .exitTimestamp(Instant.parse("2024-01-02T00:00:00Z"))
                .exitPrice(new BigDecimal("106"))
                .quantity(new BigDecimal("10"))
                .grossPnl(new BigDecimal("60"))
                .feePaid(new BigDecimal("10"))
                .netPnl(new BigDecimal(netPnl))
                .exitReason(reason)
                .build();
    }
}
