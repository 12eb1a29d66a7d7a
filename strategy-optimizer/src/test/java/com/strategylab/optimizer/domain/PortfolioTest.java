package com.strategylab.optimizer.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Portfolio operations.
 */
class PortfolioTest {

    private static final BigDecimal FEE = new BigDecimal("0.001");
    private static final Instant ENTRY = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant EXIT = Instant.parse("2024-01-01T05:00:00Z");

    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        portfolio = new Portfolio(new BigDecimal("10000"));
    }

    @Test
    void testBuy_SuccessfulPurchase() {
        // Act
        boolean filled = portfolio.buy(ENTRY, new BigDecimal("100"), new BigDecimal("50"), FEE);

        // Assert
        assertTrue(filled);
        assertTrue(portfolio.isLong());
        assertAmount("4995", portfolio.getCash());
        assertAmount("50", portfolio.getPosition().getQuantity());
        assertAmount("5", portfolio.getPosition().getEntryFee());
        assertEquals(ENTRY, portfolio.getPosition().getEntryTimestamp());
        assertTrue(portfolio.getTrades().isEmpty(), "A trade is recorded only when the position closes");
    }

    @Test
    void testBuy_InsufficientFunds() {
        // Act - 100 units at $100 plus 0.1% fee costs $10,010
        boolean filled = portfolio.buy(ENTRY, new BigDecimal("100"), new BigDecimal("100"), FEE);

        // Assert
        assertFalse(filled);
        assertFalse(portfolio.isLong());
        assertAmount("10000", portfolio.getCash());
    }

    @Test
    void testBuy_RejectedWhenAlreadyLong() {
        portfolio.buy(ENTRY, new BigDecimal("100"), new BigDecimal("10"), FEE);

        boolean second = portfolio.buy(EXIT, new BigDecimal("100"), new BigDecimal("10"), FEE);

        assertFalse(second, "No pyramiding");
        assertAmount("10", portfolio.getPosition().getQuantity());
    }

    @Test
    void testBuy_ZeroQuantityIsNoOp() {
        assertFalse(portfolio.buy(ENTRY, new BigDecimal("100"), BigDecimal.ZERO, FEE));
        assertAmount("10000", portfolio.getCash());
    }

    @Test
    void testSell_RecordsRoundTrip() {
        // Arrange
        portfolio.buy(ENTRY, new BigDecimal("100"), new BigDecimal("50"), FEE);

        // Act
        Trade trade = portfolio.sell(EXIT, new BigDecimal("110"), FEE, ExitReason.SIGNAL);

        // Assert
        assertNotNull(trade);
        assertFalse(portfolio.isLong());
        assertAmount("500", trade.getGrossPnl());
        assertAmount("10.5", trade.getFeePaid());
        assertAmount("489.5", trade.getNetPnl());
        assertAmount("10489.5", portfolio.getCash());
        assertEquals(ENTRY, trade.getEntryTimestamp());
        assertEquals(EXIT, trade.getExitTimestamp());
        assertEquals(ExitReason.SIGNAL, trade.getExitReason());
        assertEquals(1, portfolio.getTrades().size());
    }

    @Test
    void testSell_WhenFlatReturnsNull() {
        assertNull(portfolio.sell(EXIT, new BigDecimal("110"), FEE, ExitReason.SIGNAL));
        assertTrue(portfolio.getTrades().isEmpty());
    }

    @Test
    void testGetEquity_MarksOpenPosition() {
        portfolio.buy(ENTRY, new BigDecimal("100"), new BigDecimal("50"), FEE);

        assertAmount("10995", portfolio.getEquity(new BigDecimal("120")));
        assertAmount("9995", portfolio.getEquity(null), "Missing mark falls back to the entry price");
    }

    @Test
    void testGetEquity_FlatIsCash() {
        assertAmount("10000", portfolio.getEquity(new BigDecimal("120")));
    }

    @Test
    void testTradesAreUnmodifiable() {
        assertThrows(UnsupportedOperationException.class, () -> portfolio.getTrades().add(null));
        assertThrows(UnsupportedOperationException.class, () -> portfolio.getEquityCurve().add(null));
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertAmount(expected, actual, null);
    }

    private static void assertAmount(String expected, BigDecimal actual, String message) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
                (message != null ? message + ": " : "") + "expected " + expected + " but was " + actual);
    }
}
