package com.strategylab.optimizer.domain.optimization;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SweepControl.
 */
class SweepControlTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void testNoneNeverStopsUntilRequested() {
        SweepControl control = SweepControl.none();
        assertFalse(control.shouldStop());

        control.requestStop();

        assertTrue(control.shouldStop());
    }

    @Test
    void testDeadline() {
        assertFalse(SweepControl.withDeadline(clock.instant().plusSeconds(1), clock).shouldStop());
        assertTrue(SweepControl.withDeadline(clock.instant(), clock).shouldStop());
        assertTrue(SweepControl.withDeadline(clock.instant().minusSeconds(1), clock).shouldStop());
    }

    @Test
    void testTimeout() {
        SweepControl control = SweepControl.withTimeout(Duration.ofMinutes(5));

        assertFalse(control.shouldStop());
        assertNotNull(control.getDeadline());
    }
}
