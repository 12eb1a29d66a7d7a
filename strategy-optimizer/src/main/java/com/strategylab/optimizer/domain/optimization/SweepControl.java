package com.strategylab.optimizer.domain.optimization;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a sweep: an optional deadline plus a stop flag any thread may set.
 * Checked before each combination starts; running combinations finish.
 */
public final class SweepControl {

    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private SweepControl(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static SweepControl none() {
        return new SweepControl(null, Clock.systemUTC());
    }

    public static SweepControl withTimeout(Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new SweepControl(clock.instant().plus(timeout), clock);
    }

    public static SweepControl withDeadline(Instant deadline, Clock clock) {
        return new SweepControl(deadline, clock);
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean shouldStop() {
        return stopRequested.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    public Instant getDeadline() {
        return deadline;
    }
}
