package com.strategylab.optimizer.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest and sweep metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Counter sweepsCompletedCounter;
    private final Counter sweepsCancelledCounter;
    private final Timer executionTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.runsCompletedCounter = Counter.builder("backtest.runs.completed")
                .description("Total number of backtest runs completed successfully")
                .register(meterRegistry);

        this.runsFailedCounter = Counter.builder("backtest.runs.failed")
                .description("Total number of backtest runs rejected or failed")
                .register(meterRegistry);

        this.sweepsCompletedCounter = Counter.builder("optimizer.sweeps.completed")
                .description("Total number of optimizer sweeps that evaluated every combination")
                .register(meterRegistry);

        this.sweepsCancelledCounter = Counter.builder("optimizer.sweeps.cancelled")
                .description("Total number of optimizer sweeps stopped by a deadline or stop request")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("backtest.execution.time")
                .description("Backtest run execution time")
                .register(meterRegistry);

        log.info("BacktestMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a successful run with its execution time.
     */
    public void recordRunCompleted(long executionTimeMs) {
        runsCompletedCounter.increment();
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunFailed() {
        runsFailedCounter.increment();
    }

    public void recordSweepCompleted() {
        sweepsCompletedCounter.increment();
    }

    public void recordSweepCancelled() {
        sweepsCancelledCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Runs completed=%d, Runs failed=%d, Sweeps completed=%d, "
                        + "Sweeps cancelled=%d, AvgExecTime=%.3fs",
                (long) runsCompletedCounter.count(),
                (long) runsFailedCounter.count(),
                (long) sweepsCompletedCounter.count(),
                (long) sweepsCancelledCounter.count(),
                executionTimer.mean(TimeUnit.SECONDS));
    }
}
