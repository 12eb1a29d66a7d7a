package com.strategylab.optimizer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for optimizer sweeps. Spring shuts it down with the context.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "optimizerExecutor")
    public ExecutorService optimizerExecutor(BacktestProperties properties) {
        int workerThreads = Math.max(1, properties.getOptimizer().getWorkerThreads());
        AtomicInteger counter = new AtomicInteger();
        log.info("Creating optimizer pool with {} worker threads", workerThreads);

        return Executors.newFixedThreadPool(workerThreads,
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("OptimizerWorker-" + counter.incrementAndGet());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
