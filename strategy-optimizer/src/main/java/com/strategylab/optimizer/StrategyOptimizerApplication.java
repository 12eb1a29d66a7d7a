package com.strategylab.optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the strategy optimizer service.
 * Backtests, parameter searches and walk-forward validation run in-process on the optimizer pool.
 */
@SpringBootApplication
public class StrategyOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategyOptimizerApplication.class, args);
    }

}
