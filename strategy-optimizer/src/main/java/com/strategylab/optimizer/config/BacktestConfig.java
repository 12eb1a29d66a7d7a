package com.strategylab.optimizer.config;

import com.strategylab.optimizer.domain.BacktestEngine;
import com.strategylab.optimizer.indicator.IndicatorCalculator;
import com.strategylab.optimizer.indicator.TechnicalIndicatorCalculator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the plain-Java engine into the application context.
 */
@Configuration
@EnableConfigurationProperties(BacktestProperties.class)
public class BacktestConfig {

    @Bean
    public IndicatorCalculator indicatorCalculator() {
        return new TechnicalIndicatorCalculator();
    }

    @Bean
    public BacktestEngine backtestEngine(IndicatorCalculator indicatorCalculator) {
        return new BacktestEngine(indicatorCalculator);
    }
}
