package com.strategylab.optimizer.config;

import com.strategylab.optimizer.domain.BacktestSettings;
import com.strategylab.optimizer.domain.BarInterval;
import com.strategylab.optimizer.domain.ExecutionTiming;
import com.strategylab.optimizer.domain.PositionSizing;
import com.strategylab.optimizer.domain.optimization.OptimizationObjective;
import com.strategylab.optimizer.domain.optimization.WalkForwardConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Defaults for backtest runs and sweeps, bound from {@code backtest.*}.
 * Converted into immutable {@link BacktestSettings} before reaching the engine.
 */
@Data
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    private BigDecimal initialCapital = BacktestSettings.DEFAULT_INITIAL_CAPITAL;
    private BigDecimal feeRate = BacktestSettings.DEFAULT_FEE_RATE;
    private PositionSizing positionSizing = PositionSizing.WHOLE_UNITS;
    private BigDecimal positionFraction = BigDecimal.ONE;
    private ExecutionTiming executionTiming = ExecutionTiming.CLOSE;
    private String barInterval = BarInterval.H1.getCode();
    private BigDecimal stopLossPct;
    private BigDecimal takeProfitPct;
    private boolean requireFullWarmup = false;

    private Optimizer optimizer = new Optimizer();
    private WalkForward walkForward = new WalkForward();

    public BacktestSettings toSettings() {
        BacktestSettings settings = BacktestSettings.builder()
                .initialCapital(initialCapital)
                .feeRate(feeRate)
                .positionSizing(positionSizing)
                .positionFraction(positionFraction)
                .executionTiming(executionTiming)
                .barInterval(BarInterval.fromCode(barInterval))
                .stopLossPct(stopLossPct)
                .takeProfitPct(takeProfitPct)
                .requireFullWarmup(requireFullWarmup)
                .build();
        settings.validate();
        return settings;
    }

    public WalkForwardConfig toWalkForwardConfig() {
        return WalkForwardConfig.builder()
                .trainBars(walkForward.getTrainBars())
                .testBars(walkForward.getTestBars())
                .stepBars(walkForward.getStepBars())
                .maxWindows(walkForward.getMaxWindows())
                .build();
    }

    @Data
    public static class Optimizer {
        private OptimizationObjective objective = OptimizationObjective.SHARPE_RATIO;
        private int workerThreads = 4;
    }

    @Data
    public static class WalkForward {
        private int trainBars = 720;
        private int testBars = 168;
        private Integer stepBars;
        private int maxWindows = 0;
    }
}
