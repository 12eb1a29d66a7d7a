package com.strategylab.optimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Summary statistics of one backtest run. Percentages are expressed in percent (6.93 = 6.93%),
 * {@code winRate} as a fraction in [0, 1].
 */
@Value
@Builder
public class PerformanceReport {

    BigDecimal initialCapital;
    BigDecimal finalEquity;
    BigDecimal totalReturnPct;
    BigDecimal winRate;
    BigDecimal sharpeRatio;
    BigDecimal sortinoRatio;
    BigDecimal volatilityPct;
    BigDecimal maxDrawdownPct;
    BigDecimal calmarRatio;
    BigDecimal profitFactor;
    int numTrades;
    int winningTrades;
    int losingTrades;
    BigDecimal averageWin;
    BigDecimal averageLoss;
    BigDecimal largestWin;
    BigDecimal largestLoss;
}
