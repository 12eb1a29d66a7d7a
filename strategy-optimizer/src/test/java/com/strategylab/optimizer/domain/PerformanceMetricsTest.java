package com.strategylab.optimizer.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PerformanceMetrics calculations.
 */
class PerformanceMetricsTest {

    @Test
    void testCalculateTotalReturn_WithProfit() {
        BigDecimal totalReturn = PerformanceMetrics.calculateTotalReturn(new BigDecimal("1000"), new BigDecimal("1069.3"));

        assertEquals(new BigDecimal("6.9300"), totalReturn);
    }

    @Test
    void testCalculateTotalReturn_WithLoss() {
        BigDecimal totalReturn = PerformanceMetrics.calculateTotalReturn(new BigDecimal("10000"), new BigDecimal("8500"));

        assertEquals(new BigDecimal("-15.0000"), totalReturn);
    }

    @Test
    void testCalculateMaxDrawdown_PositivePercentage() {
        // Peak 120 -> 90 is 25%, later 130 -> 117 is only 10%
        List<BigDecimal> equity = values("100", "120", "90", "130", "117");

        assertEquals(new BigDecimal("25.0000"), PerformanceMetrics.calculateMaxDrawdown(equity));
    }

    @Test
    void testCalculateMaxDrawdown_NoDrawdown() {
        assertEquals(0, PerformanceMetrics.calculateMaxDrawdown(values("100", "110", "120")).signum());
        assertEquals(0, PerformanceMetrics.calculateMaxDrawdown(List.of()).signum());
    }

    @Test
    void testCalculateSharpeRatio_ZeroWhenFlatOrTooShort() {
        assertEquals(0, PerformanceMetrics.calculateSharpeRatio(values("100", "100", "100"), 365).signum());
        assertEquals(0, PerformanceMetrics.calculateSharpeRatio(values("100"), 365).signum());
        assertEquals(0, PerformanceMetrics.calculateSharpeRatio(List.of(), 365).signum());
    }

    @Test
    void testCalculateSharpeRatio_AnnualisedWithPopulationStd() {
        // Returns 10% and 0%: mean 5%, population std 5%, ratio 1 * sqrt(365)
        BigDecimal sharpe = PerformanceMetrics.calculateSharpeRatio(values("100", "110", "110"), 365);

        assertEquals(new BigDecimal("19.1050"), sharpe);
    }

    @Test
    void testCalculateSortinoRatio_ZeroWithoutDownside() {
        assertEquals(0, PerformanceMetrics.calculateSortinoRatio(values("100", "110", "121"), 365).signum());
    }

    @Test
    void testCalculateSortinoRatio_PositiveWhenGainsOutweighLosses() {
        BigDecimal sortino = PerformanceMetrics.calculateSortinoRatio(values("100", "120", "114", "130"), 365);

        assertTrue(sortino.signum() > 0);
    }

    @Test
    void testCalculateWinRate() {
        List<Trade> trades = trades("10", "-5", "3", "0");

        assertEquals(new BigDecimal("0.5000"), PerformanceMetrics.calculateWinRate(trades));
        assertEquals(0, PerformanceMetrics.calculateWinRate(List.of()).signum());
    }

    @Test
    void testCalculateProfitFactor() {
        assertEquals(new BigDecimal("2.6000"), PerformanceMetrics.calculateProfitFactor(trades("10", "-5", "3")));
    }

    @Test
    void testCalculateProfitFactor_Sentinels() {
        assertEquals(PerformanceMetrics.PROFIT_FACTOR_NO_LOSSES, PerformanceMetrics.calculateProfitFactor(trades("10", "3")));
        assertEquals(PerformanceMetrics.PROFIT_FACTOR_NO_LOSSES, PerformanceMetrics.calculateProfitFactor(List.of()));
        assertEquals(0, PerformanceMetrics.calculateProfitFactor(trades("-10", "-3")).signum());
    }

    @Test
    void testCalculateCalmarRatio() {
        assertEquals(new BigDecimal("2.0000"),
                PerformanceMetrics.calculateCalmarRatio(new BigDecimal("20"), new BigDecimal("10")));
        assertEquals(0, PerformanceMetrics.calculateCalmarRatio(new BigDecimal("20"), BigDecimal.ZERO).signum());
    }

    @Test
    void testReport_CombinesMetrics() {
        // Arrange
        List<EquityPoint> curve = new ArrayList<>();
        String[] equity = {"1000", "990.1", "1069.3"};
        for (int i = 0; i < equity.length; i++) {
            curve.add(new EquityPoint(Instant.parse("2024-01-01T00:00:00Z").plusSeconds(3600L * i),
                    new BigDecimal(equity[i])));
        }

        // Act
        PerformanceReport report = PerformanceMetrics.report(new BigDecimal("1000"), curve,
                trades("69.3", "-10"), BarInterval.H1);

        // Assert
        assertEquals(new BigDecimal("6.9300"), report.getTotalReturnPct());
        assertEquals(new BigDecimal("1069.3000"), report.getFinalEquity());
        assertEquals(2, report.getNumTrades());
        assertEquals(1, report.getWinningTrades());
        assertEquals(1, report.getLosingTrades());
        assertEquals(new BigDecimal("0.5000"), report.getWinRate());
        assertEquals(new BigDecimal("69.3000"), report.getLargestWin());
        assertEquals(new BigDecimal("-10.0000"), report.getLargestLoss());
        assertEquals(new BigDecimal("6.9300"), report.getProfitFactor());
        assertEquals(new BigDecimal("0.9900"), report.getMaxDrawdownPct());
        assertTrue(report.getVolatilityPct().signum() > 0);
    }

    @Test
    void testReport_EmptyCurveKeepsInitialCapital() {
        PerformanceReport report = PerformanceMetrics.report(new BigDecimal("1000"), List.of(), List.of(), BarInterval.D1);

        assertEquals(0, report.getTotalReturnPct().signum());
        assertEquals(0, report.getNumTrades());
        assertEquals(PerformanceMetrics.PROFIT_FACTOR_NO_LOSSES, report.getProfitFactor());
    }

    private static List<BigDecimal> values(String... values) {
        return java.util.Arrays.stream(values).map(BigDecimal::new).toList();
    }

    private static List<Trade> trades(String... netPnls) {
        List<Trade> trades = new ArrayList<>();
        for (String netPnl : netPnls) {
            trades.add(Trade.builder()
                    .entryTimestamp(Instant.parse("2024-01-01T00:00:00Z"))
                    .entryPrice(new BigDecimal("100"))
                    .exitTimestamp(Instant.parse("2024-01-01T01:00:00Z"))
                    .exitPrice(new BigDecimal("100"))
                    .quantity(BigDecimal.ONE)
                    .grossPnl(new BigDecimal(netPnl))
                    .feePaid(BigDecimal.ZERO)
                    .netPnl(new BigDecimal(netPnl))
                    .exitReason(ExitReason.SIGNAL)
                    .build());
        }
        return trades;
    }
}
