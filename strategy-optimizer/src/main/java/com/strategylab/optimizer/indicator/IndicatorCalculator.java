package com.strategylab.optimizer.indicator;

import com.strategylab.optimizer.domain.PriceSeries;

/**
 * Computes derived numeric series from prices. Results are aligned by bar index and carry
 * leading undefined values for the warm-up period.
 */
public interface IndicatorCalculator {

    IndicatorSeries compute(PriceSeries series, IndicatorSpec spec);
}
