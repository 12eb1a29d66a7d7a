package com.strategylab.optimizer.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable, timestamp-ordered sequence of bars for one instrument.
 * Shared read-only by every backtest run spawned from it.
 */
public final class PriceSeries {

    private final String symbol;
    private final BarInterval interval;
    private final List<Bar> bars;

    private PriceSeries(String symbol, BarInterval interval, List<Bar> bars) {
        this.symbol = symbol;
        this.interval = interval;
        this.bars = bars;
    }

    /**
     * Build a series, rejecting bars without a timestamp and timestamps that are not
     * strictly increasing.
     */
    public static PriceSeries of(String symbol, BarInterval interval, List<Bar> bars) {
        if (interval == null) {
            throw new InvalidParameterException("Bar interval is required");
        }
        if (bars == null) {
            throw new InvalidParameterException("Bars are required");
        }

        Instant previous = null;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null || bar.getTimestamp() == null) {
                throw new InvalidParameterException("Bar " + i + " has no timestamp");
            }
            if (previous != null && !bar.getTimestamp().isAfter(previous)) {
                throw new InvalidParameterException("Bar timestamps must be strictly increasing (index "
                        + i + ": " + bar.getTimestamp() + " after " + previous + ")");
            }
            previous = bar.getTimestamp();
        }

        return new PriceSeries(symbol, interval, Collections.unmodifiableList(new ArrayList<>(bars)));
    }

    /**
     * Read-only view of bars {@code [fromIndex, toIndex)}.
     */
    public PriceSeries slice(int fromIndex, int toIndex) {
        if (fromIndex < 0 || toIndex > bars.size() || fromIndex > toIndex) {
            throw new IndexOutOfBoundsException("Invalid slice [" + fromIndex + ", " + toIndex
                    + ") of series with " + bars.size() + " bars");
        }
        return new PriceSeries(symbol, interval, bars.subList(fromIndex, toIndex));
    }

    public String getSymbol() {
        return symbol;
    }

    public BarInterval getInterval() {
        return interval;
    }

    public List<Bar> getBars() {
        return bars;
    }

    public Bar get(int index) {
        return bars.get(index);
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    /**
     * Close prices as doubles, {@code NaN} where the close is missing.
     */
    public double[] closes() {
        double[] closes = new double[bars.size()];
        for (int i = 0; i < closes.length; i++) {
            BigDecimal close = bars.get(i).getClose();
            closes[i] = close != null ? close.doubleValue() : Double.NaN;
        }
        return closes;
    }

    @Override
    public String toString() {
        return "PriceSeries(" + symbol + ", " + interval.getCode() + ", " + bars.size() + " bars)";
    }
}
