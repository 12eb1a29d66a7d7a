package com.strategylab.optimizer.indicator;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Indicator values aligned 1:1 with a price series by bar index.
 * Undefined values (warm-up, gaps) are {@code NaN}.
 */
public final class IndicatorSeries {

    public static final String VALUE = "value";
    public static final String MACD_LINE = "macd";
    public static final String SIGNAL_LINE = "signal";
    public static final String HISTOGRAM = "histogram";
    public static final String UPPER = "upper";
    public static final String MIDDLE = "middle";
    public static final String LOWER = "lower";

    private final IndicatorSpec spec;
    private final Map<String, double[]> components;
    private final int size;

    private IndicatorSeries(IndicatorSpec spec, Map<String, double[]> components, int size) {
        this.spec = spec;
        this.components = components;
        this.size = size;
    }

    /**
     * @param components component name to values; every array must have the same length
     */
    public static IndicatorSeries of(IndicatorSpec spec, Map<String, double[]> components) {
        if (components.isEmpty()) {
            throw new IllegalArgumentException("Indicator " + spec + " has no components");
        }
        Map<String, double[]> copy = new LinkedHashMap<>();
        int size = -1;
        for (Map.Entry<String, double[]> entry : components.entrySet()) {
            double[] values = entry.getValue();
            if (size >= 0 && values.length != size) {
                throw new IllegalArgumentException("Component " + entry.getKey() + " of " + spec
                        + " has " + values.length + " values, expected " + size);
            }
            size = values.length;
            copy.put(entry.getKey(), Arrays.copyOf(values, values.length));
        }
        return new IndicatorSeries(spec, copy, size);
    }

    public static IndicatorSeries single(IndicatorSpec spec, double[] values) {
        return of(spec, Map.of(VALUE, values));
    }

    public int size() {
        return size;
    }

    /**
     * @return the value, or {@code NaN} when undefined at {@code index}
     */
    public double value(String component, int index) {
        double[] values = components.get(component);
        if (values == null) {
            throw new IllegalArgumentException("Indicator " + spec + " has no component '" + component + "'");
        }
        return values[index];
    }

    public double value(int index) {
        return value(VALUE, index);
    }

    /**
     * True when every component holds a finite number at {@code index}.
     */
    public boolean isDefined(int index) {
        if (index < 0 || index >= size) {
            return false;
        }
        for (double[] values : components.values()) {
            if (!Double.isFinite(values[index])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Index of the first fully defined value, or -1 if there is none.
     */
    int firstDefinedIndex() {
        for (int i = 0; i < size; i++) {
            if (isDefined(i)) {
                return i;
            }
        }
        return -1;
    }
}
