package com.strategylab.optimizer.domain.optimization;

import com.strategylab.optimizer.domain.InvalidParameterException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ordered mapping of parameter name to candidate values. Combinations enumerate the Cartesian
 * product with the last parameter varying fastest.
 */
public final class ParameterGrid {

    private final Map<String, List<Object>> candidates;
    private final long size;

    private ParameterGrid(Map<String, List<Object>> candidates, long size) {
        this.candidates = candidates;
        this.size = size;
    }

    /**
     * @throws InvalidParameterException if the grid is empty, a name is blank, or a candidate list is
     *                                   empty or repeats a value
     */
    public static ParameterGrid of(Map<String, ? extends List<?>> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new InvalidParameterException("Parameter grid must name at least one parameter");
        }

        Map<String, List<Object>> copy = new LinkedHashMap<>();
        long size = 1;
        for (Map.Entry<String, ? extends List<?>> entry : candidates.entrySet()) {
            String name = entry.getKey();
            if (name == null || name.isBlank()) {
                throw new InvalidParameterException("Parameter grid contains a blank parameter name");
            }
            List<?> values = entry.getValue();
            if (values == null || values.isEmpty()) {
                throw new InvalidParameterException("Parameter '" + name + "' has no candidate values");
            }
            Set<Object> seen = new HashSet<>();
            for (Object value : values) {
                if (value == null) {
                    throw new InvalidParameterException("Parameter '" + name + "' contains a null candidate");
                }
                if (!seen.add(value)) {
                    throw new InvalidParameterException("Parameter '" + name + "' lists " + value + " more than once");
                }
            }
            copy.put(name, List.copyOf(values));
            size = Math.multiplyExact(size, values.size());
        }
        return new ParameterGrid(Collections.unmodifiableMap(copy), size);
    }

    public List<String> parameterNames() {
        return List.copyOf(candidates.keySet());
    }

    /** Number of combinations in the full product. */
    public long size() {
        return size;
    }

    /**
     * Every combination, in enumeration order.
     */
    public List<Map<String, Object>> combinations() {
        if (size > Integer.MAX_VALUE) {
            throw new InvalidParameterException("Parameter grid too large to enumerate: " + size + " combinations");
        }
        List<Map<String, Object>> combinations = new ArrayList<>((int) size);
        for (long i = 0; i < size; i++) {
            combinations.add(combinationAt(i));
        }
        return combinations;
    }

    /**
     * Distinct combinations drawn without replacement, returned in enumeration order.
     * A sample at least as large as the grid returns the whole grid.
     */
    public List<Map<String, Object>> sample(int sampleSize, Random random) {
        if (sampleSize <= 0) {
            throw new InvalidParameterException("Sample size must be positive: " + sampleSize);
        }
        if (sampleSize >= size) {
            return combinations();
        }

        // Floyd's algorithm: exactly sampleSize draws, no rejection loop
        Set<Long> picked = new LinkedHashSet<>();
        for (long j = size - sampleSize; j < size; j++) {
            long candidate = random.nextLong(j + 1);
            picked.add(picked.contains(candidate) ? j : candidate);
        }

        List<Map<String, Object>> sample = new ArrayList<>(sampleSize);
        for (long index : new TreeSet<>(picked)) {
            sample.add(combinationAt(index));
        }
        return sample;
    }

    /**
     * Decode a combination from its position in the product.
     */
    public Map<String, Object> combinationAt(long index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Combination " + index + " outside grid of " + size);
        }

        List<String> names = parameterNames();
        Object[] values = new Object[names.size()];
        long remainder = index;
        for (int p = names.size() - 1; p >= 0; p--) {
            List<Object> options = candidates.get(names.get(p));
            values[p] = options.get((int) (remainder % options.size()));
            remainder /= options.size();
        }

        Map<String, Object> combination = new LinkedHashMap<>();
        for (int p = 0; p < names.size(); p++) {
            combination.put(names.get(p), values[p]);
        }
        return combination;
    }

    @Override
    public String toString() {
        return "ParameterGrid" + candidates;
    }
}
