package com.strategylab.optimizer.domain.optimization;

import com.strategylab.optimizer.domain.InvalidParameterException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ParameterGrid enumeration and sampling.
 */
class ParameterGridTest {

    private static ParameterGrid grid() {
        Map<String, List<?>> candidates = new LinkedHashMap<>();
        candidates.put("fastWindow", List.of(5, 10));
        candidates.put("slowWindow", List.of(20, 30, 50));
        return ParameterGrid.of(candidates);
    }

    @Test
    void testSizeIsCartesianProduct() {
        assertEquals(6, grid().size());
        assertEquals(List.of("fastWindow", "slowWindow"), grid().parameterNames());
    }

    @Test
    void testLastParameterVariesFastest() {
        ParameterGrid grid = grid();

        assertEquals(Map.of("fastWindow", 5, "slowWindow", 20), grid.combinationAt(0));
        assertEquals(Map.of("fastWindow", 5, "slowWindow", 30), grid.combinationAt(1));
        assertEquals(Map.of("fastWindow", 10, "slowWindow", 20), grid.combinationAt(3));
        assertEquals(Map.of("fastWindow", 10, "slowWindow", 50), grid.combinationAt(5));
        assertThrows(IndexOutOfBoundsException.class, () -> grid.combinationAt(6));
    }

    @Test
    void testCombinationsAreDistinct() {
        List<Map<String, Object>> combinations = grid().combinations();

        assertEquals(6, combinations.size());
        assertEquals(6, new HashSet<>(combinations).size());
    }

    @Test
    void testSampleIsReproducibleForSeed() {
        ParameterGrid grid = grid();

        List<Map<String, Object>> first = grid.sample(3, new Random(42));
        List<Map<String, Object>> second = grid.sample(3, new Random(42));

        assertEquals(first, second);
        assertEquals(3, new HashSet<>(first).size());
        assertTrue(grid.combinations().containsAll(first));
    }

    @Test
    void testSampleKeepsEnumerationOrder() {
        ParameterGrid grid = grid();
        List<Map<String, Object>> all = grid.combinations();

        List<Map<String, Object>> sample = grid.sample(4, new Random(7));

        for (int i = 1; i < sample.size(); i++) {
            assertTrue(all.indexOf(sample.get(i - 1)) < all.indexOf(sample.get(i)));
        }
    }

    @Test
    void testOversizedSampleReturnsWholeGrid() {
        assertEquals(grid().combinations(), grid().sample(100, new Random(1)));
    }

    @Test
    void testInvalidGrids() {
        assertThrows(InvalidParameterException.class, () -> ParameterGrid.of(Map.of()));
        assertThrows(InvalidParameterException.class, () -> ParameterGrid.of(Map.of("period", List.of())));
        assertThrows(InvalidParameterException.class, () -> ParameterGrid.of(Map.of(" ", List.of(1))));
        assertThrows(InvalidParameterException.class,
                () -> ParameterGrid.of(Map.of("period", Arrays.asList(10, null))));
        assertThrows(InvalidParameterException.class, () -> grid().sample(0, new Random(1)));
    }

    @Test
    void testRepeatedCandidateRejected() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> ParameterGrid.of(Map.of("fastWindow", List.of(5, 5, 5))));

        assertTrue(e.getMessage().contains("fastWindow"));
    }
}
