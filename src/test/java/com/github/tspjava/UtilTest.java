package com.github.tspjava;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.tspjava.TSPException.Kind.ASYMMETRIC_COST;
import static com.github.tspjava.TSPException.Kind.INVALID_DIMENSION;
import static com.github.tspjava.TSPException.Kind.NEGATIVE_OR_NON_FINITE_COST;
import static com.github.tspjava.TSPException.Kind.TIMED_OUT;
import static java.lang.Double.NaN;
import static java.lang.Double.POSITIVE_INFINITY;
import static org.junit.jupiter.api.Assertions.*;

class UtilTest {
    @Test
    void acceptsValidMatrices() {
        assertDoesNotThrow(() -> Util.validate(1, new double[][]{{0.0}}, true));
        assertDoesNotThrow(() -> Util.validate(2, new double[][]{{0.0, 1.5}, {1.5, 0.0}}, true));

        // the diagonal is never read
        assertDoesNotThrow(() -> Util.validate(2, new double[][]{{NaN, 1.0}, {1.0, -7.0}}, true));

        // infinity means "not connected" where finiteness isn't required
        assertDoesNotThrow(() -> Util.validate(2, new double[][]{
                {0.0, POSITIVE_INFINITY},
                {POSITIVE_INFINITY, 0.0}}, false));
    }

    @Test
    void rejectsBadDimensions() {
        assertKind(INVALID_DIMENSION, 0, new double[0][0], true);
        assertKind(INVALID_DIMENSION, -1, new double[0][0], true);
        assertKind(INVALID_DIMENSION, 2, null, true);
        assertKind(INVALID_DIMENSION, 3, new double[2][2], true);
        assertKind(INVALID_DIMENSION, 2, new double[][]{{0.0, 1.0}, {1.0}}, true);
        assertKind(INVALID_DIMENSION, 2, new double[][]{{0.0, 1.0}, null}, true);
    }

    @Test
    void rejectsBadCosts() {
        assertKind(NEGATIVE_OR_NON_FINITE_COST, 2, new double[][]{{0.0, -1.0}, {-1.0, 0.0}}, true);
        assertKind(NEGATIVE_OR_NON_FINITE_COST, 2, new double[][]{{0.0, NaN}, {NaN, 0.0}}, false);
        assertKind(NEGATIVE_OR_NON_FINITE_COST, 2, new double[][]{
                {0.0, POSITIVE_INFINITY},
                {POSITIVE_INFINITY, 0.0}}, true);
        assertKind(NEGATIVE_OR_NON_FINITE_COST, 2, new double[][]{
                {0.0, Double.NEGATIVE_INFINITY},
                {Double.NEGATIVE_INFINITY, 0.0}}, false);
    }

    @Test
    void rejectsCostsThatOverflowWhenSummed() {
        double[][] huge = {
                {0.0, 1e308, 1e308},
                {1e308, 0.0, 1e308},
                {1e308, 1e308, 0.0}};

        assertKind(NEGATIVE_OR_NON_FINITE_COST, 3, huge, true);
        assertKind(NEGATIVE_OR_NON_FINITE_COST, 3, huge, false);

        // large, but four of them still fit in a double
        assertDoesNotThrow(() -> Util.validate(3, new double[][]{
                {0.0, 1e300, 1e300},
                {1e300, 0.0, 1e300},
                {1e300, 1e300, 0.0}}, true));
        // missing edges don't count towards the sum
        assertDoesNotThrow(() -> Util.validate(3, new double[][]{
                {0.0, POSITIVE_INFINITY, 1.0},
                {POSITIVE_INFINITY, 0.0, 1.0},
                {1.0, 1.0, 0.0}}, false));
    }

    @Test
    void rejectsAsymmetricCosts() {
        assertKind(ASYMMETRIC_COST, 3, new double[][]{
                {0.0, 1.0, 2.0},
                {1.0, 0.0, 3.0},
                {2.0, 3.5, 0.0}}, true);
        assertKind(ASYMMETRIC_COST, 2, new double[][]{
                {0.0, 1.0},
                {POSITIVE_INFINITY, 0.0}}, false);
    }

    @Test
    void tourCost() {
        double[][] costs = {
                {0.0, 1.0, 3.0},
                {1.0, 0.0, 2.0},
                {3.0, 2.0, 0.0}};

        assertEquals(6.0, Util.tourCost(List.of(0, 1, 2, 0), costs));
        assertEquals(3.0, Util.tourCost(List.of(0, 1, 2), costs));
        assertEquals(0.0, Util.tourCost(List.of(0), costs));
    }

    @Test
    void deadlines() {
        assertEquals(Long.MAX_VALUE, Util.deadline(Long.MAX_VALUE));
        assertDoesNotThrow(() -> Util.checkDeadline(Util.deadline(60_000L), "test"));

        var e = assertThrows(TSPException.class, () -> Util.checkDeadline(System.currentTimeMillis() - 1L, "test"));
        assertEquals(TIMED_OUT, e.getKind());
    }

    private static void assertKind(TSPException.Kind kind, int size, double[][] costMatrix, boolean requireFinite) {
        var e = assertThrows(TSPException.class, () -> Util.validate(size, costMatrix, requireFinite));
        assertEquals(kind, e.getKind());
    }
}
