package com.github.tspjava;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static com.github.tspjava.TSPException.Kind.ASYMMETRIC_COST;
import static com.github.tspjava.TSPException.Kind.INVALID_DIMENSION;
import static com.github.tspjava.TSPException.Kind.NEGATIVE_OR_NON_FINITE_COST;
import static com.github.tspjava.TSPException.Kind.TIMED_OUT;

/**
 * Miscellaneous utilities.
 */
public class Util {
    private Util() {
    }

    /**
     * Validate a symmetric cost matrix. The diagonal is never read.
     *
     * @param size           the number of locations; must be positive
     * @param costMatrix     a square matrix of dimension <code>size</code>
     * @param requireFinite  if true, infinite costs are rejected; otherwise <code>+Infinity</code> is accepted
     *                       and means the pair of locations is not directly connected. Finite costs so large that
     *                       <code>size</code> of them could sum to infinity are rejected either way.
     * @throws TSPException of kind {@link TSPException.Kind#INVALID_DIMENSION},
     *                      {@link TSPException.Kind#NEGATIVE_OR_NON_FINITE_COST} or
     *                      {@link TSPException.Kind#ASYMMETRIC_COST} if invalid
     */
    public static void validate(int size, double[][] costMatrix, boolean requireFinite) {
        if (size <= 0) {
            throw new TSPException(INVALID_DIMENSION, "size must be positive, was " + size);
        }
        if (costMatrix == null || costMatrix.length != size) {
            throw new TSPException(INVALID_DIMENSION, "costMatrix must have " + size + " rows");
        }
        for (var row = 0; row < size; row++) {
            if (costMatrix[row] == null || costMatrix[row].length != size) {
                throw new TSPException(INVALID_DIMENSION, "costMatrix row " + row + " must have " + size + " columns");
            }
        }

        var max = 0.0;

        for (var row = 1; row < size; row++) {
            for (var col = 0; col < row; col++) {
                var lower = costMatrix[row][col];
                var upper = costMatrix[col][row];

                checkCost(row, col, lower, requireFinite);
                checkCost(col, row, upper, requireFinite);
                if (lower != upper) {
                    throw new TSPException(ASYMMETRIC_COST,
                            "costMatrix[" + row + "][" + col + "]=" + lower +
                                    " but costMatrix[" + col + "][" + row + "]=" + upper);
                }
                if (!Double.isInfinite(lower)) {
                    max = Math.max(max, lower);
                }
            }
        }

        // every path, tree or tour sums at most `size` finite costs
        if (Double.isInfinite(max * (size + 1))) {
            throw new TSPException(NEGATIVE_OR_NON_FINITE_COST,
                    "costs up to " + max + " can overflow a tour of " + size + " locations");
        }
    }

    private static void checkCost(int row, int col, double cost, boolean requireFinite) {
        if (Double.isNaN(cost) || cost < 0.0 || requireFinite && Double.isInfinite(cost)) {
            throw new TSPException(NEGATIVE_OR_NON_FINITE_COST, "costMatrix[" + row + "][" + col + "]=" + cost);
        }
    }

    /**
     * Compute the total cost of a sequence of locations, summing the cost of each consecutive pair.
     * Pass a closed sequence (first element equal to the last) to get the cost of a cycle.
     *
     * @param nodes      location indexes into <code>costMatrix</code>
     * @param costMatrix the travel costs
     * @return the sum; zero for sequences shorter than two
     */
    public static double tourCost(List<Integer> nodes, double[][] costMatrix) {
        var total = 0.0;

        for (var i = 1; i < nodes.size(); i++) {
            total += costMatrix[nodes.get(i - 1)][nodes.get(i)];
        }
        return total;
    }

    /**
     * Convert a timeout to an absolute deadline, saturating rather than overflowing.
     *
     * @param timeoutMillis the maximum wall-clock time in milliseconds
     * @return the deadline, as a {@link System#currentTimeMillis()} value
     */
    public static long deadline(long timeoutMillis) {
        var now = System.currentTimeMillis();
        return timeoutMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + timeoutMillis;
    }

    /**
     * Fail if the deadline has passed.
     *
     * @param deadline a {@link System#currentTimeMillis()} value
     * @param stage    what was in progress, for the exception message
     * @throws TSPException of kind {@link TSPException.Kind#TIMED_OUT}
     */
    public static void checkDeadline(long deadline, String stage) {
        if (System.currentTimeMillis() > deadline) {
            throw new TSPException(TIMED_OUT, "deadline passed during " + stage);
        }
    }

    /**
     * Format a millisecond count as seconds for the debug log.
     *
     * @param millis elapsed time
     * @return seconds, to 3 decimal places
     */
    public static BigDecimal toSeconds(long millis) {
        return BigDecimal.valueOf(millis).divide(BigDecimal.valueOf(1000L), 3, RoundingMode.HALF_EVEN);
    }
}
