package com.github.tspjava;

/**
 * Unchecked exception raised by the spanning tree builder and the tour solvers. No partial tree or tour is ever
 * returned alongside one of these.
 */
public class TSPException extends RuntimeException {
    /**
     * The category of failure.
     */
    public enum Kind {
        /**
         * The node count is not positive, or the cost matrix is missing or not square with the given dimension.
         */
        INVALID_DIMENSION,
        /**
         * <code>costMatrix[i][j] != costMatrix[j][i]</code> for some pair of nodes.
         */
        ASYMMETRIC_COST,
        /**
         * An off-diagonal cost is negative or NaN, or infinite where the algorithm needs finite costs.
         */
        NEGATIVE_OR_NON_FINITE_COST,
        /**
         * The spanning tree builder ran out of usable edges before connecting every node.
         */
        DISCONNECTED_GRAPH,
        /**
         * The problem is too large for the subset-indexed dynamic program.
         */
        SUBSET_OVERFLOW,
        /**
         * A solver reached a state that valid inputs cannot produce. This is a bug.
         */
        INTERNAL_INVARIANT_VIOLATION,
        /**
         * The caller's deadline passed before a result was available.
         */
        TIMED_OUT
    }

    private final Kind kind;

    /**
     * Constructor.
     *
     * @param kind    the category of failure
     * @param message a description naming the offending values
     */
    public TSPException(Kind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    /**
     * Get the category of failure.
     *
     * @return the kind
     */
    public Kind getKind() {
        return kind;
    }
}
