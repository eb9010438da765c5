package com.github.tspjava.tsp;

import com.github.tspjava.Util;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Record type to hold a solution to the problem.
 *
 * @param state reports whether the tour is {@link State#OPTIMAL} or only {@link State#APPROXIMATE}
 * @param cost  the total travel cost of the closed tour
 * @param nodes the locations in visiting order, represented as integer array indexes into the cost matrix.
 *              Starts and ends with zero, so a problem of size <code>n</code> yields <code>n + 1</code> entries.
 */
public record Tour(State state, double cost, List<Integer> nodes) {
    /**
     * Canonical constructor; takes an immutable copy of <code>nodes</code>.
     *
     * @param state reports whether the tour is {@link State#OPTIMAL} or only {@link State#APPROXIMATE}
     * @param cost  the total travel cost of the closed tour
     * @param nodes the locations in visiting order, starting and ending with zero
     */
    public Tour {
        nodes = ImmutableList.copyOf(nodes);
    }

    /**
     * Convenience constructor to compute the cost based on the cost matrix.
     *
     * @param state      reports whether the tour is {@link State#OPTIMAL} or only {@link State#APPROXIMATE}
     * @param costMatrix the travel costs
     * @param nodes      the locations in visiting order, starting and ending with zero
     */
    public Tour(State state, double[][] costMatrix, List<Integer> nodes) {
        this(state, Util.tourCost(nodes, costMatrix), nodes);
    }

    /**
     * How good the tour is known to be.
     */
    public enum State {
        /**
         * Produced by a heuristic. For metric costs, at most twice the optimal cost.
         */
        APPROXIMATE,
        /**
         * Proven minimal over all Hamiltonian cycles.
         */
        OPTIMAL
    }

    @Override
    public String toString() {
        return nodes.stream().map(String::valueOf).collect(Collectors.joining(" -> ")) +
                " (" + state + ", cost " + cost + ")";
    }
}
