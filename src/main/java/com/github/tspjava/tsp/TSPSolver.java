package com.github.tspjava.tsp;

import com.github.tspjava.TSPException;
import com.github.tspjava.Util;
import org.ojalgo.netio.BasicLogger;

/**
 * <p>
 * Abstract superclass for implementations of a symmetric Travelling Salesman Problem solver.
 * </p><p>
 * Location zero is the start and end of every tour. The cost matrix must be square, symmetric, non-negative
 * and finite off the diagonal; the diagonal is ignored.
 * </p>
 */
public abstract class TSPSolver {
    private boolean debug;

    /**
     * Default constructor.
     */
    protected TSPSolver() {
    }

    /**
     * Equivalent to <code>solve(size, costMatrix, 1000L * 60L * 60L)</code>
     *
     * @param size       the number of locations
     * @param costMatrix symmetric square matrix of distances between locations
     * @return the tour
     */
    public final Tour solve(int size, double[][] costMatrix) {
        return solve(size, costMatrix, 1000L * 60L * 60L);
    }

    /**
     * Solve the symmetric Travelling Salesman Problem (TSP)
     *
     * @param size          the number of locations
     * @param costMatrix    symmetric square matrix of distances between locations
     * @param timeoutMillis the maximum wall-clock time in milliseconds
     * @return the tour
     * @throws TSPException if the input is invalid, the timeout expires, or the solver cannot handle the size
     */
    public final Tour solve(int size, double[][] costMatrix, long timeoutMillis) {
        Util.validate(size, costMatrix, true);

        return doSolve(size, costMatrix, timeoutMillis);
    }

    /**
     * To be implemented by subclasses. Called by {@link #solve(int, double[][], long)} after validating the
     * cost matrix.
     *
     * @param size       the number of locations
     * @param costMatrix symmetric square matrix of distances between locations
     * @param timeout    the maximum wall-clock time in milliseconds
     * @return the tour
     */
    protected abstract Tour doSolve(int size, double[][] costMatrix, long timeout);

    void debug(String s) {
        if (debug) {
            BasicLogger.debug(s);
        }
    }

    /**
     * Get the debug property
     *
     * @return true if debug logging is enabled
     */
    public boolean isDebug() {
        return debug;
    }

    /**
     * Set the debug property. If enabled, logging works via ojAlgo's {@link BasicLogger} mechanism.
     * You can supply a thin wrapper implementation to redirect it to the logging library of your choice.
     *
     * @param debug true if debug logging is enabled
     */
    public void setDebug(boolean debug) {
        this.debug = debug;
    }
}
