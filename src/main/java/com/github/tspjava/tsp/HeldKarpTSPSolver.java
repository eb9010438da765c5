package com.github.tspjava.tsp;

import com.github.tspjava.TSPException;
import com.google.errorprone.annotations.concurrent.GuardedBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.function.IntSupplier;
import java.util.stream.IntStream;

import static com.github.tspjava.TSPException.Kind.INTERNAL_INVARIANT_VIOLATION;
import static com.github.tspjava.TSPException.Kind.SUBSET_OVERFLOW;
import static com.github.tspjava.Util.checkDeadline;
import static com.github.tspjava.Util.deadline;
import static com.github.tspjava.Util.toSeconds;
import static java.lang.Double.POSITIVE_INFINITY;

/**
 * <p>
 * Exact solver for the symmetric Travelling Salesman Problem, using the Held-Karp dynamic program over subsets of
 * locations.
 * </p><p>
 * For every subset <code>S</code> containing location zero (a bitmask with bit zero set), and every other
 * location <code>i</code> in <code>S</code>, the table holds the cost of the cheapest path that starts at zero,
 * visits exactly <code>S</code>, and ends at <code>i</code>. The tour is then read back from the full set.
 * </p><p>
 * Time is <code>O(2^n n^2)</code> and memory is <code>O(2^n n)</code>, which puts a hard ceiling on the problem
 * size: anything above {@link #getMaxSize()} is refused with {@link TSPException.Kind#SUBSET_OVERFLOW} before any
 * allocation. The default of {@value #DEFAULT_MAX_SIZE} already needs several gigabytes of heap; in practice
 * expect to stay around 20.
 * </p><p>
 * With {@link #setParallelism(int)} above one, the subsets of each size are spread over a dedicated
 * {@link ForkJoinPool}, which is released by {@link #close()}. Results do not depend on the parallelism.
 * </p>
 */
public class HeldKarpTSPSolver extends TSPSolver implements AutoCloseable {
    /**
     * Largest size the subset bitmask can represent.
     */
    public static final int MAX_SUPPORTED_SIZE = 30;
    /**
     * Default for {@link #setMaxSize(int)}.
     */
    public static final int DEFAULT_MAX_SIZE = 25;
    private static final int DEADLINE_CHECK_MASK = 0x3FF;

    private int maxSize = DEFAULT_MAX_SIZE;
    private int parallelism = 1;
    @GuardedBy("this")
    private ForkJoinPool pool;

    /**
     * Default constructor
     */
    public HeldKarpTSPSolver() {
    }

    @Override
    protected Tour doSolve(int size, double[][] costMatrix, long timeout) {
        if (size > maxSize) {
            throw new TSPException(SUBSET_OVERFLOW, "size " + size + " exceeds the maximum of " + maxSize);
        }
        if (size == 1) {
            return new Tour(Tour.State.OPTIMAL, 0.0, List.of(0, 0));
        }

        var start = System.currentTimeMillis();
        var deadline = deadline(timeout);
        var opt = new double[1 << (size - 1)][];

        if (parallelism > 1) {
            fillParallel(size, costMatrix, opt, deadline);
        } else {
            fillSequential(size, costMatrix, opt, deadline);
        }

        debug("Filled " + opt.length + "x" + size + " table in " +
                toSeconds(System.currentTimeMillis() - start) + "s; parallelism " + parallelism);

        var tour = new Tour(Tour.State.OPTIMAL, costMatrix, reconstruct(size, costMatrix, opt));

        debug("Elapsed: " + toSeconds(System.currentTimeMillis() - start) + "s; " + tour);
        return tour;
    }

    // increasing numeric order, so that S \ {i} is always filled before S
    private static void fillSequential(int size, double[][] costMatrix, double[][] opt, long deadline) {
        for (var subset = 1; subset < 1 << size; subset += 2) {
            if ((subset & DEADLINE_CHECK_MASK) == 1) {
                checkDeadline(deadline, "subset " + subset);
            }
            opt[subset >>> 1] = computeRow(subset, size, costMatrix, opt);
        }
    }

    // one layer per subset size; every row in a layer depends only on the layer below
    private void fillParallel(int size, double[][] costMatrix, double[][] opt, long deadline) {
        var workers = getPool();

        for (var members = 1; members <= size; members++) {
            var layer = members;

            checkDeadline(deadline, "subsets of size " + layer);
            await(workers.submit(() -> IntStream.range(0, opt.length)
                    .parallel()
                    .map(row -> row << 1 | 1)
                    .filter(subset -> Integer.bitCount(subset) == layer)
                    .forEach(subset -> {
                        if ((subset & DEADLINE_CHECK_MASK) == 1) {
                            checkDeadline(deadline, "subset " + subset);
                        }
                        opt[subset >>> 1] = computeRow(subset, size, costMatrix, opt);
                    })));
        }
    }

    // a worker's runtime exception surfaces as itself
    static void await(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while filling the subset table", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    /**
     * Compute the table row for one subset. Cells for locations outside the subset, and for location zero, are
     * left at +infinity.
     */
    static double[] computeRow(int subset, int size, double[][] costMatrix, double[][] opt) {
        var row = new double[size];
        var members = Integer.bitCount(subset);

        Arrays.fill(row, POSITIVE_INFINITY);
        for (var i = 1; i < size; i++) {
            if ((subset & 1 << i) == 0) {
                continue;
            }
            if (members == 2) {
                row[i] = costMatrix[0][i];
                continue;
            }

            var prev = opt[(subset & ~(1 << i)) >>> 1];
            var min = POSITIVE_INFINITY;

            for (var j = 1; j < size; j++) {
                if (j != i && (subset & 1 << j) != 0) {
                    var cost = prev[j] + costMatrix[j][i];
                    if (cost < min) {
                        min = cost;
                    }
                }
            }
            row[i] = min;
        }
        return row;
    }

    /**
     * Read the tour back out of a filled table, from the last location visited towards the first. Ties go to the
     * lowest location index.
     *
     * @throws TSPException of kind {@link TSPException.Kind#INTERNAL_INVARIANT_VIOLATION} if some step has no
     *                      finite candidate
     */
    static List<Integer> reconstruct(int size, double[][] costMatrix, double[][] opt) {
        var tour = new ArrayList<Integer>(size + 1);
        var remaining = (1 << size) - 1;
        var last = 0;

        tour.add(0);
        for (var step = 1; step < size; step++) {
            var row = opt[remaining >>> 1];
            var best = -1;
            var min = POSITIVE_INFINITY;

            for (var k = 1; k < size; k++) {
                if ((remaining & 1 << k) != 0) {
                    var cost = row[k] + costMatrix[k][last];
                    if (cost < min) {
                        min = cost;
                        best = k;
                    }
                }
            }

            if (best < 0) {
                throw new TSPException(INTERNAL_INVARIANT_VIOLATION,
                        "no candidate at step " + step + " for subset " + Integer.toBinaryString(remaining));
            }
            tour.add(best);
            remaining &= ~(1 << best);
            last = best;
        }
        tour.add(0);

        return tour;
    }

    private synchronized ForkJoinPool getPool() {
        if (pool != null && pool.getParallelism() != parallelism) {
            pool.shutdown();
            pool = null;
        }
        if (pool == null) {
            pool = new ForkJoinPool(parallelism);
        }
        return pool;
    }

    /**
     * Shut down the worker pool, if one was started. The solver remains usable; a new pool is started on demand.
     */
    @Override
    public synchronized void close() {
        if (pool != null) {
            pool.shutdown();
            pool = null;
        }
    }

    /**
     * Get the maxSize property
     *
     * @return the largest problem size this solver will attempt
     */
    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Set the maxSize property. Problems larger than this fail with {@link TSPException.Kind#SUBSET_OVERFLOW}.
     *
     * @param maxSize between 1 and {@value #MAX_SUPPORTED_SIZE}
     */
    public void setMaxSize(int maxSize) {
        if (maxSize < 1 || maxSize > MAX_SUPPORTED_SIZE) {
            throw new IllegalArgumentException("maxSize must be between 1 and " + MAX_SUPPORTED_SIZE + ".");
        }
        this.maxSize = maxSize;
    }

    /**
     * Get the parallelism property
     *
     * @return the number of worker threads used to fill the table; 1 means the calling thread only
     */
    public int getParallelism() {
        return parallelism;
    }

    /**
     * Set the parallelism property.
     *
     * @param parallelism a positive number of worker threads; 1 (the default) fills the table on the calling thread
     */
    public void setParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive.");
        }
        this.parallelism = parallelism;
    }

    /**
     * Set the parallelism property from a supplier, such as ojAlgo's
     * {@link org.ojalgo.concurrent.Parallelism#CORES}.
     *
     * @param parallelism supplies a positive number of worker threads
     */
    public void setParallelism(IntSupplier parallelism) {
        setParallelism(parallelism.getAsInt());
    }
}
