package com.github.tspjava.mst;

import com.github.tspjava.TSPException;
import com.github.tspjava.Util;

import java.util.ArrayList;
import java.util.List;

import static com.github.tspjava.TSPException.Kind.DISCONNECTED_GRAPH;
import static com.github.tspjava.Util.checkDeadline;

/**
 * <p>
 * Kruskal's minimum spanning tree algorithm over a complete undirected graph given as a symmetric cost matrix.
 * </p><p>
 * Infinite costs are allowed here, and mean that the two locations are not directly connected. If that leaves
 * the graph disconnected, the build fails with {@link TSPException.Kind#DISCONNECTED_GRAPH}.
 * </p>
 */
public final class SpanningTreeBuilder {
    private static final int DEADLINE_CHECK_INTERVAL = 4096;

    private SpanningTreeBuilder() {
    }

    /**
     * Equivalent to <code>build(size, costMatrix, 1000L * 60L * 60L)</code>
     *
     * @param size       the number of locations
     * @param costMatrix symmetric square matrix of distances between locations (the diagonal is ignored)
     * @return the minimum spanning tree
     */
    public static SpanningTree build(int size, double[][] costMatrix) {
        return build(size, costMatrix, 1000L * 60L * 60L);
    }

    /**
     * Build a minimum spanning tree.
     *
     * @param size          the number of locations
     * @param costMatrix    symmetric square matrix of distances between locations (the diagonal is ignored)
     * @param timeoutMillis the maximum wall-clock time in milliseconds
     * @return the minimum spanning tree, with exactly <code>size - 1</code> edges
     * @throws TSPException if the matrix is invalid, the graph is disconnected, or the timeout expires
     */
    public static SpanningTree build(int size, double[][] costMatrix, long timeoutMillis) {
        Util.validate(size, costMatrix, false);

        return kruskal(size, costMatrix, Util.deadline(timeoutMillis));
    }

    private static SpanningTree kruskal(int size, double[][] costMatrix, long deadline) {
        var edges = enumerateEdges(size, costMatrix);

        checkDeadline(deadline, "edge enumeration");
        edges.sort(null);
        checkDeadline(deadline, "edge sorting");

        var tree = new ArrayList<Edge>(Math.max(size - 1, 0));
        var forest = new DisjointSetForest(size);

        for (var i = 0; i < edges.size() && tree.size() < size - 1; i++) {
            if (i % DEADLINE_CHECK_INTERVAL == 0) {
                checkDeadline(deadline, "edge scan");
            }

            var edge = edges.get(i);
            if (forest.union(edge.head(), edge.tail())) {
                tree.add(edge);
            }
        }

        if (tree.size() < size - 1) {
            throw new TSPException(DISCONNECTED_GRAPH, "only " + tree.size() + " of " + (size - 1) +
                    " edges selected; " + forest.count() + " components remain");
        }
        return new SpanningTree(tree);
    }

    // row-major, so the list starts out in (head, tail) order
    private static List<Edge> enumerateEdges(int size, double[][] costMatrix) {
        var edges = new ArrayList<Edge>(edgeCapacity(size));

        for (var head = 0; head < size; head++) {
            var row = costMatrix[head];

            for (var tail = head + 1; tail < size; tail++) {
                if (!Double.isInfinite(row[tail])) {
                    edges.add(new Edge(head, tail, row[tail]));
                }
            }
        }
        return edges;
    }

    // n(n-1)/2 overflows an int above 46341 locations
    static int edgeCapacity(int size) {
        return (int) Math.min((long) size * (size - 1) / 2, Integer.MAX_VALUE - 8);
    }
}
