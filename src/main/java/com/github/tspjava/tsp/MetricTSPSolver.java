package com.github.tspjava.tsp;

import com.github.tspjava.TSPException;
import com.github.tspjava.mst.SpanningTree;
import com.github.tspjava.mst.SpanningTreeBuilder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

import static com.github.tspjava.TSPException.Kind.INTERNAL_INVARIANT_VIOLATION;
import static com.github.tspjava.Util.toSeconds;

/**
 * <p>
 * The classic 2-approximation for the metric Travelling Salesman Problem: build a minimum spanning tree, walk it
 * depth-first from location zero, and skip locations already visited.
 * </p><p>
 * If the costs satisfy the triangle inequality, the tour costs at most twice the optimum. That precondition is not
 * checked; without it the result is still a valid tour, but the bound is lost.
 * </p>
 *
 * @see SpanningTreeBuilder
 */
public class MetricTSPSolver extends TSPSolver {
    /**
     * Default constructor
     */
    public MetricTSPSolver() {
    }

    @Override
    protected Tour doSolve(int size, double[][] costMatrix, long timeout) {
        var start = System.currentTimeMillis();
        var tree = SpanningTreeBuilder.build(size, costMatrix, timeout);

        debug("Spanning tree weight " + tree.weight() + ": " + tree.edges());

        var tour = new Tour(Tour.State.APPROXIMATE, costMatrix, shortcut(size, tree));

        debug("Elapsed: " + toSeconds(System.currentTimeMillis() - start) + "s; " + tour);
        return tour;
    }

    /**
     * Traverse the Eulerian circuit implicitly defined by the tree, skipping already visited locations.
     * Neighbours are pushed in tree-construction order, so the last one pushed is explored first.
     */
    static List<Integer> shortcut(int size, SpanningTree tree) {
        var adjacency = adjacencyLists(size, tree);
        var visited = new boolean[size];
        var tour = new ArrayList<Integer>(size + 1);
        var open = new ArrayDeque<Integer>();

        open.push(0);
        while (tour.size() < size) {
            var node = open.poll();

            if (node == null) {
                throw new TSPException(INTERNAL_INVARIANT_VIOLATION,
                        "tree walk ended after " + tour.size() + " of " + size + " locations");
            }
            if (!visited[node]) {
                visited[node] = true;
                tour.add(node);
                adjacency.get(node).forEach(open::push);
            }
        }
        tour.add(0);

        return tour;
    }

    private static List<List<Integer>> adjacencyLists(int size, SpanningTree tree) {
        var adjacency = new ArrayList<List<Integer>>(size);

        for (var i = 0; i < size; i++) {
            adjacency.add(new ArrayList<>());
        }
        for (var edge : tree.edges()) {
            adjacency.get(edge.head()).add(edge.tail());
            adjacency.get(edge.tail()).add(edge.head());
        }
        return adjacency;
    }
}
