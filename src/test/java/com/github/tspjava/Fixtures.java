package com.github.tspjava;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tspjava.mst.DisjointSetForest;
import com.github.tspjava.mst.Edge;
import com.google.common.collect.Collections2;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import com.google.common.collect.Sets;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Shared problem instances and brute-force oracles for the tests.
 */
public final class Fixtures {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Fixtures() {
    }

    /**
     * The 4-location example: <code>c[0][1]=1, c[0][2]=3, c[0][3]=2, c[1][2]=2, c[1][3]=4, c[2][3]=3</code>.
     */
    public static double[][] fourLocations() throws IOException {
        return load("/com/github/tspjava/tsp/four-locations.json");
    }

    public static double[][] load(String resource) throws IOException {
        return MAPPER.readValue(Fixtures.class.getResource(resource), double[][].class);
    }

    /**
     * Random points in a 100x100 square with Euclidean distances, which are metric.
     */
    public static double[][] euclidean(int size, long seed) {
        var rand = new Random(seed);
        var xs = rand.doubles(size, 0.0, 100.0).toArray();
        var ys = rand.doubles(size, 0.0, 100.0).toArray();
        var costs = new double[size][size];

        for (var i = 0; i < size; i++) {
            for (var j = 0; j < i; j++) {
                costs[i][j] = Math.hypot(xs[i] - xs[j], ys[i] - ys[j]);
                costs[j][i] = costs[i][j];
            }
        }
        return costs;
    }

    /**
     * Random symmetric integer costs in <code>[1, 20]</code>. Not necessarily metric.
     */
    public static double[][] randomSymmetric(int size, long seed) {
        var rand = new Random(seed);
        var costs = new double[size][size];

        for (var i = 0; i < size; i++) {
            for (var j = 0; j < i; j++) {
                costs[i][j] = 1 + rand.nextInt(20);
                costs[j][i] = costs[i][j];
            }
        }
        return costs;
    }

    /**
     * Minimum over all <code>(n-1)!</code> orderings of the locations after zero.
     */
    public static double bruteForceTourCost(double[][] costMatrix) {
        var size = costMatrix.length;
        if (size == 1) {
            return 0.0;
        }

        var interior = IntStream.range(1, size).boxed().toList();
        var best = Double.POSITIVE_INFINITY;

        for (var permutation : Collections2.permutations(interior)) {
            var tour = new ArrayList<Integer>(size + 1);
            tour.add(0);
            tour.addAll(permutation);
            tour.add(0);
            best = Math.min(best, Util.tourCost(tour, costMatrix));
        }
        return best;
    }

    /**
     * Minimum weight over every <code>(n-1)</code>-subset of edges that forms a spanning tree.
     */
    public static double bruteForceTreeWeight(double[][] costMatrix) {
        var size = costMatrix.length;
        var edges = new ArrayList<Edge>();

        for (var i = 0; i < size; i++) {
            for (var j = i + 1; j < size; j++) {
                edges.add(new Edge(i, j, costMatrix[i][j]));
            }
        }

        var indexes = ContiguousSet.create(Range.closedOpen(0, edges.size()), DiscreteDomain.integers());
        var best = Double.POSITIVE_INFINITY;

        for (var subset : Sets.combinations(indexes, size - 1)) {
            var forest = new DisjointSetForest(size);
            var weight = 0.0;
            var acyclic = true;

            for (var index : subset) {
                var edge = edges.get(index);
                acyclic &= forest.union(edge.head(), edge.tail());
                weight += edge.cost();
            }
            if (acyclic) {
                best = Math.min(best, weight);
            }
        }
        return best;
    }

    /**
     * Check the shape of a tour: <code>size + 1</code> entries, zero at both ends, every other location once.
     */
    public static boolean isValidTour(int size, List<Integer> nodes) {
        if (nodes.size() != size + 1 || nodes.get(0) != 0 || nodes.get(size) != 0) {
            return false;
        }
        var interior = nodes.subList(1, size).stream().sorted().toList();
        return interior.equals(IntStream.range(1, size).boxed().toList());
    }
}
