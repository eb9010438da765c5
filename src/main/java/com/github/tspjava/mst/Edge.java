package com.github.tspjava.mst;

/**
 * Represents an edge in an undirected graph. Edges are ordered by cost, then by <code>head</code>, then by
 * <code>tail</code>, which is a total order over the edges of one graph.
 *
 * @param head the lower-numbered endpoint, as an integer array index into the cost matrix
 * @param tail the higher-numbered endpoint, as an integer array index into the cost matrix
 * @param cost the travel cost between the two endpoints
 */
public record Edge(int head, int tail, double cost) implements Comparable<Edge> {
    /**
     * Canonical constructor; folds <code>-0.0</code> into <code>0.0</code> so that both tie on cost.
     *
     * @param head the lower-numbered endpoint
     * @param tail the higher-numbered endpoint
     * @param cost the travel cost between the two endpoints
     */
    public Edge {
        cost = cost + 0.0;
    }

    @Override
    public int compareTo(Edge o) {
        var v = Double.compare(cost, o.cost);
        if (v != 0) {
            return v;
        }
        v = Integer.compare(head, o.head);
        return v != 0 ? v : Integer.compare(tail, o.tail);
    }

    @Override
    public String toString() {
        return "(" + head + "," + tail + "," + cost + ")";
    }
}
