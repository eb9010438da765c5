package com.github.tspjava.mst;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Record type to hold a spanning tree.
 *
 * @param edges  the tree edges, in the order they were selected
 * @param weight the total cost of <code>edges</code>
 */
public record SpanningTree(List<Edge> edges, double weight) {
    /**
     * Canonical constructor; takes an immutable copy of <code>edges</code>.
     *
     * @param edges  the tree edges, in the order they were selected
     * @param weight the total cost of <code>edges</code>
     */
    public SpanningTree {
        edges = ImmutableList.copyOf(edges);
    }

    /**
     * Convenience constructor to compute the weight from the edges.
     *
     * @param edges the tree edges, in the order they were selected
     */
    public SpanningTree(List<Edge> edges) {
        this(edges, edges.stream().mapToDouble(Edge::cost).sum());
    }
}
