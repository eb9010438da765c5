package com.github.tspjava.mst;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * <p>
 * A disjoint-set forest (union-find) over the integers <code>0..size-1</code>, with path compression and
 * union-by-rank, so that a sequence of operations runs in near-constant amortized time per operation.
 * </p><p>
 * Indexes are not range-checked beyond what the JVM does for array access.
 * </p>
 */
public final class DisjointSetForest {
    private final int[] parent;
    private final int[] rank;
    private int count;

    /**
     * Create a forest in which every element is in its own singleton set.
     *
     * @param size the number of elements
     */
    public DisjointSetForest(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative.");
        }
        parent = new int[size];
        rank = new int[size];
        count = size;

        for (var i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    /**
     * Find the representative of the set containing <code>i</code>. Every node on the path from <code>i</code> is
     * re-pointed directly at the root.
     *
     * @param i an element
     * @return the root of its tree
     */
    public int find(int i) {
        var root = i;
        while (parent[root] != root) {
            root = parent[root];
        }

        // second pass: compress
        while (parent[i] != root) {
            var next = parent[i];
            parent[i] = root;
            i = next;
        }
        return root;
    }

    /**
     * Merge the sets containing <code>i</code> and <code>j</code>. The root of higher rank absorbs the other; on
     * equal ranks, <code>j</code>'s root absorbs <code>i</code>'s and its rank goes up by one.
     *
     * @param i an element
     * @param j another element
     * @return true if two distinct sets were merged, false if they were already the same set
     */
    @CanIgnoreReturnValue
    public boolean union(int i, int j) {
        var rootI = find(i);
        var rootJ = find(j);

        if (rootI == rootJ) {
            return false;
        }
        if (rank[rootI] > rank[rootJ]) {
            parent[rootJ] = rootI;
        } else {
            parent[rootI] = rootJ;
            if (rank[rootI] == rank[rootJ]) {
                rank[rootJ]++;
            }
        }
        count--;
        return true;
    }

    /**
     * @param i an element
     * @param j another element
     * @return true if both are in the same set
     */
    public boolean connected(int i, int j) {
        return find(i) == find(j);
    }

    /**
     * @return the number of disjoint sets
     */
    public int count() {
        return count;
    }

    /**
     * @return the number of elements
     */
    public int size() {
        return parent.length;
    }

    // visible for testing
    int rank(int i) {
        return rank[i];
    }

    // visible for testing; no compression
    int parent(int i) {
        return parent[i];
    }
}
