package org.crimenet.runtime.model;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

/**
 * Undirected simple graph over agent ids {@code 0 .. size-1}.
 * <p>
 * Adjacency is stored as one {@link IntOpenHashSet} per node, so neighbor lookup, edge
 * insertion, removal and membership tests are all O(1) expected. Every edge is stored in both
 * endpoint sets; the public mutators keep the two sides in sync, which makes edge existence
 * symmetric by construction. Self-loops are rejected and duplicate insertions are no-ops.
 * <p>
 * <b>Thread safety:</b> Not thread-safe.
 */
public class SocialNetwork {

    private final IntOpenHashSet[] adjacency;
    private long edgeCount;

    /**
     * Creates an edgeless network.
     *
     * @param size Number of nodes. Must be positive.
     */
    public SocialNetwork(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Network size must be positive, got " + size);
        }
        this.adjacency = new IntOpenHashSet[size];
        for (int i = 0; i < size; i++) {
            adjacency[i] = new IntOpenHashSet();
        }
    }

    public int size() {
        return adjacency.length;
    }

    public long edgeCount() {
        return edgeCount;
    }

    /**
     * Returns a read-only live view of the neighbors of a node.
     *
     * @param node The node id.
     * @return The neighbor ids.
     */
    public IntSet neighbors(int node) {
        checkNode(node);
        return IntSets.unmodifiable(adjacency[node]);
    }

    public int degree(int node) {
        checkNode(node);
        return adjacency[node].size();
    }

    public boolean hasEdge(int a, int b) {
        checkNode(a);
        checkNode(b);
        return adjacency[a].contains(b);
    }

    /**
     * Adds the undirected edge {a, b}.
     *
     * @return {@code true} if the edge was new, {@code false} if it already existed.
     * @throws IllegalArgumentException if {@code a == b} or either id is out of range.
     */
    public boolean addEdge(int a, int b) {
        checkNode(a);
        checkNode(b);
        if (a == b) {
            throw new IllegalArgumentException("Self-loop rejected for node " + a);
        }
        if (!adjacency[a].add(b)) {
            return false;
        }
        adjacency[b].add(a);
        edgeCount++;
        return true;
    }

    /**
     * Removes the undirected edge {a, b}; no-op if it does not exist.
     *
     * @return {@code true} if an edge was removed.
     */
    public boolean removeEdge(int a, int b) {
        checkNode(a);
        checkNode(b);
        if (!adjacency[a].remove(b)) {
            return false;
        }
        adjacency[b].remove(a);
        edgeCount--;
        return true;
    }

    private void checkNode(int node) {
        if (node < 0 || node >= adjacency.length) {
            throw new IllegalArgumentException("Unknown node " + node + " (network size " + adjacency.length + ")");
        }
    }
}
