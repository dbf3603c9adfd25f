package org.crimenet.runtime.worldgen;

import java.util.Arrays;

import org.crimenet.runtime.model.SocialNetwork;
import org.crimenet.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Builds a Barabási–Albert preferential-attachment network.
 * <p>
 * The process starts from a star over {@code m + 1} nodes. Every further node attaches to
 * {@code m} distinct existing nodes, each picked with probability proportional to its current
 * degree. Degree weighting is implemented with the usual "repeated nodes" list, in which every
 * node appears once per incident edge, so a uniform pick from the list is a degree-weighted
 * pick from the graph. The result is connected and has a heavy-tailed degree distribution.
 */
public class ScaleFreeNetworkGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ScaleFreeNetworkGenerator.class);

    private final int attachmentCount;

    /**
     * @param attachmentCount Edges added per new node ({@code m}). Must be at least 1.
     */
    public ScaleFreeNetworkGenerator(int attachmentCount) {
        if (attachmentCount < 1) {
            throw new IllegalArgumentException("Attachment count must be >= 1, got " + attachmentCount);
        }
        this.attachmentCount = attachmentCount;
    }

    /**
     * Generates a network.
     *
     * @param size Number of nodes. Must exceed the attachment count.
     * @param random Stream used for target selection.
     * @return The generated network.
     */
    public SocialNetwork generate(int size, IRandomProvider random) {
        final int m = attachmentCount;
        if (m >= size) {
            throw new IllegalArgumentException("Barabasi-Albert requires 1 <= m < n, got m=" + m + ", n=" + size);
        }
        SocialNetwork network = new SocialNetwork(size);
        IntArrayList repeatedNodes = new IntArrayList(2 * m * size);

        // Seed star: node 0 joined to 1..m
        for (int leaf = 1; leaf <= m; leaf++) {
            network.addEdge(0, leaf);
            repeatedNodes.add(0);
            repeatedNodes.add(leaf);
        }

        IntOpenHashSet targets = new IntOpenHashSet(m);
        for (int source = m + 1; source < size; source++) {
            targets.clear();
            while (targets.size() < m) {
                targets.add(repeatedNodes.getInt(random.nextInt(repeatedNodes.size())));
            }
            // Sorted so the edge insertion order (and therefore hash iteration) is seed-stable
            int[] sorted = targets.toIntArray();
            Arrays.sort(sorted);
            for (int target : sorted) {
                network.addEdge(source, target);
                repeatedNodes.add(target);
                repeatedNodes.add(source);
            }
        }

        LOG.debug("Generated scale-free network: {} nodes, {} edges (m={})", size, network.edgeCount(), m);
        return network;
    }
}
