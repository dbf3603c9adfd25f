package org.crimenet.runtime.phases;

import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.model.SocialNetwork;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Shared arithmetic of the behavioral mechanisms.
 */
final class Exposure {

    private Exposure() {
    }

    /**
     * Fraction of an agent's neighbors that were CRIMINAL in the given state snapshot.
     *
     * @return 0 for an isolated agent.
     */
    static double criminalNeighborShare(int agentId, AgentState[] states, SocialNetwork network) {
        IntSet neighbors = network.neighbors(agentId);
        int degree = neighbors.size();
        if (degree == 0) {
            return 0.0;
        }
        int criminal = 0;
        IntIterator it = neighbors.iterator();
        while (it.hasNext()) {
            if (states[it.nextInt()] == AgentState.CRIMINAL) {
                criminal++;
            }
        }
        return (double) criminal / degree;
    }

    static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
