package org.crimenet.runtime.phases;

import java.util.Arrays;

import org.crimenet.runtime.Simulation;
import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.model.Agent;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.model.Population;
import org.crimenet.runtime.model.SocialNetwork;
import org.crimenet.runtime.spi.IRandomProvider;
import org.crimenet.runtime.spi.ITickPhase;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Phase 6: tie rewiring for the incarceration entries of this tick.
 * <p>
 * Phases 3 and 4 queue one entry per move into DETAINED or PRISON; this phase drains the queue,
 * so each entry is rewired exactly once no matter how long the stay lasts. For each entry:
 * <ul>
 *   <li>every tie to a currently LAWFUL neighbor is dropped with the configured probability;</li>
 *   <li>for each of {@code max-new-edges-per-event} slots, with the configured probability, a
 *   tie to a random CRIMINAL agent is added (up to five draws per slot to find one that is not
 *   the agent itself and not already a neighbor).</li>
 * </ul>
 * All mutations go through {@link SocialNetwork}, which rejects self-loops and ignores
 * duplicates.
 */
public class NetworkRewiringPhase implements ITickPhase {

    static final int DRAWS_PER_SLOT = 5;

    @Override
    public void execute(Simulation simulation) {
        int[] entries = simulation.drainPendingRewiring();
        SimulationParameters params = simulation.getParameters();
        if (entries.length == 0 || !params.isRewiringEnabled()) {
            return;
        }

        Population population = simulation.getPopulation();
        SocialNetwork network = simulation.getNetwork();
        IRandomProvider random = simulation.getRandomProvider();

        IntArrayList criminals = new IntArrayList();
        for (Agent agent : population) {
            if (agent.getState() == AgentState.CRIMINAL) {
                criminals.add(agent.getId());
            }
        }

        for (int agentId : entries) {
            int removed = dropLawfulTies(agentId, params, population, network, random);
            int added = addCriminalTies(agentId, criminals, params, network, random);
            simulation.getCounters().recordRewiring(removed, added);
        }
    }

    private int dropLawfulTies(int agentId, SimulationParameters params, Population population,
                               SocialNetwork network, IRandomProvider random) {
        int[] neighbors = network.neighbors(agentId).toIntArray();
        Arrays.sort(neighbors);
        int removed = 0;
        for (int neighbor : neighbors) {
            if (population.get(neighbor).getState() == AgentState.LAWFUL
                    && random.nextDouble() < params.getDropLawfulEdgeProbability()
                    && network.removeEdge(agentId, neighbor)) {
                removed++;
            }
        }
        return removed;
    }

    private int addCriminalTies(int agentId, IntArrayList criminals, SimulationParameters params,
                                SocialNetwork network, IRandomProvider random) {
        if (criminals.isEmpty()) {
            return 0;
        }
        int added = 0;
        for (int slot = 0; slot < params.getMaxNewEdgesPerEvent(); slot++) {
            if (random.nextDouble() >= params.getAddCriminalEdgeProbability()) {
                continue;
            }
            for (int draw = 0; draw < DRAWS_PER_SLOT; draw++) {
                int candidate = criminals.getInt(random.nextInt(criminals.size()));
                if (candidate != agentId && network.addEdge(agentId, candidate)) {
                    added++;
                    break;
                }
            }
        }
        return added;
    }
}
