package org.crimenet.runtime.phases;

import org.crimenet.runtime.Simulation;
import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.TickCounters;
import org.crimenet.runtime.model.Agent;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.model.SocialNetwork;
import org.crimenet.runtime.spi.IRandomProvider;
import org.crimenet.runtime.spi.ITickPhase;

/**
 * Phase 2: crime events.
 * <p>
 * Each CRIMINAL agent commits at most one crime per day, with probability
 * {@code clamp(crimeBase + crimeCapitalW * capital + crimePeerW * peerShare)}. Every agent,
 * criminal or not, appends today's count to its rolling evidence window, so all windows stay
 * aligned on the same days.
 */
public class CrimeGenerationPhase implements ITickPhase {

    @Override
    public void execute(Simulation simulation) {
        SimulationParameters params = simulation.getParameters();
        SocialNetwork network = simulation.getNetwork();
        IRandomProvider random = simulation.getRandomProvider();
        AgentState[] snapshot = simulation.getTickStartStates();
        TickCounters counters = simulation.getCounters();

        for (Agent agent : simulation.getPopulation()) {
            int crimes = 0;
            if (agent.getState() == AgentState.CRIMINAL) {
                double peerShare = Exposure.criminalNeighborShare(agent.getId(), snapshot, network);
                double p = Exposure.clamp01(params.getCrimeBaseRate()
                        + params.getCrimeCapitalWeight() * agent.getCriminalCapital()
                        + params.getCrimePeerWeight() * peerShare);
                if (random.nextDouble() < p) {
                    crimes = 1;
                }
            }
            agent.recordCrimes(crimes);
            counters.addCrimeEvents(crimes);
        }
    }
}
