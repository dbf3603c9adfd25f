package org.crimenet.runtime.phases;

import org.crimenet.runtime.Simulation;
import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.model.Agent;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.model.SocialNetwork;
import org.crimenet.runtime.spi.IRandomProvider;
import org.crimenet.runtime.spi.ITickPhase;

/**
 * Phase 1: escalation of LAWFUL and AT_RISK agents under social influence.
 * <p>
 * Propensity is {@code clamp(base + peerW * peerShare + stigmaW * stigma + capitalW * capital)},
 * where {@code peerShare} is the fraction of CRIMINAL neighbors in the tick-start snapshot, so
 * the iteration order over agents has no effect on exposure.
 * <ul>
 *   <li>LAWFUL agents whose propensity reaches the risk threshold become AT_RISK.</li>
 *   <li>AT_RISK agents (including those promoted a moment ago) become CRIMINAL with
 *   probability equal to their propensity.</li>
 *   <li>Otherwise, an AT_RISK agent below the threshold returns to LAWFUL with the configured
 *   decay rate.</li>
 * </ul>
 */
public class SocialInfluencePhase implements ITickPhase {

    @Override
    public void execute(Simulation simulation) {
        SimulationParameters params = simulation.getParameters();
        SocialNetwork network = simulation.getNetwork();
        IRandomProvider random = simulation.getRandomProvider();
        AgentState[] snapshot = simulation.getTickStartStates();
        long tick = simulation.getCurrentTick();

        for (Agent agent : simulation.getPopulation()) {
            if (!agent.getState().isSusceptible()) {
                continue;
            }
            double propensity = propensity(agent, Exposure.criminalNeighborShare(agent.getId(), snapshot, network), params);

            if (agent.getState() == AgentState.LAWFUL && propensity >= params.getRiskThreshold()) {
                agent.shiftTo(AgentState.AT_RISK, tick);
            }
            if (agent.getState() == AgentState.AT_RISK) {
                if (random.nextDouble() < propensity) {
                    agent.shiftTo(AgentState.CRIMINAL, tick);
                } else if (params.getAtRiskDecayRate() > 0.0
                        && propensity < params.getRiskThreshold()
                        && random.nextDouble() < params.getAtRiskDecayRate()) {
                    agent.shiftTo(AgentState.LAWFUL, tick);
                }
            }
        }
    }

    /**
     * Computes an agent's escalation propensity.
     *
     * @param agent The agent.
     * @param peerShare Fraction of CRIMINAL neighbors.
     * @param params Behavior weights.
     * @return The propensity in [0, 1].
     */
    public static double propensity(Agent agent, double peerShare, SimulationParameters params) {
        return Exposure.clamp01(agent.getBasePropensity()
                + params.getPeerInfluenceWeight() * peerShare
                + params.getStigmaWeight() * agent.getStigma()
                + params.getCapitalWeight() * agent.getCriminalCapital());
    }
}
