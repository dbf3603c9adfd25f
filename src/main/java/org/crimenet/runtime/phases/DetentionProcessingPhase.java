package org.crimenet.runtime.phases;

import org.crimenet.runtime.Simulation;
import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.TickCounters;
import org.crimenet.runtime.model.Agent;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.model.Population;
import org.crimenet.runtime.spi.IRandomProvider;
import org.crimenet.runtime.spi.ITickPhase;

/**
 * Phase 4: detention countdown and judicial outcome.
 * <p>
 * Every DETAINED agent that did not enter detention during the current tick loses one day.
 * When the countdown reaches zero the court decides, using the rolling crime window as an
 * evidence proxy (it says nothing about whether the agent is actually guilty):
 * <pre>
 *   evidence = floor + (1 - floor) * clamp(crimesInWindow / max(1, N * saturation))
 *   P(convict) = clamp(convictionBase * forensic * evidence)
 * </pre>
 * A convicted agent enters PRISON with a drawn sentence and gains the prison criminal-capital
 * increment once; the entry is queued for rewiring. An acquitted agent returns to AT_RISK and
 * still gains the detention criminal-capital increment.
 * <p>
 * If entry-time congestion scaling is configured, each new sentence is multiplied by
 * {@code 1 - strength × prisonShare}, never below one day.
 */
public class DetentionProcessingPhase implements ITickPhase {

    @Override
    public void execute(Simulation simulation) {
        SimulationParameters params = simulation.getParameters();
        Population population = simulation.getPopulation();
        IRandomProvider random = simulation.getRandomProvider();
        TickCounters counters = simulation.getCounters();
        long tick = simulation.getCurrentTick();

        int prisonCount = population.count(AgentState.PRISON);

        for (Agent agent : population) {
            if (agent.getState() != AgentState.DETAINED || agent.getStateEnteredTick() == tick) {
                continue;
            }
            if (agent.countDown() > 0) {
                continue;
            }

            if (random.nextDouble() < convictionProbability(agent, params)) {
                int days = params.getSentenceDistribution().draw(random, params.getSentenceMeanDays());
                if (params.getCongestionScalingStrength() > 0.0) {
                    double prisonShare = (double) prisonCount / population.size();
                    days = Math.max(1, (int) (days * (1.0 - params.getCongestionScalingStrength() * prisonShare)));
                }
                agent.imprison(days, params.getPrisonCapitalIncrement(), tick);
                prisonCount++;
                counters.recordConviction();
                simulation.scheduleRewiring(agent.getId());
            } else {
                agent.releaseFromDetention(params.getDetentionCapitalIncrement(), tick);
                counters.recordDetentionRelease();
            }
        }
    }

    /**
     * Evidence strength derived from the agent's rolling crime window, in [floor, 1].
     */
    public static double evidence(Agent agent, SimulationParameters params) {
        double saturation = Math.max(1.0, params.getEvidenceWindowDays() * params.getEvidenceSaturationFraction());
        double density = Exposure.clamp01(agent.getCrimeHistory().total() / saturation);
        return params.getEvidenceFloor() + (1.0 - params.getEvidenceFloor()) * density;
    }

    /**
     * Probability that a detained agent is convicted when its detention ends.
     */
    public static double convictionProbability(Agent agent, SimulationParameters params) {
        return Exposure.clamp01(params.getConvictionBaseProbability() * params.getForensicCapacity()
                * evidence(agent, params));
    }
}
