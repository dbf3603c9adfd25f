package org.crimenet.runtime.phases;

import org.crimenet.runtime.Simulation;
import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.TickCounters;
import org.crimenet.runtime.model.Agent;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.model.Population;
import org.crimenet.runtime.spi.ITickPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phase 5: sentence countdown, release and the congestion threshold policy.
 * <p>
 * Every PRISON agent that did not enter prison during the current tick loses one day; at zero
 * it returns to AT_RISK and gains the release criminal-capital increment. The prison-entry
 * increment was already applied by {@link DetentionProcessingPhase} and is not repeated here.
 * <p>
 * When the threshold policy is enabled and the prison population rises above
 * {@code share × population}, the remaining sentences of all PRISON agents are multiplied by
 * the shortening factor once. The policy re-arms only after the prison population has fallen
 * back to or below the threshold, so staying above it does not shorten sentences again.
 */
public class PrisonProcessingPhase implements ITickPhase {

    private static final Logger LOG = LoggerFactory.getLogger(PrisonProcessingPhase.class);

    private boolean congestionActive = false;

    @Override
    public void execute(Simulation simulation) {
        SimulationParameters params = simulation.getParameters();
        Population population = simulation.getPopulation();
        TickCounters counters = simulation.getCounters();
        long tick = simulation.getCurrentTick();

        for (Agent agent : population) {
            if (agent.getState() != AgentState.PRISON || agent.getStateEnteredTick() == tick) {
                continue;
            }
            if (agent.countDown() == 0) {
                agent.releaseFromPrison(params.getPrisonReleaseCapitalIncrement(), tick);
                counters.recordPrisonRelease();
            }
        }

        if (params.isCongestionThresholdEnabled()) {
            applyCongestionPolicy(params, population, counters, tick);
        }
    }

    private void applyCongestionPolicy(SimulationParameters params, Population population,
                                       TickCounters counters, long tick) {
        int prisonCount = population.count(AgentState.PRISON);
        boolean overThreshold = prisonCount > params.getCongestionThresholdShare() * population.size();

        if (overThreshold && !congestionActive) {
            int shortened = 0;
            long daysRemoved = 0;
            for (Agent agent : population) {
                if (agent.getState() == AgentState.PRISON) {
                    daysRemoved += agent.shortenSentence(params.getCongestionShorteningFactor());
                    shortened++;
                }
            }
            congestionActive = true;
            counters.addSentencesShortened(shortened);
            LOG.info("Tick {}: prison population {} crossed congestion threshold, shortened {} sentences by {} days",
                    tick, prisonCount, shortened, daysRemoved);
        } else if (!overThreshold && congestionActive) {
            congestionActive = false;
            LOG.debug("Tick {}: prison population {} back under congestion threshold", tick, prisonCount);
        }
    }

    /**
     * @return {@code true} while the prison population stays above the threshold after a shortening.
     */
    public boolean isCongestionActive() {
        return congestionActive;
    }
}
