package org.crimenet.runtime.phases;

import java.util.Map;

import org.crimenet.runtime.Simulation;
import org.crimenet.runtime.TickCounters;
import org.crimenet.runtime.metrics.TickMetrics;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.spi.ITickPhase;

/**
 * Phase 7: emits the tick's {@link TickMetrics} record from the counters and the final state tally.
 */
public class MetricsCollectionPhase implements ITickPhase {

    @Override
    public void execute(Simulation simulation) {
        TickCounters c = simulation.getCounters();
        Map<AgentState, Integer> states = simulation.getPopulation().countByState();

        simulation.getMetricsCollector().record(new TickMetrics(
                simulation.getCurrentTick(),
                c.getCrimeEvents(),
                c.getArrests(),
                c.getWrongfulDetentions(),
                c.getConvictions(),
                c.getDetentionReleases(),
                c.getPrisonReleases(),
                c.getRewiringEvents(),
                c.getEdgesRemoved(),
                c.getEdgesAdded(),
                c.getSentencesShortened(),
                states.get(AgentState.LAWFUL),
                states.get(AgentState.AT_RISK),
                states.get(AgentState.CRIMINAL),
                states.get(AgentState.DETAINED),
                states.get(AgentState.PRISON)));
    }
}
