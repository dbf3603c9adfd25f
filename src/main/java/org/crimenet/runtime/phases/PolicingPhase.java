package org.crimenet.runtime.phases;

import org.crimenet.runtime.Simulation;
import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.TickCounters;
import org.crimenet.runtime.model.Agent;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.model.Population;
import org.crimenet.runtime.spi.IRandomProvider;
import org.crimenet.runtime.spi.ITickPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Phase 3: arrest targeting.
 * <p>
 * The number of attempts is {@code floor(coercive × population)}. For each attempt, with
 * probability equal to the forensic capacity a CRIMINAL agent is drawn uniformly; otherwise
 * a LAWFUL or AT_RISK agent is drawn uniformly. When the chosen pool is empty the other pool is
 * used, so an attempt only fails for lack of targets when nobody is eligible. Low forensic
 * capacity therefore shifts arrests onto innocent agents. The candidate pools are taken when
 * the phase starts; an attempt that lands on an agent already detained earlier in this phase
 * is void.
 * <p>
 * Each arrest moves the target to DETAINED with a drawn detention length, adds stigma and
 * queues the entry for rewiring. An arrest is wrongful when the target was not CRIMINAL.
 */
public class PolicingPhase implements ITickPhase {

    private static final Logger LOG = LoggerFactory.getLogger(PolicingPhase.class);

    @Override
    public void execute(Simulation simulation) {
        SimulationParameters params = simulation.getParameters();
        int attempts = params.arrestAttemptsPerTick();
        if (attempts == 0) {
            return;
        }

        Population population = simulation.getPopulation();
        IRandomProvider random = simulation.getRandomProvider();
        TickCounters counters = simulation.getCounters();
        long tick = simulation.getCurrentTick();

        IntArrayList criminals = new IntArrayList();
        IntArrayList nonCriminals = new IntArrayList();
        for (Agent agent : population) {
            AgentState state = agent.getState();
            if (state == AgentState.CRIMINAL) {
                criminals.add(agent.getId());
            } else if (state.isEligibleForArrest()) {
                nonCriminals.add(agent.getId());
            }
        }

        int voided = 0;
        for (int i = 0; i < attempts; i++) {
            Agent target;
            if (random.nextDouble() < params.getForensicCapacity() && !criminals.isEmpty()) {
                target = population.get(criminals.getInt(random.nextInt(criminals.size())));
            } else if (!nonCriminals.isEmpty()) {
                target = population.get(nonCriminals.getInt(random.nextInt(nonCriminals.size())));
            } else if (!criminals.isEmpty()) {
                target = population.get(criminals.getInt(random.nextInt(criminals.size())));
            } else {
                voided++;
                continue;
            }

            if (!target.getState().isEligibleForArrest()) {
                voided++;
                continue;
            }

            boolean wrongful = target.getState() != AgentState.CRIMINAL;
            int days = params.getDetentionDistribution().draw(random, params.getDetentionMeanDays());
            target.detain(days, params.getDetentionStigmaIncrement(), tick);
            counters.recordArrest(wrongful);
            simulation.scheduleRewiring(target.getId());
        }

        if (voided > 0) {
            LOG.trace("Tick {}: {} of {} arrest attempts void", tick, voided, attempts);
        }
    }
}
