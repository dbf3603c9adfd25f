package org.crimenet.runtime.worldgen;

import java.util.ArrayList;
import java.util.List;

import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.model.Agent;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.model.Population;
import org.crimenet.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the initial population.
 * <ul>
 *   <li>Each agent draws one uniform value: below {@code initial-criminal-share} it starts
 *   CRIMINAL, below the sum with {@code initial-at-risk-share} AT_RISK, otherwise LAWFUL.</li>
 *   <li>Base propensity is drawn from Normal(mean, stddev) and clamped to [0, 1].</li>
 * </ul>
 */
public class PopulationSeeder {

    private static final Logger LOG = LoggerFactory.getLogger(PopulationSeeder.class);

    private final SimulationParameters parameters;

    public PopulationSeeder(SimulationParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @param random Stream used for state and propensity draws.
     * @return A population of {@code population.size} agents with ids {@code 0..size-1}.
     */
    public Population seed(IRandomProvider random) {
        int size = parameters.getPopulationSize();
        double criminalShare = parameters.getInitialCriminalShare();
        double atRiskCutoff = criminalShare + parameters.getInitialAtRiskShare();

        List<Agent> agents = new ArrayList<>(size);
        for (int id = 0; id < size; id++) {
            double u = random.nextDouble();
            AgentState state;
            if (u < criminalShare) {
                state = AgentState.CRIMINAL;
            } else if (u < atRiskCutoff) {
                state = AgentState.AT_RISK;
            } else {
                state = AgentState.LAWFUL;
            }
            double propensity = parameters.getPropensityMean() + parameters.getPropensityStddev() * random.nextGaussian();
            agents.add(new Agent(id, state, Math.max(0.0, Math.min(1.0, propensity)), parameters.getEvidenceWindowDays()));
        }

        Population population = new Population(agents);
        LOG.debug("Seeded population: {}", population.countByState());
        return population;
    }
}
