package org.crimenet.runtime.worldgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.internal.services.SeededRandomProvider;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.model.Population;
import org.crimenet.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class PopulationSeederTest {

    @Test
    void statesFollowCumulativeSharesAndPropensityIsClamped() {
        SimulationParameters params = SimulationParameters.defaults().withOverrides(Map.of(
                "population.size", 3,
                "network.attachment-count", 1,
                "population.initial-criminal-share", 0.05,
                "population.initial-at-risk-share", 0.20,
                "population.propensity-mean", 0.15,
                "population.propensity-stddev", 0.05));
        IRandomProvider random = mock(IRandomProvider.class);
        when(random.nextDouble()).thenReturn(0.01, 0.10, 0.90);
        when(random.nextGaussian()).thenReturn(0.0, 100.0, -100.0);

        Population population = new PopulationSeeder(params).seed(random);

        assertThat(population.get(0).getState()).isEqualTo(AgentState.CRIMINAL);
        assertThat(population.get(1).getState()).isEqualTo(AgentState.AT_RISK);
        assertThat(population.get(2).getState()).isEqualTo(AgentState.LAWFUL);
        assertThat(population.get(0).getBasePropensity()).isCloseTo(0.15, within(1e-12));
        assertThat(population.get(1).getBasePropensity()).isEqualTo(1.0);
        assertThat(population.get(2).getBasePropensity()).isEqualTo(0.0);
    }

    @Test
    void agentsStartCleanWithAnEmptyEvidenceWindow() {
        SimulationParameters params = SimulationParameters.defaults();

        Population population = new PopulationSeeder(params).seed(new SeededRandomProvider(3));

        assertThat(population.size()).isEqualTo(500);
        assertThat(population.count(AgentState.DETAINED) + population.count(AgentState.PRISON)).isZero();
        assertThat(population).allSatisfy(agent -> {
            assertThat(agent.getStigma()).isZero();
            assertThat(agent.getCriminalCapital()).isZero();
            assertThat(agent.getCrimeHistory().size()).isZero();
            assertThat(agent.getCrimeHistory().capacity()).isEqualTo(30);
        });
    }

    @Test
    void largePopulationsApproximateTheConfiguredShares() {
        SimulationParameters params = SimulationParameters.defaults().withOverrides(Map.of("population.size", 20_000));

        Population population = new PopulationSeeder(params).seed(new SeededRandomProvider(9));

        assertThat(population.count(AgentState.CRIMINAL) / 20_000.0).isCloseTo(0.05, within(0.01));
        assertThat(population.count(AgentState.AT_RISK) / 20_000.0).isCloseTo(0.20, within(0.015));
    }
}
