package org.crimenet.runtime.phases;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.crimenet.runtime.Simulation;
import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.model.Agent;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class DetentionProcessingPhaseTest {

    private final IRandomProvider random = mock(IRandomProvider.class);

    @Test
    void evidenceGrowsWithRecentCrimesAndSaturates() {
        SimulationParameters params = SimulationParameters.defaults();
        Agent agent = new Agent(0, AgentState.CRIMINAL, 0.1, 30);

        assertThat(DetentionProcessingPhase.evidence(agent, params)).isCloseTo(0.35, within(1e-12));

        agent.recordCrimes(1);
        agent.recordCrimes(1);
        // saturation at 30 * 0.15 = 4.5 crimes
        assertThat(DetentionProcessingPhase.evidence(agent, params)).isCloseTo(0.35 + 0.65 * (2 / 4.5), within(1e-12));

        for (int i = 0; i < 5; i++) {
            agent.recordCrimes(1);
        }
        assertThat(DetentionProcessingPhase.evidence(agent, params)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void convictionProbabilityScalesWithForensicCapacity() {
        Agent agent = new Agent(0, AgentState.CRIMINAL, 0.1, 30);
        SimulationParameters high = SimulationParameters.defaults().withOverrides(Map.of("policing.forensic-capacity", 1.0));
        SimulationParameters low = SimulationParameters.defaults().withOverrides(Map.of("policing.forensic-capacity", 0.2));

        assertThat(DetentionProcessingPhase.convictionProbability(agent, high)).isCloseTo(0.6 * 0.35, within(1e-12));
        assertThat(DetentionProcessingPhase.convictionProbability(agent, low)).isCloseTo(0.6 * 0.2 * 0.35, within(1e-12));
    }

    @Test
    void agentsDetainedThisTickAreNotCountedDown() {
        SimulationParameters params = PhaseFixtures.params(2, Map.of());
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.CRIMINAL, AgentState.LAWFUL);
        agents.get(0).detain(1, 0.1, 0);
        Simulation sim = PhaseFixtures.simulation(params, agents, PhaseFixtures.network(2), random);

        new DetentionProcessingPhase().execute(sim);

        assertThat(agents.get(0).getState()).isEqualTo(AgentState.DETAINED);
        assertThat(agents.get(0).getRemainingDuration()).isEqualTo(1);
        verifyNoInteractions(random);
    }

    @Test
    void countdownContinuesUntilZero() {
        SimulationParameters params = PhaseFixtures.params(2, Map.of());
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.CRIMINAL, AgentState.LAWFUL);
        agents.get(0).detain(2, 0.1, -1);
        Simulation sim = PhaseFixtures.simulation(params, agents, PhaseFixtures.network(2), random);

        new DetentionProcessingPhase().execute(sim);

        assertThat(agents.get(0).getState()).isEqualTo(AgentState.DETAINED);
        assertThat(agents.get(0).getRemainingDuration()).isEqualTo(1);
        verifyNoInteractions(random);
    }

    @Test
    void convictionSendsAgentToPrison() {
        SimulationParameters params = PhaseFixtures.params(2, Map.of("prison.sentence.mean-days", 180));
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.CRIMINAL, AgentState.LAWFUL);
        Agent agent = agents.get(0);
        agent.detain(1, 0.1, -1);
        when(random.nextDouble()).thenReturn(0.0);
        Simulation sim = PhaseFixtures.simulation(params, agents, PhaseFixtures.network(2), random);

        new DetentionProcessingPhase().execute(sim);

        assertThat(agent.getState()).isEqualTo(AgentState.PRISON);
        assertThat(agent.getRemainingDuration()).isEqualTo(180);
        assertThat(agent.getCriminalCapital()).isCloseTo(0.20, within(1e-12));
        assertThat(sim.getCounters().getConvictions()).isEqualTo(1);
        assertThat(sim.getCounters().getDetentionReleases()).isZero();
        assertThat(sim.drainPendingRewiring()).containsExactly(0);
    }

    @Test
    void acquittalReleasesToAtRiskWithCapital() {
        SimulationParameters params = PhaseFixtures.params(2, Map.of());
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.LAWFUL, AgentState.LAWFUL);
        Agent agent = agents.get(0);
        agent.detain(1, 0.1, -1);
        when(random.nextDouble()).thenReturn(0.99);
        Simulation sim = PhaseFixtures.simulation(params, agents, PhaseFixtures.network(2), random);

        new DetentionProcessingPhase().execute(sim);

        assertThat(agent.getState()).isEqualTo(AgentState.AT_RISK);
        assertThat(agent.getCriminalCapital()).isCloseTo(0.15, within(1e-12));
        assertThat(sim.getCounters().getDetentionReleases()).isEqualTo(1);
        assertThat(sim.drainPendingRewiring()).isEmpty();
    }

    @Test
    void crowdedPrisonShortensNewSentencesWhenScalingIsOn() {
        SimulationParameters params = PhaseFixtures.params(2, Map.of(
                "prison.sentence.mean-days", 180,
                "congestion.sentence-scaling-strength", 1.0));
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.CRIMINAL, AgentState.CRIMINAL);
        agents.get(0).detain(1, 0.0, -5);
        agents.get(0).imprison(100, 0.0, -4);
        agents.get(1).detain(1, 0.0, -1);
        when(random.nextDouble()).thenReturn(0.0);
        Simulation sim = PhaseFixtures.simulation(params, agents, PhaseFixtures.network(2), random);

        new DetentionProcessingPhase().execute(sim);

        // half the population already in prison: 180 * (1 - 1.0 * 0.5)
        assertThat(agents.get(1).getRemainingDuration()).isEqualTo(90);
    }
}
