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
class SocialInfluencePhaseTest {

    private final IRandomProvider random = mock(IRandomProvider.class);

    @Test
    void propensityCombinesAllDrivers() {
        SimulationParameters params = SimulationParameters.defaults();
        Agent agent = new Agent(0, AgentState.LAWFUL, 0.10, 30);
        agent.detain(1, 0.20, 1);
        agent.releaseFromDetention(0.40, 2);

        double propensity = SocialInfluencePhase.propensity(agent, 0.5, params);

        // 0.10 + 0.35 * 0.5 + 0.25 * 0.20 + 0.35 * 0.40
        assertThat(propensity).isCloseTo(0.465, within(1e-9));
    }

    @Test
    void propensityIsClampedToOne() {
        SimulationParameters params = SimulationParameters.defaults();
        Agent agent = new Agent(0, AgentState.LAWFUL, 0.90, 30);

        assertThat(SocialInfluencePhase.propensity(agent, 1.0, params)).isEqualTo(1.0);
    }

    @Test
    void criminalNeighbourPushesLawfulAgentToAtRisk() {
        SimulationParameters params = PhaseFixtures.params(2, Map.of());
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.LAWFUL, AgentState.CRIMINAL);
        when(random.nextDouble()).thenReturn(0.9);
        Simulation sim = PhaseFixtures.simulation(params, agents, PhaseFixtures.network(2, new int[]{0, 1}), random);

        new SocialInfluencePhase().execute(sim);

        // propensity 0.45 >= 0.30 but the escalation draw 0.9 fails
        assertThat(agents.get(0).getState()).isEqualTo(AgentState.AT_RISK);
        assertThat(agents.get(1).getState()).isEqualTo(AgentState.CRIMINAL);
    }

    @Test
    void agentCanClimbBothStepsInOneTick() {
        SimulationParameters params = PhaseFixtures.params(2, Map.of());
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.LAWFUL, AgentState.CRIMINAL);
        when(random.nextDouble()).thenReturn(0.2);
        Simulation sim = PhaseFixtures.simulation(params, agents, PhaseFixtures.network(2, new int[]{0, 1}), random);

        new SocialInfluencePhase().execute(sim);

        assertThat(agents.get(0).getState()).isEqualTo(AgentState.CRIMINAL);
    }

    @Test
    void exposureUsesStatesFrozenAtTickStart() {
        SimulationParameters params = PhaseFixtures.params(2, Map.of());
        // Agent 0 turns criminal during the phase; agent 1 must still see it as AT_RISK
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.AT_RISK, AgentState.LAWFUL);
        when(random.nextDouble()).thenReturn(0.0);
        Simulation sim = PhaseFixtures.simulation(params, agents, PhaseFixtures.network(2, new int[]{0, 1}), random);

        new SocialInfluencePhase().execute(sim);

        assertThat(agents.get(0).getState()).isEqualTo(AgentState.CRIMINAL);
        assertThat(agents.get(1).getState()).isEqualTo(AgentState.LAWFUL);
    }

    @Test
    void atRiskAgentsDecayWhenConfigured() {
        SimulationParameters params = PhaseFixtures.params(2, Map.of("behavior.at-risk-decay-rate", 0.5));
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.AT_RISK, AgentState.LAWFUL);
        when(random.nextDouble()).thenReturn(0.5, 0.1);
        Simulation sim = PhaseFixtures.simulation(params, agents, PhaseFixtures.network(2), random);

        new SocialInfluencePhase().execute(sim);

        assertThat(agents.get(0).getState()).isEqualTo(AgentState.LAWFUL);
    }

    @Test
    void atRiskAgentsStayWithoutDecay() {
        SimulationParameters params = PhaseFixtures.params(2, Map.of());
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.AT_RISK, AgentState.LAWFUL);
        when(random.nextDouble()).thenReturn(0.5);
        Simulation sim = PhaseFixtures.simulation(params, agents, PhaseFixtures.network(2), random);

        new SocialInfluencePhase().execute(sim);

        assertThat(agents.get(0).getState()).isEqualTo(AgentState.AT_RISK);
    }

    @Test
    void criminalAndIncarceratedAgentsAreNotInfluenced() {
        SimulationParameters params = PhaseFixtures.params(2, Map.of());
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.CRIMINAL, AgentState.CRIMINAL);
        agents.get(1).detain(5, 0.1, 0);
        Simulation sim = PhaseFixtures.simulation(params, agents, PhaseFixtures.network(2, new int[]{0, 1}), random);

        new SocialInfluencePhase().execute(sim);

        verifyNoInteractions(random);
        assertThat(agents.get(1).getState()).isEqualTo(AgentState.DETAINED);
    }
}
