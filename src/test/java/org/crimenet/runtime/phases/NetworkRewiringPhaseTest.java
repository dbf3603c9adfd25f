package org.crimenet.runtime.phases;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.crimenet.runtime.Simulation;
import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.model.Agent;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.model.SocialNetwork;
import org.crimenet.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class NetworkRewiringPhaseTest {

    private final IRandomProvider random = mock(IRandomProvider.class);

    /**
     * Agent 0 was just detained; 1 and 2 are lawful friends, 3 is at risk, 4 is the only criminal.
     */
    private static List<Agent> world() {
        List<Agent> agents = PhaseFixtures.agents(30, AgentState.CRIMINAL, AgentState.LAWFUL, AgentState.LAWFUL,
                AgentState.AT_RISK, AgentState.CRIMINAL);
        agents.get(0).detain(5, 0.1, 0);
        return agents;
    }

    private static SocialNetwork star() {
        return PhaseFixtures.network(5, new int[]{0, 1}, new int[]{0, 2}, new int[]{0, 3});
    }

    @Test
    void dropsLawfulTiesAndLinksToCriminals() {
        SimulationParameters params = PhaseFixtures.params(5, Map.of());
        SocialNetwork network = star();
        when(random.nextDouble()).thenReturn(0.1, 0.5, 0.0);
        when(random.nextInt(anyInt())).thenReturn(0);
        Simulation sim = PhaseFixtures.simulation(params, world(), network, random);
        sim.scheduleRewiring(0);

        new NetworkRewiringPhase().execute(sim);

        assertThat(network.hasEdge(0, 1)).isFalse();
        assertThat(network.hasEdge(0, 2)).isTrue();
        assertThat(network.hasEdge(0, 3)).isTrue();
        assertThat(network.hasEdge(0, 4)).isTrue();
        assertThat(network.edgeCount()).isEqualTo(3);
        assertThat(sim.getCounters().getRewiringEvents()).isEqualTo(1);
        assertThat(sim.getCounters().getEdgesRemoved()).isEqualTo(1);
        assertThat(sim.getCounters().getEdgesAdded()).isEqualTo(1);
        assertThat(sim.drainPendingRewiring()).isEmpty();
    }

    @Test
    void repeatedCandidatesNeverCreateDuplicateEdges() {
        SimulationParameters params = PhaseFixtures.params(5, Map.of("rewiring.drop-lawful-edge-probability", 0.0));
        SocialNetwork network = star();
        network.addEdge(0, 4);
        when(random.nextDouble()).thenReturn(0.0);
        when(random.nextInt(anyInt())).thenReturn(0);
        Simulation sim = PhaseFixtures.simulation(params, world(), network, random);
        sim.scheduleRewiring(0);

        new NetworkRewiringPhase().execute(sim);

        assertThat(network.edgeCount()).isEqualTo(4);
        assertThat(sim.getCounters().getEdgesAdded()).isZero();
    }

    @Test
    void addProbabilityGatesEachSlot() {
        SimulationParameters params = PhaseFixtures.params(5, Map.of(
                "rewiring.drop-lawful-edge-probability", 0.0,
                "rewiring.add-criminal-edge-probability", 0.5));
        SocialNetwork network = star();
        when(random.nextDouble()).thenReturn(0.9);
        Simulation sim = PhaseFixtures.simulation(params, world(), network, random);
        sim.scheduleRewiring(0);

        new NetworkRewiringPhase().execute(sim);

        assertThat(network.hasEdge(0, 4)).isFalse();
        assertThat(sim.getCounters().getRewiringEvents()).isEqualTo(1);
    }

    @Test
    void disabledRewiringStillDrainsTheQueue() {
        SimulationParameters params = PhaseFixtures.params(5, Map.of("rewiring.enabled", false));
        SocialNetwork network = star();
        Simulation sim = PhaseFixtures.simulation(params, world(), network, random);
        sim.scheduleRewiring(0);

        new NetworkRewiringPhase().execute(sim);

        verifyNoInteractions(random);
        assertThat(network.edgeCount()).isEqualTo(3);
        assertThat(sim.getCounters().getRewiringEvents()).isZero();
        assertThat(sim.drainPendingRewiring()).isEmpty();
    }

    @Test
    void nothingHappensWithoutEntries() {
        SimulationParameters params = PhaseFixtures.params(5, Map.of());
        Simulation sim = PhaseFixtures.simulation(params, world(), star(), random);

        new NetworkRewiringPhase().execute(sim);

        verifyNoInteractions(random);
    }
}
