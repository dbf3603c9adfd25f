package org.crimenet.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class PopulationTest {

    @Test
    void agentsAreIndexedById() {
        Agent second = new Agent(1, AgentState.CRIMINAL, 0.1, 5);
        Agent first = new Agent(0, AgentState.LAWFUL, 0.1, 5);

        Population population = new Population(List.of(second, first));

        assertThat(population.get(0)).isSameAs(first);
        assertThat(population.get(1)).isSameAs(second);
        assertThat(population.size()).isEqualTo(2);
        assertThat(population).extracting(Agent::getId).containsExactly(0, 1);
    }

    @Test
    void countByStateIncludesEveryState() {
        Population population = new Population(List.of(
                new Agent(0, AgentState.LAWFUL, 0.1, 5),
                new Agent(1, AgentState.LAWFUL, 0.1, 5),
                new Agent(2, AgentState.CRIMINAL, 0.1, 5)));

        Map<AgentState, Integer> counts = population.countByState();

        assertThat(counts).containsOnlyKeys(AgentState.values());
        assertThat(counts.get(AgentState.LAWFUL)).isEqualTo(2);
        assertThat(counts.get(AgentState.CRIMINAL)).isEqualTo(1);
        assertThat(counts.get(AgentState.PRISON)).isZero();
        assertThat(population.count(AgentState.AT_RISK)).isZero();
    }

    @Test
    void snapshotIsDetachedFromLaterChanges() {
        Agent agent = new Agent(0, AgentState.CRIMINAL, 0.1, 5);
        Population population = new Population(List.of(agent));

        AgentState[] snapshot = population.snapshotStates();
        agent.detain(3, 0.1, 1);

        assertThat(snapshot).containsExactly(AgentState.CRIMINAL);
        assertThat(population.snapshotStates()).containsExactly(AgentState.DETAINED);
    }

    @Test
    void rejectsGapsAndDuplicates() {
        assertThatThrownBy(() -> new Population(List.of(new Agent(1, AgentState.LAWFUL, 0.1, 5))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Population(List.of(
                new Agent(0, AgentState.LAWFUL, 0.1, 5),
                new Agent(0, AgentState.LAWFUL, 0.1, 5))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Population(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
