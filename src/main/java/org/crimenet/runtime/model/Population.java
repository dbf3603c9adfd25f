package org.crimenet.runtime.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Agent store indexed by id.
 * <p>
 * Agents are held in an array at the position of their id, so lookup and update by id are
 * O(1). The population is fixed for the whole run: there is no birth or death.
 */
public class Population implements Iterable<Agent> {

    private final Agent[] agents;

    /**
     * Creates a population from agents whose ids are exactly {@code 0 .. agents.size()-1}.
     *
     * @param agents The agents, in any order.
     * @throws IllegalArgumentException if the list is empty or the ids are not dense and unique.
     */
    public Population(List<Agent> agents) {
        if (agents.isEmpty()) {
            throw new IllegalArgumentException("Population must contain at least one agent");
        }
        this.agents = new Agent[agents.size()];
        for (Agent agent : agents) {
            int id = agent.getId();
            if (id < 0 || id >= this.agents.length) {
                throw new IllegalArgumentException("Agent id " + id + " outside 0.." + (this.agents.length - 1));
            }
            if (this.agents[id] != null) {
                throw new IllegalArgumentException("Duplicate agent id " + id);
            }
            this.agents[id] = agent;
        }
    }

    public Agent get(int id) {
        return agents[id];
    }

    public int size() {
        return agents.length;
    }

    /**
     * Captures the state of every agent, indexed by id.
     * <p>
     * Phases that must not see changes made earlier in the same tick read from this copy.
     *
     * @return A fresh array of states.
     */
    public AgentState[] snapshotStates() {
        AgentState[] states = new AgentState[agents.length];
        for (int i = 0; i < agents.length; i++) {
            states[i] = agents[i].getState();
        }
        return states;
    }

    /**
     * @return Number of agents per state; every state is present as a key.
     */
    public Map<AgentState, Integer> countByState() {
        int[] counts = new int[AgentState.values().length];
        for (Agent agent : agents) {
            counts[agent.getState().ordinal()]++;
        }
        Map<AgentState, Integer> result = new EnumMap<>(AgentState.class);
        for (AgentState state : AgentState.values()) {
            result.put(state, counts[state.ordinal()]);
        }
        return result;
    }

    public int count(AgentState state) {
        int count = 0;
        for (Agent agent : agents) {
            if (agent.getState() == state) {
                count++;
            }
        }
        return count;
    }

    public List<Agent> asList() {
        return Collections.unmodifiableList(Arrays.asList(agents));
    }

    @Override
    public Iterator<Agent> iterator() {
        return asList().iterator();
    }
}
