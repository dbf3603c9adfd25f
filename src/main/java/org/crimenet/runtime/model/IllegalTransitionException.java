package org.crimenet.runtime.model;

/**
 * Thrown when a state change is attempted that the {@link AgentState} machine does not permit.
 * <p>
 * This never represents a recoverable condition: it means a mechanism tried to move an
 * agent along an edge that does not exist, so the run is aborted with the offending agent,
 * the attempted transition and the tick as diagnostic context.
 */
public class IllegalTransitionException extends IllegalStateException {

    private final int agentId;
    private final AgentState from;
    private final AgentState to;
    private final long tick;

    /**
     * Creates an IllegalTransitionException.
     *
     * @param agentId The agent whose state was to change.
     * @param from The agent's current state.
     * @param to The attempted target state.
     * @param tick The tick at which the transition was attempted.
     */
    public IllegalTransitionException(int agentId, AgentState from, AgentState to, long tick) {
        super(String.format("Illegal transition %s -> %s for agent %d at tick %d", from, to, agentId, tick));
        this.agentId = agentId;
        this.from = from;
        this.to = to;
        this.tick = tick;
    }

    public int getAgentId() {
        return agentId;
    }

    public AgentState getFrom() {
        return from;
    }

    public AgentState getTo() {
        return to;
    }

    public long getTick() {
        return tick;
    }
}
