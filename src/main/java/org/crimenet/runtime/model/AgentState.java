package org.crimenet.runtime.model;

/**
 * Legal/criminal status of an agent. Every agent is in exactly one state at any tick.
 * <p>
 * The permitted transitions form a closed state machine with no terminal state:
 * <pre>
 *   LAWFUL   -&gt; AT_RISK, DETAINED
 *   AT_RISK  -&gt; CRIMINAL, LAWFUL, DETAINED
 *   CRIMINAL -&gt; DETAINED
 *   DETAINED -&gt; PRISON, AT_RISK
 *   PRISON   -&gt; AT_RISK
 * </pre>
 * Anything else is an internal invariant violation, see {@link IllegalTransitionException}.
 */
public enum AgentState {
    LAWFUL,
    AT_RISK,
    CRIMINAL,
    DETAINED,
    PRISON;

    /**
     * Checks whether the state machine permits a direct move from this state to {@code target}.
     *
     * @param target The state to move to.
     * @return {@code true} if the transition is legal.
     */
    public boolean canTransitionTo(AgentState target) {
        return switch (this) {
            case LAWFUL -> target == AT_RISK || target == DETAINED;
            case AT_RISK -> target == CRIMINAL || target == LAWFUL || target == DETAINED;
            case CRIMINAL -> target == DETAINED;
            case DETAINED -> target == PRISON || target == AT_RISK;
            case PRISON -> target == AT_RISK;
        };
    }

    /**
     * @return {@code true} for DETAINED and PRISON, the states carrying a countdown.
     */
    public boolean isIncarcerated() {
        return this == DETAINED || this == PRISON;
    }

    /**
     * @return {@code true} for the states that policing may target.
     */
    public boolean isEligibleForArrest() {
        return !isIncarcerated();
    }

    /**
     * @return {@code true} for the states that social influence acts upon.
     */
    public boolean isSusceptible() {
        return this == LAWFUL || this == AT_RISK;
    }
}
