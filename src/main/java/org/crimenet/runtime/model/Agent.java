package org.crimenet.runtime.model;

/**
 * Mutable record of a single individual in the simulated population.
 * <p>
 * An Agent is created once at initialization and persists for the entire run. Its identity
 * ({@link #getId()}) doubles as its node key in the {@link SocialNetwork}. State changes go
 * exclusively through the transition methods of this class, each of which validates the move
 * against {@link AgentState#canTransitionTo(AgentState)} and throws
 * {@link IllegalTransitionException} otherwise.
 * <p>
 * Invariants maintained here:
 * <ul>
 *   <li>{@code remainingDuration > 0} iff the state is DETAINED or PRISON, 0 otherwise.</li>
 *   <li>{@code stigma} and {@code criminalCapital} stay in [0, 1] and never decrease.</li>
 *   <li>The crime history window has a fixed capacity for the agent's lifetime.</li>
 * </ul>
 * <p>
 * <b>Thread safety:</b> Not thread-safe. A simulation replicate is single-threaded.
 */
public class Agent {

    private final int id;
    private final double basePropensity;
    private final CrimeHistory crimeHistory;

    private AgentState state;
    private double stigma;
    private double criminalCapital;
    private int remainingDuration;
    private long stateEnteredTick;
    private int incarcerationEntries;

    /**
     * Creates a new agent.
     *
     * @param id Stable identifier, also the network node key.
     * @param initialState State at tick 0. Must not be DETAINED or PRISON.
     * @param basePropensity Fixed baseline propensity in [0, 1].
     * @param evidenceWindowDays Capacity of the rolling crime history.
     * @throws IllegalArgumentException if the initial state is an incarcerated state or the
     *                                  propensity is outside [0, 1].
     */
    public Agent(int id, AgentState initialState, double basePropensity, int evidenceWindowDays) {
        if (initialState.isIncarcerated()) {
            throw new IllegalArgumentException("Agent " + id + " cannot start in state " + initialState);
        }
        if (basePropensity < 0.0 || basePropensity > 1.0 || Double.isNaN(basePropensity)) {
            throw new IllegalArgumentException("Base propensity must be in [0, 1], got " + basePropensity);
        }
        this.id = id;
        this.state = initialState;
        this.basePropensity = basePropensity;
        this.crimeHistory = new CrimeHistory(evidenceWindowDays);
    }

    public int getId() {
        return id;
    }

    public AgentState getState() {
        return state;
    }

    public double getBasePropensity() {
        return basePropensity;
    }

    public double getStigma() {
        return stigma;
    }

    public double getCriminalCapital() {
        return criminalCapital;
    }

    public CrimeHistory getCrimeHistory() {
        return crimeHistory;
    }

    /**
     * @return Days left in DETAINED or PRISON, or 0 in any other state.
     */
    public int getRemainingDuration() {
        return remainingDuration;
    }

    /**
     * @return The tick at which the current state was entered (0 for the initial state).
     */
    public long getStateEnteredTick() {
        return stateEnteredTick;
    }

    /**
     * @return How many times this agent has entered DETAINED or PRISON.
     */
    public int getIncarcerationEntries() {
        return incarcerationEntries;
    }

    /**
     * Applies a social transition (LAWFUL/AT_RISK/CRIMINAL moves that carry no countdown).
     *
     * @param target The new state. Must not be an incarcerated state.
     * @param tick The current tick.
     * @throws IllegalTransitionException if the move is not permitted.
     */
    public void shiftTo(AgentState target, long tick) {
        if (target.isIncarcerated()) {
            throw new IllegalTransitionException(id, state, target, tick);
        }
        transition(target, tick);
    }

    /**
     * Arrests the agent: moves it to DETAINED, starts the detention countdown and adds stigma.
     *
     * @param days Detention length. Must be positive.
     * @param stigmaIncrement Non-negative stigma added on entry.
     * @param tick The current tick.
     * @throws IllegalTransitionException if the agent is already incarcerated.
     * @throws IllegalArgumentException if days is not positive.
     */
    public void detain(int days, double stigmaIncrement, long tick) {
        requirePositiveDuration(days);
        transition(AgentState.DETAINED, tick);
        this.remainingDuration = days;
        this.incarcerationEntries++;
        this.stigma = accumulate(stigma, stigmaIncrement);
    }

    /**
     * Convicts a detained agent: moves it to PRISON, starts the sentence countdown and adds
     * criminal capital once for this entry.
     *
     * @param days Sentence length. Must be positive.
     * @param capitalIncrement Non-negative criminal capital added on entry.
     * @param tick The current tick.
     * @throws IllegalTransitionException if the agent is not DETAINED.
     * @throws IllegalArgumentException if days is not positive.
     */
    public void imprison(int days, double capitalIncrement, long tick) {
        requirePositiveDuration(days);
        transition(AgentState.PRISON, tick);
        this.remainingDuration = days;
        this.incarcerationEntries++;
        this.criminalCapital = accumulate(criminalCapital, capitalIncrement);
    }

    /**
     * Releases a detained agent without conviction. Detention is criminogenic regardless of
     * outcome, so criminal capital is still increased.
     *
     * @param capitalIncrement Non-negative criminal capital added on release.
     * @param tick The current tick.
     * @throws IllegalTransitionException if the agent is not DETAINED.
     */
    public void releaseFromDetention(double capitalIncrement, long tick) {
        if (state != AgentState.DETAINED) {
            throw new IllegalTransitionException(id, state, AgentState.AT_RISK, tick);
        }
        transition(AgentState.AT_RISK, tick);
        this.remainingDuration = 0;
        this.criminalCapital = accumulate(criminalCapital, capitalIncrement);
    }

    /**
     * Releases an agent that has served its sentence.
     *
     * @param capitalIncrement Non-negative criminal capital added on release.
     * @param tick The current tick.
     * @throws IllegalTransitionException if the agent is not in PRISON.
     */
    public void releaseFromPrison(double capitalIncrement, long tick) {
        if (state != AgentState.PRISON) {
            throw new IllegalTransitionException(id, state, AgentState.AT_RISK, tick);
        }
        transition(AgentState.AT_RISK, tick);
        this.remainingDuration = 0;
        this.criminalCapital = accumulate(criminalCapital, capitalIncrement);
    }

    /**
     * Decrements the countdown of an incarcerated agent by one day.
     *
     * @return The remaining days after decrementing; 0 means the stay is over.
     * @throws IllegalStateException if the agent is not incarcerated.
     */
    public int countDown() {
        if (!state.isIncarcerated()) {
            throw new IllegalStateException("Agent " + id + " has no countdown in state " + state);
        }
        remainingDuration--;
        return remainingDuration;
    }

    /**
     * Scales the remaining sentence of an imprisoned agent, never below one day.
     *
     * @param factor Multiplier in (0, 1].
     * @return The number of days removed.
     * @throws IllegalStateException if the agent is not in PRISON.
     */
    public int shortenSentence(double factor) {
        if (state != AgentState.PRISON) {
            throw new IllegalStateException("Agent " + id + " has no sentence in state " + state);
        }
        int shortened = Math.max(1, (int) Math.round(remainingDuration * factor));
        int removed = remainingDuration - shortened;
        remainingDuration = shortened;
        return removed;
    }

    /**
     * Appends today's crime outcome to the rolling evidence window.
     *
     * @param crimeEvents Crimes committed today.
     */
    public void recordCrimes(int crimeEvents) {
        crimeHistory.record(crimeEvents);
    }

    private void transition(AgentState target, long tick) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalTransitionException(id, state, target, tick);
        }
        this.state = target;
        this.stateEnteredTick = tick;
    }

    private void requirePositiveDuration(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("Duration must be positive for agent " + id + ", got " + days);
        }
    }

    private static double accumulate(double current, double increment) {
        if (increment < 0.0) {
            throw new IllegalArgumentException("Increment must be >= 0, got " + increment);
        }
        return Math.min(1.0, current + increment);
    }

    @Override
    public String toString() {
        return "Agent{id=" + id + ", state=" + state + ", stigma=" + stigma
                + ", criminalCapital=" + criminalCapital + ", remaining=" + remainingDuration + "}";
    }
}
