package org.crimenet.runtime.metrics;

import org.crimenet.runtime.model.AgentState;

/**
 * Aggregate outcome of one simulated day.
 * <p>
 * Produced once per tick by the metrics phase and never mutated afterwards. Event counts
 * refer to what happened during the tick; state counts are taken after all other phases.
 *
 * @param tick The day number, starting at 1.
 * @param crimeEvents Crimes committed.
 * @param arrests Agents moved to DETAINED.
 * @param wrongfulDetentions Arrests whose target was not CRIMINAL at arrest time.
 * @param convictions Detention exits into PRISON.
 * @param detentionReleases Detention exits back to AT_RISK.
 * @param prisonReleases Sentences served.
 * @param rewiringEvents Incarceration entries whose ties were rewired.
 * @param edgesRemoved Ties to LAWFUL neighbors dropped by rewiring.
 * @param edgesAdded Ties to CRIMINAL agents created by rewiring.
 * @param sentencesShortened Prison sentences cut by the congestion threshold policy.
 * @param lawful Agents in LAWFUL at end of tick.
 * @param atRisk Agents in AT_RISK at end of tick.
 * @param criminal Agents in CRIMINAL at end of tick.
 * @param detained Agents in DETAINED at end of tick.
 * @param prison Agents in PRISON at end of tick.
 */
public record TickMetrics(
        long tick,
        int crimeEvents,
        int arrests,
        int wrongfulDetentions,
        int convictions,
        int detentionReleases,
        int prisonReleases,
        int rewiringEvents,
        int edgesRemoved,
        int edgesAdded,
        int sentencesShortened,
        int lawful,
        int atRisk,
        int criminal,
        int detained,
        int prison
) {

    public TickMetrics {
        if (wrongfulDetentions > arrests) {
            throw new IllegalArgumentException("Wrongful detentions (" + wrongfulDetentions
                    + ") exceed arrests (" + arrests + ") at tick " + tick);
        }
    }

    /**
     * @return Total number of agents, the sum of all state counts.
     */
    public int population() {
        return lawful + atRisk + criminal + detained + prison;
    }

    public int count(AgentState state) {
        return switch (state) {
            case LAWFUL -> lawful;
            case AT_RISK -> atRisk;
            case CRIMINAL -> criminal;
            case DETAINED -> detained;
            case PRISON -> prison;
        };
    }

    /**
     * @return Fraction of the population in the given state, in [0, 1].
     */
    public double share(AgentState state) {
        int total = population();
        return total == 0 ? 0.0 : (double) count(state) / total;
    }

    /**
     * @return Detention releases plus prison releases.
     */
    public int releases() {
        return detentionReleases + prisonReleases;
    }

    /**
     * @return Agents leaving DETAINED this tick, either convicted or released.
     */
    public int detentionExits() {
        return convictions + detentionReleases;
    }

    /**
     * @return Wrongful detentions over arrests, or 0 when there were no arrests.
     */
    public double wrongfulDetentionRate() {
        return arrests == 0 ? 0.0 : (double) wrongfulDetentions / arrests;
    }
}
