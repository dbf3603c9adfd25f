package org.crimenet.runtime.metrics;

import org.crimenet.runtime.model.AgentState;

/**
 * Totals and averages over a complete metrics series.
 *
 * @param ticks Number of records summarized.
 * @param crimeEvents Total crimes.
 * @param arrests Total arrests.
 * @param wrongfulDetentions Total wrongful arrests.
 * @param convictions Total convictions.
 * @param detentionReleases Total releases from detention without conviction.
 * @param prisonReleases Total sentences served.
 * @param wrongfulDetentionRate Total wrongful arrests over total arrests (0 without arrests).
 * @param meanCriminalShare Average CRIMINAL share over all ticks.
 * @param meanDetainedShare Average DETAINED share over all ticks.
 * @param meanPrisonShare Average PRISON share over all ticks.
 * @param finalCriminalShare CRIMINAL share at the last tick.
 * @param finalDetainedShare DETAINED share at the last tick.
 * @param finalPrisonShare PRISON share at the last tick.
 */
public record RunSummary(
        int ticks,
        long crimeEvents,
        long arrests,
        long wrongfulDetentions,
        long convictions,
        long detentionReleases,
        long prisonReleases,
        double wrongfulDetentionRate,
        double meanCriminalShare,
        double meanDetainedShare,
        double meanPrisonShare,
        double finalCriminalShare,
        double finalDetainedShare,
        double finalPrisonShare
) {

    /**
     * Summarizes a series.
     *
     * @param series The records, in tick order. May be empty.
     * @return The summary; all values are 0 for an empty series.
     */
    public static RunSummary of(Iterable<TickMetrics> series) {
        int ticks = 0;
        long crimes = 0;
        long arrests = 0;
        long wrongful = 0;
        long convictions = 0;
        long detentionReleases = 0;
        long prisonReleases = 0;
        double criminalShare = 0.0;
        double detainedShare = 0.0;
        double prisonShare = 0.0;
        TickMetrics last = null;

        for (TickMetrics m : series) {
            ticks++;
            crimes += m.crimeEvents();
            arrests += m.arrests();
            wrongful += m.wrongfulDetentions();
            convictions += m.convictions();
            detentionReleases += m.detentionReleases();
            prisonReleases += m.prisonReleases();
            criminalShare += m.share(AgentState.CRIMINAL);
            detainedShare += m.share(AgentState.DETAINED);
            prisonShare += m.share(AgentState.PRISON);
            last = m;
        }

        if (ticks == 0) {
            return new RunSummary(0, 0, 0, 0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
        }
        return new RunSummary(ticks, crimes, arrests, wrongful, convictions, detentionReleases, prisonReleases,
                arrests == 0 ? 0.0 : (double) wrongful / arrests,
                criminalShare / ticks, detainedShare / ticks, prisonShare / ticks,
                last.share(AgentState.CRIMINAL), last.share(AgentState.DETAINED), last.share(AgentState.PRISON));
    }
}
