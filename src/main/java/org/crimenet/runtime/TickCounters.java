package org.crimenet.runtime;

/**
 * Event counters for the tick in progress.
 * <p>
 * Reset by {@link Simulation} at the start of every tick, incremented by the phases and read by
 * the metrics phase to build the tick's record.
 */
public final class TickCounters {

    private int crimeEvents;
    private int arrests;
    private int wrongfulDetentions;
    private int convictions;
    private int detentionReleases;
    private int prisonReleases;
    private int rewiringEvents;
    private int edgesRemoved;
    private int edgesAdded;
    private int sentencesShortened;

    void reset() {
        crimeEvents = 0;
        arrests = 0;
        wrongfulDetentions = 0;
        convictions = 0;
        detentionReleases = 0;
        prisonReleases = 0;
        rewiringEvents = 0;
        edgesRemoved = 0;
        edgesAdded = 0;
        sentencesShortened = 0;
    }

    public void addCrimeEvents(int count) {
        crimeEvents += count;
    }

    /**
     * @param wrongful Whether the target was not CRIMINAL at arrest time.
     */
    public void recordArrest(boolean wrongful) {
        arrests++;
        if (wrongful) {
            wrongfulDetentions++;
        }
    }

    public void recordConviction() {
        convictions++;
    }

    public void recordDetentionRelease() {
        detentionReleases++;
    }

    public void recordPrisonRelease() {
        prisonReleases++;
    }

    public void recordRewiring(int removed, int added) {
        rewiringEvents++;
        edgesRemoved += removed;
        edgesAdded += added;
    }

    public void addSentencesShortened(int count) {
        sentencesShortened += count;
    }

    public int getCrimeEvents() {
        return crimeEvents;
    }

    public int getArrests() {
        return arrests;
    }

    public int getWrongfulDetentions() {
        return wrongfulDetentions;
    }

    public int getConvictions() {
        return convictions;
    }

    public int getDetentionReleases() {
        return detentionReleases;
    }

    public int getPrisonReleases() {
        return prisonReleases;
    }

    public int getRewiringEvents() {
        return rewiringEvents;
    }

    public int getEdgesRemoved() {
        return edgesRemoved;
    }

    public int getEdgesAdded() {
        return edgesAdded;
    }

    public int getSentencesShortened() {
        return sentencesShortened;
    }
}
