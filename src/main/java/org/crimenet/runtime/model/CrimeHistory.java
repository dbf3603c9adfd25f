package org.crimenet.runtime.model;

/**
 * Fixed-capacity rolling window of daily crime-event counts.
 * <p>
 * Backed by a preallocated ring buffer: {@link #record(int)} overwrites the oldest slot once
 * the window is full, so the window never holds more than {@code capacity} entries and holds
 * exactly {@code capacity} entries after {@code capacity} days. A running sum is maintained
 * so that {@link #total()} is O(1).
 * <p>
 * <b>Thread safety:</b> Not thread-safe.
 */
public final class CrimeHistory {

    private final int[] counts;
    private int writeIndex;
    private int size;
    private int total;

    /**
     * Creates an empty history.
     *
     * @param capacity The window length in days. Must be at least 1.
     * @throws IllegalArgumentException if capacity &lt; 1.
     */
    public CrimeHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Crime history capacity must be >= 1, got " + capacity);
        }
        this.counts = new int[capacity];
    }

    /**
     * Appends today's crime-event count, evicting the oldest day if the window is full.
     *
     * @param crimeEvents Number of crime events committed today (0 for "no crime").
     * @throws IllegalArgumentException if crimeEvents is negative.
     */
    public void record(int crimeEvents) {
        if (crimeEvents < 0) {
            throw new IllegalArgumentException("Crime event count must be >= 0, got " + crimeEvents);
        }
        if (size == counts.length) {
            total -= counts[writeIndex];
        } else {
            size++;
        }
        counts[writeIndex] = crimeEvents;
        total += crimeEvents;
        writeIndex = (writeIndex + 1) % counts.length;
    }

    /**
     * @return Sum of crime events currently inside the window.
     */
    public int total() {
        return total;
    }

    /**
     * @return Number of days recorded so far, capped at {@link #capacity()}.
     */
    public int size() {
        return size;
    }

    public int capacity() {
        return counts.length;
    }

    /**
     * Returns the count recorded {@code daysAgo} days before the most recent entry.
     *
     * @param daysAgo 0 for the most recent day.
     * @return The recorded count.
     * @throws IndexOutOfBoundsException if the day is not inside the window.
     */
    public int get(int daysAgo) {
        if (daysAgo < 0 || daysAgo >= size) {
            throw new IndexOutOfBoundsException("Day " + daysAgo + " outside window of size " + size);
        }
        int index = Math.floorMod(writeIndex - 1 - daysAgo, counts.length);
        return counts[index];
    }

    /**
     * @return The window contents, oldest first.
     */
    public int[] toArray() {
        int[] result = new int[size];
        for (int i = 0; i < size; i++) {
            result[i] = get(size - 1 - i);
        }
        return result;
    }
}
