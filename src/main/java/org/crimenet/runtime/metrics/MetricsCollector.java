package org.crimenet.runtime.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates the ordered series of {@link TickMetrics} records of a run.
 * <p>
 * The series is exposed as a read-only list, so it can be iterated any number of times, both
 * while the run is in progress and after it has finished. Registered listeners are notified
 * of each new record for incremental output.
 */
public class MetricsCollector implements Iterable<TickMetrics> {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsCollector.class);

    private final List<TickMetrics> records = new ArrayList<>();
    private final List<ITickMetricsListener> listeners = new ArrayList<>();

    /**
     * Registers a listener. Listeners are notified in the order they are added.
     *
     * @param listener The listener to add.
     */
    public void addListener(ITickMetricsListener listener) {
        listeners.add(listener);
    }

    /**
     * Appends a record and notifies listeners.
     *
     * @param metrics The record for the tick just completed. Its tick must follow the previous one.
     * @throws IllegalArgumentException if the record is out of order.
     */
    public void record(TickMetrics metrics) {
        if (!records.isEmpty() && metrics.tick() <= records.get(records.size() - 1).tick()) {
            throw new IllegalArgumentException("Tick " + metrics.tick() + " recorded after tick "
                    + records.get(records.size() - 1).tick());
        }
        records.add(metrics);
        for (ITickMetricsListener listener : listeners) {
            try {
                listener.onTick(metrics);
            } catch (RuntimeException e) {
                LOG.warn("Metrics listener '{}' failed at tick {}: {}",
                        listener.getClass().getSimpleName(), metrics.tick(), e.getMessage());
            }
        }
    }

    /**
     * @return An unmodifiable live view of all records, in tick order.
     */
    public List<TickMetrics> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    public Optional<TickMetrics> latest() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1));
    }

    @Override
    public Iterator<TickMetrics> iterator() {
        return getRecords().iterator();
    }
}
