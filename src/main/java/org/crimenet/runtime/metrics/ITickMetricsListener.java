package org.crimenet.runtime.metrics;

/**
 * Receives each {@link TickMetrics} record as soon as it has been emitted.
 * <p>
 * Listeners are called on the simulation thread, in registration order, after the record has
 * been appended to the {@link MetricsCollector}. They must not modify simulation state.
 */
@FunctionalInterface
public interface ITickMetricsListener {

    /**
     * @param metrics The record just emitted.
     */
    void onTick(TickMetrics metrics);
}
