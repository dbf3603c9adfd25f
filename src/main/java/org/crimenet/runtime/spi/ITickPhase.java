package org.crimenet.runtime.spi;

import org.crimenet.runtime.Simulation;

/**
 * One of the fixed sub-phases of a simulated day.
 * <p>
 * Phases are executed by {@link Simulation#tick()} in a fixed order, once per tick, on the
 * simulation thread. Each phase receives the simulation as its context and has access to:
 * <ul>
 *   <li>Parameters via {@code simulation.getParameters()}</li>
 *   <li>Agents via {@code simulation.getPopulation()}</li>
 *   <li>The tie structure via {@code simulation.getNetwork()}</li>
 *   <li>States frozen at tick start via {@code simulation.getTickStartStates()}</li>
 *   <li>The run's single random stream via {@code simulation.getRandomProvider()}</li>
 *   <li>This tick's event counters via {@code simulation.getCounters()}</li>
 * </ul>
 * A phase instance belongs to exactly one simulation and may keep state across ticks.
 */
public interface ITickPhase {

    /**
     * Executes the phase for the current tick.
     *
     * @param simulation The simulation context.
     */
    void execute(Simulation simulation);

    /**
     * @return A short name used in diagnostics.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
