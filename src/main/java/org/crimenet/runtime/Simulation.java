package org.crimenet.runtime;

import java.util.List;

import org.crimenet.runtime.internal.services.SeededRandomProvider;
import org.crimenet.runtime.metrics.MetricsCollector;
import org.crimenet.runtime.metrics.TickMetrics;
import org.crimenet.runtime.model.AgentState;
import org.crimenet.runtime.model.IllegalTransitionException;
import org.crimenet.runtime.model.Population;
import org.crimenet.runtime.model.SocialNetwork;
import org.crimenet.runtime.phases.CrimeGenerationPhase;
import org.crimenet.runtime.phases.DetentionProcessingPhase;
import org.crimenet.runtime.phases.MetricsCollectionPhase;
import org.crimenet.runtime.phases.NetworkRewiringPhase;
import org.crimenet.runtime.phases.PolicingPhase;
import org.crimenet.runtime.phases.PrisonProcessingPhase;
import org.crimenet.runtime.phases.SocialInfluencePhase;
import org.crimenet.runtime.spi.IRandomProvider;
import org.crimenet.runtime.spi.ITickPhase;
import org.crimenet.runtime.worldgen.PopulationSeeder;
import org.crimenet.runtime.worldgen.ScaleFreeNetworkGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Runs one simulation replicate day by day.
 * <p>
 * A Simulation is the explicit context of a run: it owns the population, the social network,
 * the single seeded random stream, the per-tick counters and the metrics series. Nothing is
 * held in static state, so independent replicates may run concurrently in one process, each on
 * its own thread. A single replicate is strictly single-threaded.
 * <p>
 * Every tick executes the same seven phases in a fixed order:
 * <ol>
 *   <li>{@link SocialInfluencePhase} - LAWFUL/AT_RISK escalation from peer exposure</li>
 *   <li>{@link CrimeGenerationPhase} - crime events, rolling evidence windows</li>
 *   <li>{@link PolicingPhase} - arrest targeting and detention entry</li>
 *   <li>{@link DetentionProcessingPhase} - judicial outcome at end of detention</li>
 *   <li>{@link PrisonProcessingPhase} - sentence completion and congestion policy</li>
 *   <li>{@link NetworkRewiringPhase} - tie rewiring for this tick's incarceration entries</li>
 *   <li>{@link MetricsCollectionPhase} - the tick's {@link TickMetrics} record</li>
 * </ol>
 * The order is part of the model: changing it changes the emergent dynamics, so it cannot be
 * configured.
 */
public class Simulation {

    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final SimulationParameters parameters;
    private final Population population;
    private final SocialNetwork network;
    private final IRandomProvider randomProvider;
    private final List<ITickPhase> phases;
    private final MetricsCollector metricsCollector = new MetricsCollector();
    private final TickCounters counters = new TickCounters();
    private final IntArrayList pendingRewiring = new IntArrayList();

    private AgentState[] tickStartStates;
    private long currentTick = 0L;

    /**
     * Creates a simulation over an existing population and network.
     *
     * @param parameters Validated run parameters.
     * @param population The agents; ids must match the network's node ids.
     * @param network The initial tie structure. It is mutated in place during the run.
     * @param randomProvider The run's single random stream.
     * @throws IllegalArgumentException if population and network sizes differ.
     */
    public Simulation(SimulationParameters parameters, Population population, SocialNetwork network,
                      IRandomProvider randomProvider) {
        if (population.size() != network.size()) {
            throw new IllegalArgumentException("Population size " + population.size()
                    + " does not match network size " + network.size());
        }
        this.parameters = parameters;
        this.population = population;
        this.network = network;
        this.randomProvider = randomProvider;
        this.phases = List.of(
                new SocialInfluencePhase(),
                new CrimeGenerationPhase(),
                new PolicingPhase(),
                new DetentionProcessingPhase(),
                new PrisonProcessingPhase(),
                new NetworkRewiringPhase(),
                new MetricsCollectionPhase());
        this.tickStartStates = population.snapshotStates();
    }

    /**
     * Builds a complete simulation from parameters: seeds the random stream, generates the
     * scale-free network and the initial population.
     * <p>
     * Network generation and population seeding draw from derived streams, so changing, say,
     * the network generator does not shift the random sequence seen by the daily dynamics.
     *
     * @param parameters Validated run parameters.
     * @return A simulation at tick 0.
     */
    public static Simulation create(SimulationParameters parameters) {
        SeededRandomProvider root = new SeededRandomProvider(parameters.getSeed());
        SocialNetwork network = new ScaleFreeNetworkGenerator(parameters.getAttachmentCount())
                .generate(parameters.getPopulationSize(), root.deriveFor("network", 0L));
        Population population = new PopulationSeeder(parameters).seed(root.deriveFor("population", 0L));
        return new Simulation(parameters, population, network, root.deriveFor("dynamics", 0L));
    }

    /**
     * Executes one simulated day: all seven phases, over all agents.
     *
     * @return The metrics record emitted for this tick.
     * @throws IllegalTransitionException if a phase attempts a transition the state machine
     *                                    forbids; the run must then be abandoned.
     */
    public TickMetrics tick() {
        currentTick++;
        counters.reset();
        tickStartStates = population.snapshotStates();

        for (ITickPhase phase : phases) {
            try {
                phase.execute(this);
            } catch (IllegalTransitionException e) {
                LOG.error("Aborting run in phase '{}' at tick {}: {}", phase.name(), currentTick, e.getMessage());
                throw e;
            }
        }

        TickMetrics metrics = metricsCollector.latest()
                .orElseThrow(() -> new IllegalStateException("No metrics emitted for tick " + currentTick));
        if (LOG.isDebugEnabled()) {
            LOG.debug("Tick {}: crimes={} arrests={} wrongful={} convictions={} criminal={} detained={} prison={}",
                    currentTick, metrics.crimeEvents(), metrics.arrests(), metrics.wrongfulDetentions(),
                    metrics.convictions(), metrics.criminal(), metrics.detained(), metrics.prison());
        }
        return metrics;
    }

    /**
     * Runs the remaining days up to the configured horizon.
     *
     * @return The metrics collector holding the full series.
     */
    public MetricsCollector run() {
        long remaining = parameters.getHorizonDays() - currentTick;
        if (remaining > 0) {
            run((int) remaining);
        }
        return metricsCollector;
    }

    /**
     * Runs a fixed number of days.
     *
     * @param days Number of ticks to execute. Must not be negative.
     * @return The metrics collector holding the full series.
     */
    public MetricsCollector run(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("Days must be >= 0, got " + days);
        }
        LOG.info("Starting run: seed={}, population={}, days={}, coercive={}, forensic={}",
                parameters.getSeed(), population.size(), days,
                parameters.getCoerciveCapacity(), parameters.getForensicCapacity());
        long start = System.nanoTime();
        for (int i = 0; i < days; i++) {
            tick();
        }
        if (days > 0 && parameters.arrestAttemptsPerTick() == 0) {
            LOG.warn("Coercive capacity {} yields no arrest attempts for population {}",
                    parameters.getCoerciveCapacity(), population.size());
        }
        LOG.info("Run finished at tick {} in {} ms", currentTick, (System.nanoTime() - start) / 1_000_000L);
        return metricsCollector;
    }

    /**
     * Queues an incarceration entry for rewiring in this tick's rewiring phase.
     * Must be called exactly once per entry into DETAINED or PRISON.
     *
     * @param agentId The agent that entered DETAINED or PRISON.
     */
    public void scheduleRewiring(int agentId) {
        pendingRewiring.add(agentId);
    }

    /**
     * Hands the queued incarceration entries to the caller and clears the queue.
     *
     * @return Agent ids in the order their entries occurred.
     */
    public int[] drainPendingRewiring() {
        int[] drained = pendingRewiring.toIntArray();
        pendingRewiring.clear();
        return drained;
    }

    public SimulationParameters getParameters() {
        return parameters;
    }

    public Population getPopulation() {
        return population;
    }

    public SocialNetwork getNetwork() {
        return network;
    }

    public IRandomProvider getRandomProvider() {
        return randomProvider;
    }

    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    public TickCounters getCounters() {
        return counters;
    }

    /**
     * @return Agent states as they were when the current tick started, indexed by id.
     *         Phases must not modify the returned array.
     */
    public AgentState[] getTickStartStates() {
        return tickStartStates;
    }

    /**
     * @return The tick currently executing, or the last completed tick between calls to {@link #tick()}.
     *         0 before the first tick.
     */
    public long getCurrentTick() {
        return currentTick;
    }

    /**
     * @return An unmodifiable view of the phases in execution order.
     */
    public List<ITickPhase> getPhases() {
        return phases;
    }
}
