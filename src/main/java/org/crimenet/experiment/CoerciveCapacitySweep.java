package org.crimenet.experiment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.crimenet.runtime.Simulation;
import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.metrics.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs independent replicates over a range of coercive capacities.
 * <p>
 * Replicate {@code r} of every point uses seed {@code baseSeed + r}, so points differ only in
 * the swept parameter. Each replicate is its own {@link Simulation}; replicates may run on a
 * thread pool, while every single replicate stays on one thread. Results are returned in the
 * order of the configured capacities regardless of completion order.
 */
public class CoerciveCapacitySweep {

    private static final Logger LOG = LoggerFactory.getLogger(CoerciveCapacitySweep.class);

    private final SimulationParameters baseParameters;
    private final List<Double> coerciveCapacities;
    private final int replicates;
    private final int parallelism;

    /**
     * @param baseParameters Parameters shared by every run; seed is the base seed.
     * @param coerciveCapacities The values to sweep, in output order. Must not be empty.
     * @param replicates Runs per value. Must be at least 1.
     * @param parallelism Worker threads; 0 = auto ({@code availableProcessors}), 1 = sequential.
     */
    public CoerciveCapacitySweep(SimulationParameters baseParameters, List<Double> coerciveCapacities,
                                 int replicates, int parallelism) {
        if (coerciveCapacities.isEmpty()) {
            throw new IllegalArgumentException("At least one coercive capacity is required");
        }
        if (replicates < 1) {
            throw new IllegalArgumentException("Replicates must be >= 1, got " + replicates);
        }
        if (parallelism < 0) {
            throw new IllegalArgumentException("Parallelism must be >= 0, got " + parallelism);
        }
        this.baseParameters = baseParameters;
        this.coerciveCapacities = List.copyOf(coerciveCapacities);
        this.replicates = replicates;
        this.parallelism = parallelism == 0 ? Runtime.getRuntime().availableProcessors() : parallelism;
    }

    /**
     * Builds the parameters for every run up front, so configuration errors surface before any
     * replicate starts.
     */
    List<List<SimulationParameters>> planRuns() {
        List<List<SimulationParameters>> plan = new ArrayList<>();
        for (double capacity : coerciveCapacities) {
            List<SimulationParameters> point = new ArrayList<>();
            for (int r = 0; r < replicates; r++) {
                point.add(baseParameters.withOverrides(Map.of(
                        "policing.coercive-capacity", capacity,
                        "seed", baseParameters.getSeed() + r)));
            }
            plan.add(point);
        }
        return plan;
    }

    /**
     * Executes the sweep.
     *
     * @return One point per configured capacity, in configured order.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public List<SweepPoint> run() throws InterruptedException {
        List<List<SimulationParameters>> plan = planRuns();
        int total = coerciveCapacities.size() * replicates;
        LOG.info("Starting sweep: {} capacities x {} replicates on {} thread(s)",
                coerciveCapacities.size(), replicates, parallelism);

        AtomicInteger completed = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "sweep-worker");
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<List<Future<RunSummary>>> futures = new ArrayList<>();
            for (List<SimulationParameters> point : plan) {
                List<Future<RunSummary>> pointFutures = new ArrayList<>();
                for (SimulationParameters params : point) {
                    pointFutures.add(executor.submit(() -> {
                        RunSummary summary = RunSummary.of(Simulation.create(params).run());
                        LOG.debug("Replicate done ({}/{}): cc={} seed={} wrongfulRate={}",
                                completed.incrementAndGet(), total, params.getCoerciveCapacity(),
                                params.getSeed(), summary.wrongfulDetentionRate());
                        return summary;
                    }));
                }
                futures.add(pointFutures);
            }

            List<SweepPoint> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                List<RunSummary> summaries = new ArrayList<>();
                for (Future<RunSummary> future : futures.get(i)) {
                    summaries.add(await(future));
                }
                results.add(new SweepPoint(coerciveCapacities.get(i), summaries));
            }
            LOG.info("Sweep finished: {} runs", total);
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static RunSummary await(Future<RunSummary> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Sweep replicate failed", cause);
        }
    }
}
