package org.crimenet.experiment;

import java.util.List;

import org.crimenet.runtime.metrics.RunSummary;

/**
 * Aggregated replicates of one parameter point of a sweep.
 *
 * @param coerciveCapacity The coercive capacity of this point.
 * @param replicates The per-replicate summaries, in seed order.
 */
public record SweepPoint(double coerciveCapacity, List<RunSummary> replicates) {

    public SweepPoint {
        replicates = List.copyOf(replicates);
    }

    public long totalArrests() {
        return replicates.stream().mapToLong(RunSummary::arrests).sum();
    }

    public long totalWrongfulDetentions() {
        return replicates.stream().mapToLong(RunSummary::wrongfulDetentions).sum();
    }

    /**
     * @return Wrongful arrests over arrests, pooled across replicates (0 without arrests).
     */
    public double pooledWrongfulDetentionRate() {
        long arrests = totalArrests();
        return arrests == 0 ? 0.0 : (double) totalWrongfulDetentions() / arrests;
    }

    public double meanCriminalShare() {
        return replicates.stream().mapToDouble(RunSummary::meanCriminalShare).average().orElse(0.0);
    }

    public double meanPrisonShare() {
        return replicates.stream().mapToDouble(RunSummary::meanPrisonShare).average().orElse(0.0);
    }
}
