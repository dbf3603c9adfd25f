package org.crimenet.runtime.metrics;

import java.util.Locale;

import org.crimenet.runtime.model.AgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs a one-line progress report every {@code intervalDays} recorded days.
 */
public class ProgressLogListener implements ITickMetricsListener {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressLogListener.class);

    private final int intervalDays;
    private final long totalDays;
    private long daysSeen;
    private long arrests;

    /**
     * @param intervalDays Days between reports. Must be positive.
     * @param totalDays Planned length of the run, used in the report only.
     */
    public ProgressLogListener(int intervalDays, long totalDays) {
        if (intervalDays < 1) {
            throw new IllegalArgumentException("Progress interval must be >= 1 day, got " + intervalDays);
        }
        this.intervalDays = intervalDays;
        this.totalDays = totalDays;
    }

    @Override
    public void onTick(TickMetrics metrics) {
        daysSeen++;
        arrests += metrics.arrests();
        if (daysSeen % intervalDays == 0) {
            LOG.info("Day {}/{}: criminal {}, prison {}, arrests so far {}",
                    daysSeen, totalDays,
                    String.format(Locale.ROOT, "%.3f", metrics.share(AgentState.CRIMINAL)),
                    String.format(Locale.ROOT, "%.3f", metrics.share(AgentState.PRISON)),
                    arrests);
        }
    }

    long getDaysSeen() {
        return daysSeen;
    }
}
