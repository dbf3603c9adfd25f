package org.crimenet.datapipeline;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.crimenet.runtime.metrics.TickMetrics;
import org.crimenet.runtime.model.AgentState;

/**
 * Writes a metrics series as CSV, one row per simulated day.
 * <p>
 * Columns: {@code day}, the event counts of {@link TickMetrics}, the state counts and the state
 * shares (six decimals, locale-independent).
 */
public class MetricsCsvWriter {

    static final List<String> HEADER = List.of(
            "day",
            "crime_events",
            "arrests",
            "wrongful_detentions",
            "convictions",
            "detention_releases",
            "prison_releases",
            "rewiring_events",
            "edges_removed",
            "edges_added",
            "sentences_shortened",
            "lawful",
            "at_risk",
            "criminal",
            "detained",
            "prison",
            "share_lawful",
            "share_at_risk",
            "share_criminal",
            "share_detained",
            "share_prison");

    /**
     * Writes the series to a file, replacing any existing content.
     *
     * @param file Target path; parent directories must exist.
     * @param series Records in tick order.
     * @throws IOException if the file cannot be written.
     */
    public void write(Path file, Iterable<TickMetrics> series) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(writer, series);
        }
    }

    /**
     * Writes the series to an open writer. The writer is not closed.
     */
    public void write(Writer writer, Iterable<TickMetrics> series) throws IOException {
        writer.write(String.join(",", HEADER));
        writer.write('\n');
        for (TickMetrics m : series) {
            writer.write(formatRow(m));
            writer.write('\n');
        }
        writer.flush();
    }

    static String formatRow(TickMetrics m) {
        StringBuilder row = new StringBuilder(160);
        row.append(m.tick())
                .append(',').append(m.crimeEvents())
                .append(',').append(m.arrests())
                .append(',').append(m.wrongfulDetentions())
                .append(',').append(m.convictions())
                .append(',').append(m.detentionReleases())
                .append(',').append(m.prisonReleases())
                .append(',').append(m.rewiringEvents())
                .append(',').append(m.edgesRemoved())
                .append(',').append(m.edgesAdded())
                .append(',').append(m.sentencesShortened());
        for (AgentState state : AgentState.values()) {
            row.append(',').append(m.count(state));
        }
        for (AgentState state : AgentState.values()) {
            row.append(',').append(String.format(Locale.ROOT, "%.6f", m.share(state)));
        }
        return row.toString();
    }
}
