package org.crimenet.datapipeline;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.metrics.RunSummary;
import org.crimenet.runtime.metrics.TickMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.ConfigRenderOptions;

/**
 * Writes the files produced by a single run into an output directory.
 * <p>
 * All files share a stem that encodes the timestamp and the key parameters, e.g.
 * {@code 20260101-120000__n500__m3__fc0p7__cc0p03__det30__evw30}:
 * <ul>
 *   <li>{@code <stem>.csv} - the metrics series ({@link MetricsCsvWriter})</li>
 *   <li>{@code <stem>.conf} - the exact simulation parameters, as HOCON</li>
 *   <li>{@code <stem>.json} - the {@link RunSummary} (optional)</li>
 * </ul>
 */
public class RunArtifacts {

    private static final Logger LOG = LoggerFactory.getLogger(RunArtifacts.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Path outputDirectory;
    private final MetricsCsvWriter csvWriter = new MetricsCsvWriter();
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public RunArtifacts(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /**
     * Builds the file stem for a run.
     *
     * @param params The run's parameters.
     * @param timestamp The run's start time.
     * @return The stem, without extension.
     */
    public static String fileStem(SimulationParameters params, LocalDateTime timestamp) {
        return String.join("__",
                TIMESTAMP.format(timestamp),
                "n" + params.getPopulationSize(),
                "m" + params.getAttachmentCount(),
                "fc" + filenameDecimal(params.getForensicCapacity()),
                "cc" + filenameDecimal(params.getCoerciveCapacity()),
                "det" + (int) params.getDetentionMeanDays(),
                "evw" + params.getEvidenceWindowDays());
    }

    /**
     * Renders a decimal for use in a file name: three decimals at most, trailing zeros
     * stripped, point replaced by {@code p} ({@code 0.55 -> 0p55}, {@code 1.0 -> 1}).
     */
    public static String filenameDecimal(double value) {
        String s = String.format(Locale.ROOT, "%.3f", value);
        if (s.indexOf('.') >= 0) {
            s = s.replaceAll("0+$", "");
            if (s.endsWith(".")) {
                s = s.substring(0, s.length() - 1);
            }
        }
        return s.replace('.', 'p');
    }

    /**
     * Writes all artifacts of a run.
     *
     * @param stem File stem from {@link #fileStem(SimulationParameters, LocalDateTime)}.
     * @param params The run's parameters.
     * @param series The metrics series.
     * @param writeSummary Whether to write the JSON summary.
     * @return The paths written, CSV first.
     * @throws IOException if the directory or a file cannot be written.
     */
    public List<Path> write(String stem, SimulationParameters params, Iterable<TickMetrics> series,
                            boolean writeSummary) throws IOException {
        Files.createDirectories(outputDirectory);
        List<Path> written = new ArrayList<>();

        Path csv = outputDirectory.resolve(stem + ".csv");
        csvWriter.write(csv, series);
        written.add(csv);

        Path conf = outputDirectory.resolve(stem + ".conf");
        Files.writeString(conf, renderParameters(params), StandardCharsets.UTF_8);
        written.add(conf);

        if (writeSummary) {
            Path json = outputDirectory.resolve(stem + ".json");
            try (Writer writer = Files.newBufferedWriter(json, StandardCharsets.UTF_8)) {
                gson.toJson(RunSummary.of(series), writer);
            }
            written.add(json);
        }

        for (Path path : written) {
            LOG.info("Saved {}", path.toAbsolutePath());
        }
        return written;
    }

    /**
     * @return The parameters as a HOCON document rooted at {@value SimulationParameters#CONFIG_PATH},
     *         suitable for passing back via {@code --config}.
     */
    public static String renderParameters(SimulationParameters params) {
        return params.toConfig()
                .atPath(SimulationParameters.CONFIG_PATH)
                .root()
                .render(ConfigRenderOptions.defaults().setOriginComments(false).setJson(false));
    }
}
