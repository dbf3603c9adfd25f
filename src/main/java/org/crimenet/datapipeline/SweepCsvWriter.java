package org.crimenet.datapipeline;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.crimenet.experiment.SweepPoint;

/**
 * Writes one CSV row per sweep point.
 */
public class SweepCsvWriter {

    static final String HEADER = "coercive_capacity,replicates,arrests,wrongful_detentions,"
            + "wrongful_detention_rate,mean_criminal_share,mean_prison_share";

    /**
     * @param file Target path; parent directories are created if needed.
     * @param points Sweep results in output order.
     * @throws IOException if the file cannot be written.
     */
    public void write(Path file, List<SweepPoint> points) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.write('\n');
            for (SweepPoint point : points) {
                writer.write(String.format(Locale.ROOT, "%s,%d,%d,%d,%.6f,%.6f,%.6f",
                        point.coerciveCapacity(),
                        point.replicates().size(),
                        point.totalArrests(),
                        point.totalWrongfulDetentions(),
                        point.pooledWrongfulDetentionRate(),
                        point.meanCriminalShare(),
                        point.meanPrisonShare()));
                writer.write('\n');
            }
        }
    }
}
