package org.crimenet.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.crimenet.cli.CommandLineInterface;
import org.crimenet.datapipeline.SweepCsvWriter;
import org.crimenet.experiment.CoerciveCapacitySweep;
import org.crimenet.experiment.SweepPoint;
import org.crimenet.runtime.InvalidConfigurationException;
import org.crimenet.runtime.SimulationParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Sweeps the coercive capacity and reports the wrongful-detention rate per value.
 * <p>
 * Defaults come from the {@code crimenet.sweep} block; every option overrides its setting.
 */
@Command(
    name = "sweep",
    description = "Run replicates over a range of coercive capacities and summarize them"
)
public class SweepCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SweepCommand.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    @Option(
        names = {"--coercive"},
        split = ",",
        paramLabel = "CC",
        description = "Comma-separated coercive capacities (default: crimenet.sweep.coercive-capacities)"
    )
    private List<Double> coerciveCapacities;

    @Option(names = {"-r", "--replicates"}, description = "Replicates per value (default: crimenet.sweep.replicates)")
    private Integer replicates;

    @Option(names = {"-p", "--parallelism"}, description = "Worker threads, 0 = all cores (default: crimenet.sweep.parallelism)")
    private Integer parallelism;

    @Option(names = {"--seed"}, description = "Base seed; replicate r uses seed + r")
    private Long seed;

    @Option(names = {"--days"}, description = "Number of days per replicate")
    private Integer days;

    @Option(names = {"-o", "--output-dir"}, description = "Directory for the sweep CSV (default: crimenet.output.directory)")
    private Path outputDirectory;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Config config = parent.getConfig();

        List<SweepPoint> points;
        try {
            SimulationParameters base = SimulationParameters.fromApplicationConfig(config);
            if (seed != null) {
                base = base.withOverrides(Map.of("seed", seed));
            }
            if (days != null) {
                base = base.withOverrides(Map.of("horizon-days", days));
            }
            CoerciveCapacitySweep sweep = new CoerciveCapacitySweep(
                base,
                coerciveCapacities != null ? coerciveCapacities : config.getDoubleList("crimenet.sweep.coercive-capacities"),
                replicates != null ? replicates : config.getInt("crimenet.sweep.replicates"),
                parallelism != null ? parallelism : config.getInt("crimenet.sweep.parallelism"));
            points = sweep.run();
        } catch (InvalidConfigurationException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Sweep interrupted");
            return 1;
        }

        Path directory = outputDirectory != null
            ? outputDirectory
            : Path.of(config.getString("crimenet.output.directory"));
        Path file = directory.resolve("sweep-" + TIMESTAMP.format(LocalDateTime.now()) + ".csv");
        try {
            new SweepCsvWriter().write(file, points);
            log.info("Saved {}", file.toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to write sweep results to {}", file.toAbsolutePath(), e);
            err.println("Error: could not write sweep results: " + e.getMessage());
            return 1;
        }

        out.println("coercive_capacity  replicates  arrests  wrongful_rate  mean_criminal_share");
        for (SweepPoint point : points) {
            out.printf("%17.4f  %10d  %7d  %13.4f  %19.4f%n",
                point.coerciveCapacity(), point.replicates().size(), point.totalArrests(),
                point.pooledWrongfulDetentionRate(), point.meanCriminalShare());
        }
        out.println("wrote " + file);
        out.flush();
        return 0;
    }
}
