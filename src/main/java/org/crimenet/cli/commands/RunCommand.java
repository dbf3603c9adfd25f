package org.crimenet.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.crimenet.cli.CommandLineInterface;
import org.crimenet.datapipeline.RunArtifacts;
import org.crimenet.runtime.InvalidConfigurationException;
import org.crimenet.runtime.Simulation;
import org.crimenet.runtime.SimulationParameters;
import org.crimenet.runtime.metrics.MetricsCollector;
import org.crimenet.runtime.metrics.ProgressLogListener;
import org.crimenet.runtime.metrics.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs a single replicate and writes its CSV, parameter and summary files.
 */
@Command(
    name = "run",
    description = "Run one simulation replicate and save its metrics"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"--seed"}, description = "Root random seed (overrides crimenet.simulation.seed)")
    private Long seed;

    @Option(names = {"--days"}, description = "Number of days to simulate (overrides crimenet.simulation.horizon-days)")
    private Integer days;

    @Option(names = {"-o", "--output-dir"}, description = "Directory for result files (default: crimenet.output.directory)")
    private Path outputDirectory;

    @Option(names = {"--no-summary"}, description = "Do not write the JSON run summary")
    private boolean noSummary;

    @Option(
        names = {"--set"},
        paramLabel = "KEY=VALUE",
        description = "Override a simulation setting, relative to crimenet.simulation (repeatable), "
            + "e.g. --set policing.forensic-capacity=0.9"
    )
    private Map<String, String> settings = new LinkedHashMap<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Config config = parent.getConfig();
        SimulationParameters params;
        try {
            params = SimulationParameters.fromApplicationConfig(config).withOverrides(collectOverrides());
        } catch (InvalidConfigurationException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }

        LocalDateTime startedAt = LocalDateTime.now();
        Simulation simulation = Simulation.create(params);
        int progressInterval = config.getInt("crimenet.output.progress-interval-days");
        if (progressInterval > 0) {
            simulation.getMetricsCollector().addListener(
                new ProgressLogListener(progressInterval, params.getHorizonDays()));
        }
        MetricsCollector series = simulation.run();
        RunSummary summary = RunSummary.of(series);

        Path directory = outputDirectory != null
            ? outputDirectory
            : Path.of(config.getString("crimenet.output.directory"));
        boolean writeSummary = !noSummary && config.getBoolean("crimenet.output.write-summary");
        List<Path> written;
        try {
            written = new RunArtifacts(directory).write(
                RunArtifacts.fileStem(params, startedAt), params, series, writeSummary);
        } catch (IOException e) {
            log.error("Failed to write results to {}", directory.toAbsolutePath(), e);
            err.println("Error: could not write results: " + e.getMessage());
            return 1;
        }

        out.printf("Simulated %d days with %d agents (seed %d)%n",
            summary.ticks(), params.getPopulationSize(), params.getSeed());
        out.printf("  arrests: %d, wrongful: %d (rate %.4f), convictions: %d%n",
            summary.arrests(), summary.wrongfulDetentions(), summary.wrongfulDetentionRate(), summary.convictions());
        out.printf("  final shares: criminal %.4f, detained %.4f, prison %.4f%n",
            summary.finalCriminalShare(), summary.finalDetainedShare(), summary.finalPrisonShare());
        for (Path path : written) {
            out.println("  wrote " + path);
        }
        out.flush();
        return 0;
    }

    private Map<String, Object> collectOverrides() {
        Map<String, Object> overrides = new HashMap<>(settings);
        if (seed != null) {
            overrides.put("seed", seed);
        }
        if (days != null) {
            overrides.put("horizon-days", days);
        }
        return overrides;
    }
}
