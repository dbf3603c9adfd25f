package org.crimenet.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.crimenet.cli.commands.RunCommand;
import org.crimenet.cli.commands.SweepCommand;
import org.crimenet.cli.config.ConfigLoader;
import org.crimenet.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "crimenet",
    mixinStandardHelpOptions = true,
    version = "crimenet 0.2.0",
    description = "crimenet - agent-based simulation of crime, policing and incarceration on a social network",
    subcommands = {
        RunCommand.class,
        SweepCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Any setting can be overridden with a system property, e.g.",
        "  java -Dcrimenet.simulation.policing.forensic-capacity=0.9 -jar crimenet.jar run"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String LOGGING_FORMAT_PROPERTY = "crimenet.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: config/crimenet.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line used by {@link #main(String[])}; tests use it to run commands in-process.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("crimenet");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved application configuration.
     * @throws IllegalArgumentException if {@code --config} names a missing file.
     * @throws ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        Config loaded = ConfigLoader.resolve(configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });

        if (loaded.hasPath("logging.format")) {
            String format = loaded.getString("logging.format");
            System.setProperty(LOGGING_FORMAT_PROPERTY, "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(loaded);

        config = loaded;
        return config;
    }

    private static void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure logging: " + e.getMessage());
        }
    }
}
