package org.crimenet.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;

@Tag("unit")
class CommandLineInterfaceTest {

    @Test
    void registersAllSubcommands() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getCommandName()).isEqualTo("crimenet");
        assertThat(cmdLine.getSubcommands()).containsKeys("run", "sweep", "help");
    }

    @Test
    void versionOption() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("crimenet");
    }

    @Test
    void levelColorsOnlyForVisibleLevels() {
        assertThat(LogLevelHighlightConverter.colorFor(Level.ERROR)).isNotNull();
        assertThat(LogLevelHighlightConverter.colorFor(Level.INFO)).isNotEqualTo(LogLevelHighlightConverter.colorFor(Level.WARN));
        assertThat(LogLevelHighlightConverter.colorFor(Level.TRACE)).isNull();
    }
}
