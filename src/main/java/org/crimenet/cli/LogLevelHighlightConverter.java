package org.crimenet.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the wrapped pattern by log level for the {@code STDOUT} appender.
 * <p>
 * ERROR red, WARN yellow, INFO green, DEBUG cyan; TRACE is left uncolored.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String color = colorFor(event.getLevel());
        return color == null ? in : color + in + RESET;
    }

    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> "\u001B[31m";
            case Level.WARN_INT -> "\u001B[33m";
            case Level.INFO_INT -> "\u001B[32m";
            case Level.DEBUG_INT -> "\u001B[36m";
            default -> null;
        };
    }
}
