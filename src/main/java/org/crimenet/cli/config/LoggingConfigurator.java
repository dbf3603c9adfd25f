package org.crimenet.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies per-logger levels from the {@code logging.levels} block, e.g.
 * <pre>
 * logging.levels {
 *   "org.crimenet" = INFO
 *   "org.crimenet.runtime.phases" = DEBUG
 * }
 * </pre>
 * Logger names containing dots must be quoted in HOCON. The special name {@code ROOT} targets
 * the root logger.
 */
public final class LoggingConfigurator {

    static final String LEVELS_PATH = "logging.levels";

    private LoggingConfigurator() {
    }

    /**
     * @param config The application configuration. Nothing happens without a {@code logging.levels} block.
     * @throws IllegalArgumentException if a level name is not a logback level.
     */
    public static void configure(Config config) {
        if (!config.hasPath(LEVELS_PATH)) {
            return;
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        for (Map.Entry<String, ConfigValue> entry : config.getObject(LEVELS_PATH).entrySet()) {
            String levelName = String.valueOf(entry.getValue().unwrapped()).trim();
            Level level = Level.toLevel(levelName, null);
            if (level == null) {
                throw new IllegalArgumentException(
                        "Unknown log level '" + levelName + "' for logger '" + entry.getKey() + "'");
            }
            String loggerName = "ROOT".equalsIgnoreCase(entry.getKey())
                    ? org.slf4j.Logger.ROOT_LOGGER_NAME
                    : entry.getKey();
            Logger logger = context.getLogger(loggerName);
            logger.setLevel(level);
        }
    }
}
