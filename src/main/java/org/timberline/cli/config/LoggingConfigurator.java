package org.timberline.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

/**
 * Applies per-logger levels from {@code logging.levels}, e.g.
 * <pre>
 * logging.levels {
 *   "org.timberline" = INFO
 *   "org.timberline.pipeline.tiling" = DEBUG
 * }
 * </pre>
 * Logger names contain dots, so they must be quoted in HOCON.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath("logging.levels")) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.levels").root().entrySet()) {
            String loggerName = entry.getKey();
            String levelName = String.valueOf(entry.getValue().unwrapped());
            Logger logger = "ROOT".equalsIgnoreCase(loggerName)
                ? context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                : context.getLogger(loggerName);
            logger.setLevel(Level.toLevel(levelName, Level.INFO));
        }
    }
}
