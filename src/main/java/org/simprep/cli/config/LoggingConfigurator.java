package org.simprep.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Applies the {@code logging} section of the configuration to Logback at runtime.
 * <p>
 * {@code logging.levels} maps logger names to levels, e.g.
 * {@code logging.levels { "org.simprep.pipeline.engines" = DEBUG }} to see generated engine
 * inputs. With {@code logging.file = true} a run also writes {@code simprep.log} to its
 * working directory.
 */
public final class LoggingConfigurator {

    static final String FILE_APPENDER = "SIMPREP_FILE";
    static final String LOG_FILE_NAME = "simprep.log";
    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    private LoggingConfigurator() {
    }

    /**
     * Sets the configured logger levels.
     *
     * @param config the resolved application configuration
     */
    public static void configure(Config config) {
        if (!config.hasPath("logging.levels")) {
            return;
        }
        Config levels = config.getConfig("logging.levels");
        levels.root().keySet().forEach(name -> {
            ch.qos.logback.classic.Logger logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(name);
            logger.setLevel(Level.toLevel(levels.getString("\"" + name + "\""), Level.INFO));
        });
    }

    /**
     * Adds a file appender writing {@code simprep.log} in the working directory if the
     * configuration enables it. Calling it twice does not add a second appender.
     *
     * @param config the resolved application configuration
     * @param workDir directory of the run
     * @return the log file, or null if file logging is off
     */
    public static Path attachRunLog(Config config, Path workDir) {
        if (!config.hasPath("logging.file") || !config.getBoolean("logging.file")) {
            return null;
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        Path logFile = workDir.resolve(LOG_FILE_NAME);
        if (root.getAppender(FILE_APPENDER) != null) {
            return logFile;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName(FILE_APPENDER);
        appender.setFile(logFile.toString());
        appender.setEncoder(encoder);
        appender.start();
        root.addAppender(appender);
        return logFile;
    }
}
