package io.jsonsift.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code logging.level} from the CLI configuration to the Logback root logger. Appenders
 * come from {@code logback.xml}, which writes to standard error so that query results on standard
 * output stay clean.
 */
public final class LogbackConfigurator {

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Sets the root level; unknown names fall back to WARN.
     *
     * @param level TRACE, DEBUG, INFO, WARN, ERROR or OFF
     */
    public static void configure(String level) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
            return;
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(Level.toLevel(level, Level.WARN));
    }
}
