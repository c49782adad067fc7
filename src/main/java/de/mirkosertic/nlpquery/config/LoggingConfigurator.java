package de.mirkosertic.nlpquery.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.jspecify.annotations.Nullable;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Switches the pipeline's log level at runtime.
 * <p>
 * Debug mode raises the {@code de.mirkosertic.nlpquery} logger to DEBUG. Leaving debug mode
 * restores the level that was configured before, which may be inherited from the root logger.
 */
public final class LoggingConfigurator {

    static final String BASE_LOGGER = "de.mirkosertic.nlpquery";

    private static boolean debugActive;
    private static @Nullable Level previousLevel;

    private LoggingConfigurator() {
    }

    /**
     * Enter or leave debug mode. Does nothing when the SLF4J backend is not Logback.
     */
    public static synchronized void applyDebugMode(final boolean debug) {
        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            LoggerFactory.getLogger(LoggingConfigurator.class)
                    .warn("Debug mode needs Logback, found {}", factory.getClass().getName());
            return;
        }
        final ch.qos.logback.classic.Logger logger = ((LoggerContext) factory).getLogger(BASE_LOGGER);

        if (debug && !debugActive) {
            previousLevel = logger.getLevel();
            logger.setLevel(Level.DEBUG);
            debugActive = true;
            logger.info("Debug mode enabled");
        } else if (!debug && debugActive) {
            logger.setLevel(previousLevel);
            debugActive = false;
            logger.info("Debug mode disabled");
        }
    }

    public static synchronized boolean isDebugActive() {
        return debugActive;
    }
}
