package com.prettyprinter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.*;

/**
 * Configures java.util.logging for the printer and hands out loggers.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;
    private static final Path LOG_FILE = Paths.get("prettyprinter.log");

    /**
     * Initializes the logging system from the bundled configuration, or with console and
     * file handlers when that is missing.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                if (is != null) {
                    LogManager.getLogManager().readConfiguration(is);
                    initialized = true;
                    return;
                }
            }

            configureBasicLogging();
            initialized = true;
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            initialized = true;
        }
    }

    private static void configureBasicLogging() throws IOException {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());

        FileHandler fileHandler = new FileHandler(LOG_FILE.toString(), true);
        fileHandler.setLevel(Level.ALL);
        fileHandler.setFormatter(new SimpleFormatter());

        rootLogger.addHandler(consoleHandler);
        rootLogger.addHandler(fileHandler);
        rootLogger.setLevel(Level.ALL);
    }

    /**
     * Sets the console logging level.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;

        if (initialized) {
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    handler.setLevel(level);
                }
            }
            Logger.getLogger("com.prettyprinter").setLevel(level);
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Closes all handlers of the root logger.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
        }
    }
}
