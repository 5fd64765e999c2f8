package com.photomatic.logging;

import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Shared JUL logger for the compositing engine and the desktop shell.
 */
public final class AppLogger {
    private static final String LOGGER_NAME = "com.photomatic.Photomatic";
    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
                if (record.getThrown() == null) {
                    return line;
                }
                Throwable thrown = record.getThrown();
                return line + "    %s: %s%n".formatted(thrown.getClass().getName(), thrown.getMessage());
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.out, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (Exception ignored) {
            // platform default encoding stays in place
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(resolveLevel());
        return logger;
    }

    private static Level resolveLevel() {
        String configured = System.getProperty("photomatic.logLevel");
        if (configured == null || configured.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(configured.trim());
        } catch (IllegalArgumentException ex) {
            return Level.INFO;
        }
    }
}
