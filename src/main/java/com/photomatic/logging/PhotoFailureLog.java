package com.photomatic.logging;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Appends ingest and export failures to a CSV file so a session's skipped photos can be
 * reviewed after the window is closed.
 */
public final class PhotoFailureLog {

    private static final Logger LOGGER = AppLogger.get();
    private static final String HEADER = "timestamp,stage,source,exception_type,message";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    public enum Stage {
        INGEST,
        EXPORT
    }

    private final Path logFile;
    private final Object lock = new Object();

    public PhotoFailureLog(Path logFile) {
        this.logFile = Objects.requireNonNull(logFile, "logFile");
    }

    public Path logFile() {
        return logFile;
    }

    public void logFailure(Stage stage, String sourceName, Exception exception) {
        append(FailureRow.of(Instant.now(), stage, sourceName, exception));
    }

    private void append(FailureRow row) {
        synchronized (lock) {
            try {
                Path parent = logFile.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                String text = Files.exists(logFile)
                    ? row.toCsvLine() + System.lineSeparator()
                    : HEADER + System.lineSeparator() + row.toCsvLine() + System.lineSeparator();
                Files.writeString(logFile, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Failed to write photo failure log " + logFile, e);
            }
        }
    }

    /**
     * Quotes a field when it holds a separator, quote or line break. Embedded quotes are doubled.
     */
    static String csvField(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String doubled = value.replace("\"", "\"\"");
        return value.chars().anyMatch(c -> c == ',' || c == '"' || c == '\n' || c == '\r')
            ? '"' + doubled + '"'
            : doubled;
    }

    /** One skipped or unsaved photo. */
    record FailureRow(String timestamp, Stage stage, String source, String exceptionType, String message) {

        static FailureRow of(Instant when, Stage stage, String source, Exception exception) {
            return new FailureRow(
                TIMESTAMP_FORMAT.format(when),
                stage,
                source,
                exception == null ? null : exception.getClass().getName(),
                exception == null ? null : exception.getMessage());
        }

        String toCsvLine() {
            return Stream.of(timestamp, stage == null ? null : stage.name(), source, exceptionType, message)
                .map(PhotoFailureLog::csvField)
                .collect(Collectors.joining(","));
        }
    }
}
