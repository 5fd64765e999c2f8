package com.photomatic.logging;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhotoFailureLogTest {

    @TempDir
    Path tempDir;

    @Test
    void writesHeaderOnceThenOneRowPerFailure() throws IOException {
        Path csv = tempDir.resolve("logs").resolve("failures.csv");
        PhotoFailureLog log = new PhotoFailureLog(csv);

        log.logFailure(PhotoFailureLog.Stage.INGEST, "a.jpg", new IOException("truncated"));
        log.logFailure(PhotoFailureLog.Stage.EXPORT, "b.jpg", new IllegalStateException("no space"));

        List<String> lines = Files.readAllLines(csv);
        assertEquals(3, lines.size());
        assertEquals("timestamp,stage,source,exception_type,message", lines.get(0));
        assertTrue(lines.get(1).endsWith(",INGEST,a.jpg,java.io.IOException,truncated"), lines.get(1));
        assertTrue(lines.get(2).endsWith(",EXPORT,b.jpg,java.lang.IllegalStateException,no space"), lines.get(2));
    }

    @Test
    void quotesFieldsWithSeparators() {
        assertEquals("plain.jpg", PhotoFailureLog.csvField("plain.jpg"));
        assertEquals("\"my, photo.jpg\"", PhotoFailureLog.csvField("my, photo.jpg"));
        assertEquals("\"say \"\"cheese\"\"\"", PhotoFailureLog.csvField("say \"cheese\""));
        assertEquals("\"line\nbreak\"", PhotoFailureLog.csvField("line\nbreak"));
        assertEquals("", PhotoFailureLog.csvField(null));
    }

    @Test
    void rowListsColumnsInHeaderOrder() {
        PhotoFailureLog.FailureRow row = new PhotoFailureLog.FailureRow(
            "2024-05-01 10:00:00", PhotoFailureLog.Stage.EXPORT, "beach, sunset.jpg", "java.io.IOException", null);

        assertEquals("2024-05-01 10:00:00,EXPORT,\"beach, sunset.jpg\",java.io.IOException,", row.toCsvLine());
    }

    @Test
    void missingExceptionLeavesColumnsEmpty() throws IOException {
        Path csv = tempDir.resolve("failures.csv");

        new PhotoFailureLog(csv).logFailure(PhotoFailureLog.Stage.INGEST, null, null);

        assertTrue(Files.readAllLines(csv).get(1).endsWith(",INGEST,,,"));
    }
}
