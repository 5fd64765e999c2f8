package com.photomatic.core.ingest;

import com.photomatic.core.metadata.ExifMetadataDecoder;
import com.photomatic.core.model.PhotoRecord;
import com.photomatic.core.model.PhotoSource;
import com.photomatic.testing.TestPhotos;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchIngestionPipelineTest {

    private final List<ExecutorService> executors = new ArrayList<>();

    @AfterEach
    void shutdown() {
        executors.forEach(ExecutorService::shutdownNow);
    }

    @Test
    void skipsBrokenFilesAndKeepsSubmissionOrder() {
        List<String> events = new ArrayList<>();
        BatchIngestionPipeline pipeline = new BatchIngestionPipeline(ingestor(), Runnable::run, Runnable::run);

        CompletableFuture<BatchResult> future = pipeline.submit(
            List.of(TestPhotos.jpegSource("a.jpg", 60, 40),
                TestPhotos.brokenSource("b.jpg"),
                TestPhotos.jpegSource("c.jpg", 40, 60)),
            record -> events.add("record " + record.getName()),
            failure -> events.add("failure " + failure.sourceName()));

        BatchResult result = future.join();
        assertEquals(List.of("record a.jpg", "failure b.jpg", "record c.jpg"), events);
        assertEquals(List.of("a.jpg", "c.jpg"), names(result.records()));
        assertEquals(1, result.failures().size());
        assertEquals("b.jpg", result.failures().get(0).sourceName());
        assertEquals(3, result.submitted());
    }

    @Test
    void deliversInOrderAcrossThreads() throws Exception {
        ExecutorService worker = track(Executors.newSingleThreadExecutor());
        ExecutorService publisher = track(Executors.newSingleThreadExecutor());
        List<String> published = Collections.synchronizedList(new ArrayList<>());
        List<PhotoSource> sources = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            sources.add(TestPhotos.jpegSource("photo" + i + ".jpg", 30 + i * 10, 40));
        }

        BatchResult result = new BatchIngestionPipeline(ingestor(), worker, publisher)
            .submit(sources, record -> published.add(record.getName()), failure -> published.add("!"))
            .get(30, TimeUnit.SECONDS);

        List<String> expected = sources.stream().map(PhotoSource::name).collect(Collectors.toList());
        assertEquals(expected, published, "Records must be published in submission order");
        assertEquals(expected, names(result.records()));
        assertTrue(result.failures().isEmpty());
    }

    @Test
    void unexpectedDecoderExceptionSkipsOnlyThatFile() {
        ImageIoRasterDecoder imageIo = new ImageIoRasterDecoder();
        PhotoIngestor flaky = new PhotoIngestor(new ExifMetadataDecoder(),
            (name, bytes) -> {
                if (name.equals("a.jpg")) {
                    throw new IllegalStateException("decoder crashed");
                }
                return imageIo.decode(name, bytes);
            },
            TestPhotos.SMALL_LAYOUT);
        List<String> events = new ArrayList<>();
        BatchIngestionPipeline pipeline = new BatchIngestionPipeline(flaky, Runnable::run, Runnable::run);

        BatchResult result = pipeline.submit(
            List.of(TestPhotos.jpegSource("a.jpg", 60, 40),
                TestPhotos.jpegSource("b.jpg", 60, 40),
                TestPhotos.jpegSource("c.jpg", 40, 60)),
            record -> events.add("record " + record.getName()),
            failure -> events.add("failure " + failure.sourceName())).join();

        assertEquals(List.of("failure a.jpg", "record b.jpg", "record c.jpg"), events);
        assertEquals(List.of("b.jpg", "c.jpg"), names(result.records()));
        IngestFailure failure = result.failures().get(0);
        assertInstanceOf(IllegalStateException.class, failure.cause().getCause());
        assertTrue(failure.cause().getMessage().contains("decoder crashed"), failure.cause().getMessage());
    }

    @Test
    void errorDuringDecodeStillCompletesTheBatch() throws Exception {
        ExecutorService worker = track(Executors.newSingleThreadExecutor());
        PhotoIngestor outOfMemory = new PhotoIngestor(new ExifMetadataDecoder(),
            (name, bytes) -> {
                throw new OutOfMemoryError("Java heap space");
            },
            TestPhotos.SMALL_LAYOUT);

        CompletableFuture<BatchResult> future = new BatchIngestionPipeline(outOfMemory, worker, Runnable::run)
            .submit(List.of(TestPhotos.jpegSource("huge.jpg", 60, 40)), record -> { }, failure -> { });

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(30, TimeUnit.SECONDS));
        assertInstanceOf(OutOfMemoryError.class, e.getCause());
    }

    private static PhotoIngestor ingestor() {
        return new PhotoIngestor(new ExifMetadataDecoder(), new ImageIoRasterDecoder(), TestPhotos.SMALL_LAYOUT);
    }

    private ExecutorService track(ExecutorService executor) {
        executors.add(executor);
        return executor;
    }

    private static List<String> names(List<PhotoRecord> records) {
        return records.stream().map(PhotoRecord::getName).collect(Collectors.toList());
    }
}
