package com.photomatic.core.ingest;

import com.photomatic.core.model.PhotoRecord;
import com.photomatic.core.model.PhotoSource;
import com.photomatic.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ingests a batch of files one after another on a worker executor and hands every record to
 * the owning thread in submission order.
 * <p>
 * File N+1 is not read before file N has been ingested or has failed. Records and the final
 * {@link BatchResult} are delivered through the publisher executor, which must run tasks in
 * the order they were submitted (the Swing event queue does).
 */
public final class BatchIngestionPipeline {

    private static final Logger LOGGER = AppLogger.get();

    private final PhotoIngestor ingestor;
    private final Executor worker;
    private final Executor publisher;

    public BatchIngestionPipeline(PhotoIngestor ingestor, Executor worker, Executor publisher) {
        this.ingestor = Objects.requireNonNull(ingestor, "ingestor");
        this.worker = Objects.requireNonNull(worker, "worker");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * @param onRecord called on the publisher executor for every successfully ingested photo
     * @param onFailure called on the publisher executor for every skipped file
     */
    public CompletableFuture<BatchResult> submit(List<PhotoSource> sources,
                                                 Consumer<PhotoRecord> onRecord,
                                                 Consumer<IngestFailure> onFailure) {
        List<PhotoSource> batch = List.copyOf(sources);
        CompletableFuture<BatchResult> result = new CompletableFuture<>();
        try {
            worker.execute(() -> runBatch(batch, onRecord, onFailure, result));
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    private void runBatch(List<PhotoSource> batch,
                          Consumer<PhotoRecord> onRecord,
                          Consumer<IngestFailure> onFailure,
                          CompletableFuture<BatchResult> result) {
        LOGGER.info("Loading %d photo(s)".formatted(batch.size()));
        List<PhotoRecord> records = new ArrayList<>();
        List<IngestFailure> failures = new ArrayList<>();
        try {
            for (PhotoSource source : batch) {
                PhotoRecord record;
                try {
                    record = ingestor.ingest(source);
                } catch (PhotoDecodeException e) {
                    skip(source, e, failures, onFailure);
                    continue;
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "Unexpected error ingesting " + source.name(), e);
                    skip(source, new PhotoDecodeException(source.name(),
                        "Unable to load image " + source.name() + ": " + e, e), failures, onFailure);
                    continue;
                }
                records.add(record);
                publisher.execute(() -> onRecord.accept(record));
            }
        } catch (Throwable t) {
            // Errors such as OutOfMemoryError end the batch; the future still has to complete
            LOGGER.log(Level.SEVERE, "Photo batch aborted after %d photo(s)".formatted(records.size()), t);
            publisher.execute(() -> result.completeExceptionally(t));
            return;
        }
        BatchResult outcome = new BatchResult(records, failures);
        LOGGER.info("Loaded %d of %d photo(s)".formatted(records.size(), batch.size()));
        publisher.execute(() -> result.complete(outcome));
    }

    private void skip(PhotoSource source,
                      PhotoDecodeException cause,
                      List<IngestFailure> failures,
                      Consumer<IngestFailure> onFailure) {
        LOGGER.warning("Skipping " + source.name() + ": " + cause.getMessage());
        IngestFailure failure = new IngestFailure(source.name(), cause);
        failures.add(failure);
        publisher.execute(() -> onFailure.accept(failure));
    }
}
