package com.photomatic.core.session;

import com.photomatic.config.LayoutSettings;
import com.photomatic.core.export.FileSaveTarget;
import com.photomatic.core.export.PhotoExportException;
import com.photomatic.core.export.PhotoExporter;
import com.photomatic.core.ingest.BatchIngestionPipeline;
import com.photomatic.core.ingest.BatchResult;
import com.photomatic.core.ingest.ImageIoRasterDecoder;
import com.photomatic.core.ingest.IngestFailure;
import com.photomatic.core.ingest.PhotoIngestor;
import com.photomatic.core.metadata.ExifMetadataDecoder;
import com.photomatic.core.model.DisplayOption;
import com.photomatic.core.model.DisplayOptions;
import com.photomatic.core.model.PhotoRecord;
import com.photomatic.core.model.PhotoSource;
import com.photomatic.core.render.Compositor;
import com.photomatic.logging.AppLogger;
import com.photomatic.logging.PhotoFailureLog;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One editing session: the loaded photos, the current options and the preview surface.
 * <p>
 * All methods are called from the owning thread (the Swing event thread in the desktop
 * shell). Ingestion runs on a worker and reports back through the publisher executor given
 * at construction, which must execute on that same thread.
 */
public final class PhotoSession implements AutoCloseable {

    private static final Logger LOGGER = AppLogger.get();

    private final SessionStore store;
    private final SessionStateMachine stateMachine;
    private final BatchIngestionPipeline pipeline;
    private final Compositor compositor;
    private final PhotoExporter exporter;
    private final PhotoFailureLog failureLog;
    private final ExecutorService ownedWorker;

    private DisplayOptions options = DisplayOptions.defaults();
    private BufferedImage surface;

    public PhotoSession(SessionStore store,
                        SessionStateMachine stateMachine,
                        BatchIngestionPipeline pipeline,
                        Compositor compositor,
                        PhotoExporter exporter,
                        PhotoFailureLog failureLog) {
        this(store, stateMachine, pipeline, compositor, exporter, failureLog, null);
    }

    private PhotoSession(SessionStore store,
                         SessionStateMachine stateMachine,
                         BatchIngestionPipeline pipeline,
                         Compositor compositor,
                         PhotoExporter exporter,
                         PhotoFailureLog failureLog,
                         ExecutorService ownedWorker) {
        this.store = Objects.requireNonNull(store, "store");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.compositor = Objects.requireNonNull(compositor, "compositor");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
        this.failureLog = Objects.requireNonNull(failureLog, "failureLog");
        this.ownedWorker = ownedWorker;
    }

    /**
     * Wires a session with the default decoders and a dedicated ingestion thread.
     */
    public static PhotoSession create(LayoutSettings settings, Executor publisher, PhotoFailureLog failureLog) {
        ExecutorService worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "photo-ingest");
            thread.setDaemon(true);
            return thread;
        });
        PhotoIngestor ingestor = new PhotoIngestor(new ExifMetadataDecoder(), new ImageIoRasterDecoder(), settings);
        return new PhotoSession(
            new SessionStore(),
            new SessionStateMachine(),
            new BatchIngestionPipeline(ingestor, worker, publisher),
            new Compositor(settings),
            new PhotoExporter(settings.exportQuality()),
            failureLog,
            worker
        );
    }

    public SessionStore store() {
        return store;
    }

    public SessionStateMachine stateMachine() {
        return stateMachine;
    }

    public DisplayOptions options() {
        return options;
    }

    /**
     * Replaces every loaded photo with the given files. The store is emptied right away and
     * refills as the files are ingested.
     *
     * @throws BatchInProgressException if a batch or an export is still running
     */
    public CompletableFuture<BatchResult> loadReplace(List<PhotoSource> files) {
        return load(files, true);
    }

    /**
     * Adds the given files after the loaded ones without moving the selection.
     *
     * @throws BatchInProgressException if a batch or an export is still running
     */
    public CompletableFuture<BatchResult> loadAppend(List<PhotoSource> files) {
        return load(files, false);
    }

    public void selectPhoto(int index) {
        store.select(index);
    }

    public void setOption(DisplayOption option, boolean enabled) {
        options = options.with(Objects.requireNonNull(option, "option"), enabled);
    }

    /**
     * Paints the selected photo onto the session's preview surface.
     *
     * @return the surface, or empty when nothing is loaded
     */
    public Optional<BufferedImage> renderCurrent() {
        Optional<PhotoRecord> selected = store.selected();
        if (selected.isEmpty()) {
            return Optional.empty();
        }
        if (surface == null) {
            surface = compositor.createSurface();
        }
        compositor.render(surface, selected.get(), options);
        return Optional.of(surface);
    }

    /**
     * Renders the selected photo and saves it as JPEG. The session is SAVING for the duration
     * and back in EDITING afterwards, whether the export worked or not.
     *
     * @return where the export was stored
     * @throws IllegalStateException when nothing is being edited
     */
    public String exportCurrent(FileSaveTarget target) throws PhotoExportException {
        Objects.requireNonNull(target, "target");
        PhotoRecord photo = store.selected()
            .orElseThrow(() -> new IllegalStateException("No photo selected for export"));
        stateMachine.beginSaving();
        try {
            BufferedImage frame = renderCurrent().orElseThrow(() -> new PhotoExportException("Nothing to export"));
            return exporter.export(frame, photo.getName(), target);
        } catch (PhotoExportException e) {
            LOGGER.log(Level.SEVERE, "Export of " + photo.getName() + " failed", e);
            failureLog.logFailure(PhotoFailureLog.Stage.EXPORT, photo.getName(), e);
            throw e;
        } finally {
            stateMachine.finishSaving();
        }
    }

    @Override
    public void close() {
        if (ownedWorker != null) {
            ownedWorker.shutdownNow();
        }
    }

    private CompletableFuture<BatchResult> load(List<PhotoSource> files, boolean replace) {
        if (files == null || files.isEmpty()) {
            return CompletableFuture.completedFuture(BatchResult.empty());
        }
        if (!stateMachine.canLoad()) {
            throw new BatchInProgressException("Cannot load photos while " + stateMachine.state());
        }
        stateMachine.beginLoading();
        if (replace) {
            store.replaceAll(List.of());
        }
        return pipeline.submit(files, this::publish, this::recordFailure)
            .whenComplete((result, error) -> {
                if (error != null) {
                    LOGGER.log(Level.SEVERE, "Photo batch failed", error);
                }
                stateMachine.finishLoading(!store.isEmpty());
            });
    }

    private void publish(PhotoRecord record) {
        store.append(List.of(record));
    }

    private void recordFailure(IngestFailure failure) {
        failureLog.logFailure(PhotoFailureLog.Stage.INGEST, failure.sourceName(), failure.cause());
    }
}
