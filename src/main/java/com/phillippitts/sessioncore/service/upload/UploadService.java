package com.phillippitts.sessioncore.service.upload;

import com.phillippitts.sessioncore.config.properties.UploadProperties;
import com.phillippitts.sessioncore.exception.DuplicateRequestKeyException;
import com.phillippitts.sessioncore.exception.UploadRejectedException;
import com.phillippitts.sessioncore.exception.UploadRejectedException.Reason;
import com.phillippitts.sessioncore.service.metrics.UploadMetrics;
import com.phillippitts.sessioncore.service.upload.event.UploadFinishedEvent;
import com.phillippitts.sessioncore.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Caller side of the upload pipeline: validates files, tracks per-file progress and awaits the
 * backend's acknowledgment through {@link AckCoordinator}.
 *
 * <p>Validation happens on the calling thread, before any request is registered:
 * <ul>
 *   <li>transport connected and storage location configured (batch-level)</li>
 *   <li>file exists and is a regular file</li>
 *   <li>file size within {@code upload.max-file-size-bytes}</li>
 * </ul>
 * Reading, encoding and dispatch run on the {@code uploadExecutor}. Failures after dispatch
 * (timeout, transport, backend error) leave a FAILED progress item marked retryable; retrying is
 * the user's decision.
 *
 * @since 1.0
 */
@Service
public class UploadService {

    private static final Logger LOG = LogManager.getLogger(UploadService.class);

    private final AckCoordinator coordinator;
    private final UploadTransport transport;
    private final UploadProperties props;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final UploadMetrics metrics;

    private final ConcurrentMap<UUID, UploadProgress> progress = new ConcurrentHashMap<>();

    public UploadService(AckCoordinator coordinator,
                         UploadTransport transport,
                         UploadProperties props,
                         @Qualifier("uploadExecutor") Executor executor,
                         ApplicationEventPublisher publisher,
                         UploadMetrics metrics) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.props = Objects.requireNonNull(props, "props");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Uploads several files. Per-file validation failures are recorded as FAILED progress items
     * and do not stop the remaining files.
     *
     * @param files files to upload
     * @return one progress item per file, in input order
     * @throws UploadRejectedException if the transport is disconnected or no storage location is set
     */
    public List<UploadProgress> uploadAll(List<Path> files) {
        Objects.requireNonNull(files, "files");
        String storageLocation = requireReadyToUpload();
        List<UploadProgress> started = new ArrayList<>(files.size());
        for (Path file : files) {
            UUID uploadId = UUID.randomUUID();
            try {
                started.add(start(uploadId, file, storageLocation));
            } catch (UploadRejectedException e) {
                started.add(progress.get(uploadId));
            }
        }
        return started;
    }

    /**
     * Uploads a single file.
     *
     * @param file file to upload
     * @return the PENDING progress item
     * @throws UploadRejectedException on any caller-side validation failure
     */
    public UploadProgress upload(Path file) {
        Objects.requireNonNull(file, "file");
        return start(UUID.randomUUID(), file, requireReadyToUpload());
    }

    /**
     * @return progress items, oldest first
     */
    public List<UploadProgress> progress() {
        return progress.values().stream()
                .sorted(Comparator.comparing(UploadProgress::createdAt))
                .toList();
    }

    public void clearCompleted() {
        progress.values().removeIf(UploadProgress::isComplete);
    }

    public void clearFailed() {
        progress.values().removeIf(UploadProgress::isFailed);
    }

    /**
     * Probes the backend, giving up after {@code upload.connection-test-timeout}.
     *
     * @return future completing with true if the backend answered in time
     */
    public CompletableFuture<Boolean> testConnection() {
        Duration timeout = props.getConnectionTestTimeout();
        return transport.testConnection(timeout)
                .completeOnTimeout(false, timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    LOG.warn("Connection test failed: {}", e.getMessage());
                    return false;
                });
    }

    private String requireReadyToUpload() {
        if (!transport.isConnected()) {
            metrics.incrementRejected(Reason.NOT_CONNECTED);
            throw new UploadRejectedException(Reason.NOT_CONNECTED, "*", "Not connected to server");
        }
        String storageLocation = props.getStorageLocation();
        if (storageLocation == null || storageLocation.isBlank()) {
            metrics.incrementRejected(Reason.NO_STORAGE_LOCATION);
            throw new UploadRejectedException(Reason.NO_STORAGE_LOCATION, "*", "No storage location configured");
        }
        return storageLocation;
    }

    private UploadProgress start(UUID uploadId, Path file, String storageLocation) {
        String filename = file.getFileName() == null ? file.toString() : file.getFileName().toString();

        if (!Files.isRegularFile(file)) {
            throw reject(uploadId, filename, 0, Reason.FILE_NOT_FOUND, "File not found");
        }
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw reject(uploadId, filename, 0, Reason.UNREADABLE, "Cannot read file attributes: " + e.getMessage());
        }
        if (size > props.getMaxFileSizeBytes()) {
            throw reject(uploadId, filename, size, Reason.SIZE_LIMIT_EXCEEDED,
                    "File too large: " + size + " bytes. Max: " + props.getMaxFileSizeBytes() + " bytes ("
                    + (props.getMaxFileSizeBytes() / (1024 * 1024)) + " MB)");
        }

        UploadProgress item = UploadProgress.pending(uploadId, filename, size);
        progress.put(uploadId, item);
        LOG.info("Upload queued: uploadId={}, file={}, bytes={}", LogSanitizer.shortId(uploadId), filename, size);
        executor.execute(() -> perform(uploadId, file, filename, storageLocation));
        return item;
    }

    private UploadRejectedException reject(UUID uploadId, String filename, long size, Reason reason, String message) {
        LOG.error("Upload rejected: file={}, reason={}", filename, reason);
        progress.put(uploadId, UploadProgress.rejected(uploadId, filename, size, message));
        metrics.incrementRejected(reason);
        return new UploadRejectedException(reason, filename, message);
    }

    private void perform(UUID uploadId, Path file, String filename, String storageLocation) {
        ThreadContext.put("uploadId", LogSanitizer.shortId(uploadId));
        try {
            update(uploadId, UploadProgress::uploading);

            byte[] data;
            try {
                data = Files.readAllBytes(file);
            } catch (IOException e) {
                LOG.error("Failed to read file for upload: file={}", filename, e);
                update(uploadId, p -> p.failed(e.getMessage(), true));
                return;
            }
            String content = Base64.getEncoder().encodeToString(data);
            update(uploadId, p -> p.withBytesUploaded(data.length));
            LOG.info("Uploading file: {} ({} bytes) to {}", filename, data.length, storageLocation);

            long t0 = System.nanoTime();
            CompletableFuture<AckOutcome> ack;
            try {
                ack = coordinator.beginRequest(filename, UploadMessage.of(filename, content, storageLocation),
                        props.getTimeout());
            } catch (DuplicateRequestKeyException e) {
                LOG.warn("Upload already in flight for file={}", filename);
                update(uploadId, p -> p.failed("An upload of this file is already in progress", true));
                return;
            }
            ack.whenComplete((outcome, error) -> finish(uploadId, filename, outcome, error, t0));
        } catch (RuntimeException e) {
            LOG.error("Upload could not be dispatched: file={}", filename, e);
            update(uploadId, p -> p.failed("Upload could not be started: " + e.getMessage(), true));
        } finally {
            ThreadContext.remove("uploadId");
        }
    }

    private void finish(UUID uploadId, String filename, AckOutcome outcome, Throwable error, long t0) {
        if (error != null) {
            // Only cancellation by a caller reaches here; the coordinator never fails the future
            LOG.info("Upload abandoned: file={}", filename);
            update(uploadId, p -> p.failed("Cancelled", true));
            return;
        }
        long elapsed = System.nanoTime() - t0;
        metrics.recordOutcome(outcome.status(), elapsed);
        switch (outcome.status()) {
            case ACKNOWLEDGED -> {
                update(uploadId, UploadProgress::completed);
                LOG.info("Upload successful: {}", filename);
            }
            case REJECTED -> update(uploadId, p -> p.failed("Upload failed", true));
            case TIMEOUT -> update(uploadId, p -> p.failed("Timed out waiting for acknowledgment", true));
            case TRANSPORT_FAILURE -> update(uploadId, p -> p.failed("Transport unavailable", true));
        }
        if (!outcome.isSuccess()) {
            LOG.error("Upload failed: file={}, status={}", filename, outcome.status());
        }
        publisher.publishEvent(new UploadFinishedEvent(uploadId, filename, outcome.status(), Instant.now()));
    }

    private void update(UUID uploadId, UnaryOperator<UploadProgress> change) {
        progress.computeIfPresent(uploadId, (id, current) -> change.apply(current));
    }
}
