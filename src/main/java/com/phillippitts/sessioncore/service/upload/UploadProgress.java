package com.phillippitts.sessioncore.service.upload;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-file upload progress as shown to the user.
 *
 * @param id             upload identifier (not the ack request id)
 * @param filename       file name
 * @param totalBytes     file size
 * @param bytesUploaded  bytes read and handed to the transport so far
 * @param status         current status
 * @param failureMessage human-readable failure, null unless FAILED
 * @param retryable      true when the failure is worth retrying (timeout, transport, rejection)
 * @param createdAt      when the upload was requested
 */
public record UploadProgress(
        UUID id,
        String filename,
        long totalBytes,
        long bytesUploaded,
        Status status,
        String failureMessage,
        boolean retryable,
        Instant createdAt
) {

    public enum Status { PENDING, UPLOADING, COMPLETED, FAILED }

    public UploadProgress {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(filename, "filename must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    static UploadProgress pending(UUID id, String filename, long totalBytes) {
        return new UploadProgress(id, filename, totalBytes, 0, Status.PENDING, null, false, Instant.now());
    }

    static UploadProgress rejected(UUID id, String filename, long totalBytes, String message) {
        return new UploadProgress(id, filename, totalBytes, 0, Status.FAILED, message, false, Instant.now());
    }

    UploadProgress uploading() {
        return new UploadProgress(id, filename, totalBytes, bytesUploaded, Status.UPLOADING, null, false, createdAt);
    }

    UploadProgress withBytesUploaded(long bytes) {
        return new UploadProgress(id, filename, totalBytes, bytes, status, failureMessage, retryable, createdAt);
    }

    UploadProgress completed() {
        return new UploadProgress(id, filename, totalBytes, totalBytes, Status.COMPLETED, null, false, createdAt);
    }

    UploadProgress failed(String message, boolean canRetry) {
        return new UploadProgress(id, filename, totalBytes, bytesUploaded, Status.FAILED, message, canRetry, createdAt);
    }

    /**
     * @return fraction uploaded in [0, 1]; 0 for empty files
     */
    public double fraction() {
        if (totalBytes <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) bytesUploaded / totalBytes);
    }

    public boolean isComplete() {
        return status == Status.COMPLETED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
