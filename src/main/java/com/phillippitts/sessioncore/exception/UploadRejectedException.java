package com.phillippitts.sessioncore.exception;

/**
 * Thrown when an upload fails caller-side validation before any request is registered
 * (missing file, size limit, no connection, no storage location).
 */
public class UploadRejectedException extends SessionCoreException {

    public enum Reason { FILE_NOT_FOUND, SIZE_LIMIT_EXCEEDED, NOT_CONNECTED, NO_STORAGE_LOCATION, UNREADABLE }

    private final Reason reason;
    private final String filename;

    public UploadRejectedException(Reason reason, String filename, String message) {
        super(message + " (file: " + filename + ")");
        this.reason = reason;
        this.filename = filename;
    }

    public UploadRejectedException(Reason reason, String filename, String message, Throwable cause) {
        super(message + " (file: " + filename + ")", cause);
        this.reason = reason;
        this.filename = filename;
    }

    public Reason getReason() {
        return reason;
    }

    public String getFilename() {
        return filename;
    }
}
