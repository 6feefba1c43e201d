package com.phillippitts.sessioncore.exception;

/**
 * Thrown when the persistent store rejects a queue write. The in-memory queue state is rolled
 * back before this propagates, so memory and store never diverge.
 */
public class QueueStoreException extends SessionCoreException {

    public QueueStoreException(String message) {
        super(message);
    }

    public QueueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
