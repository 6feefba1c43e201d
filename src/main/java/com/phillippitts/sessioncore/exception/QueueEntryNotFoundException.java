package com.phillippitts.sessioncore.exception;

import java.util.UUID;

/**
 * Thrown when a queue operation names a session that is not in the priority queue.
 */
public class QueueEntryNotFoundException extends SessionCoreException {

    private final UUID sessionId;

    public QueueEntryNotFoundException(UUID sessionId) {
        super("Session not in priority queue: " + sessionId);
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
