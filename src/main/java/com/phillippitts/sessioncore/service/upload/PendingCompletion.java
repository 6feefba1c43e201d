package com.phillippitts.sessioncore.service.upload;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * One outstanding request awaiting an acknowledgment or a timeout.
 *
 * <p>Owned exclusively by {@link AckCoordinator}. Whoever removes this instance from the
 * coordinator's table is the only party allowed to complete {@link #future()}.
 */
final class PendingCompletion {

    private final String key;
    private final String requestId;
    private final Instant createdAt;
    private final long sequence;
    private final CompletableFuture<AckOutcome> future = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timeoutHandle;

    PendingCompletion(String key, String requestId, Instant createdAt, long sequence) {
        this.key = key;
        this.requestId = requestId;
        this.createdAt = createdAt;
        this.sequence = sequence;
    }

    String key() {
        return key;
    }

    String requestId() {
        return requestId;
    }

    Instant createdAt() {
        return createdAt;
    }

    long sequence() {
        return sequence;
    }

    CompletableFuture<AckOutcome> future() {
        return future;
    }

    void armTimeout(ScheduledFuture<?> handle) {
        this.timeoutHandle = handle;
    }

    /**
     * Cancels the timeout task if it has been armed. Harmless if the timeout is the caller.
     */
    void disarmTimeout() {
        ScheduledFuture<?> handle = timeoutHandle;
        if (handle != null) {
            handle.cancel(false);
        }
    }
}
