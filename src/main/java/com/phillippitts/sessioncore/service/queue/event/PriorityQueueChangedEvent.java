package com.phillippitts.sessioncore.service.queue.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after the queue order changed and the change was persisted. Listeners re-read
 * {@code PriorityQueueManager.snapshot()} to re-render.
 *
 * @param sessionId session that moved, or null for {@link Change#RENORMALIZED}
 */
public record PriorityQueueChangedEvent(UUID sessionId, Change change, Instant at) {

    public enum Change { ENQUEUED, DEQUEUED, REORDERED, PRIORITY_CHANGED, RENORMALIZED, RELOADED }
}
