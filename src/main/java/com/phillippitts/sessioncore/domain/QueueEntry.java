package com.phillippitts.sessioncore.domain;

import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable domain model for a session participating in the reorderable priority queue.
 *
 * <p>Entries sort by {@code (priority ascending, orderKey ascending, stableId ascending)}. The
 * order key is a fractional key and may collide under floating-point pressure; the stable id
 * (the session's own identifier) keeps the order strict and total.
 *
 * @param sessionId session identifier (must not be null)
 * @param priority  priority bucket; lower values sort first (see {@link PriorityLevel})
 * @param orderKey  fractional order key within the bucket
 * @param queuedAt  when the session entered the queue (nullable for entries loaded without it)
 */
public record QueueEntry(
        UUID sessionId,
        int priority,
        double orderKey,
        Instant queuedAt
) {

    /**
     * Strict total order used for every queue snapshot.
     */
    public static final Comparator<QueueEntry> ORDER = Comparator
            .comparingInt(QueueEntry::priority)
            .thenComparing(QueueEntry::orderKey, Double::compare)
            .thenComparing(QueueEntry::stableId);

    /**
     * @throws NullPointerException if sessionId is null
     * @throws IllegalArgumentException if priority is negative or orderKey is not finite
     */
    public QueueEntry {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (priority < 0) {
            throw new IllegalArgumentException("Priority must be non-negative, got: " + priority);
        }
        if (!Double.isFinite(orderKey)) {
            throw new IllegalArgumentException("Order key must be finite, got: " + orderKey);
        }
    }

    /**
     * Tie-break identifier: the lowercase session UUID string.
     */
    public String stableId() {
        return sessionId.toString().toLowerCase(Locale.ROOT);
    }

    public QueueEntry withOrderKey(double newKey) {
        return new QueueEntry(sessionId, priority, newKey, queuedAt);
    }

    public QueueEntry withPriority(int newPriority, double newKey) {
        return new QueueEntry(sessionId, newPriority, newKey, queuedAt);
    }

    public boolean sameBucket(QueueEntry other) {
        return other != null && other.priority == priority;
    }
}
