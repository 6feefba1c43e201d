package com.phillippitts.sessioncore.service.queue;

import com.phillippitts.sessioncore.config.properties.QueueProperties;
import com.phillippitts.sessioncore.domain.QueueEntry;
import com.phillippitts.sessioncore.exception.QueueEntryNotFoundException;
import com.phillippitts.sessioncore.exception.QueueStoreException;
import com.phillippitts.sessioncore.service.queue.event.PriorityQueueChangedEvent;
import com.phillippitts.sessioncore.service.queue.event.PriorityQueueChangedEvent.Change;
import com.phillippitts.sessioncore.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drag-reorderable priority queue of sessions.
 *
 * <p>Entries sort by {@link QueueEntry#ORDER}. A reorder writes one entry with a fractional key
 * between its new neighbors (see {@link OrderKeySequencer}); the whole queue is rewritten only
 * when keys get too close, checked after every reorder.
 *
 * <p><b>Persistence:</b> the {@link QueueStore} is authoritative. Every change is written to the
 * store first and committed to memory only when the write succeeds, so a failed write leaves
 * the in-memory order exactly as persisted.
 *
 * <p><b>Thread Safety:</b> a single {@link ReentrantLock} guards reads, writes and
 * renormalization. Change events are published after the lock is released.
 *
 * @since 1.0
 */
@Service
public class PriorityQueueManager {

    private static final Logger LOG = LogManager.getLogger(PriorityQueueManager.class);

    private final Lock lock = new ReentrantLock();
    private final Map<UUID, QueueEntry> entries = new HashMap<>();

    private final QueueStore store;
    private final ApplicationEventPublisher publisher;
    private final QueueProperties props;

    public PriorityQueueManager(QueueStore store, ApplicationEventPublisher publisher, QueueProperties props) {
        this.store = Objects.requireNonNull(store, "store");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.props = Objects.requireNonNull(props, "props");
    }

    @PostConstruct
    void load() {
        reload();
    }

    /**
     * Replaces the in-memory queue with the store's contents, respacing keys if the persisted
     * ones are already too close.
     *
     * @throws QueueStoreException if the store cannot be read
     */
    public void reload() {
        List<PriorityQueueChangedEvent> events = new ArrayList<>();
        lock.lock();
        try {
            List<QueueEntry> fetched = store.fetchQueueEntries();
            entries.clear();
            for (QueueEntry entry : fetched) {
                entries.put(entry.sessionId(), entry);
            }
            LOG.info("Loaded {} queue entries", entries.size());
            events.add(event(null, Change.RELOADED));
            renormalizeIfNeeded(events);
        } finally {
            lock.unlock();
        }
        events.forEach(publisher::publishEvent);
    }

    /**
     * Appends a session to the tail of the default bucket ({@code queue.default-priority}).
     *
     * @return true if the session was added; false if it was already queued
     */
    public boolean enqueue(UUID sessionId) {
        return enqueue(sessionId, props.getDefaultPriority());
    }

    /**
     * Appends a session to the tail of {@code priority}'s bucket.
     *
     * @return true if the session was added; false if it was already queued
     * @throws IllegalArgumentException if priority is negative
     * @throws QueueStoreException if the write fails (queue unchanged)
     */
    public boolean enqueue(UUID sessionId, int priority) {
        Objects.requireNonNull(sessionId, "sessionId cannot be null");
        if (priority < 0) {
            throw new IllegalArgumentException("Priority must be non-negative, got: " + priority);
        }
        lock.lock();
        try {
            if (entries.containsKey(sessionId)) {
                LOG.info("Session {} already queued", LogSanitizer.shortId(sessionId));
                return false;
            }
            double key = OrderKeySequencer.appendKey(maxKeyInBucket(priority, null));
            QueueEntry entry = new QueueEntry(sessionId, priority, key, Instant.now());
            store.writeQueueEntry(entry);
            entries.put(sessionId, entry);
            LOG.info("Session {} queued with priority {}", LogSanitizer.shortId(sessionId), priority);
        } finally {
            lock.unlock();
        }
        publisher.publishEvent(event(sessionId, Change.ENQUEUED));
        return true;
    }

    /**
     * Removes a session from the queue.
     *
     * @return true if it was queued
     * @throws QueueStoreException if the delete fails (queue unchanged)
     */
    public boolean dequeue(UUID sessionId) {
        if (sessionId == null) {
            return false;
        }
        lock.lock();
        try {
            if (!entries.containsKey(sessionId)) {
                return false;
            }
            store.removeQueueEntry(sessionId);
            entries.remove(sessionId);
            LOG.info("Session {} dequeued", LogSanitizer.shortId(sessionId));
        } finally {
            lock.unlock();
        }
        publisher.publishEvent(event(sessionId, Change.DEQUEUED));
        return true;
    }

    /**
     * Moves a session to the tail of another bucket.
     *
     * @return true if the priority changed; false if it already had {@code newPriority}
     * @throws QueueEntryNotFoundException if the session is not queued
     * @throws QueueStoreException if the write fails (queue unchanged)
     */
    public boolean changePriority(UUID sessionId, int newPriority) {
        if (newPriority < 0) {
            throw new IllegalArgumentException("Priority must be non-negative, got: " + newPriority);
        }
        lock.lock();
        try {
            QueueEntry current = require(sessionId);
            if (current.priority() == newPriority) {
                return false;
            }
            double key = OrderKeySequencer.appendKey(maxKeyInBucket(newPriority, sessionId));
            QueueEntry updated = current.withPriority(newPriority, key);
            store.writeQueueEntry(updated);
            entries.put(sessionId, updated);
            LOG.info("Session {} priority {} -> {}", LogSanitizer.shortId(sessionId), current.priority(), newPriority);
        } finally {
            lock.unlock();
        }
        publisher.publishEvent(event(sessionId, Change.PRIORITY_CHANGED));
        return true;
    }

    /**
     * Places {@code movingId} between two neighbors of its own bucket.
     *
     * <p>A neighbor that is the moving entry itself, is not queued, or belongs to another bucket
     * is ignored. With one neighbor given the other is derived from the current order, so
     * {@code reorder(m, a, null)} means "directly after a". If the resulting slot is the one the
     * entry already occupies nothing is written and no event is published.
     *
     * @return true if the entry moved
     * @throws QueueEntryNotFoundException if {@code movingId} is not queued
     * @throws IllegalArgumentException if {@code aboveId} sorts after {@code belowId} or names the same entry
     * @throws QueueStoreException if the write fails (queue unchanged)
     */
    public boolean reorder(UUID movingId, UUID aboveId, UUID belowId) {
        List<PriorityQueueChangedEvent> events = new ArrayList<>();
        lock.lock();
        try {
            QueueEntry moving = require(movingId);
            QueueEntry above = neighbor(aboveId, moving);
            QueueEntry below = neighbor(belowId, moving);
            if (above != null && below != null && above.sessionId().equals(below.sessionId())) {
                throw new IllegalArgumentException("Neighbor " + aboveId + " given as both above and below");
            }
            if (above != null && below != null && QueueEntry.ORDER.compare(above, below) > 0) {
                throw new IllegalArgumentException("Neighbor " + aboveId + " sorts after " + belowId);
            }
            if (!moveLocked(moving, above, below, events)) {
                return false;
            }
        } finally {
            lock.unlock();
        }
        events.forEach(publisher::publishEvent);
        return true;
    }

    /**
     * List-index form of {@link #reorder(UUID, UUID, UUID)}, as produced by a drag gesture.
     *
     * <p>{@code toIndex} is the position in the pre-move snapshot before which the entry is
     * dropped ({@code size()} drops at the end). Dropping onto its own slot or the slot right
     * after it is a no-op. The destination is clamped to the entry's own bucket.
     *
     * @return true if the entry moved
     * @throws IndexOutOfBoundsException if an index is outside the snapshot
     * @throws QueueStoreException if the write fails (queue unchanged)
     */
    public boolean move(int fromIndex, int toIndex) {
        List<PriorityQueueChangedEvent> events = new ArrayList<>();
        lock.lock();
        try {
            List<QueueEntry> sorted = sortedLocked();
            if (fromIndex < 0 || fromIndex >= sorted.size()) {
                throw new IndexOutOfBoundsException("fromIndex " + fromIndex + " out of range [0, " + sorted.size() + ")");
            }
            if (toIndex < 0 || toIndex > sorted.size()) {
                throw new IndexOutOfBoundsException("toIndex " + toIndex + " out of range [0, " + sorted.size() + "]");
            }
            QueueEntry moving = sorted.get(fromIndex);
            int bucketStart = fromIndex;
            while (bucketStart > 0 && sorted.get(bucketStart - 1).sameBucket(moving)) {
                bucketStart--;
            }
            int bucketEnd = fromIndex + 1;
            while (bucketEnd < sorted.size() && sorted.get(bucketEnd).sameBucket(moving)) {
                bucketEnd++;
            }
            int target = Math.max(bucketStart, Math.min(toIndex, bucketEnd));
            if (target == fromIndex || target == fromIndex + 1) {
                LOG.debug("Move of {} to its own slot ignored", LogSanitizer.shortId(moving.sessionId()));
                return false;
            }
            QueueEntry above = target > bucketStart ? sorted.get(target - 1) : null;
            QueueEntry below = target < bucketEnd ? sorted.get(target) : null;
            if (!moveLocked(moving, above, below, events)) {
                return false;
            }
        } finally {
            lock.unlock();
        }
        events.forEach(publisher::publishEvent);
        return true;
    }

    /**
     * @return all entries in queue order
     */
    public List<QueueEntry> snapshot() {
        lock.lock();
        try {
            return List.copyOf(sortedLocked());
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(UUID sessionId) {
        lock.lock();
        try {
            return sessionId != null && entries.containsKey(sessionId);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes {@code moving} between {@code above} and {@code below} (same bucket, either may be
     * null) and respaces the queue if the new key is too close to a neighbor.
     *
     * @return false if the slot is the one the entry already occupies
     */
    private boolean moveLocked(QueueEntry moving, QueueEntry above, QueueEntry below,
                               List<PriorityQueueChangedEvent> events) {
        List<QueueEntry> bucket = new ArrayList<>();
        for (QueueEntry e : sortedLocked()) {
            if (e.sameBucket(moving) && !e.sessionId().equals(moving.sessionId())) {
                bucket.add(e);
            }
        }
        if (above == null && below == null) {
            if (!bucket.isEmpty()) {
                LOG.debug("Reorder of {} named no neighbor in its bucket; ignored",
                        LogSanitizer.shortId(moving.sessionId()));
            }
            return false;
        }
        if (above != null && below == null) {
            int i = bucket.indexOf(above);
            below = i + 1 < bucket.size() ? bucket.get(i + 1) : null;
        } else if (above == null) {
            int i = bucket.indexOf(below);
            above = i > 0 ? bucket.get(i - 1) : null;
        }

        QueueEntry currentAbove = null;
        QueueEntry currentBelow = null;
        for (QueueEntry e : bucket) {
            if (QueueEntry.ORDER.compare(e, moving) < 0) {
                currentAbove = e;
            } else {
                currentBelow = e;
                break;
            }
        }
        if (Objects.equals(above, currentAbove) && Objects.equals(below, currentBelow)) {
            LOG.debug("Reorder of {} to its current slot ignored", LogSanitizer.shortId(moving.sessionId()));
            return false;
        }

        double key = OrderKeySequencer.computeInsertionKey(
                above == null ? null : above.orderKey(),
                below == null ? null : below.orderKey());
        QueueEntry updated = moving.withOrderKey(key);
        store.writeQueueEntry(updated);
        entries.put(moving.sessionId(), updated);
        LOG.debug("Session {} reordered: key {} -> {}", LogSanitizer.shortId(moving.sessionId()), moving.orderKey(), key);
        events.add(event(moving.sessionId(), Change.REORDERED));

        renormalizeIfNeeded(events);
        return true;
    }

    /**
     * A failed respacing is logged and dropped: the preceding change is already persisted and the
     * queue stays as it was before the attempt.
     */
    private void renormalizeIfNeeded(List<PriorityQueueChangedEvent> events) {
        List<QueueEntry> sorted = sortedLocked();
        if (!OrderKeySequencer.needsRenormalization(sorted)) {
            return;
        }
        List<QueueEntry> respaced = OrderKeySequencer.renormalize(sorted);
        try {
            store.writeQueueEntries(respaced);
        } catch (QueueStoreException e) {
            LOG.error("Queue renormalization failed; keeping previous keys", e);
            return;
        }
        for (QueueEntry entry : respaced) {
            entries.put(entry.sessionId(), entry);
        }
        LOG.info("Queue renormalized: {} entries", respaced.size());
        events.add(event(null, Change.RENORMALIZED));
    }

    private QueueEntry neighbor(UUID id, QueueEntry moving) {
        if (id == null || id.equals(moving.sessionId())) {
            return null;
        }
        QueueEntry candidate = entries.get(id);
        if (candidate == null) {
            LOG.debug("Neighbor {} is not queued; ignored", LogSanitizer.shortId(id));
            return null;
        }
        return candidate.sameBucket(moving) ? candidate : null;
    }

    private QueueEntry require(UUID sessionId) {
        Objects.requireNonNull(sessionId, "sessionId cannot be null");
        QueueEntry entry = entries.get(sessionId);
        if (entry == null) {
            throw new QueueEntryNotFoundException(sessionId);
        }
        return entry;
    }

    private Double maxKeyInBucket(int priority, UUID excluding) {
        Double max = null;
        for (QueueEntry e : entries.values()) {
            if (e.priority() == priority && !e.sessionId().equals(excluding)
                    && (max == null || e.orderKey() > max)) {
                max = e.orderKey();
            }
        }
        return max;
    }

    private List<QueueEntry> sortedLocked() {
        List<QueueEntry> sorted = new ArrayList<>(entries.values());
        sorted.sort(QueueEntry.ORDER);
        return sorted;
    }

    private static PriorityQueueChangedEvent event(UUID sessionId, Change change) {
        return new PriorityQueueChangedEvent(sessionId, change, Instant.now());
    }
}
