package com.phillippitts.sessioncore.service.queue;

import com.phillippitts.sessioncore.domain.QueueEntry;
import com.phillippitts.sessioncore.exception.QueueStoreException;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Persistent, authoritative copy of the queue. Writes are synchronous.
 *
 * <p>Implementations throw {@link QueueStoreException} when a write cannot be made durable; the
 * caller rolls back its in-memory state.
 */
public interface QueueStore {

    /**
     * @return every persisted entry, in no particular order
     */
    List<QueueEntry> fetchQueueEntries();

    /**
     * Inserts or replaces the entry for {@link QueueEntry#sessionId()}.
     */
    void writeQueueEntry(QueueEntry entry);

    /**
     * Writes several entries as one batch. Either all are persisted or, on exception, none are.
     */
    void writeQueueEntries(Collection<QueueEntry> entries);

    /**
     * Removes the entry for {@code sessionId}; no-op if absent.
     */
    void removeQueueEntry(UUID sessionId);
}
