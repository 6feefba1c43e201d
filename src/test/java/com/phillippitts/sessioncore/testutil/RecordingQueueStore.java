package com.phillippitts.sessioncore.testutil;

import com.phillippitts.sessioncore.domain.QueueEntry;
import com.phillippitts.sessioncore.exception.QueueStoreException;
import com.phillippitts.sessioncore.service.queue.QueueStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * QueueStore that counts writes and can be told to fail.
 */
public class RecordingQueueStore implements QueueStore {

    private final Map<UUID, QueueEntry> entries = new LinkedHashMap<>();
    private int singleWrites;
    private int batchWrites;
    private int removals;
    private boolean failSingleWrites;
    private boolean failBatchWrites;

    @Override
    public synchronized List<QueueEntry> fetchQueueEntries() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public synchronized void writeQueueEntry(QueueEntry entry) {
        if (failSingleWrites) {
            throw new QueueStoreException("write refused: " + entry.sessionId());
        }
        singleWrites++;
        entries.put(entry.sessionId(), entry);
    }

    @Override
    public synchronized void writeQueueEntries(Collection<QueueEntry> batch) {
        if (failBatchWrites) {
            throw new QueueStoreException("batch write refused");
        }
        batchWrites++;
        for (QueueEntry entry : batch) {
            entries.put(entry.sessionId(), entry);
        }
    }

    @Override
    public synchronized void removeQueueEntry(UUID sessionId) {
        removals++;
        entries.remove(sessionId);
    }

    /** Seeds an entry without counting it as a write. */
    public synchronized void seed(QueueEntry entry) {
        entries.put(entry.sessionId(), entry);
    }

    public synchronized QueueEntry stored(UUID sessionId) {
        return entries.get(sessionId);
    }

    public synchronized int writeCount() {
        return singleWrites + batchWrites + removals;
    }

    public synchronized int batchWriteCount() {
        return batchWrites;
    }

    public synchronized void failSingleWrites(boolean fail) {
        this.failSingleWrites = fail;
    }

    public synchronized void failBatchWrites(boolean fail) {
        this.failBatchWrites = fail;
    }
}
