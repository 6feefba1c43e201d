package com.phillippitts.sessioncore.service.queue;

import com.phillippitts.sessioncore.domain.QueueEntry;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime store used when no persistent {@link QueueStore} bean is provided.
 *
 * <p>Registered by {@code CoordinationConfig}.
 */
public class InMemoryQueueStore implements QueueStore {

    private final Map<UUID, QueueEntry> entries = new ConcurrentHashMap<>();

    @Override
    public List<QueueEntry> fetchQueueEntries() {
        return List.copyOf(entries.values());
    }

    @Override
    public void writeQueueEntry(QueueEntry entry) {
        entries.put(entry.sessionId(), entry);
    }

    @Override
    public synchronized void writeQueueEntries(Collection<QueueEntry> batch) {
        for (QueueEntry entry : batch) {
            entries.put(entry.sessionId(), entry);
        }
    }

    @Override
    public void removeQueueEntry(UUID sessionId) {
        entries.remove(sessionId);
    }
}
