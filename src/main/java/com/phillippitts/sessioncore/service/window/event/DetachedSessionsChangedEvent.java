package com.phillippitts.sessioncore.service.window.event;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Published when the set of sessions shown outside the main window changes. Drives the
 * "open in another window" indicator in session lists.
 */
public record DetachedSessionsChangedEvent(Set<UUID> detachedSessions, Instant at) {

    public DetachedSessionsChangedEvent {
        detachedSessions = Set.copyOf(detachedSessions);
    }
}
