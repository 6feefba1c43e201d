package com.phillippitts.sessioncore.service.window;

import com.phillippitts.sessioncore.domain.SessionWindow;
import com.phillippitts.sessioncore.domain.WindowClaim;
import com.phillippitts.sessioncore.service.window.event.DetachedSessionsChangedEvent;
import com.phillippitts.sessioncore.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks which session is shown in which window so that a session is open in at most one
 * window at a time.
 *
 * <p><b>State per session:</b>
 * <pre>
 * Unclaimed  → Claimed(W)  (claim by W)
 * Claimed(W) → Claimed(W)  (re-claim by W, refresh)
 * Claimed(W) → Unclaimed   (release, or W closes)
 * </pre>
 * A claim by another window while {@code Claimed(W)} is rejected with
 * {@link ClaimResult#redirected(SessionWindow)} and leaves the state unchanged.
 *
 * <p><b>Main window:</b> "detached" means claimed by any window other than the designated main
 * window. If no main window is designated, the first window to claim a session becomes main.
 *
 * <p><b>Thread Safety:</b> every read and write goes through one {@link ReentrantLock}. Window
 * callbacks ({@link SessionWindow#bringToFront()}) and event publication run after the lock is
 * released. Events go out under a separate publication lock in commit order; a change that is
 * superseded before it is delivered is folded into the newer event.
 *
 * <p>Owned by the application context; construct a fresh instance per test.
 *
 * @since 1.0
 */
@Component
public class WindowSessionRegistry {

    private static final Logger LOG = LogManager.getLogger(WindowSessionRegistry.class);

    private final Lock lock = new ReentrantLock();
    private final Map<UUID, SessionWindow> sessionToWindow = new HashMap<>();
    private SessionWindow mainWindow;
    private Set<UUID> detached = Set.of();
    private long detachedVersion;

    // Held while delivering; never acquired with the state lock held
    private final Lock publishLock = new ReentrantLock();
    private long publishedVersion;

    private final ApplicationEventPublisher publisher;

    public WindowSessionRegistry(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Claims {@code sessionId} for {@code window}.
     *
     * @return {@code CLAIMED} if the session was unclaimed or already held by {@code window};
     *         {@code REDIRECTED(holder)} if another window holds it (state unchanged)
     * @throws NullPointerException if sessionId or window is null
     */
    public ClaimResult claim(UUID sessionId, SessionWindow window) {
        Objects.requireNonNull(sessionId, "sessionId cannot be null");
        Objects.requireNonNull(window, "window cannot be null");

        ClaimResult result;
        boolean changed;
        lock.lock();
        try {
            SessionWindow holder = sessionToWindow.get(sessionId);
            if (holder != null && holder != window) {
                LOG.info("Session {} already open in window '{}', redirecting",
                        LogSanitizer.shortId(sessionId), holder.title());
                return ClaimResult.redirected(holder);
            }
            if (mainWindow == null) {
                mainWindow = window;
                LOG.info("Main window registered: '{}'", window.title());
            }
            sessionToWindow.put(sessionId, window);
            result = ClaimResult.claimed(window);
            changed = recomputeDetached();
            LOG.info("Session {} claimed by window '{}'", LogSanitizer.shortId(sessionId), window.title());
        } finally {
            lock.unlock();
        }
        if (changed) {
            publishLatest();
        }
        return result;
    }

    /**
     * Claims the session for {@code window}, or brings the holding window to the front.
     *
     * @return true if the caller should display the session; false if another window was focused
     */
    public boolean trySelect(UUID sessionId, SessionWindow window) {
        ClaimResult result = claim(sessionId, window);
        if (result.isClaimed()) {
            return true;
        }
        result.holder().bringToFront();
        return false;
    }

    /**
     * Removes the claim on {@code sessionId} regardless of holder. No-op if unclaimed.
     */
    public void release(UUID sessionId) {
        if (sessionId == null) {
            return;
        }
        boolean changed = false;
        lock.lock();
        try {
            SessionWindow removed = sessionToWindow.remove(sessionId);
            if (removed != null) {
                LOG.info("Session {} released from window '{}'", LogSanitizer.shortId(sessionId), removed.title());
                changed = recomputeDetached();
            }
        } finally {
            lock.unlock();
        }
        if (changed) {
            publishLatest();
        }
    }

    /**
     * Removes every claim held by {@code window} (the window is closing). Clears the main window
     * designation if {@code window} was main.
     *
     * @return the sessions that were released
     */
    public List<UUID> releaseAll(SessionWindow window) {
        Objects.requireNonNull(window, "window cannot be null");
        List<UUID> released = new ArrayList<>();
        boolean changed;
        lock.lock();
        try {
            sessionToWindow.entrySet().removeIf(e -> {
                if (e.getValue() == window) {
                    released.add(e.getKey());
                    return true;
                }
                return false;
            });
            if (window == mainWindow) {
                mainWindow = null;
                LOG.info("Main window '{}' closed", window.title());
            }
            changed = recomputeDetached();
        } finally {
            lock.unlock();
        }
        if (!released.isEmpty()) {
            LOG.info("Released {} session(s) from closing window '{}'", released.size(), window.title());
        }
        if (changed) {
            publishLatest();
        }
        return released;
    }

    /**
     * Designates the window against which "detached" is computed. Idempotent.
     */
    public void setMainWindow(SessionWindow window) {
        Objects.requireNonNull(window, "window cannot be null");
        boolean changed;
        lock.lock();
        try {
            if (mainWindow == window) {
                return;
            }
            mainWindow = window;
            changed = recomputeDetached();
            LOG.info("Main window set explicitly: '{}'", window.title());
        } finally {
            lock.unlock();
        }
        if (changed) {
            publishLatest();
        }
    }

    /**
     * @return true if the session is claimed by a window other than the main window
     */
    public boolean isDetached(UUID sessionId) {
        if (sessionId == null) {
            return false;
        }
        lock.lock();
        try {
            SessionWindow holder = sessionToWindow.get(sessionId);
            return holder != null && holder != mainWindow;
        } finally {
            lock.unlock();
        }
    }

    public Optional<SessionWindow> windowFor(UUID sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(sessionToWindow.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    public boolean isClaimed(UUID sessionId) {
        return windowFor(sessionId).isPresent();
    }

    public Optional<SessionWindow> mainWindow() {
        lock.lock();
        try {
            return Optional.ofNullable(mainWindow);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return snapshot of all current claims
     */
    public List<WindowClaim> claims() {
        lock.lock();
        try {
            List<WindowClaim> snapshot = new ArrayList<>(sessionToWindow.size());
            sessionToWindow.forEach((id, w) -> snapshot.add(new WindowClaim(id, w)));
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    public Set<UUID> claimedSessions() {
        lock.lock();
        try {
            return Set.copyOf(sessionToWindow.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return snapshot of sessions shown outside the main window
     */
    public Set<UUID> detachedSessions() {
        lock.lock();
        try {
            return detached;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Must be called with the lock held.
     *
     * @return true if the detached set changed
     */
    private boolean recomputeDetached() {
        Set<UUID> next = new HashSet<>();
        sessionToWindow.forEach((id, w) -> {
            if (w != mainWindow) {
                next.add(id);
            }
        });
        if (next.equals(detached)) {
            return false;
        }
        detached = Set.copyOf(next);
        detachedVersion++;
        return true;
    }

    /**
     * Publishes the current detached set unless that version has already gone out. Called with the
     * state lock released; the snapshot is re-read under {@code publishLock}.
     */
    private void publishLatest() {
        publishLock.lock();
        try {
            Set<UUID> snapshot;
            long version;
            lock.lock();
            try {
                snapshot = detached;
                version = detachedVersion;
            } finally {
                lock.unlock();
            }
            if (version <= publishedVersion) {
                return;
            }
            publishedVersion = version;
            publisher.publishEvent(new DetachedSessionsChangedEvent(snapshot, Instant.now()));
        } finally {
            publishLock.unlock();
        }
    }
}
