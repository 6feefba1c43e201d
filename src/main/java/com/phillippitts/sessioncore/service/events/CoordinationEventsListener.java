package com.phillippitts.sessioncore.service.events;

import com.phillippitts.sessioncore.service.queue.event.PriorityQueueChangedEvent;
import com.phillippitts.sessioncore.service.upload.AckStatus;
import com.phillippitts.sessioncore.service.upload.event.UploadFinishedEvent;
import com.phillippitts.sessioncore.service.window.event.DetachedSessionsChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operational log of coordination events. Upload failures are throttled per status so a dead
 * backend does not flood the log.
 */
@Component
class CoordinationEventsListener {
    private static final Logger LOG = LogManager.getLogger(CoordinationEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);
    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onUploadFinished(UploadFinishedEvent e) {
        if (e.status() == AckStatus.ACKNOWLEDGED) {
            return;
        }
        if (shouldLog("upload-" + e.status())) {
            String hint = switch (e.status()) {
                case TIMEOUT -> "Backend did not acknowledge in time; check upload.timeout and backend load.";
                case TRANSPORT_FAILURE -> "Transport refused the message; check the backend connection.";
                default -> "Backend reported an error for the file.";
            };
            LOG.warn("Upload failed: status={}. {}", e.status(), hint);
        }
    }

    @EventListener
    void onDetachedSessionsChanged(DetachedSessionsChangedEvent e) {
        LOG.debug("Detached sessions now: {}", e.detachedSessions().size());
    }

    @EventListener
    void onQueueChanged(PriorityQueueChangedEvent e) {
        if (e.change() == PriorityQueueChangedEvent.Change.RENORMALIZED) {
            LOG.info("Queue order keys respaced");
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
