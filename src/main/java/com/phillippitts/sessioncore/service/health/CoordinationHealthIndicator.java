package com.phillippitts.sessioncore.service.health;

import com.phillippitts.sessioncore.service.queue.PriorityQueueManager;
import com.phillippitts.sessioncore.service.upload.AckCoordinator;
import com.phillippitts.sessioncore.service.upload.UploadTransport;
import com.phillippitts.sessioncore.service.window.WindowSessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the coordination core.
 *
 * <ul>
 *   <li>UP: upload transport connected</li>
 *   <li>DEGRADED: transport disconnected; windows and queue still work, uploads are rejected</li>
 * </ul>
 *
 * <p>Details carry pending acknowledgments, claimed and detached session counts, and queue size.
 * Exposed via /actuator/health.
 */
@Component
public class CoordinationHealthIndicator implements HealthIndicator {

    private final AckCoordinator ackCoordinator;
    private final UploadTransport transport;
    private final WindowSessionRegistry windows;
    private final PriorityQueueManager queue;

    public CoordinationHealthIndicator(AckCoordinator ackCoordinator,
                                       UploadTransport transport,
                                       WindowSessionRegistry windows,
                                       PriorityQueueManager queue) {
        this.ackCoordinator = ackCoordinator;
        this.transport = transport;
        this.windows = windows;
        this.queue = queue;
    }

    @Override
    public Health health() {
        Health.Builder builder = transport.isConnected()
                ? Health.up()
                : Health.status("DEGRADED").withDetail("transport", "disconnected");
        return builder
                .withDetail("pendingAcknowledgments", ackCoordinator.pendingCount())
                .withDetail("claimedSessions", windows.claimedSessions().size())
                .withDetail("detachedSessions", windows.detachedSessions().size())
                .withDetail("queueSize", queue.size())
                .build();
    }
}
