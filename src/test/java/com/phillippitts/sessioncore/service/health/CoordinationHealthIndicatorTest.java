package com.phillippitts.sessioncore.service.health;

import com.phillippitts.sessioncore.service.queue.PriorityQueueManager;
import com.phillippitts.sessioncore.service.upload.AckCoordinator;
import com.phillippitts.sessioncore.service.upload.UploadTransport;
import com.phillippitts.sessioncore.service.window.WindowSessionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CoordinationHealthIndicatorTest {

    private AckCoordinator ackCoordinator;
    private UploadTransport transport;
    private WindowSessionRegistry windows;
    private PriorityQueueManager queue;
    private CoordinationHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        ackCoordinator = mock(AckCoordinator.class);
        transport = mock(UploadTransport.class);
        windows = mock(WindowSessionRegistry.class);
        queue = mock(PriorityQueueManager.class);
        indicator = new CoordinationHealthIndicator(ackCoordinator, transport, windows, queue);

        when(ackCoordinator.pendingCount()).thenReturn(2);
        when(windows.claimedSessions()).thenReturn(Set.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID()));
        when(windows.detachedSessions()).thenReturn(Set.of(UUID.randomUUID()));
        when(queue.size()).thenReturn(7);
    }

    @Test
    void shouldReportUpWhenTransportConnected() {
        when(transport.isConnected()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("pendingAcknowledgments", 2)
                .containsEntry("claimedSessions", 3)
                .containsEntry("detachedSessions", 1)
                .containsEntry("queueSize", 7)
                .doesNotContainKey("transport");
    }

    @Test
    void shouldReportDegradedWhenTransportDisconnected() {
        when(transport.isConnected()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("transport", "disconnected");
        assertThat(health.getDetails()).containsEntry("queueSize", 7);
    }
}
