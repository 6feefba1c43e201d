package com.phillippitts.sessioncore.presentation.controller;

import com.phillippitts.sessioncore.domain.QueueEntry;
import com.phillippitts.sessioncore.exception.QueueEntryNotFoundException;
import com.phillippitts.sessioncore.service.queue.PriorityQueueManager;
import com.phillippitts.sessioncore.service.upload.AckCoordinator;
import com.phillippitts.sessioncore.service.upload.UploadProgress;
import com.phillippitts.sessioncore.service.upload.UploadService;
import com.phillippitts.sessioncore.service.window.WindowSessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only diagnostics over the coordination state. Nothing here mutates claims, queue order or
 * pending uploads.
 */
@RestController
@RequestMapping("/coordination")
class CoordinationStatusController {

    private static final Logger LOG = LogManager.getLogger(CoordinationStatusController.class);

    private final AckCoordinator ackCoordinator;
    private final UploadService uploadService;
    private final WindowSessionRegistry windows;
    private final PriorityQueueManager queue;

    CoordinationStatusController(AckCoordinator ackCoordinator,
                                 UploadService uploadService,
                                 WindowSessionRegistry windows,
                                 PriorityQueueManager queue) {
        this.ackCoordinator = ackCoordinator;
        this.uploadService = uploadService;
        this.windows = windows;
        this.queue = queue;
    }

    @GetMapping("/status")
    ResponseEntity<StatusView> status() {
        LOG.debug("Coordination status requested");
        List<ClaimView> claims = windows.claims().stream()
                .map(c -> new ClaimView(c.sessionId(), c.window().title(), windows.isDetached(c.sessionId())))
                .toList();
        return ResponseEntity.ok(new StatusView(
                ackCoordinator.pendingKeys(),
                uploadService.progress(),
                claims,
                queue.snapshot(),
                Instant.now()));
    }

    @GetMapping("/queue/{sessionId}")
    ResponseEntity<QueueEntry> queueEntry(@PathVariable UUID sessionId) {
        return queue.snapshot().stream()
                .filter(e -> e.sessionId().equals(sessionId))
                .findFirst()
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new QueueEntryNotFoundException(sessionId));
    }

    record StatusView(List<String> pendingUploads,
                      List<UploadProgress> uploads,
                      List<ClaimView> claims,
                      List<QueueEntry> queue,
                      Instant timestamp) {
    }

    record ClaimView(UUID sessionId, String window, boolean detached) {
    }
}
