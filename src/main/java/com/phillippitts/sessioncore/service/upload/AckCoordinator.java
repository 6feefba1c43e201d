package com.phillippitts.sessioncore.service.upload;

import com.phillippitts.sessioncore.config.logging.MdcTaskDecorator;
import com.phillippitts.sessioncore.exception.DuplicateRequestKeyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns "send a request, later receive a keyed acknowledgment, or time out" into a single
 * future that completes exactly once.
 *
 * <p><b>Resolution model:</b> every outstanding request is a {@link PendingCompletion} in a
 * {@link ConcurrentHashMap} keyed by the request key. All completion paths (acknowledgment by
 * key, acknowledgment by echoed request id, fallback match, timeout, transport failure) go through
 * {@link #completeIfPending(PendingCompletion, AckStatus)}, which uses {@code remove(key, pending)} as the
 * single atomic check-and-remove. The path that removes the entry completes the future; every
 * other path observes "already resolved" and does nothing.
 *
 * <p><b>Races:</b> a response for an unknown key (it lost to the timeout, or was never
 * registered) is logged and dropped. Neither path blocks beyond map access.
 *
 * <p><b>Cancellation:</b> callers may cancel the returned future. The pending entry stays in the
 * table and is drained by the next acknowledgment or by its timeout; the outcome is discarded.
 *
 * <p><b>Request ids:</b> each registration gets a generated id that is stamped into the outbound
 * message. Backends that echo it are matched by id, which is immune to server-side renames;
 * {@link #resolveByFallbackMatch(String, AckStatus)} remains for backends that do not.
 *
 * @since 1.0
 */
@Service
public class AckCoordinator {

    private static final Logger LOG = LogManager.getLogger(AckCoordinator.class);
    private static final TaskDecorator MDC = new MdcTaskDecorator();

    private final ConcurrentMap<String, PendingCompletion> pending = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private final UploadTransport transport;
    private final UploadMessageCodec codec;
    private final TaskScheduler scheduler;
    private final Clock clock;

    public AckCoordinator(UploadTransport transport,
                          UploadMessageCodec codec,
                          @Qualifier("ackTimeoutScheduler") TaskScheduler scheduler) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = scheduler.getClock();
    }

    /**
     * Registers a pending completion under {@code key}, sends the payload and starts the timeout.
     * If the timeout cannot be scheduled the request is not sent and resolves with
     * {@code TRANSPORT_FAILURE}. The timeout task runs with the caller's ThreadContext.
     *
     * @param key     correlation key (the resource's filename)
     * @param payload outbound message; its request id is replaced by a generated one
     * @param timeout how long to wait for an acknowledgment
     * @return future completing exactly once with the outcome
     * @throws DuplicateRequestKeyException if a request is already pending for {@code key}
     * @throws IllegalArgumentException if timeout is not positive
     */
    public CompletableFuture<AckOutcome> beginRequest(String key, UploadMessage payload, Duration timeout) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeout);
        }

        String requestId = UUID.randomUUID().toString();
        PendingCompletion pc = new PendingCompletion(key, requestId, clock.instant(), sequence.incrementAndGet());
        if (pending.putIfAbsent(key, pc) != null) {
            throw new DuplicateRequestKeyException(key);
        }

        // Armed before sending; an ack that beats armTimeout leaves a timer that finds nothing to remove
        try {
            pc.armTimeout(scheduler.schedule(MDC.decorate(() -> onTimeout(pc)), clock.instant().plus(timeout)));
        } catch (RuntimeException e) {
            LOG.warn("Could not schedule timeout, not sending: key={}, reason={}", key, e.getMessage());
            completeIfPending(pc, AckStatus.TRANSPORT_FAILURE);
            return pc.future();
        }

        try {
            transport.send(codec.encode(payload.withRequestId(requestId)));
            LOG.debug("Request sent: key={}, requestId={}, timeout={}", key, requestId, timeout);
        } catch (RuntimeException e) {
            LOG.warn("Transport failed to send request: key={}, reason={}", key, e.getMessage());
            completeIfPending(pc, AckStatus.TRANSPORT_FAILURE);
        }
        return pc.future();
    }

    /**
     * Resolves the request registered under {@code key}.
     *
     * @return true if this call resolved it; false if nothing was pending (late or unknown)
     */
    public boolean resolve(String key, AckStatus status) {
        Objects.requireNonNull(status, "status");
        if (key == null) {
            return false;
        }
        PendingCompletion pc = pending.get(key);
        if (pc == null) {
            LOG.debug("No pending request for key={}, dropping {} response", key, status);
            return false;
        }
        return completeIfPending(pc, status);
    }

    /**
     * Resolves the request whose generated id the backend echoed.
     *
     * @return true if this call resolved it; false if no pending request carries that id
     */
    public boolean resolveByRequestId(String requestId, AckStatus status) {
        Objects.requireNonNull(status, "status");
        if (requestId == null) {
            return false;
        }
        for (PendingCompletion pc : pending.values()) {
            if (pc.requestId().equals(requestId)) {
                return completeIfPending(pc, status);
            }
        }
        LOG.debug("No pending request for requestId={}, dropping {} response", requestId, status);
        return false;
    }

    /**
     * Resolves the only pending request when a response names a key nobody registered (the
     * backend renamed the resource to avoid a collision).
     *
     * <p>With zero or several pending requests the match would be a guess, so nothing happens.
     *
     * @param reportedKey key named by the response, for logging
     * @return true if the single pending request was resolved by this call
     */
    public boolean resolveByFallbackMatch(String reportedKey, AckStatus status) {
        Objects.requireNonNull(status, "status");
        List<PendingCompletion> snapshot = new ArrayList<>(pending.values());
        if (snapshot.size() != 1) {
            LOG.info("Ambiguous fallback match for reported key={}: {} requests pending, dropping response",
                    reportedKey, snapshot.size());
            return false;
        }
        PendingCompletion only = snapshot.get(0);
        LOG.warn("Key mismatch: sent '{}', received '{}'. Resolving the only pending request.",
                only.key(), reportedKey);
        return completeIfPending(only, status);
    }

    /**
     * @return number of requests still awaiting an outcome
     */
    public int pendingCount() {
        return pending.size();
    }

    public boolean isPending(String key) {
        return key != null && pending.containsKey(key);
    }

    /**
     * @return pending keys, oldest registration first
     */
    public List<String> pendingKeys() {
        return pending.values().stream()
                .sorted(Comparator.comparingLong(PendingCompletion::sequence))
                .map(PendingCompletion::key)
                .toList();
    }

    private void onTimeout(PendingCompletion pc) {
        if (completeIfPending(pc, AckStatus.TIMEOUT)) {
            LOG.warn("Request timed out: key={}, requestId={}", pc.key(), pc.requestId());
        }
    }

    /**
     * The single removal primitive shared by every resolution path.
     */
    private boolean completeIfPending(PendingCompletion pc, AckStatus status) {
        if (!pending.remove(pc.key(), pc)) {
            return false;
        }
        pc.disarmTimeout();
        AckOutcome outcome = new AckOutcome(pc.key(), pc.requestId(), status, clock.instant());
        if (!pc.future().complete(outcome)) {
            LOG.info("Caller abandoned request key={}; discarding {} outcome", pc.key(), status);
        } else {
            LOG.debug("Request resolved: key={}, status={}", pc.key(), status);
        }
        return true;
    }
}
