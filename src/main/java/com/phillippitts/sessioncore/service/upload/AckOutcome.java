package com.phillippitts.sessioncore.service.upload;

import java.time.Instant;
import java.util.Objects;

/**
 * Result delivered exactly once to the caller of {@link AckCoordinator#beginRequest}.
 *
 * @param key        the key the request was registered under
 * @param requestId  identifier generated when the request was registered
 * @param status     terminal outcome
 * @param resolvedAt when the outcome was decided
 */
public record AckOutcome(String key, String requestId, AckStatus status, Instant resolvedAt) {

    public AckOutcome {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(resolvedAt, "resolvedAt must not be null");
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }
}
