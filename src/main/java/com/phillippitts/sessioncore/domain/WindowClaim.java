package com.phillippitts.sessioncore.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * "Session S is currently displayed in window W".
 *
 * @param sessionId the claimed session
 * @param window    the window holding the claim
 */
public record WindowClaim(UUID sessionId, SessionWindow window) {

    public WindowClaim {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(window, "window must not be null");
    }
}
