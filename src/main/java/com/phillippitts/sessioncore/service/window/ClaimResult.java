package com.phillippitts.sessioncore.service.window;

import com.phillippitts.sessioncore.domain.SessionWindow;

import java.util.Objects;

/**
 * Outcome of a claim attempt.
 *
 * <p>{@code REDIRECTED} is not an error: another window already shows the session and the caller
 * should bring {@link #holder()} forward instead of displaying it itself.
 *
 * @param status claimed or redirected
 * @param holder the window that holds the claim after the attempt
 */
public record ClaimResult(Status status, SessionWindow holder) {

    public enum Status { CLAIMED, REDIRECTED }

    public ClaimResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(holder, "holder must not be null");
    }

    public static ClaimResult claimed(SessionWindow window) {
        return new ClaimResult(Status.CLAIMED, window);
    }

    public static ClaimResult redirected(SessionWindow holder) {
        return new ClaimResult(Status.REDIRECTED, holder);
    }

    public boolean isClaimed() {
        return status == Status.CLAIMED;
    }
}
