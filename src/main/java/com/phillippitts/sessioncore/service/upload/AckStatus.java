package com.phillippitts.sessioncore.service.upload;

/**
 * Terminal outcome of an acknowledged request. None of these is retried by the coordinator;
 * retry policy belongs to the caller.
 */
public enum AckStatus {
    /** Backend confirmed the request. */
    ACKNOWLEDGED,
    /** Backend answered with an error for the request. */
    REJECTED,
    /** No answer within the configured window. */
    TIMEOUT,
    /** The transport refused to send the request. */
    TRANSPORT_FAILURE;

    public boolean isSuccess() {
        return this == ACKNOWLEDGED;
    }
}
