package com.phillippitts.sessioncore.exception;

/**
 * Base exception for all sessioncore application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SessionCoreException extends RuntimeException {

    public SessionCoreException(String message) {
        super(message);
    }

    public SessionCoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public SessionCoreException(Throwable cause) {
        super(cause);
    }
}
