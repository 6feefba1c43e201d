package com.phillippitts.sessioncore.exception;

/**
 * Thrown when a request is registered under a key that already has an outstanding
 * acknowledgment. Callers are expected to serialize requests per key, so this signals misuse
 * rather than a race.
 */
public class DuplicateRequestKeyException extends SessionCoreException {

    private final String key;

    public DuplicateRequestKeyException(String key) {
        super("A request is already pending for key: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
