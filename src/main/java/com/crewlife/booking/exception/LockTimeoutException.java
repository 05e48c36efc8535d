package com.crewlife.booking.exception;

/**
 * Thrown when the per-key lock for an identity could not be acquired in time.
 */
public class LockTimeoutException extends RuntimeException {

    public LockTimeoutException(String message) {
        super(message);
    }

    public LockTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
