package com.crewlife.booking.exception;

/**
 * Exception thrown when the invite row store cannot complete an operation.
 * Wraps lower-level DynamoDB exceptions; callers treat it as a retryable outage.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
