package com.crewlife.booking.exception;

/**
 * Thrown when an index key cannot be built from the given brand, hash or position text.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
