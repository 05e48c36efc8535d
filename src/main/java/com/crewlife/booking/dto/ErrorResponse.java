package com.crewlife.booking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body shared by every endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String error;
    private final String message;
    private final boolean retryable;
    private final Integer remainingAttempts;
    private final long timestamp;

    public ErrorResponse(String error, String message) {
        this(error, message, false, null);
    }

    public ErrorResponse(String error, String message, boolean retryable, Integer remainingAttempts) {
        this.error = error;
        this.message = message;
        this.retryable = retryable;
        this.remainingAttempts = remainingAttempts;
        this.timestamp = System.currentTimeMillis();
    }

    public String getError() { return error; }
    public String getMessage() { return message; }
    public boolean isRetryable() { return retryable; }
    public Integer getRemainingAttempts() { return remainingAttempts; }
    public long getTimestamp() { return timestamp; }
}
