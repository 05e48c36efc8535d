package com.crewlife.booking.model;

/**
 * Lifecycle of the one-time code stored on an invite row.
 * PENDING is the only non-terminal value.
 */
public enum OtpStatus {
    PENDING,
    VERIFIED,
    EXPIRED,
    FAILED,
    SUPERSEDED;

    public boolean isPending() {
        return this == PENDING;
    }
}
