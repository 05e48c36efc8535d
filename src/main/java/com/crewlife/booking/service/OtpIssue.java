package com.crewlife.booking.service;

import java.time.Instant;

/**
 * A freshly issued code. {@code rowId} is the reference the candidate submits the code against.
 */
public record OtpIssue(String rowId, String code, Instant expiresAt) {

    @Override
    public String toString() {
        return "OtpIssue{rowId=" + rowId + ", expiresAt=" + expiresAt + "}";
    }
}
