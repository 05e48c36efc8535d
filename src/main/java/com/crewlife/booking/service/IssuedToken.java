package com.crewlife.booking.service;

import java.time.Instant;

public record IssuedToken(String token, Instant expiresAt, String rowId) {

    @Override
    public String toString() {
        return "IssuedToken{rowId=" + rowId + ", expiresAt=" + expiresAt + "}";
    }
}
