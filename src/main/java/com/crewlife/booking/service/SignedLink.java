package com.crewlife.booking.service;

import java.time.Instant;

public record SignedLink(String url, String signature, long issuedAt, Instant expiresAt) {
}
