package com.crewlife.booking.service;

import com.crewlife.booking.model.TokenStatus;

import java.time.Instant;

/**
 * Values returned by {@link CandidateAccessService}. None of them carries a code, a token
 * or a booking URL except {@link AccessGranted}.
 */
public final class CandidateViews {

    private CandidateViews() {
    }

    public record RequestPageView(String brand,
                                  String brandName,
                                  String textForEmail,
                                  String maskedEmail,
                                  boolean fullyVerified,
                                  Instant linkExpiresAt) {
    }

    public record RequestOtpCommand(String brand, String email, String textForEmail, Long ts, String sig) {
    }

    public record OtpRequested(String identityRef, Instant expiresAt, boolean emailSent) {
    }

    public record OtpVerified(boolean accessLinkSent, Instant accessExpiresAt) {
    }

    public record AccessPageView(String brand, String brandName, String textForEmail,
                                 TokenStatus tokenStatus, Instant expiresAt) {
    }

    public record AccessGranted(String redirectUrl) {
    }
}
