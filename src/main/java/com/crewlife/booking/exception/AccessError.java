package com.crewlife.booking.exception;

import org.springframework.http.HttpStatus;

/**
 * Every way a candidate access flow can fail.
 *
 * <p>Only {@link #STORE_UNAVAILABLE}, {@link #LOCK_TIMEOUT} and {@link #RATE_LIMITED} are
 * worth retrying; everything else requires a fresh link or code. Messages about the
 * candidate never say whether an address is known.</p>
 */
public enum AccessError {
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, false,
        "The request is incomplete or malformed."),
    SIGNATURE_INVALID(HttpStatus.FORBIDDEN, false,
        "This link is not valid. Please use the link from your invitation email."),
    LINK_EXPIRED(HttpStatus.GONE, false,
        "This invitation link has expired. Please contact your recruiter for a new one."),
    CANDIDATE_NOT_FOUND(HttpStatus.FORBIDDEN, false,
        "We could not start verification for this invitation. Please contact your recruiter."),
    INVITE_BLOCKED(HttpStatus.FORBIDDEN, false,
        "This invitation has already been used. Please contact your recruiter if you need to reschedule."),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, true,
        "Too many requests. Please wait a moment and try again."),
    OTP_NOT_FOUND(HttpStatus.NOT_FOUND, false,
        "No active verification code was found. Please request a new code."),
    OTP_EXPIRED(HttpStatus.GONE, false,
        "Your verification code has expired. Please request a new code."),
    OTP_LOCKED(HttpStatus.FORBIDDEN, false,
        "Too many incorrect attempts. Please request a new code."),
    OTP_INVALID(HttpStatus.UNAUTHORIZED, false,
        "The verification code is incorrect."),
    OTP_ALREADY_VERIFIED(HttpStatus.CONFLICT, false,
        "This code has already been used. Check your email for the access link."),
    OTP_SUPERSEDED(HttpStatus.GONE, false,
        "A newer verification code was sent. Please use the most recent code."),
    TOKEN_NOT_FOUND(HttpStatus.NOT_FOUND, false,
        "This access link is not valid."),
    TOKEN_EXPIRED(HttpStatus.GONE, false,
        "This access link has expired. Please request a new invitation."),
    TOKEN_ALREADY_USED(HttpStatus.CONFLICT, false,
        "This access link has already been used."),
    TOKEN_REVOKED(HttpStatus.GONE, false,
        "This access link has been cancelled. Please contact your recruiter."),
    TOKEN_BRAND_MISMATCH(HttpStatus.FORBIDDEN, false,
        "This access link is not valid for this brand."),
    TOKEN_NOT_VERIFIED(HttpStatus.FORBIDDEN, false,
        "This access link is not valid."),
    BOOKING_URL_MISSING(HttpStatus.UNPROCESSABLE_ENTITY, false,
        "No booking calendar is configured for this position. Please contact your recruiter."),
    BOOKING_URL_INVALID(HttpStatus.UNPROCESSABLE_ENTITY, false,
        "The booking calendar for this position is misconfigured. Please contact your recruiter."),
    LOCK_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, true,
        "The system is busy. Please try again in a few seconds."),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true,
        "The service is temporarily unavailable. Please try again shortly.");

    private final HttpStatus httpStatus;
    private final boolean retryable;
    private final String userMessage;

    AccessError(HttpStatus httpStatus, boolean retryable, String userMessage) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
        this.userMessage = userMessage;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
