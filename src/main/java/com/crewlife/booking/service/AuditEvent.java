package com.crewlife.booking.service;

public enum AuditEvent {
    SIGNED_LINK_CREATED,
    OTP_CREATED,
    OTP_SUPERSEDED,
    OTP_VERIFIED,
    OTP_FAILED,
    OTP_EXPIRED,
    INVITE_BLOCKED,
    TOKEN_ISSUED,
    TOKEN_CONFIRMED,
    TOKEN_CONSUMED,
    TOKEN_REJECTED,
    TOKEN_REVOKED,
    TOKEN_EXPIRED,
    INVITE_LOCKED,
    INVITE_UNLOCKED,
    SECRET_ROTATED,
    EMAIL_FAILED
}
