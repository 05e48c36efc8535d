package com.crewlife.booking.model;

/**
 * Lifecycle of the access token issued after a code is verified.
 *
 * <p>ISSUED → CONFIRMED → USED is the only success path. REVOKED and EXPIRED
 * are absorbing and reachable from ISSUED or CONFIRMED only.</p>
 */
public enum TokenStatus {
    ISSUED,
    CONFIRMED,
    USED,
    REVOKED,
    EXPIRED;

    /**
     * Whether the token can still be confirmed, consumed, revoked or expired.
     */
    public boolean isLive() {
        return this == ISSUED || this == CONFIRMED;
    }

    public boolean canTransitionTo(TokenStatus next) {
        if (next == null || next == this) {
            return false;
        }
        switch (this) {
            case ISSUED:
                return next == CONFIRMED || next == USED || next == REVOKED || next == EXPIRED;
            case CONFIRMED:
                return next == USED || next == REVOKED || next == EXPIRED;
            default:
                return false;
        }
    }
}
