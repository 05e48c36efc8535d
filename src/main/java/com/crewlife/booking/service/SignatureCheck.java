package com.crewlife.booking.service;

/**
 * Outcome of checking a signed link.
 */
public enum SignatureCheck {
    VALID,
    /** Signature missing, malformed or not matching the fields. */
    INVALID,
    /** Older than the allowed link age. */
    EXPIRED,
    /** Issued further in the future than the clock skew allows. */
    NOT_YET_VALID;

    public boolean isValid() {
        return this == VALID;
    }
}
