package com.crewlife.booking.model;

/**
 * Per-row lock flag. An absent value means the row carries no lock.
 */
public enum InviteLock {
    /** Set on every row of an identity once its token is consumed. */
    LOCKED,
    /** Administrator override; re-opens issuance for the identity. */
    UNLOCK
}
