package com.crewlife.booking.service;

import com.crewlife.booking.model.InviteRecord;

/**
 * Result of a reuse check. {@code matchedRow} is the row that decided the outcome, if any.
 */
public record GuardDecision(boolean blocked, InviteRecord matchedRow, String reason) {

    public static GuardDecision clear() {
        return new GuardDecision(false, null, "no prior completed invite");
    }

    public static GuardDecision overridden(InviteRecord row) {
        return new GuardDecision(false, row, "unlocked by " + row.getUnlockedBy());
    }

    public static GuardDecision blocked(InviteRecord row, String reason) {
        return new GuardDecision(true, row, reason);
    }
}
