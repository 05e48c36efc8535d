package com.crewlife.booking.service;

import com.crewlife.booking.model.InviteLock;
import com.crewlife.booking.model.InviteRecord;
import com.crewlife.booking.model.OtpStatus;
import com.crewlife.booking.model.TokenStatus;

import java.time.Instant;

/**
 * Admin view of one invite row. Never carries the token, its hash or the code.
 */
public record TokenHistoryEntry(String rowId,
                                String brand,
                                String textForEmail,
                                Instant createdAt,
                                OtpStatus otpStatus,
                                Integer otpAttempts,
                                TokenStatus tokenStatus,
                                Instant tokenExpiry,
                                Instant verifiedAt,
                                Instant usedAt,
                                InviteLock locked,
                                String unlockedBy) {

    public static TokenHistoryEntry from(InviteRecord row) {
        return new TokenHistoryEntry(row.getRowId(), row.getBrand(), row.getTextForEmail(), row.getCreatedAt(),
            row.getOtpStatus(), row.getOtpAttempts(), row.getTokenStatus(), row.getTokenExpiry(),
            row.getVerifiedAt(), row.getUsedAt(), row.getLocked(), row.getUnlockedBy());
    }
}
