package com.crewlife.booking.model;

import com.crewlife.booking.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;

import java.time.Instant;

/**
 * One invite issuance attempt for a (brand, email, position) identity.
 *
 * <p>Rows are created when a code is issued and then mutated in place by code
 * verification, token issuance and token consumption. They are never deleted and
 * double as the audit trail.</p>
 *
 * <p>Indexes:
 * IdentityKeyIndex (identityKey, createdAt) for the reuse guard and lock fan-out,
 * CandidateIndex (candidateKey, createdAt) for supersession and revocation by (email, brand),
 * TokenIndex (tokenHash) for access token lookups.</p>
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class InviteRecord {

    public static final String IDENTITY_INDEX = "IdentityKeyIndex";
    public static final String CANDIDATE_INDEX = "CandidateIndex";
    public static final String TOKEN_INDEX = "TokenIndex";

    /** Opaque row identity; also the single-use reference for code verification. */
    private String rowId;
    private Instant createdAt;
    private Instant updatedAt;

    private String brand;
    @ToString.Exclude
    private String email;
    private String emailHash;
    private String textForEmail;
    private String identityKey;
    private String candidateKey;

    /** SHA-256 of rowId and the code; the code itself is never stored. */
    @ToString.Exclude
    private String otpHash;
    private Instant otpExpiry;
    private Integer otpAttempts;
    private OtpStatus otpStatus;

    /** SHA-256 of the access token. */
    @ToString.Exclude
    private String tokenHash;
    private Instant tokenExpiry;
    private TokenStatus tokenStatus;

    private Instant verifiedAt;
    private Instant usedAt;
    private Instant revokedAt;

    private InviteLock locked;
    private Instant lockedAt;
    private String unlockedBy;
    private String unlockReason;
    private Instant unlockedAt;

    @ToString.Exclude
    private String bookingUrl;
    private String traceId;

    @DynamoDbPartitionKey
    public String getRowId() {
        return rowId;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = IDENTITY_INDEX)
    public String getIdentityKey() {
        return identityKey;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = CANDIDATE_INDEX)
    public String getCandidateKey() {
        return candidateKey;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = TOKEN_INDEX)
    public String getTokenHash() {
        return tokenHash;
    }

    @DynamoDbSecondarySortKey(indexNames = {IDENTITY_INDEX, CANDIDATE_INDEX})
    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getOtpExpiry() {
        return otpExpiry;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getTokenExpiry() {
        return tokenExpiry;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getVerifiedAt() {
        return verifiedAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUsedAt() {
        return usedAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getRevokedAt() {
        return revokedAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getLockedAt() {
        return lockedAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUnlockedAt() {
        return unlockedAt;
    }

    public boolean isOtpExpired(Instant now) {
        return otpExpiry != null && now.isAfter(otpExpiry);
    }

    public boolean isTokenExpired(Instant now) {
        return tokenExpiry != null && now.isAfter(tokenExpiry);
    }

    public int otpAttemptsOrZero() {
        return otpAttempts == null ? 0 : otpAttempts;
    }

    public boolean hasLock() {
        return locked == InviteLock.LOCKED;
    }

    public boolean hasUnlockOverride() {
        return locked == InviteLock.UNLOCK;
    }
}
