package com.crewlife.booking.repository;

import com.crewlife.booking.model.InviteLock;
import com.crewlife.booking.model.InviteRecord;
import com.crewlife.booking.model.OtpStatus;
import com.crewlife.booking.model.TokenStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Row store for invite records.
 *
 * <p>Every lookup that precedes a write decision returns the full current row
 * (strongly consistent reads on the base table). Index queries are used only to
 * find row ids.</p>
 */
public interface InviteRecordRepository {

    /**
     * Insert a new row. Fails if a row with the same id already exists.
     */
    void append(InviteRecord record);

    /**
     * Overwrite the full row.
     */
    void save(InviteRecord record);

    Optional<InviteRecord> findById(String rowId);

    /**
     * Find the row holding the access token with the given hash.
     */
    Optional<InviteRecord> findByTokenHash(String tokenHash);

    /**
     * All rows sharing an identity key, newest first.
     */
    List<InviteRecord> findByIdentityKey(String identityKey);

    /**
     * All rows for an (email, brand) pair across positions, newest first.
     */
    List<InviteRecord> findByCandidateKey(String candidateKey);

    /**
     * Atomically move the token of {@code rowId} to {@code next}, but only if its current
     * status is one of {@code expected}. Stamps usedAt or revokedAt as appropriate.
     *
     * @return false if the row's status no longer matched
     */
    boolean compareAndSetTokenStatus(String rowId, Set<TokenStatus> expected, TokenStatus next, Instant at);

    /**
     * Write the code state of {@code rowId}, but only while its code is still PENDING.
     * {@code next} may be PENDING to record a wrong guess. Stamps verifiedAt for VERIFIED.
     *
     * @return false if the code was settled concurrently
     */
    boolean updatePendingOtp(String rowId, OtpStatus next, int attempts, Instant at);

    /**
     * Attach an issued token to a VERIFIED row that carries no token yet.
     *
     * @return false if the row already has a token or is not verified
     */
    boolean attachToken(String rowId, String tokenHash, Instant tokenExpiry, Instant at);

    /**
     * Set the lock flag of an existing row.
     */
    void updateLock(String rowId, InviteLock lock, Instant at);

    /**
     * Stamp an administrator unlock override on an existing row.
     */
    void applyUnlockOverride(String rowId, String actor, String reason, Instant at);
}
