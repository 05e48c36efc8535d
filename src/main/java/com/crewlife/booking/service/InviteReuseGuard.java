package com.crewlife.booking.service;

import com.crewlife.booking.exception.AccessError;
import com.crewlife.booking.exception.InviteAccessException;
import com.crewlife.booking.model.IdentityKey;
import com.crewlife.booking.model.InviteLock;
import com.crewlife.booking.model.InviteRecord;
import com.crewlife.booking.model.TokenStatus;
import com.crewlife.booking.repository.InviteRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prevents an invite that was already completed, revoked or locked from being reopened
 * under a new code.
 *
 * <p>Consulted once, when a code is created. Rows are scanned newest first: the first row
 * carrying an administrator unlock override allows issuance, while any row with a used or
 * revoked token, or a lock flag, blocks it. Superseded code rows never block.</p>
 */
@Service
public class InviteReuseGuard {

    private static final Logger logger = LoggerFactory.getLogger(InviteReuseGuard.class);

    private final InviteRecordRepository repository;
    private final AuditLogger auditLogger;
    private final Clock clock;

    @Autowired
    public InviteReuseGuard(InviteRecordRepository repository, AuditLogger auditLogger, Clock clock) {
        this.repository = repository;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    public GuardDecision findBlocking(IdentityKey identity) {
        for (InviteRecord row : rowsFor(identity)) {
            if (row.hasUnlockOverride()) {
                logger.info("Issuance allowed by unlock override on row {}", row.getRowId());
                return GuardDecision.overridden(row);
            }
            if (row.getTokenStatus() == TokenStatus.USED) {
                return GuardDecision.blocked(row, "token already used");
            }
            if (row.getTokenStatus() == TokenStatus.REVOKED) {
                return GuardDecision.blocked(row, "token revoked");
            }
            if (row.hasLock()) {
                return GuardDecision.blocked(row, "invite locked");
            }
        }
        return GuardDecision.clear();
    }

    /**
     * Mark every row of the identity LOCKED. Runs synchronously after a token is consumed.
     *
     * @return number of rows newly locked
     */
    public int propagateLock(IdentityKey identity) {
        return lockRows(rowsFor(identity), identity.getBrand(), identity.getEmail());
    }

    /**
     * Lock every row sharing the stored identity key of {@code consumedRow}. Works for rows
     * that keep only the email hash.
     *
     * @return number of rows newly locked
     */
    public int propagateLock(InviteRecord consumedRow) {
        String identityKey = consumedRow.getIdentityKey();
        List<InviteRecord> rows = identityKey == null
            ? List.of(consumedRow)
            : repository.findByIdentityKey(identityKey).stream()
                .filter(row -> identityKey.equals(row.getIdentityKey()))
                .collect(Collectors.toList());
        return lockRows(rows, consumedRow.getBrand(), consumedRow.getEmail());
    }

    private int lockRows(List<InviteRecord> rows, String brand, String email) {
        Instant now = clock.instant();
        int locked = 0;
        for (InviteRecord row : rows) {
            if (!row.hasLock()) {
                repository.updateLock(row.getRowId(), InviteLock.LOCKED, now);
                locked++;
            }
        }
        auditLogger.record(AuditEvent.INVITE_LOCKED, brand, email, null, "rows=" + locked);
        return locked;
    }

    /**
     * Administrator override: re-open issuance for an identity by stamping UNLOCK on its
     * newest row.
     */
    public InviteRecord unlock(IdentityKey identity, String actor, String reason) {
        List<InviteRecord> rows = rowsFor(identity);
        if (rows.isEmpty()) {
            throw new InviteAccessException(AccessError.CANDIDATE_NOT_FOUND, "No invite exists for this candidate and position");
        }
        InviteRecord newest = rows.get(0);
        Instant now = clock.instant();
        repository.applyUnlockOverride(newest.getRowId(), actor, reason, now);
        newest.setLocked(InviteLock.UNLOCK);
        newest.setUnlockedBy(actor);
        newest.setUnlockReason(reason);
        newest.setUnlockedAt(now);
        newest.setUpdatedAt(now);

        logger.warn("Invite for {} unlocked by {}", identity, actor);
        auditLogger.record(AuditEvent.INVITE_UNLOCKED, identity.getBrand(), identity.getEmail(), newest.getRowId(),
            "actor=" + actor + " reason=" + reason);
        return newest;
    }

    private List<InviteRecord> rowsFor(IdentityKey identity) {
        return repository.findByIdentityKey(identity.identityKey()).stream()
            .filter(identity::matches)
            .sorted(Comparator.comparing(InviteRecord::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .collect(Collectors.toList());
    }
}
