package com.crewlife.booking.service;

import com.crewlife.booking.config.BookingAccessProperties;
import com.crewlife.booking.exception.AccessError;
import com.crewlife.booking.exception.InviteAccessException;
import com.crewlife.booking.exception.LockTimeoutException;
import com.crewlife.booking.model.IdentityKey;
import com.crewlife.booking.model.InviteRecord;
import com.crewlife.booking.model.OtpStatus;
import com.crewlife.booking.repository.InviteRecordRepository;
import com.crewlife.booking.util.EmailHashes;
import com.crewlife.booking.util.InviteKeyFactory;
import com.crewlife.booking.util.SecureCodeGenerator;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Issues and verifies the numeric one-time codes bound to a (brand, email, position) identity.
 *
 * <p>Only a SHA-256 of the row id and the code is stored. At most one row per (email, brand)
 * is PENDING: issuing a code supersedes every earlier pending one.</p>
 */
@Service
public class OtpService {

    private static final Logger logger = LoggerFactory.getLogger(OtpService.class);

    private final InviteRecordRepository repository;
    private final InviteReuseGuard reuseGuard;
    private final BookingAccessProperties properties;
    private final ConsumeLockManager lockManager;
    private final AuditLogger auditLogger;
    private final Clock clock;

    @Autowired
    public OtpService(InviteRecordRepository repository,
                      InviteReuseGuard reuseGuard,
                      ConsumeLockManager lockManager,
                      BookingAccessProperties properties,
                      AuditLogger auditLogger,
                      Clock clock) {
        this.repository = repository;
        this.reuseGuard = reuseGuard;
        this.lockManager = lockManager;
        this.properties = properties;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    /**
     * Issue a new code for {@code identity}.
     *
     * @throws InviteAccessException with INVITE_BLOCKED if the identity already completed
     *         or was locked; nothing is written in that case
     * @throws LockTimeoutException if another issuance for the same candidate holds the lock
     */
    public OtpIssue createOtp(IdentityKey identity, String bookingUrl, String traceId) {
        return lockManager.withLock(identity.candidateKey(), () -> createLocked(identity, bookingUrl, traceId));
    }

    private OtpIssue createLocked(IdentityKey identity, String bookingUrl, String traceId) {
        GuardDecision decision = reuseGuard.findBlocking(identity);
        if (decision.blocked()) {
            logger.info("Code issuance blocked for {}: {}", identity, decision.reason());
            auditLogger.record(AuditEvent.INVITE_BLOCKED, identity.getBrand(), identity.getEmail(),
                decision.matchedRow().getRowId(), decision.reason());
            throw new InviteAccessException(AccessError.INVITE_BLOCKED);
        }

        Instant now = clock.instant();
        int superseded = supersedePending(identity, now);

        String rowId = UUID.randomUUID().toString();
        String code = SecureCodeGenerator.numericCode(properties.getOtp().getLength());
        Instant expiresAt = now.plus(properties.getOtpExpiry());

        InviteRecord record = new InviteRecord();
        record.setRowId(rowId);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        record.setBrand(identity.getBrand());
        record.setEmail(identity.getEmail());
        record.setEmailHash(identity.getEmailHash());
        record.setTextForEmail(identity.getTextForEmail());
        record.setIdentityKey(identity.identityKey());
        record.setCandidateKey(identity.candidateKey());
        record.setOtpHash(digestCode(rowId, code));
        record.setOtpExpiry(expiresAt);
        record.setOtpAttempts(0);
        record.setOtpStatus(OtpStatus.PENDING);
        record.setBookingUrl(bookingUrl);
        record.setTraceId(traceId);
        repository.append(record);

        logger.info("Issued code on row {} for {} (superseded {})", rowId, identity, superseded);
        auditLogger.record(AuditEvent.OTP_CREATED, identity.getBrand(), identity.getEmail(), rowId,
            "expiresAt=" + expiresAt);
        return new OtpIssue(rowId, code, expiresAt);
    }

    /**
     * Verify a code against the row it was issued on.
     *
     * @return the row, now VERIFIED
     * @throws InviteAccessException OTP_NOT_FOUND, OTP_EXPIRED, OTP_LOCKED, OTP_INVALID,
     *         OTP_ALREADY_VERIFIED or OTP_SUPERSEDED
     */
    public InviteRecord verifyOtp(String rowId, String submittedCode) {
        InviteRecord row = repository.findById(rowId)
            .orElseThrow(() -> new InviteAccessException(AccessError.OTP_NOT_FOUND));
        return verifyAgainst(row, submittedCode);
    }

    /**
     * Verify a code against the newest pending row for {@code identity}.
     */
    public InviteRecord verifyLatestOtp(IdentityKey identity, String submittedCode) {
        InviteRecord row = repository.findByIdentityKey(identity.identityKey()).stream()
            .filter(identity::matches)
            .filter(r -> r.getOtpStatus() != null && r.getOtpStatus().isPending())
            .findFirst()
            .orElseThrow(() -> new InviteAccessException(AccessError.OTP_NOT_FOUND));
        return verifyAgainst(row, submittedCode);
    }

    private InviteRecord verifyAgainst(InviteRecord row, String submittedCode) {
        OtpStatus status = row.getOtpStatus();
        if (status == null) {
            throw new InviteAccessException(AccessError.OTP_NOT_FOUND);
        }
        if (!status.isPending()) {
            throw new InviteAccessException(errorForSettled(status));
        }

        Instant now = clock.instant();
        int maxAttempts = properties.getOtp().getMaxAttempts();

        if (row.isOtpExpired(now)) {
            settle(row, OtpStatus.EXPIRED, now);
            auditLogger.record(AuditEvent.OTP_EXPIRED, row.getBrand(), row.getEmail(), row.getRowId());
            throw new InviteAccessException(AccessError.OTP_EXPIRED);
        }

        if (row.otpAttemptsOrZero() >= maxAttempts) {
            settle(row, OtpStatus.FAILED, now);
            throw new InviteAccessException(AccessError.OTP_LOCKED);
        }

        if (!codeMatches(row, submittedCode)) {
            int attempts = row.otpAttemptsOrZero() + 1;
            row.setOtpAttempts(attempts);
            if (attempts >= maxAttempts) {
                settle(row, OtpStatus.FAILED, now);
                logger.info("Code on row {} failed after {} attempts", row.getRowId(), attempts);
                auditLogger.record(AuditEvent.OTP_FAILED, row.getBrand(), row.getEmail(), row.getRowId(),
                    "attempts=" + attempts);
                throw new InviteAccessException(AccessError.OTP_LOCKED);
            }
            settle(row, OtpStatus.PENDING, now);
            logger.debug("Wrong code on row {} ({} of {})", row.getRowId(), attempts, maxAttempts);
            throw InviteAccessException.invalidOtp(maxAttempts - attempts);
        }

        settle(row, OtpStatus.VERIFIED, now);
        row.setVerifiedAt(now);
        auditLogger.record(AuditEvent.OTP_VERIFIED, row.getBrand(), row.getEmail(), row.getRowId());
        return row;
    }

    private int supersedePending(IdentityKey identity, Instant now) {
        int count = 0;
        for (InviteRecord row : repository.findByCandidateKey(identity.candidateKey())) {
            if (row.getOtpStatus() != OtpStatus.PENDING || !sameCandidate(identity, row)) {
                continue;
            }
            if (!repository.updatePendingOtp(row.getRowId(), OtpStatus.SUPERSEDED, row.otpAttemptsOrZero(), now)) {
                logger.debug("Row {} settled before it could be superseded", row.getRowId());
                continue;
            }
            auditLogger.record(AuditEvent.OTP_SUPERSEDED, row.getBrand(), row.getEmail(), row.getRowId());
            count++;
        }
        return count;
    }

    private static boolean sameCandidate(IdentityKey identity, InviteRecord row) {
        if (!identity.getBrand().equals(InviteKeyFactory.normalizeBrand(row.getBrand()))) {
            return false;
        }
        String email = InviteKeyFactory.normalizeEmail(row.getEmail());
        return email != null && !email.isEmpty()
            ? email.equals(identity.getEmail())
            : EmailHashes.matches(identity.getEmail(), row.getEmailHash());
    }

    /**
     * Write the code state only if it is still PENDING. A code settled concurrently fails with
     * the error for the state it settled in.
     */
    private void settle(InviteRecord row, OtpStatus status, Instant now) {
        if (!repository.updatePendingOtp(row.getRowId(), status, row.otpAttemptsOrZero(), now)) {
            OtpStatus current = repository.findById(row.getRowId())
                .map(InviteRecord::getOtpStatus)
                .orElse(null);
            logger.info("Code on row {} already settled as {}; {} dropped", row.getRowId(), current, status);
            throw new InviteAccessException(current == null
                ? AccessError.OTP_NOT_FOUND
                : errorForSettled(current));
        }
        row.setOtpStatus(status);
        row.setUpdatedAt(now);
    }

    private static AccessError errorForSettled(OtpStatus status) {
        switch (status) {
            case VERIFIED:
                return AccessError.OTP_ALREADY_VERIFIED;
            case SUPERSEDED:
                return AccessError.OTP_SUPERSEDED;
            case EXPIRED:
                return AccessError.OTP_EXPIRED;
            case FAILED:
                return AccessError.OTP_LOCKED;
            default:
                return AccessError.OTP_NOT_FOUND;
        }
    }

    private static boolean codeMatches(InviteRecord row, String submittedCode) {
        if (submittedCode == null || row.getOtpHash() == null) {
            return false;
        }
        String computed = digestCode(row.getRowId(), submittedCode.trim());
        return MessageDigest.isEqual(
            computed.getBytes(StandardCharsets.UTF_8),
            row.getOtpHash().getBytes(StandardCharsets.UTF_8));
    }

    static String digestCode(String rowId, String code) {
        return DigestUtils.sha256Hex(rowId + ":" + code);
    }
}
