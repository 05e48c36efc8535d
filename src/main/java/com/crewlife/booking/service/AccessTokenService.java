package com.crewlife.booking.service;

import com.crewlife.booking.config.BookingAccessProperties;
import com.crewlife.booking.exception.AccessError;
import com.crewlife.booking.exception.InviteAccessException;
import com.crewlife.booking.exception.RepositoryException;
import com.crewlife.booking.model.IdentityKey;
import com.crewlife.booking.model.InviteRecord;
import com.crewlife.booking.model.OtpStatus;
import com.crewlife.booking.model.TokenStatus;
import com.crewlife.booking.repository.InviteRecordRepository;
import com.crewlife.booking.util.EmailHashes;
import com.crewlife.booking.util.InviteKeyFactory;
import com.crewlife.booking.util.LogMasking;
import com.crewlife.booking.util.SecureCodeGenerator;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Issues, validates and consumes the access tokens that stand between a verified
 * candidate and the booking calendar.
 *
 * <p>Reading a token ({@link #validate}) only ever moves it from ISSUED to CONFIRMED, so
 * link previewers can open the confirmation page harmlessly. {@link #consume} is the only
 * path that reveals the booking URL: under a per-identity lock it re-reads the row, marks
 * it USED with a conditional write, propagates the invite lock and only then returns.</p>
 */
@Service
public class AccessTokenService {

    private static final Logger logger = LoggerFactory.getLogger(AccessTokenService.class);
    static final int TOKEN_BYTES = 32;
    private static final Set<TokenStatus> LIVE = EnumSet.of(TokenStatus.ISSUED, TokenStatus.CONFIRMED);

    private final InviteRecordRepository repository;
    private final InviteReuseGuard reuseGuard;
    private final ConsumeLockManager lockManager;
    private final BookingUrlPolicy bookingUrlPolicy;
    private final BookingAccessProperties properties;
    private final AuditLogger auditLogger;
    private final Clock clock;

    @Autowired
    public AccessTokenService(InviteRecordRepository repository,
                              InviteReuseGuard reuseGuard,
                              ConsumeLockManager lockManager,
                              BookingUrlPolicy bookingUrlPolicy,
                              BookingAccessProperties properties,
                              AuditLogger auditLogger,
                              Clock clock) {
        this.repository = repository;
        this.reuseGuard = reuseGuard;
        this.lockManager = lockManager;
        this.bookingUrlPolicy = bookingUrlPolicy;
        this.properties = properties;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    /**
     * Issue an access token for a row whose code was just verified.
     *
     * @throws IllegalStateException if the row is not verified or already has a token
     * @throws InviteAccessException OTP_ALREADY_VERIFIED if a token was attached concurrently
     */
    public IssuedToken issueToken(InviteRecord verifiedRow) {
        if (verifiedRow.getOtpStatus() != OtpStatus.VERIFIED) {
            throw new IllegalStateException("Token can only be issued for a verified row");
        }
        if (verifiedRow.getTokenStatus() != null) {
            throw new IllegalStateException("Row " + verifiedRow.getRowId() + " already has a token");
        }

        Instant now = clock.instant();
        String token = SecureCodeGenerator.urlSafeToken(TOKEN_BYTES);
        Instant expiresAt = now.plus(properties.getTokenExpiry(verifiedRow.getBrand()));

        String tokenHash = hashToken(token);
        if (!repository.attachToken(verifiedRow.getRowId(), tokenHash, expiresAt, now)) {
            throw new InviteAccessException(AccessError.OTP_ALREADY_VERIFIED);
        }
        verifiedRow.setTokenHash(tokenHash);
        verifiedRow.setTokenExpiry(expiresAt);
        verifiedRow.setTokenStatus(TokenStatus.ISSUED);
        verifiedRow.setUpdatedAt(now);

        logger.info("Issued access token {} on row {}", LogMasking.maskToken(token), verifiedRow.getRowId());
        auditLogger.record(AuditEvent.TOKEN_ISSUED, verifiedRow.getBrand(), verifiedRow.getEmail(),
            verifiedRow.getRowId(), "expiresAt=" + expiresAt);
        return new IssuedToken(token, expiresAt, verifiedRow.getRowId());
    }

    /**
     * Read path. Confirms the token on first successful read and never reveals the booking URL.
     *
     * @param expectedBrand brand the caller expects, or null to skip the check
     * @throws InviteAccessException TOKEN_NOT_FOUND, TOKEN_EXPIRED, TOKEN_ALREADY_USED,
     *         TOKEN_REVOKED, TOKEN_BRAND_MISMATCH or TOKEN_NOT_VERIFIED
     */
    public InviteRecord validate(String token, String expectedBrand) {
        InviteRecord row = lookup(token);
        Instant now = clock.instant();
        checkUsable(row, now);

        if (expectedBrand != null && !InviteKeyFactory.normalizeBrand(expectedBrand).equals(row.getBrand())) {
            throw new InviteAccessException(AccessError.TOKEN_BRAND_MISMATCH);
        }

        if (row.getTokenStatus() == TokenStatus.ISSUED) {
            if (repository.compareAndSetTokenStatus(row.getRowId(), EnumSet.of(TokenStatus.ISSUED), TokenStatus.CONFIRMED, now)) {
                row.setTokenStatus(TokenStatus.CONFIRMED);
                row.setUpdatedAt(now);
                auditLogger.record(AuditEvent.TOKEN_CONFIRMED, row.getBrand(), row.getEmail(), row.getRowId());
            } else {
                row = repository.findById(row.getRowId())
                    .orElseThrow(() -> new InviteAccessException(AccessError.TOKEN_NOT_FOUND));
                checkUsable(row, now);
            }
        }
        return row;
    }

    /**
     * Write path. Spends the token and returns the booking destination, at most once.
     *
     * @throws InviteAccessException TOKEN_* errors, BOOKING_URL_MISSING or BOOKING_URL_INVALID
     * @throws com.crewlife.booking.exception.LockTimeoutException if the identity lock is busy
     */
    public ConsumedAccess consume(String token) {
        InviteRecord located = lookup(token);
        String lockKey = located.getIdentityKey() != null ? located.getIdentityKey() : located.getRowId();
        return lockManager.withLock(lockKey, () -> consumeLocked(located.getRowId()));
    }

    private ConsumedAccess consumeLocked(String rowId) {
        InviteRecord row = repository.findById(rowId)
            .orElseThrow(() -> new InviteAccessException(AccessError.TOKEN_NOT_FOUND));
        Instant now = clock.instant();
        checkUsable(row, now);
        String bookingUrl = bookingUrlPolicy.requireValid(row.getBookingUrl());

        if (!repository.compareAndSetTokenStatus(rowId, LIVE, TokenStatus.USED, now)) {
            auditLogger.record(AuditEvent.TOKEN_REJECTED, row.getBrand(), row.getEmail(), rowId, "lost consume race");
            throw new InviteAccessException(AccessError.TOKEN_ALREADY_USED);
        }
        auditLogger.record(AuditEvent.TOKEN_CONSUMED, row.getBrand(), row.getEmail(), rowId,
            "url=" + LogMasking.maskUrl(bookingUrl));

        try {
            reuseGuard.propagateLock(row);
        } catch (RepositoryException e) {
            // The USED row alone keeps the guard closed for this identity.
            logger.error("Lock propagation failed for {} after consuming row {}", row.getIdentityKey(), rowId, e);
        }
        return new ConsumedAccess(bookingUrl, row.getBrand(), row.getTextForEmail(), rowId);
    }

    /**
     * Revoke every live token for the candidate. With a null {@code textForEmail} all of the
     * candidate's positions for the brand are revoked.
     *
     * @return number of tokens revoked
     */
    public int revoke(String email, String brand, String textForEmail, String actor) {
        List<InviteRecord> rows = candidateRows(email, brand, textForEmail);
        Instant now = clock.instant();
        int revoked = 0;
        for (InviteRecord row : rows) {
            if (row.getTokenStatus() == null || !row.getTokenStatus().isLive()) {
                continue;
            }
            if (repository.compareAndSetTokenStatus(row.getRowId(), LIVE, TokenStatus.REVOKED, now)) {
                revoked++;
                auditLogger.record(AuditEvent.TOKEN_REVOKED, row.getBrand(), row.getEmail(), row.getRowId(),
                    "actor=" + actor);
            }
        }
        logger.info("Revoked {} token(s) for {} on {}", revoked, LogMasking.maskEmail(email), brand);
        return revoked;
    }

    /**
     * Every row for (email, brand), newest first.
     */
    public List<TokenHistoryEntry> history(String email, String brand) {
        return candidateRows(email, brand, null).stream()
            .map(TokenHistoryEntry::from)
            .collect(Collectors.toList());
    }

    private List<InviteRecord> candidateRows(String email, String brand, String textForEmail) {
        if (textForEmail != null && !textForEmail.isBlank()) {
            IdentityKey identity = IdentityKey.of(brand, email, textForEmail);
            return repository.findByIdentityKey(identity.identityKey()).stream()
                .filter(identity::matches)
                .collect(Collectors.toList());
        }
        String normalizedBrand = InviteKeyFactory.normalizeBrand(brand);
        String candidateKey = InviteKeyFactory.getCandidateKey(normalizedBrand, EmailHashes.hash(email));
        String normalizedEmail = InviteKeyFactory.normalizeEmail(email);
        return repository.findByCandidateKey(candidateKey).stream()
            .filter(row -> normalizedBrand.equals(row.getBrand()))
            .filter(row -> row.getEmail() != null
                ? normalizedEmail.equals(InviteKeyFactory.normalizeEmail(row.getEmail()))
                : EmailHashes.matches(normalizedEmail, row.getEmailHash()))
            .collect(Collectors.toList());
    }

    private InviteRecord lookup(String token) {
        if (token == null || token.isBlank()) {
            throw new InviteAccessException(AccessError.TOKEN_NOT_FOUND);
        }
        return repository.findByTokenHash(hashToken(token.trim()))
            .orElseThrow(() -> new InviteAccessException(AccessError.TOKEN_NOT_FOUND));
    }

    private void checkUsable(InviteRecord row, Instant now) {
        TokenStatus status = row.getTokenStatus();
        if (status == null) {
            throw new InviteAccessException(AccessError.TOKEN_NOT_FOUND);
        }
        switch (status) {
            case USED:
                throw new InviteAccessException(AccessError.TOKEN_ALREADY_USED);
            case REVOKED:
                throw new InviteAccessException(AccessError.TOKEN_REVOKED);
            case EXPIRED:
                throw new InviteAccessException(AccessError.TOKEN_EXPIRED);
            default:
                break;
        }
        if (row.isTokenExpired(now)) {
            if (repository.compareAndSetTokenStatus(row.getRowId(), LIVE, TokenStatus.EXPIRED, now)) {
                row.setTokenStatus(TokenStatus.EXPIRED);
                auditLogger.record(AuditEvent.TOKEN_EXPIRED, row.getBrand(), row.getEmail(), row.getRowId());
            }
            throw new InviteAccessException(AccessError.TOKEN_EXPIRED);
        }
        if (row.getOtpStatus() != OtpStatus.VERIFIED) {
            throw new InviteAccessException(AccessError.TOKEN_NOT_VERIFIED);
        }
    }

    static String hashToken(String token) {
        return DigestUtils.sha256Hex(token);
    }
}
