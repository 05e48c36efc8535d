package com.crewlife.booking.service;

import com.crewlife.booking.exception.AccessError;
import com.crewlife.booking.exception.InviteAccessException;
import com.crewlife.booking.model.IdentityKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Recruiter and administrator operations: signing invitation links, revoking or
 * unlocking invites, reading history and rotating the signing secret.
 */
@Service
public class AdminInviteService {

    private static final Logger logger = LoggerFactory.getLogger(AdminInviteService.class);

    private final LinkSignatureService signatureService;
    private final SigningSecretService secretService;
    private final CandidateSource candidateSource;
    private final PositionDirectory positionDirectory;
    private final AccessTokenService tokenService;
    private final InviteReuseGuard reuseGuard;
    private final AuditLogger auditLogger;

    @Autowired
    public AdminInviteService(LinkSignatureService signatureService,
                              SigningSecretService secretService,
                              CandidateSource candidateSource,
                              PositionDirectory positionDirectory,
                              AccessTokenService tokenService,
                              InviteReuseGuard reuseGuard,
                              AuditLogger auditLogger) {
        this.signatureService = signatureService;
        this.secretService = secretService;
        this.candidateSource = candidateSource;
        this.positionDirectory = positionDirectory;
        this.tokenService = tokenService;
        this.reuseGuard = reuseGuard;
        this.auditLogger = auditLogger;
    }

    /**
     * Sign an invitation link after confirming the candidate is on the roster.
     */
    public AccessResult<SignedLink> createSignedLink(String brand, String email, String textForEmail, String actor) {
        return AccessResult.attempt("createSignedLink", () -> {
            requireCandidateFields(brand, email, textForEmail);
            IdentityKey identity = IdentityKey.of(brand, email, textForEmail);
            if (!candidateSource.verifyCandidate(identity.getBrand(), identity.getEmail(), identity.getTextForEmail())) {
                throw new InviteAccessException(AccessError.CANDIDATE_NOT_FOUND, "Candidate is not on the roster for this position");
            }
            SignedLink link = signatureService.signRequestLink(identity.getBrand(), identity.getEmail(), identity.getTextForEmail());
            auditLogger.record(AuditEvent.SIGNED_LINK_CREATED, identity.getBrand(), identity.getEmail(), null,
                "actor=" + actor + " expiresAt=" + link.expiresAt());
            return link;
        });
    }

    /**
     * @param textForEmail position to revoke, or null for every position of the brand
     */
    public AccessResult<Integer> revoke(String brand, String email, String textForEmail, String actor) {
        return AccessResult.attempt("revoke", () -> {
            if (!positionDirectory.isKnownBrand(brand) || !RecipientPolicy.isValidFormat(email)) {
                throw new InviteAccessException(AccessError.INVALID_REQUEST);
            }
            return tokenService.revoke(email, brand, textForEmail, actor);
        });
    }

    public AccessResult<TokenHistoryEntry> unlock(String brand, String email, String textForEmail,
                                                  String actor, String reason) {
        return AccessResult.attempt("unlock", () -> {
            requireCandidateFields(brand, email, textForEmail);
            if (actor == null || actor.isBlank() || reason == null || reason.isBlank()) {
                throw new InviteAccessException(AccessError.INVALID_REQUEST, "An unlock requires an actor and a reason");
            }
            return TokenHistoryEntry.from(reuseGuard.unlock(IdentityKey.of(brand, email, textForEmail), actor, reason));
        });
    }

    public AccessResult<List<TokenHistoryEntry>> history(String brand, String email) {
        return AccessResult.attempt("history", () -> {
            if (!positionDirectory.isKnownBrand(brand) || !RecipientPolicy.isValidFormat(email)) {
                throw new InviteAccessException(AccessError.INVALID_REQUEST);
            }
            return tokenService.history(email, brand);
        });
    }

    public AccessResult<Boolean> rotateSigningSecret(String actor) {
        return AccessResult.attempt("rotateSigningSecret", () -> {
            logger.warn("Signing secret rotation requested by {}; outstanding links become invalid", actor);
            secretService.rotate(actor);
            return Boolean.TRUE;
        });
    }

    private void requireCandidateFields(String brand, String email, String textForEmail) {
        if (!positionDirectory.isKnownBrand(brand)
                || !RecipientPolicy.isValidFormat(email)
                || textForEmail == null || textForEmail.isBlank()) {
            throw new InviteAccessException(AccessError.INVALID_REQUEST);
        }
        // The signed payload joins fields with this separator.
        if (textForEmail.contains(LinkSignatureService.DELIMITER)) {
            throw new InviteAccessException(AccessError.INVALID_REQUEST, "Position text contains a reserved character");
        }
    }
}
