package com.crewlife.booking.service;

import com.crewlife.booking.config.BookingAccessProperties;
import com.crewlife.booking.exception.AccessError;
import com.crewlife.booking.exception.InviteAccessException;
import com.crewlife.booking.model.IdentityKey;
import com.crewlife.booking.model.InviteRecord;
import com.crewlife.booking.service.CandidateViews.AccessGranted;
import com.crewlife.booking.service.CandidateViews.AccessPageView;
import com.crewlife.booking.service.CandidateViews.OtpRequested;
import com.crewlife.booking.service.CandidateViews.OtpVerified;
import com.crewlife.booking.service.CandidateViews.RequestOtpCommand;
import com.crewlife.booking.service.CandidateViews.RequestPageView;
import com.crewlife.booking.service.NotificationService.MessageContext;
import com.crewlife.booking.util.InviteKeyFactory;
import com.crewlife.booking.util.LogMasking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * The candidate-facing flows: open the invitation, request a code, verify it, open the
 * access page and confirm access.
 *
 * <p>Each method returns an {@link AccessResult}; rule violations and store outages never
 * propagate past this class. Messages never reveal whether an address is on the roster.</p>
 */
@Service
public class CandidateAccessService {

    private static final Logger logger = LoggerFactory.getLogger(CandidateAccessService.class);

    private final LinkSignatureService signatureService;
    private final OtpService otpService;
    private final AccessTokenService tokenService;
    private final NotificationService notificationService;
    private final CandidateSource candidateSource;
    private final PositionDirectory positionDirectory;
    private final BookingUrlPolicy bookingUrlPolicy;
    private final RateLimitingService rateLimitingService;
    private final BookingAccessProperties properties;
    private final AuditLogger auditLogger;

    @Autowired
    public CandidateAccessService(LinkSignatureService signatureService,
                                  OtpService otpService,
                                  AccessTokenService tokenService,
                                  NotificationService notificationService,
                                  CandidateSource candidateSource,
                                  PositionDirectory positionDirectory,
                                  BookingUrlPolicy bookingUrlPolicy,
                                  RateLimitingService rateLimitingService,
                                  BookingAccessProperties properties,
                                  AuditLogger auditLogger) {
        this.signatureService = signatureService;
        this.otpService = otpService;
        this.tokenService = tokenService;
        this.notificationService = notificationService;
        this.candidateSource = candidateSource;
        this.positionDirectory = positionDirectory;
        this.bookingUrlPolicy = bookingUrlPolicy;
        this.rateLimitingService = rateLimitingService;
        this.properties = properties;
        this.auditLogger = auditLogger;
    }

    /**
     * Check an invitation link before the request page renders. When the email or position
     * is missing only the link age and signature shape are checked; the full signature is
     * confirmed when the code is requested.
     */
    public AccessResult<RequestPageView> openRequestPage(String brand, String email, String textForEmail,
                                                         Long ts, String sig) {
        return AccessResult.attempt("openRequestPage", () -> {
            if (!positionDirectory.isKnownBrand(brand) || ts == null) {
                throw new InviteAccessException(AccessError.INVALID_REQUEST);
            }
            boolean full = !isBlank(email) && !isBlank(textForEmail);
            SignatureCheck check = full
                ? signatureService.verifyRequestLink(brand, email, textForEmail, sig, ts)
                : signatureService.precheck(sig, ts, properties.getLinkMaxAge());
            requireValid(check);

            String code = InviteKeyFactory.normalizeBrand(brand);
            return new RequestPageView(code, positionDirectory.brandName(code),
                isBlank(textForEmail) ? null : textForEmail.trim(),
                full ? LogMasking.maskEmail(InviteKeyFactory.normalizeEmail(email)) : null,
                full,
                Instant.ofEpochSecond(ts).plus(properties.getLinkMaxAge()));
        });
    }

    /**
     * Validate the signed link, then issue a code and email it.
     */
    public AccessResult<OtpRequested> requestOtp(RequestOtpCommand command, String traceId) {
        return AccessResult.attempt("requestOtp", () -> {
            if (!positionDirectory.isKnownBrand(command.brand())
                    || !RecipientPolicy.isValidFormat(command.email())
                    || isBlank(command.textForEmail())
                    || command.ts() == null) {
                throw new InviteAccessException(AccessError.INVALID_REQUEST);
            }
            requireValid(signatureService.verifyRequestLink(
                command.brand(), command.email(), command.textForEmail(), command.sig(), command.ts()));

            IdentityKey identity = IdentityKey.of(command.brand(), command.email(), command.textForEmail());
            if (!rateLimitingService.isCodeRequestAllowed(identity.getBrand(), identity.getEmail())) {
                throw new InviteAccessException(AccessError.RATE_LIMITED);
            }
            if (!candidateSource.verifyCandidate(identity.getBrand(), identity.getEmail(), identity.getTextForEmail())) {
                logger.info("Candidate not on roster for {}", identity);
                throw new InviteAccessException(AccessError.CANDIDATE_NOT_FOUND);
            }

            String bookingUrl = bookingUrlPolicy.requireValid(
                positionDirectory.resolveBookingUrl(identity.getBrand(), identity.getTextForEmail()).orElse(null));

            OtpIssue issue = otpService.createOtp(identity, bookingUrl, traceId);
            DeliveryResult delivery = notificationService.sendOtpEmail(
                identity.getEmail(), issue.code(), issue.expiresAt(), contextFor(identity.getBrand(), identity.getTextForEmail()));
            if (!delivery.sent()) {
                auditLogger.record(AuditEvent.EMAIL_FAILED, identity.getBrand(), identity.getEmail(), issue.rowId(),
                    "otp email: " + delivery.error());
            }
            return new OtpRequested(issue.rowId(), issue.expiresAt(), delivery.sent());
        });
    }

    /**
     * Verify a code and email the access-confirmation link. The token is never returned here.
     */
    public AccessResult<OtpVerified> verifyOtp(String identityRef, String otp) {
        return AccessResult.attempt("verifyOtp", () -> {
            if (isBlank(identityRef) || isBlank(otp)) {
                throw new InviteAccessException(AccessError.INVALID_REQUEST);
            }
            if (!rateLimitingService.isVerifyAllowed(identityRef)) {
                throw new InviteAccessException(AccessError.RATE_LIMITED);
            }

            InviteRecord row = otpService.verifyOtp(identityRef.trim(), otp);
            IssuedToken issued = tokenService.issueToken(row);

            String accessUrl = properties.getUrls().getAccessBaseUrl()
                + "?token=" + URLEncoder.encode(issued.token(), StandardCharsets.UTF_8);
            DeliveryResult delivery;
            if (bookingUrlPolicy.isSafeToEmail(accessUrl)) {
                delivery = notificationService.sendAccessLinkEmail(row.getEmail(), accessUrl,
                    contextFor(row.getBrand(), row.getTextForEmail()));
            } else {
                logger.error("Access base URL points at a booking calendar; refusing to email it");
                delivery = DeliveryResult.failed("Access link rejected");
            }
            if (!delivery.sent()) {
                auditLogger.record(AuditEvent.EMAIL_FAILED, row.getBrand(), row.getEmail(), row.getRowId(),
                    "access email: " + delivery.error());
            }
            return new OtpVerified(delivery.sent(), issued.expiresAt());
        });
    }

    /**
     * Read-only: describes the access page. Safe to call from link previewers.
     */
    public AccessResult<AccessPageView> openAccessPage(String token, String expectedBrand) {
        return AccessResult.attempt("openAccessPage", () -> {
            InviteRecord row = tokenService.validate(token, isBlank(expectedBrand) ? null : expectedBrand);
            return new AccessPageView(row.getBrand(), positionDirectory.brandName(row.getBrand()),
                row.getTextForEmail(), row.getTokenStatus(), row.getTokenExpiry());
        });
    }

    /**
     * Spend the token and hand back the booking URL for a client-side redirect.
     */
    public AccessResult<AccessGranted> confirmAccess(String token) {
        return AccessResult.attempt("confirmAccess", () -> {
            ConsumedAccess access = tokenService.consume(token);
            logger.info("Access granted on row {} to {}", access.rowId(), LogMasking.maskUrl(access.bookingUrl()));
            return new AccessGranted(access.bookingUrl());
        });
    }

    private MessageContext contextFor(String brand, String textForEmail) {
        return new MessageContext(positionDirectory.brandName(brand), textForEmail);
    }

    private static void requireValid(SignatureCheck check) {
        switch (check) {
            case VALID:
                return;
            case EXPIRED:
                throw new InviteAccessException(AccessError.LINK_EXPIRED);
            default:
                throw new InviteAccessException(AccessError.SIGNATURE_INVALID);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
