package com.crewlife.booking.service;

import com.crewlife.booking.config.BookingAccessProperties;
import com.crewlife.booking.exception.AccessError;
import com.crewlife.booking.model.IdentityKey;
import com.crewlife.booking.model.InviteLock;
import com.crewlife.booking.model.InviteRecord;
import com.crewlife.booking.model.OtpStatus;
import com.crewlife.booking.model.TokenStatus;
import com.crewlife.booking.service.CandidateViews.AccessGranted;
import com.crewlife.booking.service.CandidateViews.AccessPageView;
import com.crewlife.booking.service.CandidateViews.OtpRequested;
import com.crewlife.booking.service.CandidateViews.OtpVerified;
import com.crewlife.booking.service.CandidateViews.RequestOtpCommand;
import com.crewlife.booking.service.CandidateViews.RequestPageView;
import com.crewlife.booking.service.impl.AcceptAllCandidateSource;
import com.crewlife.booking.testutil.CapturingNotificationService;
import com.crewlife.booking.testutil.InMemoryInviteRecordRepository;
import com.crewlife.booking.testutil.MutableClock;
import com.crewlife.booking.testutil.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("CandidateAccessService Tests")
class CandidateAccessServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private InMemoryInviteRecordRepository repository;
    private MutableClock clock;
    private BookingAccessProperties properties;
    private CapturingNotificationService notifications;
    private LinkSignatureService signatureService;
    private InviteReuseGuard reuseGuard;
    private RateLimitingService rateLimitingService;
    private CandidateAccessService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryInviteRecordRepository();
        clock = new MutableClock(T0);
        properties = TestFixtures.properties();
        notifications = new CapturingNotificationService();

        AuditLogger auditLogger = new AuditLogger();
        signatureService = new LinkSignatureService(
            new SigningSecretService(properties, null, auditLogger), properties, clock);
        reuseGuard = new InviteReuseGuard(repository, auditLogger, clock);
        ConsumeLockManager lockManager = new ConsumeLockManager(Duration.ofSeconds(2));
        OtpService otpService = new OtpService(repository, reuseGuard, lockManager, properties, auditLogger, clock);
        BookingUrlPolicy urlPolicy = new BookingUrlPolicy();
        AccessTokenService tokenService = new AccessTokenService(repository, reuseGuard,
            lockManager, urlPolicy, properties, auditLogger, clock);

        rateLimitingService = mock(RateLimitingService.class);
        when(rateLimitingService.isCodeRequestAllowed(anyString(), anyString())).thenReturn(true);
        when(rateLimitingService.isVerifyAllowed(anyString())).thenReturn(true);

        service = new CandidateAccessService(signatureService, otpService, tokenService, notifications,
            new AcceptAllCandidateSource(), new PositionDirectory(properties), urlPolicy,
            rateLimitingService, properties, auditLogger);
    }

    private RequestOtpCommand signedCommand(String brand, String email, String text) {
        SignedLink link = signatureService.signRequestLink(brand, email, text);
        return new RequestOtpCommand(brand, email, text, link.issuedAt(), link.signature());
    }

    @Test
    @DisplayName("ROYAL / a@x.com / Waiter-CL200: link, code, access page, confirm, then locked out")
    void fullFlow_GrantsBookingOnceAndBlocksReuse() {
        RequestOtpCommand command = signedCommand("ROYAL", "a@x.com", "Waiter-CL200");

        AccessResult<RequestPageView> page = service.openRequestPage(
            command.brand(), command.email(), command.textForEmail(), command.ts(), command.sig());
        assertThat(page.isSuccess()).isTrue();
        assertThat(page.getValue().brandName()).isEqualTo("Royal Caribbean");
        assertThat(page.getValue().maskedEmail()).isEqualTo("a***@x.com");

        AccessResult<OtpRequested> requested = service.requestOtp(command, "tr-flow-1");
        assertThat(requested.isSuccess()).isTrue();
        assertThat(requested.getValue().emailSent()).isTrue();
        String identityRef = requested.getValue().identityRef();

        clock.advance(Duration.ofMinutes(2));
        AccessResult<OtpVerified> verified = service.verifyOtp(identityRef, notifications.lastCode());
        assertThat(verified.isSuccess()).isTrue();
        assertThat(verified.getValue().accessLinkSent()).isTrue();
        assertThat(verified.getValue().accessExpiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(2)).plus(Duration.ofHours(48)));

        String token = notifications.lastAccessToken();
        AccessResult<AccessPageView> accessPage = service.openAccessPage(token, "ROYAL");
        assertThat(accessPage.isSuccess()).isTrue();
        assertThat(accessPage.getValue().tokenStatus()).isEqualTo(TokenStatus.CONFIRMED);
        assertThat(accessPage.getValue().textForEmail()).isEqualTo("Waiter-CL200");

        AccessResult<AccessGranted> granted = service.confirmAccess(token);
        assertThat(granted.isSuccess()).isTrue();
        assertThat(granted.getValue().redirectUrl()).isEqualTo(TestFixtures.ROYAL_CL200_URL);

        assertThat(service.confirmAccess(token).getError()).isEqualTo(AccessError.TOKEN_ALREADY_USED);
        assertThat(service.openAccessPage(token, null).getError()).isEqualTo(AccessError.TOKEN_ALREADY_USED);

        clock.advance(Duration.ofMinutes(5));
        AccessResult<OtpRequested> again = service.requestOtp(signedCommand("ROYAL", "a@x.com", "Waiter-CL200"), null);
        assertThat(again.getError()).isEqualTo(AccessError.INVITE_BLOCKED);

        InviteRecord row = repository.findById(identityRef).orElseThrow();
        assertThat(row.getOtpStatus()).isEqualTo(OtpStatus.VERIFIED);
        assertThat(row.getTokenStatus()).isEqualTo(TokenStatus.USED);
        assertThat(row.getLocked()).isEqualTo(InviteLock.LOCKED);
        assertThat(row.getTraceId()).isEqualTo("tr-flow-1");
    }

    @Test
    void emails_NeverContainBookingUrl() {
        RequestOtpCommand command = signedCommand("ROYAL", "a@x.com", "Waiter-CL200");
        String ref = service.requestOtp(command, null).getValue().identityRef();
        service.verifyOtp(ref, notifications.lastCode());

        assertThat(notifications.getSent()).hasSize(2);
        assertThat(notifications.getSent()).allSatisfy(message -> {
            assertThat(String.valueOf(message.accessUrl())).doesNotContain("calendar.google.com");
            assertThat(message.context().brandName()).isEqualTo("Royal Caribbean");
        });
        assertThat(notifications.getSent().get(1).accessUrl()).startsWith("https://book.crewlife.example/access?token=");
    }

    @Test
    void unlockOverride_AllowsNewCodeAfterCompletion() {
        RequestOtpCommand command = signedCommand("ROYAL", "a@x.com", "Waiter-CL200");
        String ref = service.requestOtp(command, null).getValue().identityRef();
        service.verifyOtp(ref, notifications.lastCode());
        service.confirmAccess(notifications.lastAccessToken());

        reuseGuard.unlock(IdentityKey.of("ROYAL", "a@x.com", "Waiter-CL200"),
            "recruiter@crewlife", "slot cancelled by ship");
        clock.advance(Duration.ofMinutes(2));

        assertThat(service.requestOtp(signedCommand("ROYAL", "a@x.com", "Waiter-CL200"), null).isSuccess()).isTrue();
    }

    @Nested
    @DisplayName("openRequestPage()")
    class OpenRequestPageTests {

        @Test
        void openRequestPage_TamperedEmail_IsSignatureInvalid() {
            RequestOtpCommand command = signedCommand("ROYAL", "a@x.com", "Waiter-CL200");

            AccessResult<RequestPageView> result = service.openRequestPage(
                "ROYAL", "b@x.com", "Waiter-CL200", command.ts(), command.sig());

            assertThat(result.getError()).isEqualTo(AccessError.SIGNATURE_INVALID);
        }

        @Test
        void openRequestPage_OldLink_IsExpired() {
            RequestOtpCommand command = signedCommand("ROYAL", "a@x.com", "Waiter-CL200");
            clock.advance(Duration.ofDays(8));

            AccessResult<RequestPageView> result = service.openRequestPage(
                "ROYAL", "a@x.com", "Waiter-CL200", command.ts(), command.sig());

            assertThat(result.getError()).isEqualTo(AccessError.LINK_EXPIRED);
        }

        @Test
        void openRequestPage_FutureLink_IsSignatureInvalid() {
            long future = T0.getEpochSecond() + 3600;
            String sig = signatureService.sign(LinkSignatureService.requestLinkParts("ROYAL", "a@x.com", "Waiter-CL200"), future);

            AccessResult<RequestPageView> result = service.openRequestPage("ROYAL", "a@x.com", "Waiter-CL200", future, sig);

            assertThat(result.getError()).isEqualTo(AccessError.SIGNATURE_INVALID);
        }

        @Test
        void openRequestPage_WithoutEmail_ChecksShapeAndAgeOnly() {
            RequestOtpCommand command = signedCommand("ROYAL", "a@x.com", "Waiter-CL200");

            AccessResult<RequestPageView> result = service.openRequestPage("ROYAL", null, null, command.ts(), command.sig());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getValue().fullyVerified()).isFalse();
            assertThat(result.getValue().maskedEmail()).isNull();
        }

        @Test
        void openRequestPage_UnknownBrand_IsInvalidRequest() {
            assertThat(service.openRequestPage("CARNIVAL", "a@x.com", "Waiter", T0.getEpochSecond(), "0123456789abcdef")
                .getError()).isEqualTo(AccessError.INVALID_REQUEST);
        }
    }

    @Nested
    @DisplayName("requestOtp()")
    class RequestOtpTests {

        @Test
        void requestOtp_InvalidSignature_WritesNothing() {
            RequestOtpCommand command = signedCommand("ROYAL", "a@x.com", "Waiter-CL200");
            RequestOtpCommand forged = new RequestOtpCommand("ROYAL", "a@x.com", "Chef-CL300", command.ts(), command.sig());

            assertThat(service.requestOtp(forged, null).getError()).isEqualTo(AccessError.SIGNATURE_INVALID);
            assertThat(repository.size()).isZero();
            assertThat(notifications.getSent()).isEmpty();
        }

        @Test
        void requestOtp_RateLimited_WritesNothing() {
            service.requestOtp(signedCommand("ROYAL", "a@x.com", "Waiter-CL200"), null);
            when(rateLimitingService.isCodeRequestAllowed("ROYAL", "a@x.com")).thenReturn(false);

            AccessResult<OtpRequested> second = service.requestOtp(signedCommand("ROYAL", "a@x.com", "Waiter-CL200"), null);

            assertThat(second.getError()).isEqualTo(AccessError.RATE_LIMITED);
            assertThat(second.isRetryable()).isTrue();
            assertThat(repository.size()).isEqualTo(1);
        }

        @Test
        void requestOtp_NoBookingCalendar_FailsBeforeIssuingCode() {
            AccessResult<OtpRequested> result = service.requestOtp(signedCommand("COSTA", "a@x.com", "Waiter-CL200"), null);

            assertThat(result.getError()).isEqualTo(AccessError.BOOKING_URL_MISSING);
            assertThat(repository.size()).isZero();
        }

        @Test
        void requestOtp_EmailFails_RowIsKeptAndReported() {
            notifications.setFailing(true);

            AccessResult<OtpRequested> result = service.requestOtp(signedCommand("ROYAL", "a@x.com", "Waiter-CL200"), null);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getValue().emailSent()).isFalse();
            assertThat(repository.size()).isEqualTo(1);
        }

        @Test
        void requestOtp_StoreDown_IsStoreUnavailable() {
            repository.setFailWrites(true);

            AccessResult<OtpRequested> result = service.requestOtp(signedCommand("ROYAL", "a@x.com", "Waiter-CL200"), null);

            assertThat(result.getError()).isEqualTo(AccessError.STORE_UNAVAILABLE);
            assertThat(notifications.getSent()).isEmpty();
        }

        @Test
        void requestOtp_MalformedEmail_IsInvalidRequest() {
            RequestOtpCommand command = new RequestOtpCommand("ROYAL", "not-an-email", "Waiter-CL200",
                T0.getEpochSecond(), "0123456789abcdef");

            assertThat(service.requestOtp(command, null).getError()).isEqualTo(AccessError.INVALID_REQUEST);
        }
    }

    @Nested
    @DisplayName("verifyOtp()")
    class VerifyOtpTests {

        @Test
        void verifyOtp_WrongCode_ReportsAttemptsAndIssuesNoToken() {
            String ref = service.requestOtp(signedCommand("ROYAL", "a@x.com", "Waiter-CL200"), null)
                .getValue().identityRef();
            String wrong = notifications.lastCode().equals("000000") ? "000001" : "000000";

            AccessResult<OtpVerified> result = service.verifyOtp(ref, wrong);

            assertThat(result.getError()).isEqualTo(AccessError.OTP_INVALID);
            assertThat(result.getRemainingAttempts()).isEqualTo(2);
            assertThat(repository.findById(ref).orElseThrow().getTokenHash()).isNull();
            assertThat(notifications.getSent()).hasSize(1);
        }

        @Test
        void verifyOtp_OldCodeAfterResend_IsSuperseded() {
            String firstRef = service.requestOtp(signedCommand("ROYAL", "a@x.com", "Waiter-CL200"), null)
                .getValue().identityRef();
            String firstCode = notifications.lastCode();
            clock.advance(Duration.ofSeconds(61));
            service.requestOtp(signedCommand("ROYAL", "a@x.com", "Waiter-CL200"), null);

            assertThat(service.verifyOtp(firstRef, firstCode).getError()).isEqualTo(AccessError.OTP_SUPERSEDED);
        }

        @Test
        @DisplayName("A double submission of the right code sends one access link")
        void verifyOtp_ConcurrentCorrectSubmissions_IssueOneToken() throws Exception {
            String ref = service.requestOtp(signedCommand("ROYAL", "a@x.com", "Waiter-CL200"), null)
                .getValue().identityRef();
            String code = notifications.lastCode();
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<AccessResult<OtpVerified>> results = new ArrayList<>();
            try {
                List<Future<AccessResult<OtpVerified>>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    Callable<AccessResult<OtpVerified>> submit = () -> {
                        start.await();
                        return service.verifyOtp(ref, code);
                    };
                    futures.add(executor.submit(submit));
                }
                start.countDown();
                for (Future<AccessResult<OtpVerified>> future : futures) {
                    results.add(future.get(10, TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(results).filteredOn(AccessResult::isSuccess).hasSize(1);
            assertThat(results).filteredOn(r -> !r.isSuccess())
                .allSatisfy(r -> assertThat(r.getError()).isEqualTo(AccessError.OTP_ALREADY_VERIFIED));
            assertThat(notifications.getSent()).filteredOn(m -> m.accessUrl() != null).hasSize(1);
            InviteRecord row = repository.findById(ref).orElseThrow();
            assertThat(row.getTokenStatus()).isEqualTo(TokenStatus.ISSUED);
            assertThat(row.getTokenHash())
                .isEqualTo(AccessTokenService.hashToken(notifications.lastAccessToken()));
        }

        @Test
        void verifyOtp_TooManySubmissions_IsRateLimited() {
            when(rateLimitingService.isVerifyAllowed(anyString())).thenReturn(false);

            assertThat(service.verifyOtp("0f8c2a4e-1111-2222-3333-444455556666", "123456").getError())
                .isEqualTo(AccessError.RATE_LIMITED);
        }

        @Test
        void verifyOtp_Blank_IsInvalidRequest() {
            assertThat(service.verifyOtp(" ", "123456").getError()).isEqualTo(AccessError.INVALID_REQUEST);
        }
    }

    @Nested
    @DisplayName("Access page")
    class AccessPageTests {

        private String token;

        @BeforeEach
        void issueToken() {
            String ref = service.requestOtp(signedCommand("ROYAL", "a@x.com", "Waiter-CL200"), null)
                .getValue().identityRef();
            service.verifyOtp(ref, notifications.lastCode());
            token = notifications.lastAccessToken();
        }

        @Test
        void openAccessPage_DoesNotRevealBookingUrl() {
            AccessResult<AccessPageView> result = service.openAccessPage(token, null);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getValue().toString()).doesNotContain("calendar.google.com");
        }

        @Test
        void openAccessPage_WrongBrand_IsRejectedAndTokenStillUsable() {
            assertThat(service.openAccessPage(token, "COSTA").getError()).isEqualTo(AccessError.TOKEN_BRAND_MISMATCH);
            assertThat(service.confirmAccess(token).isSuccess()).isTrue();
        }

        @Test
        void confirmAccess_AfterExpiry_IsExpired() {
            clock.advance(Duration.ofHours(49));

            assertThat(service.confirmAccess(token).getError()).isEqualTo(AccessError.TOKEN_EXPIRED);
        }

        @Test
        void confirmAccess_UnknownToken_IsNotFound() {
            assertThat(service.confirmAccess("bogus").getError()).isEqualTo(AccessError.TOKEN_NOT_FOUND);
        }
    }
}
