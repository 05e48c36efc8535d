package com.crewlife.booking.service;

import com.crewlife.booking.config.BookingAccessProperties;
import com.crewlife.booking.exception.AccessError;
import com.crewlife.booking.exception.InviteAccessException;
import com.crewlife.booking.model.IdentityKey;
import com.crewlife.booking.model.InviteRecord;
import com.crewlife.booking.model.OtpStatus;
import com.crewlife.booking.model.TokenStatus;
import com.crewlife.booking.repository.InviteRecordRepository;
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
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

@DisplayName("OtpService Tests")
class OtpServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");
    private static final IdentityKey WAITER = IdentityKey.of("ROYAL", "a@x.com", "Waiter-CL200");

    private InMemoryInviteRecordRepository repository;
    private MutableClock clock;
    private OtpService otpService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryInviteRecordRepository();
        clock = new MutableClock(T0);
        otpService = newService(repository);
    }

    private OtpService newService(InviteRecordRepository store) {
        BookingAccessProperties properties = TestFixtures.properties();
        AuditLogger auditLogger = new AuditLogger();
        InviteReuseGuard guard = new InviteReuseGuard(store, auditLogger, clock);
        return new OtpService(store, guard, new ConsumeLockManager(Duration.ofSeconds(2)),
            properties, auditLogger, clock);
    }

    private static AccessError errorOf(Runnable action) {
        InviteAccessException e = catchThrowableOfType(action::run, InviteAccessException.class);
        assertThat(e).as("expected an InviteAccessException").isNotNull();
        return e.getError();
    }

    private static String wrong(String code) {
        return code.equals("000000") ? "000001" : "000000";
    }

    @Nested
    @DisplayName("createOtp()")
    class CreateOtpTests {

        @Test
        void createOtp_WritesPendingRowWithHashedCode() {
            OtpIssue issue = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, "tr-test-1");

            InviteRecord row = repository.findById(issue.rowId()).orElseThrow();
            assertThat(issue.code()).matches("\\d{6}");
            assertThat(issue.expiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
            assertThat(row.getOtpStatus()).isEqualTo(OtpStatus.PENDING);
            assertThat(row.getOtpAttempts()).isZero();
            assertThat(row.getOtpHash()).isEqualTo(OtpService.digestCode(issue.rowId(), issue.code()));
            assertThat(row.getOtpHash()).doesNotContain(issue.code());
            assertThat(row.getIdentityKey()).isEqualTo(WAITER.identityKey());
            assertThat(row.getCandidateKey()).isEqualTo(WAITER.candidateKey());
            assertThat(row.getBookingUrl()).isEqualTo(TestFixtures.ROYAL_CL200_URL);
            assertThat(row.getTraceId()).isEqualTo("tr-test-1");
            assertThat(row.getTokenStatus()).isNull();
        }

        @Test
        @DisplayName("A new code supersedes the pending one for every position of the brand")
        void createOtp_SupersedesEarlierPendingAcrossPositions() {
            OtpIssue waiter = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            clock.advance(Duration.ofSeconds(90));
            IdentityKey chef = IdentityKey.of("ROYAL", "a@x.com", "Chef-CL300");
            OtpIssue chefIssue = otpService.createOtp(chef, TestFixtures.ROYAL_DEFAULT_URL, null);

            assertThat(repository.findById(waiter.rowId()).orElseThrow().getOtpStatus()).isEqualTo(OtpStatus.SUPERSEDED);
            assertThat(repository.findById(chefIssue.rowId()).orElseThrow().getOtpStatus()).isEqualTo(OtpStatus.PENDING);
            assertThat(repository.all()).filteredOn(r -> r.getOtpStatus() == OtpStatus.PENDING).hasSize(1);
        }

        @Test
        void createOtp_OtherBrand_IsNotSuperseded() {
            OtpIssue royal = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            otpService.createOtp(IdentityKey.of("COSTA", "a@x.com", "Waiter-CL200"), TestFixtures.ROYAL_CL200_URL, null);

            assertThat(repository.findById(royal.rowId()).orElseThrow().getOtpStatus()).isEqualTo(OtpStatus.PENDING);
        }

        @Test
        void createOtp_IdentityWithUsedToken_IsBlockedAndWritesNothing() {
            InviteRecord used = TestFixtures.row(WAITER, T0.minus(Duration.ofDays(1)));
            used.setOtpStatus(OtpStatus.VERIFIED);
            used.setTokenStatus(TokenStatus.USED);
            repository.append(used);

            assertThat(errorOf(() -> otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null)))
                .isEqualTo(AccessError.INVITE_BLOCKED);
            assertThat(repository.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Simultaneous requests for one candidate leave a single pending code")
        void createOtp_Concurrent_LeavesOnePendingRow() throws Exception {
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<OtpIssue>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    Callable<OtpIssue> request = () -> {
                        start.await();
                        return otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
                    };
                    futures.add(executor.submit(request));
                }
                start.countDown();
                for (Future<OtpIssue> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(repository.all()).hasSize(threads);
            assertThat(repository.all()).filteredOn(r -> r.getOtpStatus() == OtpStatus.PENDING).hasSize(1);
            assertThat(repository.all()).filteredOn(r -> r.getOtpStatus() == OtpStatus.SUPERSEDED).hasSize(threads - 1);
        }
    }

    @Nested
    @DisplayName("verifyOtp()")
    class VerifyOtpTests {

        @Test
        void verifyOtp_CorrectCode_MarksRowVerified() {
            OtpIssue issue = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            clock.advance(Duration.ofMinutes(3));

            InviteRecord row = otpService.verifyOtp(issue.rowId(), issue.code());

            assertThat(row.getOtpStatus()).isEqualTo(OtpStatus.VERIFIED);
            assertThat(row.getVerifiedAt()).isEqualTo(T0.plus(Duration.ofMinutes(3)));
            assertThat(repository.findById(issue.rowId()).orElseThrow().getOtpStatus()).isEqualTo(OtpStatus.VERIFIED);
        }

        @Test
        void verifyOtp_CodeWithSurroundingWhitespace_IsAccepted() {
            OtpIssue issue = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);

            assertThat(otpService.verifyOtp(issue.rowId(), " " + issue.code() + " ").getOtpStatus())
                .isEqualTo(OtpStatus.VERIFIED);
        }

        @Test
        void verifyOtp_WrongCode_ReportsRemainingAttempts() {
            OtpIssue issue = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);

            InviteAccessException e = catchThrowableOfType(
                () -> otpService.verifyOtp(issue.rowId(), wrong(issue.code())), InviteAccessException.class);

            assertThat(e.getError()).isEqualTo(AccessError.OTP_INVALID);
            assertThat(e.getRemainingAttempts()).isEqualTo(2);
            assertThat(repository.findById(issue.rowId()).orElseThrow().getOtpAttempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("Third wrong code fails the row; the correct code is then refused")
        void verifyOtp_ThirdWrongCode_LocksRow() {
            OtpIssue issue = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            String bad = wrong(issue.code());

            assertThat(errorOf(() -> otpService.verifyOtp(issue.rowId(), bad))).isEqualTo(AccessError.OTP_INVALID);
            assertThat(errorOf(() -> otpService.verifyOtp(issue.rowId(), bad))).isEqualTo(AccessError.OTP_INVALID);
            assertThat(errorOf(() -> otpService.verifyOtp(issue.rowId(), bad))).isEqualTo(AccessError.OTP_LOCKED);

            InviteRecord row = repository.findById(issue.rowId()).orElseThrow();
            assertThat(row.getOtpStatus()).isEqualTo(OtpStatus.FAILED);
            assertThat(row.getOtpAttempts()).isEqualTo(3);
            assertThat(errorOf(() -> otpService.verifyOtp(issue.rowId(), issue.code()))).isEqualTo(AccessError.OTP_LOCKED);
        }

        @Test
        void verifyOtp_AtElevenMinutes_IsExpired() {
            OtpIssue issue = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            clock.advance(Duration.ofMinutes(11));

            assertThat(errorOf(() -> otpService.verifyOtp(issue.rowId(), issue.code()))).isEqualTo(AccessError.OTP_EXPIRED);
            assertThat(repository.findById(issue.rowId()).orElseThrow().getOtpStatus()).isEqualTo(OtpStatus.EXPIRED);
        }

        @Test
        void verifyOtp_AtExactExpiry_IsStillAccepted() {
            OtpIssue issue = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            clock.advance(Duration.ofMinutes(10));

            assertThat(otpService.verifyOtp(issue.rowId(), issue.code()).getOtpStatus()).isEqualTo(OtpStatus.VERIFIED);
        }

        @Test
        void verifyOtp_SupersededRow_IsRefusedEvenWithCorrectCode() {
            OtpIssue first = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            OtpIssue second = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);

            assertThat(errorOf(() -> otpService.verifyOtp(first.rowId(), first.code()))).isEqualTo(AccessError.OTP_SUPERSEDED);
            assertThat(otpService.verifyOtp(second.rowId(), second.code()).getOtpStatus()).isEqualTo(OtpStatus.VERIFIED);
        }

        @Test
        void verifyOtp_AlreadyVerified_IsRefused() {
            OtpIssue issue = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            otpService.verifyOtp(issue.rowId(), issue.code());

            assertThat(errorOf(() -> otpService.verifyOtp(issue.rowId(), issue.code())))
                .isEqualTo(AccessError.OTP_ALREADY_VERIFIED);
        }

        @Test
        @DisplayName("A verification working from a stale read does not verify the code again")
        void verifyOtp_SettledAfterRead_IsAlreadyVerified() {
            OtpIssue issue = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            InviteRecord stale = repository.findById(issue.rowId()).orElseThrow();
            otpService.verifyOtp(issue.rowId(), issue.code());
            InviteRecordRepository staleReads = spy(repository);
            doReturn(Optional.of(stale)).doCallRealMethod().when(staleReads).findById(issue.rowId());

            assertThat(errorOf(() -> newService(staleReads).verifyOtp(issue.rowId(), issue.code())))
                .isEqualTo(AccessError.OTP_ALREADY_VERIFIED);
            assertThat(repository.findById(issue.rowId()).orElseThrow().getVerifiedAt()).isEqualTo(T0);
        }

        @Test
        @DisplayName("A wrong guess racing a correct one cannot reopen the code")
        void verifyOtp_WrongGuessAfterVerified_DoesNotOverwrite() {
            OtpIssue issue = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            InviteRecord stale = repository.findById(issue.rowId()).orElseThrow();
            otpService.verifyOtp(issue.rowId(), issue.code());
            InviteRecordRepository staleReads = spy(repository);
            doReturn(Optional.of(stale)).doCallRealMethod().when(staleReads).findById(issue.rowId());

            assertThat(errorOf(() -> newService(staleReads).verifyOtp(issue.rowId(), wrong(issue.code()))))
                .isEqualTo(AccessError.OTP_ALREADY_VERIFIED);
            InviteRecord row = repository.findById(issue.rowId()).orElseThrow();
            assertThat(row.getOtpStatus()).isEqualTo(OtpStatus.VERIFIED);
            assertThat(row.getOtpAttempts()).isZero();
        }

        @Test
        @DisplayName("Simultaneous submissions of the right code verify it once")
        void verifyOtp_Concurrent_ExactlyOneVerifies() throws Exception {
            OtpIssue issue = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<InviteRecord>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    Callable<InviteRecord> submit = () -> {
                        start.await();
                        return otpService.verifyOtp(issue.rowId(), issue.code());
                    };
                    futures.add(executor.submit(submit));
                }
                start.countDown();

                int verified = 0;
                for (Future<InviteRecord> future : futures) {
                    try {
                        assertThat(future.get(10, TimeUnit.SECONDS).getOtpStatus()).isEqualTo(OtpStatus.VERIFIED);
                        verified++;
                    } catch (ExecutionException e) {
                        assertThat(e.getCause()).isInstanceOf(InviteAccessException.class);
                        assertThat(((InviteAccessException) e.getCause()).getError())
                            .isEqualTo(AccessError.OTP_ALREADY_VERIFIED);
                    }
                }
                assertThat(verified).isEqualTo(1);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        void verifyOtp_UnknownRow_IsNotFound() {
            assertThat(errorOf(() -> otpService.verifyOtp("00000000-0000-0000-0000-000000000000", "123456")))
                .isEqualTo(AccessError.OTP_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("verifyLatestOtp()")
    class VerifyLatestOtpTests {

        @Test
        void verifyLatestOtp_UsesNewestPendingRow() {
            otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);
            clock.advance(Duration.ofSeconds(61));
            OtpIssue latest = otpService.createOtp(WAITER, TestFixtures.ROYAL_CL200_URL, null);

            InviteRecord row = otpService.verifyLatestOtp(WAITER, latest.code());

            assertThat(row.getRowId()).isEqualTo(latest.rowId());
        }

        @Test
        void verifyLatestOtp_NothingPending_IsNotFound() {
            assertThat(errorOf(() -> otpService.verifyLatestOtp(WAITER, "123456"))).isEqualTo(AccessError.OTP_NOT_FOUND);
        }
    }
}
