package com.crewlife.booking.service;

import com.crewlife.booking.util.LogMasking;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory request throttling for the candidate endpoints.
 */
@Service
public class RateLimitingService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitingService.class);

    static final int CODE_REQUESTS_PER_HOUR = 5;
    static final int VERIFY_ATTEMPTS_PER_HOUR = 20;

    private final MeterRegistry meterRegistry;

    // Code requests: 1 per 60 seconds per (brand, email)
    private final Cache<String, Instant> codeRequestPerMinuteCache;

    // Code requests: 5 per hour per (brand, email)
    private final Cache<String, AtomicInteger> codeRequestPerHourCache;

    // Code submissions: 20 per hour per row
    private final Cache<String, AtomicInteger> verifyPerHourCache;

    @Autowired
    public RateLimitingService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.codeRequestPerMinuteCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(60))
                .maximumSize(10000)
                .build();
        this.codeRequestPerHourCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofHours(1))
                .maximumSize(10000)
                .build();
        this.verifyPerHourCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofHours(1))
                .maximumSize(10000)
                .build();
    }

    /**
     * Enforces 1 code request per 60 seconds and 5 per hour for a candidate.
     */
    public boolean isCodeRequestAllowed(String brand, String email) {
        String key = brand + "|" + email;

        if (codeRequestPerMinuteCache.getIfPresent(key) != null) {
            logger.info("Rate limit exceeded for code request (60s limit): {}", LogMasking.maskEmail(email));
            recordRejection("otp-request");
            return false;
        }

        AtomicInteger hourlyCount = codeRequestPerHourCache.get(key, k -> new AtomicInteger(0));
        if (hourlyCount.get() >= CODE_REQUESTS_PER_HOUR) {
            logger.info("Rate limit exceeded for code request ({}/hour limit): {}",
                CODE_REQUESTS_PER_HOUR, LogMasking.maskEmail(email));
            recordRejection("otp-request");
            return false;
        }

        codeRequestPerMinuteCache.put(key, Instant.now());
        hourlyCount.incrementAndGet();
        return true;
    }

    /**
     * Enforces 20 code submissions per hour against one row.
     */
    public boolean isVerifyAllowed(String identityRef) {
        AtomicInteger hourlyCount = verifyPerHourCache.get(identityRef, k -> new AtomicInteger(0));
        if (hourlyCount.get() >= VERIFY_ATTEMPTS_PER_HOUR) {
            logger.info("Rate limit exceeded for code verification ({}/hour limit): {}",
                VERIFY_ATTEMPTS_PER_HOUR, identityRef);
            recordRejection("otp-verify");
            return false;
        }
        hourlyCount.incrementAndGet();
        return true;
    }

    private void recordRejection(String endpoint) {
        meterRegistry.counter("booking.rate_limit.rejected", "endpoint", endpoint).increment();
    }
}
