package com.crewlife.booking.service;

import com.crewlife.booking.config.BookingAccessProperties;
import com.crewlife.booking.exception.LockTimeoutException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion for token consumption and code issuance.
 *
 * <p>Locks are held weakly so idle identities do not accumulate. Waiting is bounded; a
 * caller that cannot get the lock in time fails with {@link LockTimeoutException}.</p>
 */
@Component
public class ConsumeLockManager {

    private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder()
        .weakValues()
        .build();

    private final Duration timeout;

    @Autowired
    public ConsumeLockManager(BookingAccessProperties properties) {
        this(properties.getToken().getConsumeLockTimeout());
    }

    ConsumeLockManager(Duration timeout) {
        this.timeout = timeout;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.get(key, k -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException("Interrupted while waiting for identity lock", e);
        }
        if (!acquired) {
            throw new LockTimeoutException("Timed out after " + timeout.toMillis() + "ms waiting for identity lock");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
