package com.crewlife.booking.service;

import com.crewlife.booking.exception.AccessError;
import com.crewlife.booking.exception.InvalidKeyException;
import com.crewlife.booking.exception.InviteAccessException;
import com.crewlife.booking.exception.LockTimeoutException;
import com.crewlife.booking.exception.RepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Typed outcome of a candidate or admin flow: a value, or an {@link AccessError} with the
 * message to show.
 */
public final class AccessResult<T> {

    private static final Logger logger = LoggerFactory.getLogger(AccessResult.class);

    private final T value;
    private final AccessError error;
    private final String message;
    private final Integer remainingAttempts;

    private AccessResult(T value, AccessError error, String message, Integer remainingAttempts) {
        this.value = value;
        this.error = error;
        this.message = message;
        this.remainingAttempts = remainingAttempts;
    }

    public static <T> AccessResult<T> success(T value) {
        return new AccessResult<>(value, null, null, null);
    }

    public static <T> AccessResult<T> failure(AccessError error) {
        return new AccessResult<>(null, error, error.getUserMessage(), null);
    }

    public static <T> AccessResult<T> failure(InviteAccessException e) {
        return new AccessResult<>(null, e.getError(), e.getMessage(), e.getRemainingAttempts());
    }

    /**
     * Run one flow step and fold every expected failure into a result.
     */
    static <T> AccessResult<T> attempt(String flow, Supplier<T> step) {
        try {
            return success(step.get());
        } catch (InviteAccessException e) {
            logger.info("{} rejected: {}", flow, e.getError());
            return failure(e);
        } catch (InvalidKeyException e) {
            logger.info("{} rejected: {}", flow, e.getMessage());
            return failure(AccessError.INVALID_REQUEST);
        } catch (LockTimeoutException e) {
            logger.warn("{} could not acquire identity lock: {}", flow, e.getMessage());
            return failure(AccessError.LOCK_TIMEOUT);
        } catch (RepositoryException e) {
            logger.error("{} failed on row store: {}", flow, e.getMessage(), e);
            return failure(AccessError.STORE_UNAVAILABLE);
        }
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        return value;
    }

    public AccessError getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public Integer getRemainingAttempts() {
        return remainingAttempts;
    }

    public boolean isRetryable() {
        return error != null && error.isRetryable();
    }
}
