package com.crewlife.booking.exception;

/**
 * Raised by the OTP, token and guard services for a rule violation.
 * The orchestrator converts it into a failed result; it never reaches a controller.
 */
public class InviteAccessException extends RuntimeException {

    private final AccessError error;
    private final Integer remainingAttempts;

    public InviteAccessException(AccessError error) {
        this(error, error.getUserMessage(), null);
    }

    public InviteAccessException(AccessError error, String message) {
        this(error, message, null);
    }

    private InviteAccessException(AccessError error, String message, Integer remainingAttempts) {
        super(message);
        this.error = error;
        this.remainingAttempts = remainingAttempts;
    }

    /**
     * Wrong code with attempts left.
     */
    public static InviteAccessException invalidOtp(int remainingAttempts) {
        String message = AccessError.OTP_INVALID.getUserMessage() + " " + remainingAttempts
            + (remainingAttempts == 1 ? " attempt" : " attempts") + " remaining.";
        return new InviteAccessException(AccessError.OTP_INVALID, message, remainingAttempts);
    }

    public AccessError getError() {
        return error;
    }

    public Integer getRemainingAttempts() {
        return remainingAttempts;
    }
}
