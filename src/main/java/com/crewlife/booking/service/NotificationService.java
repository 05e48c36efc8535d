package com.crewlife.booking.service;

import java.time.Instant;

/**
 * Outbound candidate email. Implementations report failures instead of throwing.
 */
public interface NotificationService {

    /**
     * Send the one-time verification code.
     *
     * @param email     candidate address
     * @param code      plaintext code; must not be logged
     * @param expiresAt absolute code expiry, shown to the candidate
     * @param context   brand name and position, for the message body
     */
    DeliveryResult sendOtpEmail(String email, String code, Instant expiresAt, MessageContext context);

    /**
     * Send the access-confirmation page link. The link never contains the booking URL.
     */
    DeliveryResult sendAccessLinkEmail(String email, String accessUrl, MessageContext context);

    record MessageContext(String brandName, String textForEmail) {
    }
}
