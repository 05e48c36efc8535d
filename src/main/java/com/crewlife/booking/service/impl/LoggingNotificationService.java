package com.crewlife.booking.service.impl;

import com.crewlife.booking.service.DeliveryResult;
import com.crewlife.booking.service.NotificationService;
import com.crewlife.booking.service.RecipientPolicy;
import com.crewlife.booking.util.LogMasking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Delivery stand-in for local runs: records that a message would have been sent.
 * Never logs the code or the full access link.
 */
public class LoggingNotificationService implements NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationService.class);

    @Override
    public DeliveryResult sendOtpEmail(String email, String code, Instant expiresAt, MessageContext context) {
        if (!RecipientPolicy.isValidFormat(email)) {
            return DeliveryResult.failed("Recipient address is not valid");
        }
        logger.info("[mail disabled] verification code for {} ({}) to {}, expires {}",
            context.brandName(), context.textForEmail(), LogMasking.maskEmail(email), expiresAt);
        return DeliveryResult.delivered();
    }

    @Override
    public DeliveryResult sendAccessLinkEmail(String email, String accessUrl, MessageContext context) {
        if (!RecipientPolicy.isValidFormat(email)) {
            return DeliveryResult.failed("Recipient address is not valid");
        }
        logger.info("[mail disabled] access link {} for {} to {}",
            LogMasking.maskUrl(accessUrl), context.brandName(), LogMasking.maskEmail(email));
        return DeliveryResult.delivered();
    }
}
