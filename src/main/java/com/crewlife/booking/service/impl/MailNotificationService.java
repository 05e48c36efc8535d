package com.crewlife.booking.service.impl;

import com.crewlife.booking.service.DeliveryResult;
import com.crewlife.booking.service.NotificationService;
import com.crewlife.booking.service.RecipientPolicy;
import com.crewlife.booking.util.LogMasking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * SMTP delivery through Spring's {@link JavaMailSender}. Plain text only.
 */
public class MailNotificationService implements NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(MailNotificationService.class);
    private static final DateTimeFormatter EXPIRY_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final JavaMailSender mailSender;
    private final String fromAddress;

    public MailNotificationService(JavaMailSender mailSender, String fromAddress) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
    }

    @Override
    public DeliveryResult sendOtpEmail(String email, String code, Instant expiresAt, MessageContext context) {
        String body = "Your verification code for the " + context.brandName() + " interview ("
            + context.textForEmail() + ") is:\n\n"
            + "    " + code + "\n\n"
            + "The code expires at " + EXPIRY_FORMAT.format(expiresAt) + ".\n"
            + "If you did not request this code you can ignore this email.";
        return send(email, context.brandName() + " interview verification code", body, "verification code");
    }

    @Override
    public DeliveryResult sendAccessLinkEmail(String email, String accessUrl, MessageContext context) {
        String body = "Your email address has been verified.\n\n"
            + "Open the link below and confirm to choose your " + context.brandName() + " interview slot ("
            + context.textForEmail() + "):\n\n"
            + accessUrl + "\n\n"
            + "The link can be used once.";
        return send(email, context.brandName() + " interview scheduling link", body, "access link");
    }

    private DeliveryResult send(String email, String subject, String body, String kind) {
        if (!RecipientPolicy.isDeliverable(email)) {
            logger.warn("Refusing to send {} to undeliverable recipient {}", kind, LogMasking.maskEmail(email));
            return DeliveryResult.failed("Recipient address is not deliverable");
        }
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(fromAddress);
            message.setTo(email.trim());
            message.setSubject(subject);
            message.setText(body);
            mailSender.send(message);
            logger.info("Sent {} email to {}", kind, LogMasking.maskEmail(email));
            return DeliveryResult.delivered();

        } catch (MailException e) {
            logger.error("Failed to send {} email to {}", kind, LogMasking.maskEmail(email), e);
            return DeliveryResult.failed("Email delivery failed");
        }
    }
}
