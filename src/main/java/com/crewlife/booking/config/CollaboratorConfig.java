package com.crewlife.booking.config;

import com.crewlife.booking.service.CandidateSource;
import com.crewlife.booking.service.NotificationService;
import com.crewlife.booking.service.impl.AcceptAllCandidateSource;
import com.crewlife.booking.service.impl.LoggingNotificationService;
import com.crewlife.booking.service.impl.MailNotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

/**
 * Selects the outbound email and candidate roster implementations.
 * <p>
 * {@code booking.notifications.mode}: "mail" sends through SMTP (requires spring.mail.*),
 * "log" (default) only records that a message would have been sent.
 */
@Configuration
public class CollaboratorConfig {

    private static final Logger logger = LoggerFactory.getLogger(CollaboratorConfig.class);

    @Bean
    @ConditionalOnProperty(name = "booking.notifications.mode", havingValue = "mail")
    public NotificationService mailNotificationService(
            JavaMailSender mailSender,
            @Value("${booking.notifications.from:no-reply@localhost}") String fromAddress) {
        logger.info("Configuring SMTP notification service with sender {}", fromAddress);
        return new MailNotificationService(mailSender, fromAddress);
    }

    @Bean
    @ConditionalOnProperty(name = "booking.notifications.mode", havingValue = "log", matchIfMissing = true)
    public NotificationService loggingNotificationService() {
        logger.warn("Email delivery disabled; notifications are only logged");
        return new LoggingNotificationService();
    }

    @Bean
    @ConditionalOnProperty(name = "booking.candidate-source.mode", havingValue = "open", matchIfMissing = true)
    public CandidateSource acceptAllCandidateSource() {
        logger.info("Candidate roster checks disabled; every signed invitation is accepted");
        return new AcceptAllCandidateSource();
    }
}
