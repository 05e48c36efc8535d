package com.crewlife.booking.service;

import com.crewlife.booking.config.BookingAccessProperties;
import com.crewlife.booking.exception.RepositoryException;
import com.crewlife.booking.util.SecureCodeGenerator;
import org.apache.commons.codec.binary.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.ParameterAlreadyExistsException;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import software.amazon.awssdk.services.ssm.model.ParameterType;
import software.amazon.awssdk.services.ssm.model.PutParameterRequest;
import software.amazon.awssdk.services.ssm.model.SsmException;

import java.nio.charset.StandardCharsets;

/**
 * Supplies the HMAC key for signed links.
 *
 * <p>The secret is loaded once and cached. Sources, in order: the
 * {@code booking.signing.secret} property, then Parameter Store when an {@link SsmClient}
 * is configured, then a process-local secret. A missing or short secret is replaced by a
 * fresh random one and persisted.</p>
 *
 * <p>Rotating the secret invalidates every outstanding link.</p>
 */
@Service
public class SigningSecretService {

    private static final Logger logger = LoggerFactory.getLogger(SigningSecretService.class);
    static final int MIN_SECRET_BYTES = 32;

    private final BookingAccessProperties properties;
    private final SsmClient ssmClient;
    private final AuditLogger auditLogger;

    private volatile byte[] cachedSecret;

    @Autowired
    public SigningSecretService(BookingAccessProperties properties,
                                @Autowired(required = false) SsmClient ssmClient,
                                AuditLogger auditLogger) {
        this.properties = properties;
        this.ssmClient = ssmClient;
        this.auditLogger = auditLogger;
    }

    public byte[] getSecret() {
        byte[] secret = cachedSecret;
        if (secret != null) {
            return secret;
        }
        synchronized (this) {
            if (cachedSecret == null) {
                cachedSecret = load();
            }
            return cachedSecret;
        }
    }

    /**
     * Replace the secret with a new random one and persist it.
     */
    public synchronized void rotate(String actor) {
        String fresh = generate();
        if (ssmClient != null) {
            try {
                persist(fresh, true);
            } catch (SsmException e) {
                throw new RepositoryException("Failed to persist rotated signing secret", e);
            }
        } else {
            logger.warn("Rotating a process-local signing secret; it will not survive a restart");
        }
        cachedSecret = fresh.getBytes(StandardCharsets.UTF_8);
        auditLogger.record(AuditEvent.SECRET_ROTATED, null, null, null, "actor=" + actor);
    }

    private byte[] load() {
        String configured = properties.getSigning().getSecret();
        if (configured != null && !configured.isBlank()) {
            if (isStrong(configured)) {
                logger.info("Using signing secret from configuration");
                return configured.getBytes(StandardCharsets.UTF_8);
            }
            logger.warn("Configured signing secret is shorter than {} bytes and will not be used", MIN_SECRET_BYTES);
        }

        if (ssmClient != null) {
            try {
                return loadFromParameterStore().getBytes(StandardCharsets.UTF_8);
            } catch (SsmException e) {
                logger.error("Failed to load signing secret from Parameter Store: {}", e.getMessage());
                throw new RepositoryException("Signing secret unavailable", e);
            }
        }

        logger.warn("No signing secret configured and Parameter Store disabled; generated a process-local secret");
        return generate().getBytes(StandardCharsets.UTF_8);
    }

    private String loadFromParameterStore() {
        String name = properties.getSigning().getSecretParameter();
        try {
            String value = readParameter(name);
            if (isStrong(value)) {
                logger.debug("Loaded signing secret from Parameter Store");
                return value;
            }
            logger.warn("Signing secret in {} is too short; replacing it", name);
            String fresh = generate();
            persist(fresh, true);
            return fresh;

        } catch (ParameterNotFoundException e) {
            logger.info("Signing secret {} not found; provisioning a new one", name);
            String fresh = generate();
            try {
                persist(fresh, false);
                return fresh;
            } catch (ParameterAlreadyExistsException raced) {
                logger.info("Signing secret {} was provisioned concurrently; using the stored value", name);
                return readParameter(name);
            }
        }
    }

    private String readParameter(String name) {
        return ssmClient.getParameter(GetParameterRequest.builder()
                .name(name)
                .withDecryption(true)
                .build())
            .parameter()
            .value();
    }

    private void persist(String value, boolean overwrite) {
        ssmClient.putParameter(PutParameterRequest.builder()
            .name(properties.getSigning().getSecretParameter())
            .type(ParameterType.SECURE_STRING)
            .value(value)
            .overwrite(overwrite)
            .build());
    }

    private static boolean isStrong(String secret) {
        return secret != null && secret.getBytes(StandardCharsets.UTF_8).length >= MIN_SECRET_BYTES;
    }

    private static String generate() {
        return Hex.encodeHexString(SecureCodeGenerator.randomBytes(MIN_SECRET_BYTES));
    }
}
