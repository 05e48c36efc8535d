package com.crewlife.booking.service;

import com.crewlife.booking.config.BookingAccessProperties;
import com.crewlife.booking.util.InviteKeyFactory;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Signs and verifies invitation links.
 *
 * <p>The signature is the first 16 hex characters of HMAC-SHA256 over the ordered parts
 * joined by the unit separator (U+001F), with the issue time in epoch seconds as the final
 * field. Verification recomputes the signature and compares in constant time.</p>
 */
@Service
public class LinkSignatureService {

    static final String DELIMITER = "\u001F";
    static final int SIGNATURE_LENGTH = 16;
    private static final Pattern SIGNATURE_PATTERN = Pattern.compile("[0-9a-f]{" + SIGNATURE_LENGTH + "}");

    private final SigningSecretService secretService;
    private final BookingAccessProperties properties;
    private final Clock clock;

    @Autowired
    public LinkSignatureService(SigningSecretService secretService, BookingAccessProperties properties, Clock clock) {
        this.secretService = secretService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if a part is null or contains the delimiter
     */
    public String sign(List<String> parts, long issuedAt) {
        for (String part : parts) {
            if (part == null || part.contains(DELIMITER)) {
                throw new IllegalArgumentException("Signed fields must be non-null and free of the delimiter");
            }
        }
        String message = String.join(DELIMITER, parts) + DELIMITER + issuedAt;
        String hex = new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secretService.getSecret()).hmacHex(message);
        return hex.substring(0, SIGNATURE_LENGTH);
    }

    public SignatureCheck verify(List<String> parts, String signature, long issuedAt, Duration maxAge) {
        if (!isWellFormed(signature)) {
            return SignatureCheck.INVALID;
        }
        String expected;
        try {
            expected = sign(parts, issuedAt);
        } catch (IllegalArgumentException e) {
            return SignatureCheck.INVALID;
        }
        boolean matches = MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.US_ASCII),
            signature.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
        if (!matches) {
            return SignatureCheck.INVALID;
        }
        return checkFreshness(issuedAt, maxAge);
    }

    /**
     * Partial verification for pages that render before every signed field is known:
     * checks the signature shape and the link age, but not the signature itself.
     */
    public SignatureCheck precheck(String signature, long issuedAt, Duration maxAge) {
        if (!isWellFormed(signature)) {
            return SignatureCheck.INVALID;
        }
        return checkFreshness(issuedAt, maxAge);
    }

    public SignatureCheck verifyRequestLink(String brand, String email, String textForEmail, String signature, long issuedAt) {
        if (brand == null || email == null || textForEmail == null) {
            return SignatureCheck.INVALID;
        }
        return verify(requestLinkParts(brand, email, textForEmail), signature, issuedAt, properties.getLinkMaxAge());
    }

    /**
     * Build the candidate-facing request link for an invitation.
     */
    public SignedLink signRequestLink(String brand, String email, String textForEmail) {
        long issuedAt = clock.instant().getEpochSecond();
        String signature = sign(requestLinkParts(brand, email, textForEmail), issuedAt);
        String url = properties.getUrls().getRequestBaseUrl()
            + "?brand=" + encode(InviteKeyFactory.normalizeBrand(brand))
            + "&e=" + encode(InviteKeyFactory.normalizeEmail(email))
            + "&t=" + encode(textForEmail.trim())
            + "&ts=" + issuedAt
            + "&sig=" + signature;
        return new SignedLink(url, signature, issuedAt, Instant.ofEpochSecond(issuedAt).plus(properties.getLinkMaxAge()));
    }

    static List<String> requestLinkParts(String brand, String email, String textForEmail) {
        return List.of(
            InviteKeyFactory.normalizeBrand(brand),
            InviteKeyFactory.normalizeEmail(email),
            textForEmail.trim());
    }

    private SignatureCheck checkFreshness(long issuedAt, Duration maxAge) {
        long now = clock.instant().getEpochSecond();
        if (issuedAt - now > properties.getLink().getClockSkew().getSeconds()) {
            return SignatureCheck.NOT_YET_VALID;
        }
        if (now - issuedAt > maxAge.getSeconds()) {
            return SignatureCheck.EXPIRED;
        }
        return SignatureCheck.VALID;
    }

    private static boolean isWellFormed(String signature) {
        return signature != null && SIGNATURE_PATTERN.matcher(signature.toLowerCase(Locale.ROOT)).matches();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
