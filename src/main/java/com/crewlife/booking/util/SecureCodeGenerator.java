package com.crewlife.booking.util;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Random material for one-time codes, access tokens and signing secrets.
 */
public final class SecureCodeGenerator {

    private static final SecureRandom random = new SecureRandom();

    private SecureCodeGenerator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Numeric code of the given length, uniform over the whole code space
     * (leading zeros included, e.g. "004217").
     */
    public static String numericCode(int length) {
        if (length < 1 || length > 9) {
            throw new IllegalArgumentException("Code length must be between 1 and 9");
        }
        int bound = (int) Math.pow(10, length);
        return String.format("%0" + length + "d", random.nextInt(bound));
    }

    /**
     * URL-safe token without padding built from {@code byteCount} random bytes.
     */
    public static String urlSafeToken(int byteCount) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes(byteCount));
    }

    public static byte[] randomBytes(int byteCount) {
        byte[] bytes = new byte[byteCount];
        random.nextBytes(bytes);
        return bytes;
    }
}
