package com.crewlife.booking.util;

import com.crewlife.booking.exception.InvalidKeyException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Key factory for the InviteRecords table and its secondary indexes.
 */
public final class InviteKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern BRAND_PATTERN = Pattern.compile("[A-Z][A-Z0-9_]{1,31}");
    private static final Pattern HASH_PATTERN = Pattern.compile("[0-9a-f]{64}");

    public static final String IDENTITY_PREFIX = "IDENTITY";
    public static final String CANDIDATE_PREFIX = "CANDIDATE";

    private InviteKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateBrand(String brand) {
        if (brand == null || !BRAND_PATTERN.matcher(brand).matches()) {
            throw new InvalidKeyException("Invalid brand code: " + brand);
        }
    }

    private static void validateEmailHash(String emailHash) {
        if (emailHash == null || !HASH_PATTERN.matcher(emailHash).matches()) {
            throw new InvalidKeyException("Invalid email hash");
        }
    }

    /**
     * Identity key: brand, email hash and the normalized position text.
     * The text is the last component so a '#' inside it cannot shift the others.
     */
    public static String getIdentityKey(String brand, String emailHash, String normalizedText) {
        validateBrand(brand);
        validateEmailHash(emailHash);
        if (normalizedText == null || normalizedText.isEmpty()) {
            throw new InvalidKeyException("Position text cannot be null or empty");
        }
        return String.join(DELIMITER, IDENTITY_PREFIX, brand, emailHash, normalizedText);
    }

    public static String getCandidateKey(String brand, String emailHash) {
        validateBrand(brand);
        validateEmailHash(emailHash);
        return String.join(DELIMITER, CANDIDATE_PREFIX, brand, emailHash);
    }

    public static String normalizeBrand(String brand) {
        return brand == null ? null : brand.trim().toUpperCase(Locale.ROOT);
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public static String normalizeText(String textForEmail) {
        return textForEmail == null ? null : textForEmail.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValidBrandCode(String brand) {
        return brand != null && BRAND_PATTERN.matcher(brand).matches();
    }
}
