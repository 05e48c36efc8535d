package com.crewlife.booking.util;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * One-way digests of candidate email addresses.
 *
 * <p>The canonical form is the SHA-256 hex of the lowercased, trimmed address.
 * Some writers persist the base64 form of the same digest, so matching accepts both.</p>
 */
public final class EmailHashes {

    private EmailHashes() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String hash(String email) {
        return DigestUtils.sha256Hex(InviteKeyFactory.normalizeEmail(email));
    }

    public static String base64Hash(String email) {
        return Base64.encodeBase64String(DigestUtils.sha256(InviteKeyFactory.normalizeEmail(email)));
    }

    /**
     * True when {@code storedHash} is either encoding of the digest of {@code email}.
     */
    public static boolean matches(String email, String storedHash) {
        if (email == null || storedHash == null || storedHash.isBlank()) {
            return false;
        }
        String candidate = storedHash.trim();
        return candidate.equalsIgnoreCase(hash(email)) || candidate.equals(base64Hash(email));
    }
}
