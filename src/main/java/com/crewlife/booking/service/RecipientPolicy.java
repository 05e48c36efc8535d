package com.crewlife.booking.service;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rejects malformed addresses and placeholder recipients before anything is sent.
 */
public final class RecipientPolicy {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Set<String> PLACEHOLDER_DOMAINS = Set.of(
        "example.com", "example.org", "example.net", "test.com", "invalid", "localhost");

    private RecipientPolicy() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean isValidFormat(String email) {
        return email != null && EMAIL.matcher(email.trim()).matches();
    }

    public static boolean isDeliverable(String email) {
        if (!isValidFormat(email)) {
            return false;
        }
        String domain = email.trim().substring(email.trim().indexOf('@') + 1).toLowerCase(Locale.ROOT);
        return !PLACEHOLDER_DOMAINS.contains(domain);
    }
}
