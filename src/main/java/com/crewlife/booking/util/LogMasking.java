package com.crewlife.booking.util;

import java.net.URI;

/**
 * Redaction helpers so candidate data never lands in logs in the clear.
 */
public final class LogMasking {

    private LogMasking() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * "alice@example.org" becomes "al***@example.org".
     */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "(none)";
        }
        int at = email.indexOf('@');
        if (at < 0) {
            return "***";
        }
        String local = email.substring(0, at);
        String prefix = local.length() <= 2 ? local.substring(0, Math.min(1, local.length())) : local.substring(0, 2);
        return prefix + "***" + email.substring(at);
    }

    /**
     * Host plus the last 8 characters, enough to tell links apart.
     */
    public static String maskUrl(String url) {
        if (url == null || url.isBlank()) {
            return "(none)";
        }
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            host = null;
        }
        String tail = url.length() > 8 ? url.substring(url.length() - 8) : url;
        return (host == null ? "?" : host) + "/..." + tail;
    }

    public static String maskToken(String token) {
        if (token == null || token.isEmpty()) {
            return "(none)";
        }
        return token.length() <= 8 ? "***" : token.substring(0, 8) + "...";
    }
}
