package com.crewlife.booking.service;

import com.crewlife.booking.exception.AccessError;
import com.crewlife.booking.exception.InviteAccessException;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes and vets booking destinations before they are revealed, and keeps them out
 * of anything emailed.
 */
@Component
public class BookingUrlPolicy {

    private static final Pattern ACCOUNT_SEGMENT = Pattern.compile("/u/\\d+/");

    /**
     * Trim and drop the Google account selector ({@code /u/1/}) so the link works for the candidate.
     */
    public String normalize(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        if (trimmed.toLowerCase(Locale.ROOT).contains("google.com")) {
            trimmed = ACCOUNT_SEGMENT.matcher(trimmed).replaceAll("/");
        }
        return trimmed;
    }

    /**
     * @return the normalized URL
     * @throws InviteAccessException BOOKING_URL_MISSING or BOOKING_URL_INVALID
     */
    public String requireValid(String url) {
        String normalized = normalize(url);
        if (normalized.isEmpty()) {
            throw new InviteAccessException(AccessError.BOOKING_URL_MISSING);
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (lower.contains("script.google.com") || lower.contains("docs.google.com/forms")) {
            throw new InviteAccessException(AccessError.BOOKING_URL_INVALID);
        }
        try {
            URI uri = new URI(normalized);
            if (!"https".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) {
                throw new InviteAccessException(AccessError.BOOKING_URL_INVALID);
            }
        } catch (URISyntaxException e) {
            throw new InviteAccessException(AccessError.BOOKING_URL_INVALID);
        }
        return normalized;
    }

    public boolean isValid(String url) {
        try {
            requireValid(url);
            return true;
        } catch (InviteAccessException e) {
            return false;
        }
    }

    /**
     * Whether a link may be emailed: it must not point at a booking calendar.
     */
    public boolean isSafeToEmail(String url) {
        String lower = url == null ? "" : url.toLowerCase(Locale.ROOT);
        return !lower.contains("calendar.google.com") && !lower.contains("/appointments/schedules/");
    }
}
