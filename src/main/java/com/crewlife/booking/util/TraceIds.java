package com.crewlife.booking.util;

import java.security.SecureRandom;

/**
 * Correlation ids of the form {@code tr-<base36 millis>-<base36 random>}.
 */
public final class TraceIds {

    public static final String MDC_KEY = "traceId";
    public static final String HEADER = "X-Trace-Id";

    private static final SecureRandom random = new SecureRandom();

    private TraceIds() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String newTraceId() {
        String time = Long.toString(System.currentTimeMillis(), 36);
        String rand = Long.toString(Math.abs(random.nextLong() % 2_176_782_336L), 36);
        return "tr-" + time + "-" + rand;
    }

    /**
     * Accepts an inbound id only if it is short and free of anything but [A-Za-z0-9-_].
     */
    public static boolean isAcceptable(String traceId) {
        return traceId != null && traceId.matches("[A-Za-z0-9_-]{6,64}");
    }
}
