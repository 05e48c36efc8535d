package com.crewlife.booking.service;

import com.crewlife.booking.util.LogMasking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes state transitions to the dedicated {@code booking.audit} logger.
 * The trace id comes from MDC; emails are masked and codes or tokens are never passed in.
 */
@Component
public class AuditLogger {

    private static final Logger audit = LoggerFactory.getLogger("booking.audit");

    public void record(AuditEvent event, String brand, String email, String rowId, String detail) {
        audit.info("event={} brand={} email={} row={} detail={}",
            event, brand, LogMasking.maskEmail(email), rowId == null ? "-" : rowId, detail == null ? "-" : detail);
    }

    public void record(AuditEvent event, String brand, String email, String rowId) {
        record(event, brand, email, rowId, null);
    }
}
