package com.leakgate.config;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/** Lenient ISO-8601 parsing: offset date-time, local date-time or plain date. */
public final class IsoTimestamps {

    /** Zone for expiry values that carry no offset, shared by the policy loader and the enforcer. */
    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    private IsoTimestamps() {
    }

    /**
     * @param zone zone applied to values that carry no offset
     * @throws DateTimeParseException if none of the accepted forms match
     */
    public static Instant parse(String value, ZoneId zone) {
        if (value == null) {
            throw new DateTimeParseException("timestamp is missing", "", 0);
        }
        String v = value.trim();
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeParseException ignored) {
            // no offset, try the local forms
        }
        try {
            return LocalDateTime.parse(v).atZone(zone).toInstant();
        } catch (DateTimeParseException ignored) {
            // not a date-time, try a plain date
        }
        return LocalDate.parse(v).atStartOfDay(zone).toInstant();
    }
}
