package com.github.dimitryivaniuta.linkorganizer.web;

import com.github.dimitryivaniuta.linkorganizer.error.ValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses ISO-8601 query parameters into instants.
 *
 * <p>Accepted: offset date-time ({@code 2024-01-01T10:00:00Z}, {@code 2024-01-01T10:00:00+02:00}),
 * local date-time read as UTC, plain date at midnight UTC. A single space may stand in for the
 * {@code T} separator ({@code 2024-01-01 10:00:00}).
 */
public final class IsoDates {

    private static final int DATE_LENGTH = "yyyy-MM-dd".length();

    private IsoDates() {
    }

    /** @return {@code null} for a null or blank value */
    public static Instant parse(String field, String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim();

        if (v.length() > DATE_LENGTH && v.charAt(DATE_LENGTH) == ' ') {
            v = v.substring(0, DATE_LENGTH) + 'T' + v.substring(DATE_LENGTH + 1);
        }
        try {
            if (v.indexOf('T') < 0) {
                return LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor t = DateTimeFormatter.ISO_DATE_TIME.parseBest(v, OffsetDateTime::from, LocalDateTime::from);
            return t instanceof OffsetDateTime odt
                    ? odt.toInstant()
                    : ((LocalDateTime) t).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid date format for " + field + ": '" + value
                    + "' (expected ISO-8601, e.g. 2024-01-01T00:00:00Z)", e);
        }
    }
}
