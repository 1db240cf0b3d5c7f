package com.niigaki.billing.application.webhook;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Lenient parsing of the date formats Asaas puts in webhook payloads ({@code yyyy-MM-dd},
 * local or offset date-times). Values that do not parse come back as {@code null}.
 */
public final class WebhookDates {

    private WebhookDates() {
    }

    public static OffsetDateTime parseOffsetDateTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDate.parse(value).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(value.replace(' ', 'T')).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    public static LocalDate parseLocalDate(String value) {
        OffsetDateTime dateTime = parseOffsetDateTime(value);
        return dateTime == null ? null : dateTime.toLocalDate();
    }

    /**
     * Whole days elapsed since the due date, never negative.
     */
    public static int daysSince(LocalDate dueDate, OffsetDateTime now) {
        long days = Duration.between(dueDate.atStartOfDay().atOffset(ZoneOffset.UTC), now).toDays();
        return (int) Math.max(0, days);
    }
}
