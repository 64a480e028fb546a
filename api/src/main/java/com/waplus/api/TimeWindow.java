package com.waplus.api;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Inclusive [start, end] window in naive UTC.
 */
public record TimeWindow(LocalDateTime start, LocalDateTime end) {

    // Microsecond precision: the store keeps microseconds, and a nanosecond end-of-day rounds into the next day.
    static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_999_000);

    public TimeWindow {
        if (start == null || end == null) {
            throw new InvalidRequestException("Both start and end of the time window are required.");
        }
        if (start.isAfter(end)) {
            throw new InvalidRequestException("Start date cannot be after end date.");
        }
    }

    /**
     * Accepts ISO dates ({@code 2023-01-31}), local date-times or offset date-times.
     * A date-only end bound covers the whole day.
     */
    public static TimeWindow parse(String start, String end) {
        return new TimeWindow(parseBound(start, "start", false), parseBound(end, "end", true));
    }

    static LocalDateTime parseBound(String raw, String name, boolean endOfDay) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRequestException("The " + name + " of the time window is required.");
        }
        String value = raw.trim();
        try {
            if (value.length() == 10) {
                LocalDate day = LocalDate.parse(value);
                return endOfDay ? day.atTime(END_OF_DAY) : day.atStartOfDay();
            }
            try {
                return LocalDateTime.parse(value);
            } catch (DateTimeParseException notLocal) {
                return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("Invalid " + name + " timestamp: " + value, e);
        }
    }
}
