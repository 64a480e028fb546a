package com.waplus.api;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Target bucket sizes for time-series aggregation and the SQL that truncates a timestamp to its bucket start.
 *
 * Seasonal buckets are meteorological seasons: DJF starts on 1 December, MAM on 1 March, JJA on 1 June
 * and SON on 1 September. January and February belong to the winter that started the previous December.
 */
public enum Granularity {
    MONTHLY("Monthly"),
    ANNUAL("Annual"),
    SEASONAL("Seasonal");

    private final String label;

    Granularity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String bucketStart(String timestampColumn) {
        return switch (this) {
            case MONTHLY -> "date_trunc('month', " + timestampColumn + ")";
            case ANNUAL -> "date_trunc('year', " + timestampColumn + ")";
            // Shift one month forward so DJF/MAM/JJA/SON line up with calendar quarters, then shift back.
            case SEASONAL -> "(date_trunc('quarter', " + timestampColumn + " + INTERVAL '1 month') - INTERVAL '1 month')";
        };
    }

    /**
     * The bucket start {@link #bucketStart(String)} computes in the store, for a single timestamp.
     */
    public LocalDateTime bucketStart(LocalDateTime timestamp) {
        LocalDate day = timestamp.toLocalDate();
        return switch (this) {
            case MONTHLY -> day.withDayOfMonth(1).atStartOfDay();
            case ANNUAL -> day.withDayOfYear(1).atStartOfDay();
            case SEASONAL -> {
                LocalDate shifted = day.plusMonths(1);
                int quarterStartMonth = (shifted.getMonthValue() - 1) / 3 * 3 + 1;
                yield LocalDate.of(shifted.getYear(), quarterStartMonth, 1).minusMonths(1).atStartOfDay();
            }
        };
    }

    public static Optional<Granularity> fromLabel(String value) {
        if (value == null) return Optional.empty();
        String trimmed = value.trim();
        return Arrays.stream(values())
            .filter(g -> g.label.equalsIgnoreCase(trimmed))
            .findFirst();
    }

    static String supportedLabels() {
        return Arrays.stream(values()).map(Granularity::label).collect(Collectors.joining(", "));
    }
}
