package com.waplus.api;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The closed set of value reductions. Parsing an unknown name fails here, before any SQL is built.
 */
public enum ReductionMethod {
    AVERAGE("Average", "AVG"),
    SUM("Sum", "SUM"),
    MIN("Min", "MIN"),
    MAX("Max", "MAX"),
    COUNT("Count", "COUNT");

    private final String label;
    private final String sqlFunction;

    ReductionMethod(String label, String sqlFunction) {
        this.label = label;
        this.sqlFunction = sqlFunction;
    }

    public String label() {
        return label;
    }

    public String apply(String column) {
        return sqlFunction + "(" + column + ")";
    }

    public static ReductionMethod fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("Aggregation method is required; expected one of " + supportedLabels() + ".");
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
            .filter(m -> m.label.equalsIgnoreCase(trimmed))
            .findFirst()
            .orElseThrow(() -> new InvalidRequestException(
                "Unsupported aggregation method: " + trimmed + "; expected one of " + supportedLabels() + "."));
    }

    static String supportedLabels() {
        return Arrays.stream(values()).map(ReductionMethod::label).collect(Collectors.joining(", "));
    }
}
