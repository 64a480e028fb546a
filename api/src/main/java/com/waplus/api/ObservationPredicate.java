package com.waplus.api;

/**
 * Composed WHERE clause over {@code indicator_timeseries o}, plus what the assembler needs to know
 * about it: the location scope and which lookup tables the conditions reference.
 */
public record ObservationPredicate(
    SqlFragment where,
    LocationFilter location,
    boolean filtersSourceResolution,
    boolean filtersQualityFlag
) {}
