package com.waplus.api;

/**
 * How the observation read is shaped: raw rows, time buckets, or one row per indicator/location.
 * {@code granularity} and {@code requestedLevel} are set only for bucketed plans; {@code reduction} is null
 * only for raw plans. {@code requestedLevel} is the granularity as the caller spelled it.
 */
public record AggregationPlan(Mode mode, Granularity granularity, ReductionMethod reduction, String requestedLevel) {

    public enum Mode { RAW, BUCKETED, SUMMARY }

    public static AggregationPlan raw() {
        return new AggregationPlan(Mode.RAW, null, null, null);
    }

    public static AggregationPlan bucketed(Granularity granularity, ReductionMethod reduction) {
        return bucketed(granularity, reduction, granularity.label());
    }

    public static AggregationPlan bucketed(Granularity granularity, ReductionMethod reduction, String requestedLevel) {
        return new AggregationPlan(Mode.BUCKETED, granularity, reduction, requestedLevel);
    }

    public static AggregationPlan summary(ReductionMethod reduction) {
        return new AggregationPlan(Mode.SUMMARY, null, reduction, null);
    }

    public boolean isRaw() {
        return mode == Mode.RAW;
    }
}
