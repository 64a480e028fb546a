package com.waplus.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class AggregationPlanner {
    private static final Logger logger = LoggerFactory.getLogger(AggregationPlanner.class);

    static final String RAW = "Raw";

    /**
     * No target granularity, {@code Raw}, or a granularity without a bucket rule (e.g. {@code Daily}) gives the
     * raw plan. A supported granularity gives a bucketed plan reduced with {@code Average} unless a method is named.
     * A supplied method is validated in every case.
     */
    public AggregationPlan planTimeseries(String aggregateTo, String aggregationMethod) {
        if (aggregateTo == null || aggregateTo.isBlank() || RAW.equalsIgnoreCase(aggregateTo.trim())) {
            validateMethod(aggregationMethod);
            return AggregationPlan.raw();
        }
        String requested = aggregateTo.trim();
        Optional<Granularity> granularity = Granularity.fromLabel(requested);
        if (granularity.isEmpty()) {
            validateMethod(aggregationMethod);
            logger.info("[INFO] granularity '{}' has no bucket rule (supported: {}), serving raw observations",
                requested, Granularity.supportedLabels());
            return AggregationPlan.raw();
        }
        return AggregationPlan.bucketed(granularity.get(), reductionOrAverage(aggregationMethod), requested);
    }

    public AggregationPlan planSummary(String aggregationMethod) {
        return AggregationPlan.summary(reductionOrAverage(aggregationMethod));
    }

    // Still parsed on raw plans so that a typo is not silently ignored.
    private static void validateMethod(String aggregationMethod) {
        if (aggregationMethod != null && !aggregationMethod.isBlank()) {
            ReductionMethod.fromLabel(aggregationMethod);
        }
    }

    private static ReductionMethod reductionOrAverage(String aggregationMethod) {
        if (aggregationMethod == null || aggregationMethod.isBlank()) {
            return ReductionMethod.AVERAGE;
        }
        return ReductionMethod.fromLabel(aggregationMethod);
    }
}
