package com.waplus.api;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns request filters into an {@link ObservationPredicate}.
 *
 * Location ids of different kinds are OR'ed: an observation belongs to a reporting unit or to an
 * infrastructure unit, never both, so a conjunction across kinds would always be empty.
 */
@Component
public class FilterComposer {

    public ObservationPredicate compose(
        List<Long> indicatorIds,
        TimeWindow window,
        LocationFilter location,
        String sourceResolution,
        String qualityFlag
    ) {
        if (indicatorIds == null || indicatorIds.isEmpty()) {
            // An empty IN list must never reach the store; callers short-circuit to an empty result.
            throw new IllegalStateException("At least one resolved indicator id is required");
        }
        if (window == null) {
            throw new InvalidRequestException("A time window is required.");
        }
        LocationFilter effectiveLocation = location != null ? location : LocationFilter.global();

        List<ConditionalClause> clauses = List.of(
            ConditionalClause.when(true, () -> SqlFragment.in("o.indicator_definition_id", indicatorIds)),
            ConditionalClause.always("o.timestamp BETWEEN ? AND ?", window.start(), window.end()),
            ConditionalClause.when(
                effectiveLocation.hasReportingUnits() || effectiveLocation.hasInfrastructure(),
                () -> locationCondition("o", effectiveLocation)
            ),
            ConditionalClause.whenPresent(trimmed(sourceResolution), "tr.name = ?"),
            ConditionalClause.whenPresent(trimmed(qualityFlag), "q.name = ?")
        );

        return new ObservationPredicate(
            ConditionalClause.fold(clauses),
            effectiveLocation,
            trimmed(sourceResolution) != null,
            trimmed(qualityFlag) != null
        );
    }

    /**
     * {@code (alias.reporting_unit_id IN (...) OR alias.infrastructure_id IN (...))}, or just the kind that is present.
     */
    static SqlFragment locationCondition(String alias, LocationFilter location) {
        List<SqlFragment> kinds = new ArrayList<>();
        if (location.hasReportingUnits()) {
            kinds.add(SqlFragment.in(alias + ".reporting_unit_id", location.reportingUnitIds()));
        }
        if (location.hasInfrastructure()) {
            kinds.add(SqlFragment.in(alias + ".infrastructure_id", location.infrastructureIds()));
        }
        return SqlFragment.anyOf(kinds);
    }

    private static String trimmed(String value) {
        if (value == null || value.isBlank()) return null;
        return value.trim();
    }
}
