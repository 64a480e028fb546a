package com.waplus.api;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the single read against {@code indicator_timeseries} for a composed predicate and an aggregation plan.
 *
 * Location joins follow the scope of the request: the supplied kind is inner-joined, both kinds are
 * left-joined only when both id sets were supplied, and a global query joins neither. Location identity
 * always comes from the observation's own columns so that grouping never merges two locations.
 */
@Component
public class ObservationQueryAssembler {
    static final String LOCATION_TYPE =
        "CASE WHEN o.reporting_unit_id IS NOT NULL THEN 'reporting_unit' "
            + "WHEN o.infrastructure_id IS NOT NULL THEN 'infrastructure' END";
    static final String LOCATION_ID = "COALESCE(o.reporting_unit_id, o.infrastructure_id)";
    static final String LOCATION_ORDER = "o.reporting_unit_id NULLS FIRST, o.infrastructure_id NULLS FIRST";
    static final String VALUE_COLUMN = "o.value_numeric";

    public SqlFragment assembleTimeseries(ObservationPredicate predicate, AggregationPlan plan) {
        return switch (plan.mode()) {
            case RAW -> raw(predicate);
            case BUCKETED -> bucketed(predicate, plan);
            case SUMMARY -> throw new IllegalArgumentException("Summary plans are assembled with assembleSummary");
        };
    }

    public SqlFragment assembleSummary(ObservationPredicate predicate, AggregationPlan plan) {
        if (plan.mode() != AggregationPlan.Mode.SUMMARY) {
            throw new IllegalArgumentException("Expected a summary plan but got " + plan.mode());
        }
        LocationFilter.Scope scope = predicate.location().scope();

        List<String> columns = new ArrayList<>(List.of(
            "d.code AS indicator_code",
            "d.name_en AS indicator_name",
            "u.abbreviation AS unit",
            plan.reduction().apply(VALUE_COLUMN) + " AS aggregated_value"
        ));
        List<String> groupBy = new ArrayList<>(List.of("d.code", "d.name_en", "u.abbreviation"));
        String orderBy = "d.code";
        // A global summary collapses every location into one row per indicator.
        if (scope != LocationFilter.Scope.GLOBAL) {
            columns.addAll(locationColumns(scope));
            groupBy.addAll(locationGroupBy(scope));
            orderBy += ", " + LOCATION_ORDER;
        }

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(String.join(", ", columns)).append(" ");
        appendFrom(sql, scope, predicate.filtersSourceResolution(), predicate.filtersQualityFlag());
        sql.append("WHERE ").append(predicate.where().sql()).append(" ");
        sql.append("GROUP BY ").append(String.join(", ", groupBy)).append(" ");
        sql.append("ORDER BY ").append(orderBy);
        return new SqlFragment(sql.toString(), predicate.where().params());
    }

    private SqlFragment raw(ObservationPredicate predicate) {
        LocationFilter.Scope scope = predicate.location().scope();

        List<String> columns = new ArrayList<>(List.of(
            "o.timestamp AS timestamp",
            VALUE_COLUMN + " AS value",
            "o.value_text AS value_text",
            "d.code AS indicator_code",
            "d.name_en AS indicator_name",
            "u.abbreviation AS unit"
        ));
        columns.addAll(locationColumns(scope));
        columns.add("tr.name AS source_temporal_resolution");
        columns.add("q.name AS quality_flag");

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(String.join(", ", columns)).append(" ");
        appendFrom(sql, scope, true, true);
        sql.append("WHERE ").append(predicate.where().sql()).append(" ");
        sql.append("ORDER BY o.timestamp, d.code, ").append(LOCATION_ORDER).append(", o.id");
        return new SqlFragment(sql.toString(), predicate.where().params());
    }

    private SqlFragment bucketed(ObservationPredicate predicate, AggregationPlan plan) {
        LocationFilter.Scope scope = predicate.location().scope();
        String bucket = plan.granularity().bucketStart("o.timestamp");

        // value_text, source resolution and quality flag are per-row facts and are dropped once rows merge.
        List<String> columns = new ArrayList<>(List.of(
            bucket + " AS timestamp",
            plan.reduction().apply(VALUE_COLUMN) + " AS value",
            "d.code AS indicator_code",
            "d.name_en AS indicator_name",
            "u.abbreviation AS unit"
        ));
        columns.addAll(locationColumns(scope));

        List<String> groupBy = new ArrayList<>(List.of(bucket, "d.code", "d.name_en", "u.abbreviation"));
        groupBy.addAll(locationGroupBy(scope));

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(String.join(", ", columns)).append(" ");
        appendFrom(sql, scope, predicate.filtersSourceResolution(), predicate.filtersQualityFlag());
        sql.append("WHERE ").append(predicate.where().sql()).append(" ");
        sql.append("GROUP BY ").append(String.join(", ", groupBy)).append(" ");
        sql.append("ORDER BY ").append(bucket).append(", d.code, ").append(LOCATION_ORDER);
        return new SqlFragment(sql.toString(), predicate.where().params());
    }

    private static void appendFrom(
        StringBuilder sql,
        LocationFilter.Scope scope,
        boolean joinTemporalResolution,
        boolean joinQualityFlag
    ) {
        sql.append("FROM indicator_timeseries o ");
        sql.append("JOIN indicator_definitions d ON d.id = o.indicator_definition_id ");
        sql.append("LEFT JOIN unit_of_measurements u ON u.id = d.unit_of_measurement_id ");
        switch (scope) {
            case REPORTING_UNITS -> sql.append("JOIN reporting_units ru ON ru.id = o.reporting_unit_id ");
            case INFRASTRUCTURE -> sql.append("JOIN infrastructures inf ON inf.id = o.infrastructure_id ");
            case BOTH -> {
                sql.append("LEFT JOIN reporting_units ru ON ru.id = o.reporting_unit_id ");
                sql.append("LEFT JOIN infrastructures inf ON inf.id = o.infrastructure_id ");
            }
            case GLOBAL -> {
                // no location join: names are not surfaced for unscoped queries
            }
        }
        if (joinTemporalResolution) {
            sql.append("LEFT JOIN temporal_resolutions tr ON tr.id = o.temporal_resolution_id ");
        }
        if (joinQualityFlag) {
            sql.append("LEFT JOIN data_quality_flags q ON q.id = o.quality_flag_id ");
        }
    }

    private static List<String> locationColumns(LocationFilter.Scope scope) {
        return List.of(
            LOCATION_TYPE + " AS location_type",
            LOCATION_ID + " AS location_id",
            locationName(scope) + " AS location_name"
        );
    }

    private static String locationName(LocationFilter.Scope scope) {
        return switch (scope) {
            case REPORTING_UNITS -> "ru.name";
            case INFRASTRUCTURE -> "inf.name";
            case BOTH -> "COALESCE(ru.name, inf.name)";
            case GLOBAL -> "CAST(NULL AS VARCHAR)";
        };
    }

    private static List<String> locationGroupBy(LocationFilter.Scope scope) {
        List<String> columns = new ArrayList<>(List.of("o.reporting_unit_id", "o.infrastructure_id"));
        switch (scope) {
            case REPORTING_UNITS -> columns.add("ru.name");
            case INFRASTRUCTURE -> columns.add("inf.name");
            case BOTH -> {
                columns.add("ru.name");
                columns.add("inf.name");
            }
            case GLOBAL -> {
                // ids only
            }
        }
        return columns;
    }
}
