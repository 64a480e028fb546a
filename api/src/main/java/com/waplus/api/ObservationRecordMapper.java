package com.waplus.api;

import org.springframework.jdbc.core.ColumnMapRowMapper;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens a result row into a chart-ready record keyed by column label, in select order.
 * Temporal values become {@code java.time} types; numerics become {@code Double} unless monetary.
 * Plan markers are appended after the columns.
 */
public class ObservationRecordMapper extends ColumnMapRowMapper {
    public static final String AGGREGATION_LEVEL = "aggregation_level";
    public static final String AGGREGATION_METHOD = "aggregation_method";

    private final Map<String, Object> markers;
    private final boolean keepDecimals;

    ObservationRecordMapper(Map<String, Object> markers, boolean keepDecimals) {
        this.markers = markers;
        this.keepDecimals = keepDecimals;
    }

    public static ObservationRecordMapper forPlan(AggregationPlan plan) {
        Map<String, Object> markers = new LinkedHashMap<>();
        switch (plan.mode()) {
            case BUCKETED -> markers.put(AGGREGATION_LEVEL, plan.requestedLevel());
            case SUMMARY -> markers.put(AGGREGATION_METHOD, plan.reduction().label());
            case RAW -> {
                // raw rows carry no markers
            }
        }
        return new ObservationRecordMapper(markers, false);
    }

    public static ObservationRecordMapper plain() {
        return new ObservationRecordMapper(Map.of(), false);
    }

    public static ObservationRecordMapper monetary() {
        return new ObservationRecordMapper(Map.of(), true);
    }

    @Override
    public Map<String, Object> mapRow(ResultSet rs, int rowNum) throws SQLException {
        Map<String, Object> record = super.mapRow(rs, rowNum);
        record.putAll(markers);
        return record;
    }

    @Override
    protected Map<String, Object> createColumnMap(int columnCount) {
        return new LinkedHashMap<>(columnCount + markers.size());
    }

    @Override
    protected Object getColumnValue(ResultSet rs, int index) throws SQLException {
        Object value = super.getColumnValue(rs, index);
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof BigDecimal && !keepDecimals) {
            return ((BigDecimal) value).doubleValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return value;
    }
}
