package com.waplus.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Financial account rollups and the non-revenue water balance.
 */
@Service
public class FinancialDataService {
    private static final Logger logger = LoggerFactory.getLogger(FinancialDataService.class);

    private final JdbcTemplate jdbcTemplate;
    private final String suppliedIndicatorCode;
    private final String billedIndicatorCode;
    private final String nrwUnit;

    public FinancialDataService(
        JdbcTemplate jdbcTemplate,
        @Value("${waplus.nrw.supplied-indicator-code:WATER_SUPPLIED_VOL}") String suppliedIndicatorCode,
        @Value("${waplus.nrw.billed-indicator-code:WATER_BILLED_VOL}") String billedIndicatorCode,
        @Value("${waplus.nrw.unit:MCM}") String nrwUnit
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.suppliedIndicatorCode = suppliedIndicatorCode;
        this.billedIndicatorCode = billedIndicatorCode;
        this.nrwUnit = nrwUnit;
    }

    public record NonRevenueWater(
        long reportingUnitId,
        double suppliedVolume,
        double billedVolume,
        double nrwVolume,
        double nrwPercentage,
        String unit
    ) {}

    public List<Map<String, Object>> getFinancialAccountsSummary(
        TimeWindow window,
        LocationFilter location,
        boolean groupByAccountType
    ) {
        if (window == null) {
            throw new InvalidRequestException("A time window is required.");
        }
        LocationFilter effectiveLocation = location != null ? location : LocationFilter.global();
        boolean located = effectiveLocation.scope() != LocationFilter.Scope.GLOBAL;

        List<String> columns = new ArrayList<>(List.of("c.code AS currency", "fat.is_cost AS is_cost"));
        List<String> groupBy = new ArrayList<>(List.of("c.code", "fat.is_cost"));
        if (groupByAccountType) {
            columns.add("fat.name AS account_type");
            columns.add("fat.category AS account_category");
            groupBy.add("fat.name");
            groupBy.add("fat.category");
        }
        List<String> orderBy = new ArrayList<>(List.of("fat.is_cost DESC", "c.code"));
        orderBy.addAll(groupBy.subList(2, groupBy.size()));
        if (located) {
            columns.add("fa.reporting_unit_id AS reporting_unit_id");
            columns.add("ru.name AS reporting_unit_name");
            columns.add("fa.infrastructure_id AS infrastructure_id");
            columns.add("inf.name AS infrastructure_name");
            groupBy.addAll(List.of("fa.reporting_unit_id", "ru.name", "fa.infrastructure_id", "inf.name"));
            orderBy.addAll(List.of("fa.reporting_unit_id", "fa.infrastructure_id"));
        }
        columns.add("SUM(fa.amount) AS total_amount");

        SqlFragment where = ConditionalClause.fold(List.of(
            ConditionalClause.always("fa.transaction_date BETWEEN ? AND ?",
                window.start().toLocalDate(), window.end().toLocalDate()),
            ConditionalClause.when(located, () -> FilterComposer.locationCondition("fa", effectiveLocation))
        ));

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(String.join(", ", columns)).append(" ");
        sql.append("FROM financial_accounts fa ");
        sql.append("JOIN financial_account_types fat ON fat.id = fa.financial_account_type_id ");
        sql.append("JOIN currencies c ON c.id = fa.currency_id ");
        if (located) {
            sql.append("LEFT JOIN reporting_units ru ON ru.id = fa.reporting_unit_id ");
            sql.append("LEFT JOIN infrastructures inf ON inf.id = fa.infrastructure_id ");
        }
        sql.append("WHERE ").append(where.sql()).append(" ");
        sql.append("GROUP BY ").append(String.join(", ", groupBy)).append(" ");
        sql.append("ORDER BY ").append(String.join(", ", orderBy));

        logger.debug("[DEBUG] SQL: {} params={}", sql, where.params());
        List<Map<String, Object>> rows = jdbcTemplate.query(
            sql.toString(), ObservationRecordMapper.monetary(), where.params().toArray());
        logger.info("[INFO] financial summary {} groupByAccountType={} returned {} rows",
            effectiveLocation, groupByAccountType, rows.size());
        return rows;
    }

    /**
     * Supplied minus billed volume over the window. Empty when nothing was supplied.
     */
    public Optional<NonRevenueWater> getNonRevenueWater(long reportingUnitId, TimeWindow window) {
        if (window == null) {
            throw new InvalidRequestException("A time window is required.");
        }
        String sql = """
            SELECT COALESCE(SUM(CASE WHEN d.code = ? THEN o.value_numeric END), 0) AS supplied_volume,
                   COALESCE(SUM(CASE WHEN d.code = ? THEN o.value_numeric END), 0) AS billed_volume
            FROM indicator_timeseries o
            JOIN indicator_definitions d ON d.id = o.indicator_definition_id
            WHERE d.code IN (?, ?)
              AND o.reporting_unit_id = ?
              AND o.timestamp BETWEEN ? AND ?
            """;
        Object[] params = {
            suppliedIndicatorCode, billedIndicatorCode,
            suppliedIndicatorCode, billedIndicatorCode,
            reportingUnitId, window.start(), window.end()
        };
        logger.debug("[DEBUG] SQL: {} params={}", sql, List.of(params));

        List<double[]> volumes = jdbcTemplate.query(
            sql,
            (rs, rowNum) -> new double[] {rs.getDouble("supplied_volume"), rs.getDouble("billed_volume")},
            params
        );
        if (volumes.isEmpty()) {
            return Optional.empty();
        }
        double supplied = volumes.get(0)[0];
        double billed = volumes.get(0)[1];
        if (supplied <= 0) {
            logger.info("[INFO] no supplied volume for reporting unit {} between {} and {}",
                reportingUnitId, window.start(), window.end());
            return Optional.empty();
        }
        double nrw = supplied - billed;
        return Optional.of(new NonRevenueWater(
            reportingUnitId, supplied, billed, nrw, nrw / supplied * 100.0, nrwUnit));
    }
}
