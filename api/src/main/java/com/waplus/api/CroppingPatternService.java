package com.waplus.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Crop-level area, yield and water figures for one reporting unit and year.
 */
@Service
public class CroppingPatternService {
    private static final Logger logger = LoggerFactory.getLogger(CroppingPatternService.class);

    private static final String SELECT = """
        SELECT cr.name_en AS crop_name, cr.code AS crop_code,
               cp.time_period_year, cp.time_period_season, cp.data_type,
               cp.area_cultivated_ha, cp.area_proposed_ha,
               cp.yield_actual_ton_ha, cp.yield_proposed_ton_ha,
               cp.water_allocation_mcm, cp.water_consumed_actual_mcm
        FROM cropping_patterns cp
        JOIN crops cr ON cr.id = cp.crop_id
        """;

    private final JdbcTemplate jdbcTemplate;

    public CroppingPatternService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<Map<String, Object>> getCroppingPatterns(
        Long reportingUnitId,
        Integer timePeriodYear,
        String timePeriodSeason,
        String patternType
    ) {
        if (reportingUnitId == null) {
            throw new InvalidRequestException("reporting_unit_id is required.");
        }
        if (timePeriodYear == null) {
            throw new InvalidRequestException("time_period_year is required.");
        }

        SqlFragment where = ConditionalClause.fold(List.of(
            ConditionalClause.always("cp.reporting_unit_id = ?", reportingUnitId),
            ConditionalClause.always("cp.time_period_year = ?", timePeriodYear),
            ConditionalClause.whenPresent(timePeriodSeason, "cp.time_period_season = ?"),
            ConditionalClause.whenPresent(patternType, "cp.data_type = ?")
        ));

        String sql = SELECT + "WHERE " + where.sql()
            + " ORDER BY cr.name_en, cp.time_period_season NULLS FIRST, cp.data_type";
        logger.debug("[DEBUG] SQL: {} params={}", sql, where.params());

        List<Map<String, Object>> rows = jdbcTemplate.query(sql, ObservationRecordMapper.plain(), where.params().toArray());
        logger.info("[INFO] cropping patterns unit={} year={} returned {} rows", reportingUnitId, timePeriodYear, rows.size());
        return rows;
    }
}
