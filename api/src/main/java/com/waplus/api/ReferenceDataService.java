package com.waplus.api;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Lookups over locations and the small reference tables the dashboard filters on.
 */
@Service
public class ReferenceDataService {
    private static final String REPORTING_UNIT_SELECT = """
        SELECT ru.id, ru.name, ru.code, ru.description, ru.area_sqkm, ru.parent_unit_id,
               ru.unit_type_id, t.name AS unit_type_name
        FROM reporting_units ru
        JOIN reporting_unit_types t ON t.id = ru.unit_type_id
        """;

    private static final RowMapper<ReportingUnitDto> REPORTING_UNIT_ROW = (rs, rowNum) -> new ReportingUnitDto(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("code"),
        rs.getString("description"),
        rs.getObject("area_sqkm", Double.class),
        rs.getObject("parent_unit_id", Long.class),
        rs.getLong("unit_type_id"),
        rs.getString("unit_type_name")
    );

    private static final RowMapper<LookupDto> LOOKUP_ROW = (rs, rowNum) -> new LookupDto(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("description")
    );

    private final JdbcTemplate jdbcTemplate;

    public ReferenceDataService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public record ReportingUnitDto(
        long id,
        String name,
        String code,
        String description,
        Double areaSqkm,
        Long parentUnitId,
        long unitTypeId,
        String unitTypeName
    ) {}

    public record LookupDto(long id, String name, String description) {}

    public record InfrastructureDto(
        long id,
        String name,
        long infrastructureTypeId,
        String infrastructureType,
        Long reportingUnitId,
        String reportingUnitName,
        Long operationalStatusId,
        String operationalStatus,
        Double capacity,
        String capacityUnit
    ) {}

    public record CropDto(long id, String code, String name, String nameLocal, String category) {}

    public List<ReportingUnitDto> listReportingUnits(Long unitTypeId, Long parentUnitId, String search, Paging paging) {
        String term = search == null || search.isBlank() ? null : "%" + escapeLike(search.trim()) + "%";
        SqlFragment where = ConditionalClause.fold(List.of(
            ConditionalClause.whenPresent(unitTypeId, "ru.unit_type_id = ?"),
            ConditionalClause.whenPresent(parentUnitId, "ru.parent_unit_id = ?"),
            ConditionalClause.whenPresent(term, "ru.name ILIKE ?")
        ));
        SqlFragment page = paging.page(REPORTING_UNIT_SELECT, where, "ru.name, ru.id");
        return jdbcTemplate.query(page.sql(), REPORTING_UNIT_ROW, page.params().toArray());
    }

    public Optional<ReportingUnitDto> findReportingUnit(long id) {
        return jdbcTemplate.query(REPORTING_UNIT_SELECT + "WHERE ru.id = ?", REPORTING_UNIT_ROW, id)
            .stream()
            .findFirst();
    }

    public List<LookupDto> listReportingUnitTypes() {
        return jdbcTemplate.query("SELECT id, name, description FROM reporting_unit_types ORDER BY name", LOOKUP_ROW);
    }

    public List<LookupDto> listTemporalResolutions() {
        return jdbcTemplate.query(
            "SELECT id, name, CAST(NULL AS VARCHAR) AS description FROM temporal_resolutions ORDER BY name",
            LOOKUP_ROW
        );
    }

    public List<LookupDto> listDataQualityFlags() {
        return jdbcTemplate.query("SELECT id, name, description FROM data_quality_flags ORDER BY name", LOOKUP_ROW);
    }

    public List<LookupDto> listInfrastructureTypes() {
        return jdbcTemplate.query("SELECT id, name, description FROM infrastructure_types ORDER BY name", LOOKUP_ROW);
    }

    public List<LookupDto> listOperationalStatusTypes() {
        return jdbcTemplate.query("SELECT id, name, description FROM operational_status_types ORDER BY name", LOOKUP_ROW);
    }

    public List<InfrastructureDto> listInfrastructure(
        Long infrastructureTypeId,
        Long reportingUnitId,
        Long operationalStatusId,
        Paging paging
    ) {
        String select = """
            SELECT inf.id, inf.name, inf.infrastructure_type_id, it.name AS infrastructure_type,
                   inf.reporting_unit_id, ru.name AS reporting_unit_name,
                   inf.operational_status_id, os.name AS operational_status,
                   inf.capacity, u.abbreviation AS capacity_unit
            FROM infrastructures inf
            JOIN infrastructure_types it ON it.id = inf.infrastructure_type_id
            LEFT JOIN reporting_units ru ON ru.id = inf.reporting_unit_id
            LEFT JOIN operational_status_types os ON os.id = inf.operational_status_id
            LEFT JOIN unit_of_measurements u ON u.id = inf.capacity_unit_id
            """;
        SqlFragment where = ConditionalClause.fold(List.of(
            ConditionalClause.whenPresent(infrastructureTypeId, "inf.infrastructure_type_id = ?"),
            ConditionalClause.whenPresent(reportingUnitId, "inf.reporting_unit_id = ?"),
            ConditionalClause.whenPresent(operationalStatusId, "inf.operational_status_id = ?")
        ));
        SqlFragment page = paging.page(select, where, "inf.name, inf.id");
        return jdbcTemplate.query(
            page.sql(),
            (rs, rowNum) -> new InfrastructureDto(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getLong("infrastructure_type_id"),
                rs.getString("infrastructure_type"),
                rs.getObject("reporting_unit_id", Long.class),
                rs.getString("reporting_unit_name"),
                rs.getObject("operational_status_id", Long.class),
                rs.getString("operational_status"),
                rs.getObject("capacity", Double.class),
                rs.getString("capacity_unit")
            ),
            page.params().toArray()
        );
    }

    public List<CropDto> listCrops(Paging paging) {
        SqlFragment page = paging.page("SELECT id, code, name_en, name_local, category FROM crops ", null, "name_en, id");
        return jdbcTemplate.query(
            page.sql(),
            (rs, rowNum) -> new CropDto(
                rs.getLong("id"),
                rs.getString("code"),
                rs.getString("name_en"),
                rs.getString("name_local"),
                rs.getString("category")
            ),
            page.params().toArray()
        );
    }

    static String escapeLike(String term) {
        return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
