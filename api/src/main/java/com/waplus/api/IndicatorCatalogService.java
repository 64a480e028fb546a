package com.waplus.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the indicator catalog. {@link #resolveIds} is the code-to-id step of every observation query.
 */
@Service
public class IndicatorCatalogService {
    private static final Logger logger = LoggerFactory.getLogger(IndicatorCatalogService.class);

    static final String SPATIAL_RASTER = "spatial_raster";

    private static final String INDICATOR_SELECT = """
        SELECT d.id, d.code, d.name_en, d.name_local, d.description_en, d.data_type,
               u.abbreviation AS unit, c.name_en AS category, d.is_spatial_raster
        FROM indicator_definitions d
        LEFT JOIN unit_of_measurements u ON u.id = d.unit_of_measurement_id
        LEFT JOIN indicator_categories c ON c.id = d.category_id
        """;

    private static final RowMapper<IndicatorDto> INDICATOR_ROW = (rs, rowNum) -> new IndicatorDto(
        rs.getLong("id"),
        rs.getString("code"),
        rs.getString("name_en"),
        rs.getString("name_local"),
        rs.getString("description_en"),
        rs.getString("data_type"),
        rs.getString("unit"),
        rs.getString("category"),
        rs.getBoolean("is_spatial_raster")
    );

    private final JdbcTemplate jdbcTemplate;

    public IndicatorCatalogService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public record IndicatorDto(
        long id,
        String code,
        String name,
        String nameLocal,
        String description,
        String dataType,
        String unit,
        String category,
        boolean spatialRaster
    ) {}

    public record CategoryDto(long id, String name, String nameLocal) {}

    public record UnitOfMeasurementDto(long id, String name, String abbreviation, String description) {}

    /**
     * Maps indicator codes to internal ids. Unknown codes are dropped; no codes means no query and an empty list.
     */
    public List<Long> resolveIds(Collection<String> codes) {
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        if (codes != null) {
            for (String code : codes) {
                if (code != null && !code.isBlank()) distinct.add(code.trim());
            }
        }
        if (distinct.isEmpty()) {
            return List.of();
        }

        SqlFragment codeIn = SqlFragment.in("code", distinct);
        List<Long> ids = jdbcTemplate.queryForList(
            "SELECT id FROM indicator_definitions WHERE " + codeIn.sql() + " ORDER BY id",
            Long.class,
            codeIn.params().toArray()
        );
        if (ids.size() < distinct.size()) {
            logger.info("[INFO] resolved {} of {} indicator codes {}", ids.size(), distinct.size(), distinct);
        }
        return ids;
    }

    public Optional<IndicatorDto> findByCode(String code) {
        List<IndicatorDto> found = jdbcTemplate.query(INDICATOR_SELECT + "WHERE d.code = ?", INDICATOR_ROW, code);
        return found.stream().findFirst();
    }

    public List<IndicatorDto> listIndicators(Long categoryId, String dataType, Paging paging) {
        String type = dataType == null || dataType.isBlank() ? null : dataType.trim();
        SqlFragment where = ConditionalClause.fold(List.of(
            ConditionalClause.whenPresent(categoryId, "d.category_id = ?"),
            ConditionalClause.when(SPATIAL_RASTER.equals(type), () -> SqlFragment.of("d.is_spatial_raster = TRUE")),
            ConditionalClause.when(type != null && !SPATIAL_RASTER.equals(type), () -> SqlFragment.of("d.data_type = ?", type))
        ));

        SqlFragment page = paging.page(INDICATOR_SELECT, where, "d.name_en, d.id");
        return jdbcTemplate.query(page.sql(), INDICATOR_ROW, page.params().toArray());
    }

    public List<CategoryDto> listCategories() {
        return jdbcTemplate.query(
            "SELECT id, name_en, name_local FROM indicator_categories ORDER BY name_en",
            (rs, rowNum) -> new CategoryDto(rs.getLong("id"), rs.getString("name_en"), rs.getString("name_local"))
        );
    }

    public List<UnitOfMeasurementDto> listUnitsOfMeasurement() {
        return jdbcTemplate.query(
            "SELECT id, name, abbreviation, description FROM unit_of_measurements ORDER BY name",
            (rs, rowNum) -> new UnitOfMeasurementDto(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("abbreviation"),
                rs.getString("description")
            )
        );
    }
}
