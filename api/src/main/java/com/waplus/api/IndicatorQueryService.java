package com.waplus.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Answers time-series and summary questions over indicator observations.
 *
 * Each call plans first (so invalid methods and granularities fail before any I/O), then resolves codes,
 * composes the predicate, and issues exactly one read. Unknown codes are dropped; if none resolve the
 * answer is an empty list and the observation table is not touched.
 */
@Service
public class IndicatorQueryService {
    private static final Logger logger = LoggerFactory.getLogger(IndicatorQueryService.class);

    private final JdbcTemplate jdbcTemplate;
    private final IndicatorCatalogService catalogService;
    private final FilterComposer filterComposer;
    private final AggregationPlanner aggregationPlanner;
    private final ObservationQueryAssembler queryAssembler;

    public IndicatorQueryService(
        JdbcTemplate jdbcTemplate,
        IndicatorCatalogService catalogService,
        FilterComposer filterComposer,
        AggregationPlanner aggregationPlanner,
        ObservationQueryAssembler queryAssembler
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.catalogService = catalogService;
        this.filterComposer = filterComposer;
        this.aggregationPlanner = aggregationPlanner;
        this.queryAssembler = queryAssembler;
    }

    public record TimeseriesQuery(
        List<String> indicatorCodes,
        TimeWindow window,
        LocationFilter location,
        String sourceResolution,
        String qualityFlag,
        String aggregateTo,
        String aggregationMethod
    ) {}

    public record SummaryQuery(
        List<String> indicatorCodes,
        TimeWindow window,
        LocationFilter location,
        String qualityFlag,
        String aggregationMethod
    ) {}

    public List<Map<String, Object>> getTimeseries(TimeseriesQuery query) {
        requireCodesAndWindow(query.indicatorCodes(), query.window());
        AggregationPlan plan = aggregationPlanner.planTimeseries(query.aggregateTo(), query.aggregationMethod());

        logger.info("[INFO] timeseries indicators={}, window={}..{}, {}, sourceResolution={}, qualityFlag={}, plan={}",
            query.indicatorCodes(), query.window().start(), query.window().end(), query.location(),
            query.sourceResolution(), query.qualityFlag(), plan);

        List<Long> indicatorIds = catalogService.resolveIds(query.indicatorCodes());
        if (indicatorIds.isEmpty()) {
            logger.info("[INFO] no indicator code resolved, returning no data");
            return List.of();
        }

        ObservationPredicate predicate = filterComposer.compose(
            indicatorIds, query.window(), query.location(), query.sourceResolution(), query.qualityFlag());
        SqlFragment statement = queryAssembler.assembleTimeseries(predicate, plan);
        return read(statement, plan);
    }

    public List<Map<String, Object>> getSummary(SummaryQuery query) {
        requireCodesAndWindow(query.indicatorCodes(), query.window());
        AggregationPlan plan = aggregationPlanner.planSummary(query.aggregationMethod());

        logger.info("[INFO] summary indicators={}, window={}..{}, {}, qualityFlag={}, method={}",
            query.indicatorCodes(), query.window().start(), query.window().end(), query.location(),
            query.qualityFlag(), plan.reduction().label());

        List<Long> indicatorIds = catalogService.resolveIds(query.indicatorCodes());
        if (indicatorIds.isEmpty()) {
            logger.info("[INFO] no indicator code resolved, returning no data");
            return List.of();
        }

        ObservationPredicate predicate = filterComposer.compose(
            indicatorIds, query.window(), query.location(), null, query.qualityFlag());
        SqlFragment statement = queryAssembler.assembleSummary(predicate, plan);
        return read(statement, plan);
    }

    private List<Map<String, Object>> read(SqlFragment statement, AggregationPlan plan) {
        logger.debug("[DEBUG] SQL: {} params={}", statement.sql(), statement.params());
        List<Map<String, Object>> records = jdbcTemplate.query(
            statement.sql(),
            ObservationRecordMapper.forPlan(plan),
            statement.params().toArray()
        );
        logger.info("[INFO] {} plan returned {} records", plan.mode(), records.size());
        return records;
    }

    private static void requireCodesAndWindow(List<String> indicatorCodes, TimeWindow window) {
        if (indicatorCodes == null || indicatorCodes.isEmpty()) {
            throw new InvalidRequestException("At least one indicator code is required.");
        }
        if (window == null) {
            throw new InvalidRequestException("A time window is required.");
        }
    }
}
