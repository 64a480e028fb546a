package com.waplus.api;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class TimeseriesController {
    private final IndicatorQueryService indicatorQueryService;

    public TimeseriesController(IndicatorQueryService indicatorQueryService) {
        this.indicatorQueryService = indicatorQueryService;
    }

    @CrossOrigin(origins = "*")
    @GetMapping(value = "/api/v1/timeseries-data", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<Map<String, Object>>> getTimeseriesData(
        @RequestParam("indicator_codes") List<String> indicatorCodes,
        @RequestParam("start_date") String startDate,
        @RequestParam("end_date") String endDate,
        @RequestParam(value = "reporting_unit_ids", required = false) List<Long> reportingUnitIds,
        @RequestParam(value = "infrastructure_ids", required = false) List<Long> infrastructureIds,
        @RequestParam(value = "temporal_resolution_name", required = false) String temporalResolutionName,
        @RequestParam(value = "quality_flag", required = false) String qualityFlag,
        @RequestParam(value = "aggregate_to", required = false) String aggregateTo,
        @RequestParam(value = "aggregation_method", required = false) String aggregationMethod
    ) {
        LocationFilter location = new LocationFilter(reportingUnitIds, infrastructureIds);
        // Chart screens are always scoped to a place; an unscoped series would mix unrelated locations.
        if (location.scope() == LocationFilter.Scope.GLOBAL) {
            throw new InvalidRequestException(
                "Either reporting_unit_ids or infrastructure_ids must be provided for timeseries data.");
        }

        List<Map<String, Object>> records = indicatorQueryService.getTimeseries(new IndicatorQueryService.TimeseriesQuery(
            indicatorCodes,
            TimeWindow.parse(startDate, endDate),
            location,
            temporalResolutionName,
            qualityFlag,
            aggregateTo,
            aggregationMethod
        ));
        return ResponseEntity.ok(records);
    }
}
