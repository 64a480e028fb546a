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
public class SummaryDataController {
    private final IndicatorQueryService indicatorQueryService;

    public SummaryDataController(IndicatorQueryService indicatorQueryService) {
        this.indicatorQueryService = indicatorQueryService;
    }

    /**
     * One value per indicator (and per location when ids are given) over the whole period.
     * Without location ids the summary is global.
     */
    @CrossOrigin(origins = "*")
    @GetMapping(value = "/api/v1/summary-data", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<Map<String, Object>>> getSummaryData(
        @RequestParam("indicator_codes") List<String> indicatorCodes,
        @RequestParam("time_period_start") String timePeriodStart,
        @RequestParam("time_period_end") String timePeriodEnd,
        @RequestParam(value = "reporting_unit_ids", required = false) List<Long> reportingUnitIds,
        @RequestParam(value = "infrastructure_ids", required = false) List<Long> infrastructureIds,
        @RequestParam(value = "quality_flag", required = false) String qualityFlag,
        @RequestParam(value = "aggregation_method", defaultValue = "Average") String aggregationMethod
    ) {
        List<Map<String, Object>> records = indicatorQueryService.getSummary(new IndicatorQueryService.SummaryQuery(
            indicatorCodes,
            TimeWindow.parse(timePeriodStart, timePeriodEnd),
            new LocationFilter(reportingUnitIds, infrastructureIds),
            qualityFlag,
            aggregationMethod
        ));
        return ResponseEntity.ok(records);
    }
}
