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
@CrossOrigin(origins = "*")
public class FinancialDataController {
    private final FinancialDataService financialDataService;

    public FinancialDataController(FinancialDataService financialDataService) {
        this.financialDataService = financialDataService;
    }

    @GetMapping(value = "/api/v1/financial-summary", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<Map<String, Object>>> getFinancialSummary(
        @RequestParam("start_date") String startDate,
        @RequestParam("end_date") String endDate,
        @RequestParam(value = "reporting_unit_id", required = false) Long reportingUnitId,
        @RequestParam(value = "infrastructure_id", required = false) Long infrastructureId,
        @RequestParam(value = "group_by_account_type", defaultValue = "false") boolean groupByAccountType
    ) {
        return ResponseEntity.ok(financialDataService.getFinancialAccountsSummary(
            TimeWindow.parse(startDate, endDate),
            LocationFilter.of(reportingUnitId, infrastructureId),
            groupByAccountType
        ));
    }

    @GetMapping(value = "/api/v1/non-revenue-water", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> getNonRevenueWater(
        @RequestParam("reporting_unit_id") long reportingUnitId,
        @RequestParam("start_date") String startDate,
        @RequestParam("end_date") String endDate
    ) {
        TimeWindow window = TimeWindow.parse(startDate, endDate);
        return financialDataService.getNonRevenueWater(reportingUnitId, window)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(404).body(Map.of(
                "detail", "No supplied water volume recorded for reporting unit " + reportingUnitId + " in this period."
            )));
    }
}
