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
public class LandAndAgricultureController {
    private final CroppingPatternService croppingPatternService;

    public LandAndAgricultureController(CroppingPatternService croppingPatternService) {
        this.croppingPatternService = croppingPatternService;
    }

    @GetMapping(value = "/api/v1/cropping-patterns", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<Map<String, Object>>> getCroppingPatterns(
        @RequestParam("reporting_unit_id") long reportingUnitId,
        @RequestParam("time_period_year") int timePeriodYear,
        @RequestParam(value = "time_period_season", required = false) String timePeriodSeason,
        @RequestParam(value = "pattern_type", required = false) String patternType
    ) {
        return ResponseEntity.ok(croppingPatternService.getCroppingPatterns(
            reportingUnitId, timePeriodYear, timePeriodSeason, patternType));
    }
}
