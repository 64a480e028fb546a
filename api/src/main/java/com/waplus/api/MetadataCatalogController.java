package com.waplus.api;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@CrossOrigin(origins = "*")
@RequestMapping(value = "/api/v1/catalog", produces = MediaType.APPLICATION_JSON_VALUE)
public class MetadataCatalogController {
    // Reference tables change only through administrative writes.
    private static final CacheControl LOOKUP_CACHE = CacheControl.maxAge(Duration.ofMinutes(5)).cachePublic();

    private final IndicatorCatalogService indicatorCatalogService;
    private final ReferenceDataService referenceDataService;
    private final int defaultPageSize;
    private final int maxPageSize;

    public MetadataCatalogController(
        IndicatorCatalogService indicatorCatalogService,
        ReferenceDataService referenceDataService,
        @Value("${waplus.catalog.default-page-size:100}") int defaultPageSize,
        @Value("${waplus.catalog.max-page-size:200}") int maxPageSize
    ) {
        this.indicatorCatalogService = indicatorCatalogService;
        this.referenceDataService = referenceDataService;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    @GetMapping("/geographic-units")
    public List<ReferenceDataService.ReportingUnitDto> listGeographicUnits(
        @RequestParam(value = "unit_type_id", required = false) Long unitTypeId,
        @RequestParam(value = "parent_unit_id", required = false) Long parentUnitId,
        @RequestParam(value = "search", required = false) String search,
        @RequestParam(value = "offset", required = false) Integer offset,
        @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return referenceDataService.listReportingUnits(unitTypeId, parentUnitId, search, paging(offset, limit));
    }

    @GetMapping("/geographic-units/{unitId}")
    public ResponseEntity<ReferenceDataService.ReportingUnitDto> getGeographicUnit(@PathVariable("unitId") long unitId) {
        return referenceDataService.findReportingUnit(unitId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/geographic-unit-types")
    public ResponseEntity<List<ReferenceDataService.LookupDto>> listGeographicUnitTypes() {
        return cached(referenceDataService.listReportingUnitTypes());
    }

    @GetMapping("/indicators")
    public List<IndicatorCatalogService.IndicatorDto> listIndicators(
        @RequestParam(value = "category_id", required = false) Long categoryId,
        @RequestParam(value = "data_type", required = false) String dataType,
        @RequestParam(value = "offset", required = false) Integer offset,
        @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return indicatorCatalogService.listIndicators(categoryId, dataType, paging(offset, limit));
    }

    @GetMapping("/indicators/{indicatorCode}")
    public ResponseEntity<IndicatorCatalogService.IndicatorDto> getIndicator(@PathVariable("indicatorCode") String indicatorCode) {
        return indicatorCatalogService.findByCode(indicatorCode)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/indicator-categories")
    public ResponseEntity<List<IndicatorCatalogService.CategoryDto>> listIndicatorCategories() {
        return cached(indicatorCatalogService.listCategories());
    }

    @GetMapping("/units-of-measurement")
    public ResponseEntity<List<IndicatorCatalogService.UnitOfMeasurementDto>> listUnitsOfMeasurement() {
        return cached(indicatorCatalogService.listUnitsOfMeasurement());
    }

    @GetMapping("/temporal-resolutions")
    public ResponseEntity<List<ReferenceDataService.LookupDto>> listTemporalResolutions() {
        return cached(referenceDataService.listTemporalResolutions());
    }

    @GetMapping("/data-quality-flags")
    public ResponseEntity<List<ReferenceDataService.LookupDto>> listDataQualityFlags() {
        return cached(referenceDataService.listDataQualityFlags());
    }

    @GetMapping("/infrastructure-types")
    public ResponseEntity<List<ReferenceDataService.LookupDto>> listInfrastructureTypes() {
        return cached(referenceDataService.listInfrastructureTypes());
    }

    @GetMapping("/operational-status-types")
    public ResponseEntity<List<ReferenceDataService.LookupDto>> listOperationalStatusTypes() {
        return cached(referenceDataService.listOperationalStatusTypes());
    }

    @GetMapping("/infrastructure")
    public List<ReferenceDataService.InfrastructureDto> listInfrastructure(
        @RequestParam(value = "infrastructure_type_id", required = false) Long infrastructureTypeId,
        @RequestParam(value = "reporting_unit_id", required = false) Long reportingUnitId,
        @RequestParam(value = "operational_status_id", required = false) Long operationalStatusId,
        @RequestParam(value = "offset", required = false) Integer offset,
        @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return referenceDataService.listInfrastructure(
            infrastructureTypeId, reportingUnitId, operationalStatusId, paging(offset, limit));
    }

    @GetMapping("/crops")
    public List<ReferenceDataService.CropDto> listCrops(
        @RequestParam(value = "offset", required = false) Integer offset,
        @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return referenceDataService.listCrops(paging(offset, limit));
    }

    private Paging paging(Integer offset, Integer limit) {
        return Paging.of(offset, limit, defaultPageSize, maxPageSize);
    }

    private static <T> ResponseEntity<List<T>> cached(List<T> body) {
        return ResponseEntity.ok().cacheControl(LOOKUP_CACHE).body(body);
    }
}
