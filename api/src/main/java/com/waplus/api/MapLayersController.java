package com.waplus.api;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@CrossOrigin(origins = "*")
public class MapLayersController {
    private final MapLayerService mapLayerService;

    public MapLayersController(MapLayerService mapLayerService) {
        this.mapLayerService = mapLayerService;
    }

    @GetMapping(value = "/api/v1/map-layers", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<MapLayerService.MapLayerDto>> getMapLayers(
        @RequestParam(value = "indicator_code", required = false) String indicatorCode
    ) {
        return ResponseEntity.ok(mapLayerService.listLayers(indicatorCode));
    }
}
