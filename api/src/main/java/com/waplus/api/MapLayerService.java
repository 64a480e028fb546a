package com.waplus.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Raster layer metadata published through GeoServer, with the WMS endpoints a map client needs.
 */
@Service
public class MapLayerService {
    private static final Logger logger = LoggerFactory.getLogger(MapLayerService.class);
    static final String SERVICE_TYPE = "WMS";

    private final JdbcTemplate jdbcTemplate;
    private final String geoserverUrl;

    public MapLayerService(
        JdbcTemplate jdbcTemplate,
        @Value("${waplus.geoserver.url:http://geoserver:8080/geoserver}") String geoserverUrl
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.geoserverUrl = stripTrailingSlash(geoserverUrl);
    }

    public record MapLayerDto(
        String layerId,
        String title,
        String description,
        String serviceType,
        String serviceEndpoint,
        String layerName,
        String associatedIndicatorCode,
        String defaultStyle,
        String legendUrl,
        LocalDateTime temporalValidityStart,
        LocalDateTime temporalValidityEnd,
        String spatialResolution
    ) {}

    public List<MapLayerDto> listLayers(String indicatorCode) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder();
        sql.append("SELECT rm.layer_name_geoserver, rm.geoserver_workspace, rm.description, rm.default_style_name, ");
        sql.append("rm.timestamp_valid_start, rm.timestamp_valid_end, rm.spatial_resolution_desc, ");
        sql.append("d.code AS indicator_code, d.name_en AS indicator_name ");
        sql.append("FROM raster_metadatas rm ");
        sql.append("JOIN indicator_definitions d ON d.id = rm.indicator_definition_id ");
        if (indicatorCode != null && !indicatorCode.isBlank()) {
            sql.append("WHERE d.code = ? ");
            params.add(indicatorCode.trim());
        }
        sql.append("ORDER BY d.code, rm.timestamp_valid_start NULLS FIRST, rm.layer_name_geoserver");

        List<MapLayerDto> layers = jdbcTemplate.query(sql.toString(), (rs, rowNum) -> {
            String layerName = rs.getString("layer_name_geoserver");
            String workspace = rs.getString("geoserver_workspace");
            String style = rs.getString("default_style_name");
            String endpoint = serviceEndpoint(workspace);
            return new MapLayerDto(
                layerName,
                rs.getString("indicator_name"),
                rs.getString("description"),
                SERVICE_TYPE,
                endpoint,
                qualifiedLayerName(workspace, layerName),
                rs.getString("indicator_code"),
                style,
                legendUrl(endpoint, qualifiedLayerName(workspace, layerName), style),
                rs.getObject("timestamp_valid_start", LocalDateTime.class),
                rs.getObject("timestamp_valid_end", LocalDateTime.class),
                rs.getString("spatial_resolution_desc")
            );
        }, params.toArray());
        logger.info("[INFO] map layers indicator={} returned {} layers", indicatorCode, layers.size());
        return layers;
    }

    String serviceEndpoint(String workspace) {
        if (workspace == null || workspace.isBlank()) {
            return geoserverUrl + "/wms";
        }
        return geoserverUrl + "/" + workspace.trim() + "/wms";
    }

    static String qualifiedLayerName(String workspace, String layerName) {
        if (workspace == null || workspace.isBlank()) {
            return layerName;
        }
        return workspace.trim() + ":" + layerName;
    }

    static String legendUrl(String endpoint, String layerName, String style) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(endpoint)
            .queryParam("service", "WMS")
            .queryParam("version", "1.1.1")
            .queryParam("request", "GetLegendGraphic")
            .queryParam("format", "image/png")
            .queryParam("layer", layerName);
        if (style != null && !style.isBlank()) {
            builder.queryParam("style", style);
        }
        return builder.build().toUriString();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
