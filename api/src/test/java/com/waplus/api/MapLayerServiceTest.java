package com.waplus.api;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MapLayerServiceTest {

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
    private final MapLayerService service = new MapLayerService(jdbcTemplate, "http://geoserver:8080/geoserver/");

    @Test
    void endpointIncludesWorkspaceWhenPresent() {
        assertThat(service.serviceEndpoint("waplus")).isEqualTo("http://geoserver:8080/geoserver/waplus/wms");
        assertThat(service.serviceEndpoint(null)).isEqualTo("http://geoserver:8080/geoserver/wms");
        assertThat(service.serviceEndpoint(" ")).isEqualTo("http://geoserver:8080/geoserver/wms");
    }

    @Test
    void legendUrlIsAGetLegendGraphicRequest() {
        String url = MapLayerService.legendUrl("http://geoserver:8080/geoserver/waplus/wms", "waplus:et_2023", "et_style");

        assertThat(url).isEqualTo("http://geoserver:8080/geoserver/waplus/wms?service=WMS&version=1.1.1"
            + "&request=GetLegendGraphic&format=image/png&layer=waplus:et_2023&style=et_style");
    }

    @Test
    void legendUrlOmitsStyleWhenNotSet() {
        assertThat(MapLayerService.legendUrl("http://geoserver:8080/geoserver/wms", "et_2023", null))
            .doesNotContain("style=");
    }

    @Test
    @SuppressWarnings("unchecked")
    void layersAreMappedFromRasterMetadata() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("layer_name_geoserver")).thenReturn("et_2023");
        when(rs.getString("geoserver_workspace")).thenReturn("waplus");
        when(rs.getString("default_style_name")).thenReturn(null);
        when(rs.getString("indicator_name")).thenReturn("Actual evapotranspiration");
        when(rs.getString("indicator_code")).thenReturn("ET_ACT");
        when(rs.getString("description")).thenReturn("Annual ET mosaic");
        when(rs.getObject("timestamp_valid_start", LocalDateTime.class)).thenReturn(LocalDateTime.of(2023, 1, 1, 0, 0));
        when(rs.getString("spatial_resolution_desc")).thenReturn("30m");

        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class))).thenAnswer(invocation -> {
            RowMapper<MapLayerService.MapLayerDto> mapper = invocation.getArgument(1);
            return List.of(mapper.mapRow(rs, 0));
        });

        List<MapLayerService.MapLayerDto> layers = service.listLayers("ET_ACT");

        assertThat(layers).hasSize(1);
        MapLayerService.MapLayerDto layer = layers.get(0);
        assertThat(layer.layerId()).isEqualTo("et_2023");
        assertThat(layer.layerName()).isEqualTo("waplus:et_2023");
        assertThat(layer.serviceType()).isEqualTo("WMS");
        assertThat(layer.serviceEndpoint()).isEqualTo("http://geoserver:8080/geoserver/waplus/wms");
        assertThat(layer.legendUrl()).contains("request=GetLegendGraphic").contains("layer=waplus:et_2023");
        assertThat(layer.temporalValidityStart()).isEqualTo(LocalDateTime.of(2023, 1, 1, 0, 0));
        assertThat(layer.temporalValidityEnd()).isNull();

        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).query(sqlCaptor.capture(), any(RowMapper.class), any(Object[].class));
        assertThat(sqlCaptor.getValue()).contains("WHERE d.code = ?");
        assertThat(sqlCaptor.getValue()).doesNotContain("geom");
    }
}
