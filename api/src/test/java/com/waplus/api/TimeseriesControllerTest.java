package com.waplus.api;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TimeseriesController.class)
@Import({
    IndicatorQueryService.class,
    IndicatorCatalogService.class,
    FilterComposer.class,
    AggregationPlanner.class,
    ObservationQueryAssembler.class
})
class TimeseriesControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JdbcTemplate jdbcTemplate;

    @Test
    @SuppressWarnings("unchecked")
    void monthlySeriesIsReturnedAsJsonRecords() throws Exception {
        when(jdbcTemplate.queryForList(anyString(), eq(Long.class), any(Object[].class))).thenReturn(List.of(7L));
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class))).thenAnswer(invocation -> {
            RowMapper<Map<String, Object>> mapper = invocation.getArgument(1);
            Map<String, Object> columns = new LinkedHashMap<>();
            columns.put("timestamp", Timestamp.valueOf(LocalDateTime.of(2023, 1, 1, 0, 0)));
            columns.put("value", new BigDecimal("100"));
            columns.put("indicator_code", "Q_RIVER");
            columns.put("location_id", 101L);
            return List.of(mapper.mapRow(ResultSetRows.row(columns), 0));
        });

        mockMvc.perform(
                get("/api/v1/timeseries-data")
                    .param("indicator_codes", "Q_RIVER")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-01-31")
                    .param("reporting_unit_ids", "101")
                    .param("aggregate_to", "Monthly")
            )
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].timestamp", startsWith("2023-01-01T00:00")))
            .andExpect(jsonPath("$[0].value").value(100.0))
            .andExpect(jsonPath("$[0].aggregation_level").value("Monthly"));

        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).query(sqlCaptor.capture(), any(RowMapper.class), any(Object[].class));
        assertThat(sqlCaptor.getValue()).contains("date_trunc('month', o.timestamp)");
        assertThat(sqlCaptor.getValue()).contains("o.reporting_unit_id IN (?)");
    }

    @Test
    void locationIsRequired() throws Exception {
        mockMvc.perform(
                get("/api/v1/timeseries-data")
                    .param("indicator_codes", "Q_RIVER")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-01-31")
            )
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value(
                "Either reporting_unit_ids or infrastructure_ids must be provided for timeseries data."));

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void unsupportedMethodIsBadRequest() throws Exception {
        mockMvc.perform(
                get("/api/v1/timeseries-data")
                    .param("indicator_codes", "Q_RIVER")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-01-31")
                    .param("infrastructure_ids", "501")
                    .param("aggregate_to", "Annual")
                    .param("aggregation_method", "Median")
            )
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail", startsWith("Unsupported aggregation method: Median")));

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @SuppressWarnings("unchecked")
    void dailyGranularityServesRawObservations() throws Exception {
        when(jdbcTemplate.queryForList(anyString(), eq(Long.class), any(Object[].class))).thenReturn(List.of(7L));
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class))).thenAnswer(invocation -> {
            RowMapper<Map<String, Object>> mapper = invocation.getArgument(1);
            Map<String, Object> columns = new LinkedHashMap<>();
            columns.put("timestamp", Timestamp.valueOf(LocalDateTime.of(2023, 1, 15, 6, 0)));
            columns.put("value", new BigDecimal("42.5"));
            columns.put("indicator_code", "Q_RIVER");
            columns.put("location_id", 101L);
            return List.of(mapper.mapRow(ResultSetRows.row(columns), 0));
        });

        mockMvc.perform(
                get("/api/v1/timeseries-data")
                    .param("indicator_codes", "Q_RIVER")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-01-31")
                    .param("reporting_unit_ids", "101")
                    .param("aggregate_to", "Daily")
            )
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].value").value(42.5))
            .andExpect(jsonPath("$[0].aggregation_level").doesNotExist());

        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).query(sqlCaptor.capture(), any(RowMapper.class), any(Object[].class));
        assertThat(sqlCaptor.getValue()).doesNotContain("GROUP BY").contains("ORDER BY o.timestamp");
    }

    @Test
    void invertedWindowIsBadRequest() throws Exception {
        mockMvc.perform(
                get("/api/v1/timeseries-data")
                    .param("indicator_codes", "Q_RIVER")
                    .param("start_date", "2023-02-01")
                    .param("end_date", "2023-01-01")
                    .param("reporting_unit_ids", "101")
            )
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value("Start date cannot be after end date."));
    }

    @Test
    void missingIndicatorCodesIsBadRequest() throws Exception {
        mockMvc.perform(
                get("/api/v1/timeseries-data")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-01-31")
                    .param("reporting_unit_ids", "101")
            )
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value("Missing required parameter: indicator_codes"));
    }

    @Test
    void nonNumericLocationIdIsBadRequest() throws Exception {
        mockMvc.perform(
                get("/api/v1/timeseries-data")
                    .param("indicator_codes", "Q_RIVER")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-01-31")
                    .param("reporting_unit_ids", "upper-basin")
            )
            .andExpect(status().isBadRequest());
    }

    @Test
    void unknownCodesGiveEmptyArray() throws Exception {
        when(jdbcTemplate.queryForList(anyString(), eq(Long.class), any(Object[].class))).thenReturn(List.of());

        mockMvc.perform(
                get("/api/v1/timeseries-data")
                    .param("indicator_codes", "NOPE")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-01-31")
                    .param("reporting_unit_ids", "101")
            )
            .andExpect(status().isOk())
            .andExpect(content().json("[]"));
    }

    @Test
    void storeFailureIsServerError() throws Exception {
        when(jdbcTemplate.queryForList(anyString(), eq(Long.class), any(Object[].class)))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(
                get("/api/v1/timeseries-data")
                    .param("indicator_codes", "Q_RIVER")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-01-31")
                    .param("reporting_unit_ids", "101")
            )
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.detail").value("Error querying the data store."));
    }
}
