package com.waplus.api;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FinancialDataController.class)
@Import(FinancialDataService.class)
class FinancialDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JdbcTemplate jdbcTemplate;

    @SuppressWarnings("unchecked")
    private String capturedSql() {
        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).query(sqlCaptor.capture(), any(RowMapper.class), any(Object[].class));
        return sqlCaptor.getValue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void financialSummaryGroupsByAccountTypeAndLocation() throws Exception {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("currency", "USD");
        row.put("is_cost", true);
        row.put("account_type", "O&M Cost");
        row.put("reporting_unit_id", 101L);
        row.put("reporting_unit_name", "Upper Basin");
        row.put("infrastructure_id", 501L);
        row.put("infrastructure_name", "Main Canal Gate");
        row.put("total_amount", new BigDecimal("55000.75"));
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class))).thenReturn(List.of(row));

        mockMvc.perform(
                get("/api/v1/financial-summary")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-12-31")
                    .param("reporting_unit_id", "101")
                    .param("infrastructure_id", "501")
                    .param("group_by_account_type", "true")
            )
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].currency").value("USD"))
            .andExpect(jsonPath("$[0].total_amount").value(55000.75))
            .andExpect(jsonPath("$[0].reporting_unit_name").value("Upper Basin"))
            .andExpect(jsonPath("$[0].infrastructure_name").value("Main Canal Gate"));

        String sql = capturedSql();
        assertThat(sql).contains("fat.name AS account_type");
        assertThat(sql).contains("ru.name AS reporting_unit_name");
        assertThat(sql).contains("inf.name AS infrastructure_name");
        assertThat(sql).contains("LEFT JOIN reporting_units ru ON ru.id = fa.reporting_unit_id");
        assertThat(sql).contains("LEFT JOIN infrastructures inf ON inf.id = fa.infrastructure_id");
        assertThat(sql).contains("GROUP BY c.code, fat.is_cost, fat.name, fat.category, "
            + "fa.reporting_unit_id, ru.name, fa.infrastructure_id, inf.name ");
        assertThat(sql).contains("SUM(fa.amount) AS total_amount");
        assertThat(sql).contains("fa.transaction_date BETWEEN ? AND ?");
        assertThat(sql).contains("(fa.reporting_unit_id IN (?) OR fa.infrastructure_id IN (?))");
        assertThat(sql).endsWith("ORDER BY fat.is_cost DESC, c.code, fat.name, fat.category, "
            + "fa.reporting_unit_id, fa.infrastructure_id");
    }

    @Test
    @SuppressWarnings("unchecked")
    void unscopedSummaryGroupsByCurrencyAndCostFlagOnly() throws Exception {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class))).thenReturn(List.of());

        mockMvc.perform(
                get("/api/v1/financial-summary")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-12-31")
            )
            .andExpect(status().isOk());

        String sql = capturedSql();
        assertThat(sql).contains("GROUP BY c.code, fat.is_cost ORDER BY fat.is_cost DESC, c.code");
        assertThat(sql).doesNotContain("reporting_unit_id");
        assertThat(sql).doesNotContain("LEFT JOIN");
    }

    @Test
    @SuppressWarnings("unchecked")
    void nonRevenueWaterIsSuppliedMinusBilled() throws Exception {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class)))
            .thenReturn(List.of(new double[] {200.0, 150.0}));

        mockMvc.perform(
                get("/api/v1/non-revenue-water")
                    .param("reporting_unit_id", "101")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-12-31")
            )
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.supplied_volume").value(200.0))
            .andExpect(jsonPath("$.billed_volume").value(150.0))
            .andExpect(jsonPath("$.nrw_volume").value(50.0))
            .andExpect(jsonPath("$.nrw_percentage").value(25.0))
            .andExpect(jsonPath("$.unit").value("MCM"));

        String sql = capturedSql();
        assertThat(sql).contains("SUM(CASE WHEN d.code = ? THEN o.value_numeric END)");
        assertThat(sql).contains("o.reporting_unit_id = ?");
    }

    @Test
    @SuppressWarnings("unchecked")
    void nothingSuppliedIsNotFound() throws Exception {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class)))
            .thenReturn(List.of(new double[] {0.0, 0.0}));

        mockMvc.perform(
                get("/api/v1/non-revenue-water")
                    .param("reporting_unit_id", "101")
                    .param("start_date", "2023-01-01")
                    .param("end_date", "2023-12-31")
            )
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.detail").exists());
    }
}
