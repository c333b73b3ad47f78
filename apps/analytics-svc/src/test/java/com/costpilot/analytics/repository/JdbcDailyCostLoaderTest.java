package com.costpilot.analytics.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.costpilot.analytics.model.CostPoint;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

@ExtendWith(MockitoExtension.class)
class JdbcDailyCostLoaderTest {

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    @Mock
    private ResultSet resultSet;

    @Test
    @SuppressWarnings("unchecked")
    void queriesDailyTotalsForInclusiveRange() throws Exception {
        JdbcDailyCostLoader loader = new JdbcDailyCostLoader(jdbcTemplate);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        ArgumentCaptor<RowMapper<CostPoint>> mapper = ArgumentCaptor.forClass(RowMapper.class);
        when(jdbcTemplate.query(sql.capture(), params.capture(), mapper.capture())).thenReturn(List.of());

        loader.loadDailyCosts(Optional.of("openai"), LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));

        assertThat(sql.getValue())
                .contains("CAST(timestamp AT TIME ZONE 'UTC' AS date)")
                .doesNotContain("CAST(timestamp AS date)");
        MapSqlParameterSource captured = (MapSqlParameterSource) params.getValue();
        assertThat(captured.getValue("service")).isEqualTo("openai");
        assertThat(captured.getValue("from")).isEqualTo(Timestamp.from(Instant.parse("2024-03-01T00:00:00Z")));
        assertThat(captured.getValue("to")).isEqualTo(Timestamp.from(Instant.parse("2024-04-01T00:00:00Z")));

        when(resultSet.getDate("cost_date")).thenReturn(Date.valueOf(LocalDate.of(2024, 3, 4)));
        when(resultSet.getDouble("total_cost")).thenReturn(12.5);
        when(resultSet.getLong("transaction_count")).thenReturn(5L);
        when(resultSet.getDouble("avg_cost")).thenReturn(2.5);
        assertThat(mapper.getValue().mapRow(resultSet, 0))
                .isEqualTo(new CostPoint(LocalDate.of(2024, 3, 4), 12.5, 5, 2.5));
    }

    @Test
    void allServicesBindNullFilter() {
        JdbcDailyCostLoader loader = new JdbcDailyCostLoader(jdbcTemplate);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        when(jdbcTemplate.query(anyString(), params.capture(), ArgumentMatchers.<RowMapper<CostPoint>>any()))
                .thenReturn(List.of());

        assertThat(loader.loadDailyCosts(Optional.empty(), LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 1))).isEmpty();

        verify(jdbcTemplate).query(anyString(), params.capture(), ArgumentMatchers.<RowMapper<CostPoint>>any());
        assertThat(((MapSqlParameterSource) params.getValue()).getValue("service")).isNull();
    }
}
