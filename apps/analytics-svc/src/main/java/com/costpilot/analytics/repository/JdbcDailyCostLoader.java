package com.costpilot.analytics.repository;

import com.costpilot.analytics.model.CostPoint;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class JdbcDailyCostLoader implements DailyCostLoader {

    private static final String DAILY_COSTS_SQL = """
            SELECT CAST(timestamp AT TIME ZONE 'UTC' AS date) AS cost_date,
                   sum(amount) AS total_cost,
                   count(*) AS transaction_count,
                   avg(amount) AS avg_cost
            FROM costs
            WHERE timestamp >= :from
              AND timestamp < :to
              AND (:service IS NULL OR service = :service)
            GROUP BY CAST(timestamp AT TIME ZONE 'UTC' AS date)
            ORDER BY cost_date ASC
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcDailyCostLoader(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<CostPoint> loadDailyCosts(Optional<String> service, LocalDate startInclusive, LocalDate endInclusive) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("from", Timestamp.from(startInclusive.atStartOfDay(ZoneOffset.UTC).toInstant()))
                .addValue("to", Timestamp.from(endInclusive.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant()))
                .addValue("service", service.orElse(null), Types.VARCHAR);
        return jdbcTemplate.query(DAILY_COSTS_SQL, params, this::mapCostPoint);
    }

    private CostPoint mapCostPoint(ResultSet rs, int rowNum) throws SQLException {
        return new CostPoint(
                rs.getDate("cost_date").toLocalDate(),
                rs.getDouble("total_cost"),
                rs.getLong("transaction_count"),
                rs.getDouble("avg_cost")
        );
    }
}
