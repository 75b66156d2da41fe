package com.herzen.metrics.repository;

import com.herzen.metrics.domain.ScoreModels.MetricError;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class MetricErrorJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public MetricErrorJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void record(MetricError e) {
        jdbcTemplate.update(
                "INSERT INTO metric_errors(metric_id, learner_id, kind, message, occurred_at) VALUES (?,?,?,?,?)",
                e.metricId(), e.learnerId(), e.kind(), truncate(e.message()), e.occurredAt());
    }

    public List<MetricError> findByMetric(String metricId) {
        return jdbcTemplate.query(
                "SELECT metric_id, learner_id, kind, message, occurred_at FROM metric_errors WHERE metric_id = ? ORDER BY id DESC LIMIT 100",
                (rs, n) -> new MetricError(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getLong(5)),
                metricId);
    }

    private String truncate(String message) {
        if (message == null || message.length() <= 2000) return message;
        return message.substring(0, 2000);
    }
}
