package com.herzen.metrics.repository;

import com.herzen.metrics.domain.ScoreModels.ItemScore;
import com.herzen.metrics.domain.ScoreModels.MetricScore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public class ScoreJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ScoreJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void replace(MetricScore s) {
        jdbcTemplate.update(
                "MERGE INTO metric_scores(metric_id, learner_id, score, computed_at) KEY(metric_id, learner_id) VALUES (?,?,?,?)",
                s.metricId(), s.learnerId(), s.score(), s.computedAt());
        jdbcTemplate.update("DELETE FROM metric_item_scores WHERE metric_id = ? AND learner_id = ?", s.metricId(), s.learnerId());
        s.items().forEach(i -> jdbcTemplate.update(
                "INSERT INTO metric_item_scores(metric_id, learner_id, item_id, tag, score, latest_at) VALUES (?,?,?,?,?,?)",
                s.metricId(), s.learnerId(), i.itemId(), i.tag(), i.score(), i.latestAt()));
        jdbcTemplate.update("MERGE INTO metric_runs(metric_id, last_updated) KEY(metric_id) VALUES (?,?)",
                s.metricId(), s.computedAt());
    }

    public Optional<MetricScore> find(String metricId, String learnerId) {
        return jdbcTemplate.query(
                        "SELECT metric_id, learner_id, score, computed_at FROM metric_scores WHERE metric_id = ? AND learner_id = ?",
                        (rs, n) -> new ScoreRow(rs.getString(1), rs.getString(2), (Double) rs.getObject(3, Double.class), rs.getLong(4)),
                        metricId, learnerId)
                .stream().findFirst()
                .map(this::withItems);
    }

    public List<MetricScore> findByMetric(String metricId) {
        return jdbcTemplate.query(
                        "SELECT metric_id, learner_id, score, computed_at FROM metric_scores WHERE metric_id = ? ORDER BY learner_id",
                        (rs, n) -> new ScoreRow(rs.getString(1), rs.getString(2), (Double) rs.getObject(3, Double.class), rs.getLong(4)),
                        metricId)
                .stream().map(this::withItems).toList();
    }

    public List<MetricScore> findByLearner(String learnerId) {
        return jdbcTemplate.query(
                        "SELECT metric_id, learner_id, score, computed_at FROM metric_scores WHERE learner_id = ? ORDER BY metric_id",
                        (rs, n) -> new ScoreRow(rs.getString(1), rs.getString(2), (Double) rs.getObject(3, Double.class), rs.getLong(4)),
                        learnerId)
                .stream().map(this::withItems).toList();
    }

    @Transactional
    public int deleteByMetric(String metricId) {
        jdbcTemplate.update("DELETE FROM metric_item_scores WHERE metric_id = ?", metricId);
        return jdbcTemplate.update("DELETE FROM metric_scores WHERE metric_id = ?", metricId);
    }

    private MetricScore withItems(ScoreRow row) {
        List<ItemScore> items = jdbcTemplate.query(
                "SELECT item_id, tag, score, latest_at FROM metric_item_scores WHERE metric_id = ? AND learner_id = ? ORDER BY item_id",
                (rs, n) -> new ItemScore(rs.getString(1), rs.getString(2),
                        (Double) rs.getObject(3, Double.class), (Long) rs.getObject(4, Long.class)),
                row.metricId(), row.learnerId());
        return new MetricScore(row.metricId(), row.learnerId(), row.score(), row.computedAt(), items);
    }

    private record ScoreRow(String metricId, String learnerId, Double score, long computedAt) {}
}
