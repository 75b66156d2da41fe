package com.herzen.metrics.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.metrics.domain.MetricModels.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

// coverage, rule_params and tag_weights are JSON documents.
@Repository
public class MetricDefinitionJdbcRepository {
    private static final String SELECT =
            "SELECT d.metric_id, d.name, d.metric_level, d.coverage, d.rule_name, d.rule_params, d.submetric_id, d.tag_weights, " +
                    "d.time_start, d.time_end, d.multiples, d.auto_compute, d.visible_to_student, r.last_updated " +
                    "FROM metric_definitions d LEFT JOIN metric_runs r ON r.metric_id = d.metric_id";

    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Double>> WEIGHTS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<MetricDefinition> mapper = (rs, n) -> new MetricDefinition(
            rs.getString(1),
            rs.getString(2),
            Level.fromValue(rs.getString(3)),
            Coverage.fromArray(read(rs.getString(4), STRINGS)),
            new Rule(rs.getString(5), read(rs.getString(6), STRINGS)),
            rs.getString(7),
            read(rs.getString(8), WEIGHTS),
            new TimeFilter(rs.getLong(9), rs.getLong(10)),
            MultiplesPolicy.fromValue(rs.getString(11)),
            rs.getBoolean(12),
            rs.getBoolean(13),
            (Long) rs.getObject(14, Long.class)
    );

    public MetricDefinitionJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void insert(MetricDefinition d) {
        jdbcTemplate.update(
                "INSERT INTO metric_definitions(metric_id, name, metric_level, coverage, rule_name, rule_params, submetric_id, tag_weights, time_start, time_end, multiples, auto_compute, visible_to_student) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)",
                d.id(), d.name(), d.level().value(), write(d.coverage().toArray()), d.rule().name(),
                write(d.rule().params()), d.submetricId(), write(d.tagWeights()),
                d.timeFilter().start(), d.timeFilter().end(), d.multiples().value(), d.autoCompute(), d.visibleToStudent());
    }

    public int update(MetricDefinition d) {
        return jdbcTemplate.update(
                "UPDATE metric_definitions SET name=?, metric_level=?, coverage=?, rule_name=?, rule_params=?, submetric_id=?, tag_weights=?, time_start=?, time_end=?, multiples=?, auto_compute=?, visible_to_student=? WHERE metric_id=?",
                d.name(), d.level().value(), write(d.coverage().toArray()), d.rule().name(),
                write(d.rule().params()), d.submetricId(), write(d.tagWeights()),
                d.timeFilter().start(), d.timeFilter().end(), d.multiples().value(), d.autoCompute(), d.visibleToStudent(),
                d.id());
    }

    public int delete(String metricId) {
        jdbcTemplate.update("DELETE FROM metric_runs WHERE metric_id = ?", metricId);
        return jdbcTemplate.update("DELETE FROM metric_definitions WHERE metric_id = ?", metricId);
    }

    public Optional<MetricDefinition> find(String metricId) {
        return jdbcTemplate.query(SELECT + " WHERE d.metric_id = ?", mapper, metricId).stream().findFirst();
    }

    public Optional<MetricDefinition> findByName(String name) {
        return jdbcTemplate.query(SELECT + " WHERE d.name = ?", mapper, name).stream().findFirst();
    }

    public List<MetricDefinition> findAll() {
        return jdbcTemplate.query(SELECT + " ORDER BY d.name", mapper);
    }

    public List<MetricDefinition> findBySubmetric(String submetricId) {
        return jdbcTemplate.query(SELECT + " WHERE d.submetric_id = ? ORDER BY d.name", mapper, submetricId);
    }

    private String write(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize metric definition column", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed metric definition column: " + json, e);
        }
    }
}
